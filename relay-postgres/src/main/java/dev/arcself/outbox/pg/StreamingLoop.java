/*
 * Copyright (C) 2026 The outbox-relay Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.arcself.outbox.pg;

import dev.arcself.outbox.core.FatalRelayException;
import dev.arcself.outbox.core.RelayMetricsListener;
import dev.arcself.outbox.core.RelayState;
import dev.arcself.outbox.core.SubscriptionIdentity;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single-threaded receive loop of an attached session. Each iteration checks for cancellation,
 * sends a standby status update when due, then reads and handles at most one frame.
 *
 * <p>The applied position only moves past a row change once its event has been published, and never
 * moves backwards. The acknowledged position always trails the applied one.
 */
public final class StreamingLoop {

  private static final Logger LOG = LoggerFactory.getLogger(StreamingLoop.class);

  private final SubscriptionIdentity identity;
  private final ReplicationConnection connection;
  private final OutboxPublisher publisher;
  private final BooleanSupplier cancelled;
  private final BiConsumer<RelayState, Throwable> stateSink;
  private final List<RelayMetricsListener<PostgresChangeEvent>> metricsListeners;
  private final long standbyIntervalNanos;
  private final long pollIntervalMillis;
  private final RelationCatalog catalog = new RelationCatalog();
  private final PgOutputDecoder decoder = new PgOutputDecoder();
  private final SessionCursor cursor;

  private long ackDeadline;
  private boolean forceAck;

  public StreamingLoop(SubscriptionIdentity identity,
                       PostgresRelayOptions options,
                       ReplicationConnection connection,
                       OutboxPublisher publisher,
                       long startPosition,
                       BooleanSupplier cancelled,
                       BiConsumer<RelayState, Throwable> stateSink,
                       List<RelayMetricsListener<PostgresChangeEvent>> metricsListeners) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
    this.stateSink = Objects.requireNonNull(stateSink, "stateSink");
    this.metricsListeners = Objects.requireNonNull(metricsListeners, "metricsListeners");
    this.standbyIntervalNanos = options.getStandbyInterval().toNanos();
    this.pollIntervalMillis = Math.max(1L, options.getPollInterval().toMillis());
    this.cursor = new SessionCursor(startPosition);
  }

  /**
   * Runs until cancelled (returns normally) or until a fatal error (throws after reporting
   * {@link RelayState#FAULTED}).
   */
  public void run() throws SQLException {
    stateSink.accept(RelayState.STREAMING, null);
    ackDeadline = System.nanoTime() + standbyIntervalNanos;
    try {
      while (true) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
          shutdown();
          return;
        }

        if (forceAck || System.nanoTime() - ackDeadline >= 0) {
          sendStandbyStatus();
        }

        byte[] data = connection.readPending();
        if (data == null) {
          waitForData();
          continue;
        }
        handleFrame(data);
      }
    } catch (PublishFailedException e) {
      if (cancelled.getAsBoolean()) {
        LOG.info("Publish to {} aborted by shutdown; position stays at {}",
          e.getSubject(), WalPositions.format(cursor.lastAppliedPosition()));
        shutdown();
        return;
      }
      stateSink.accept(RelayState.FAULTED, e);
      throw e;
    } catch (SQLException | RuntimeException e) {
      stateSink.accept(RelayState.FAULTED, e);
      throw e;
    }
  }

  private void handleFrame(byte[] data) {
    ReplicationFrame frame;
    try {
      frame = ReplicationFrame.parse(data);
    } catch (PgOutputDecodeException e) {
      decodeFailure(null, e);
      return;
    }

    switch (frame.type()) {
      case XLOG_DATA:
        handleXLogData(frame);
        break;
      case KEEPALIVE:
        cursor.advanceApplied(frame.walEnd());
        if (frame.replyRequested()) {
          forceAck = true;
        }
        break;
      default:
        LOG.warn("Ignoring replication frame of unknown type '{}'", frame.typeByte());
        break;
    }
  }

  private void handleXLogData(ReplicationFrame frame) {
    long position = frame.endPosition();
    PgOutputRecord record;
    try {
      record = decoder.decode(catalog, frame.payload(), position);
    } catch (UnknownRelationException e) {
      throw new FatalRelayException("Row change for relation " + e.relationId()
        + " arrived before its relation message at " + WalPositions.format(position), e);
    } catch (PgOutputDecodeException e) {
      decodeFailure(WalPositions.format(position), e);
      return;
    }

    switch (record.kind()) {
      case CHANGE: {
        PostgresChangeEvent event = record.event();
        String subject = publisher.publish(event);
        emitPublished(event, subject);
        break;
      }
      case RELATION:
        LOG.debug("Registered relation {} ({} relations known)", record.relation(), catalog.size());
        break;
      case SKIPPED:
        LOG.debug("Skipping pgoutput message '{}' at {}", record.messageType(), WalPositions.format(position));
        break;
      default:
        break;
    }
    cursor.advanceApplied(position);
  }

  private void decodeFailure(String walPosition, PgOutputDecodeException error) {
    LOG.warn("Could not decode replication record at {}; position not advanced: {}",
      walPosition == null ? "<unknown>" : walPosition, error.getMessage());
    for (RelayMetricsListener<PostgresChangeEvent> listener : metricsListeners) {
      listener.onDecodeFailure(walPosition, error);
    }
  }

  private void sendStandbyStatus() throws SQLException {
    boolean moved = cursor.hasUnacknowledged();
    connection.sendStandbyStatus(cursor.lastAppliedPosition(), Instant.now(), false);
    long acknowledged = cursor.acknowledge();
    forceAck = false;
    ackDeadline = System.nanoTime() + standbyIntervalNanos;
    if (moved) {
      String text = WalPositions.format(acknowledged);
      LOG.debug("Acknowledged {} for slot {}", text, identity.slotName());
      for (RelayMetricsListener<PostgresChangeEvent> listener : metricsListeners) {
        listener.onPositionAcknowledged(identity.slotName(), text);
      }
    }
  }

  private void shutdown() {
    stateSink.accept(RelayState.SHUTTING_DOWN, null);
    if (!cursor.hasUnacknowledged()) {
      return;
    }
    try {
      sendStandbyStatus();
    } catch (SQLException e) {
      LOG.warn("Final acknowledgement of {} for slot {} failed; it will be replayed after restart",
        WalPositions.format(cursor.lastAppliedPosition()), identity.slotName(), e);
    }
  }

  private void waitForData() {
    long untilDeadline = TimeUnit.NANOSECONDS.toMillis(ackDeadline - System.nanoTime());
    long wait = Math.max(1L, Math.min(pollIntervalMillis, untilDeadline));
    try {
      Thread.sleep(wait);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void emitPublished(PostgresChangeEvent event, String subject) {
    for (RelayMetricsListener<PostgresChangeEvent> listener : metricsListeners) {
      listener.onEventPublished(event, subject);
    }
  }

  SessionCursor cursor() {
    return cursor;
  }

  RelationCatalog catalog() {
    return catalog;
  }
}
