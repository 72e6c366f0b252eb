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
import dev.arcself.outbox.core.MessageBroker;
import dev.arcself.outbox.core.RelayMetricsListener;
import dev.arcself.outbox.core.RelayState;
import dev.arcself.outbox.core.RelayStateChange;
import dev.arcself.outbox.core.RelaySubscription;
import dev.arcself.outbox.core.SubscriptionIdentity;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays committed row changes of a PostgreSQL publication to a {@link MessageBroker}.
 *
 * <p>A dedicated daemon thread provisions the broker subjects, opens the replication session and runs
 * the {@link StreamingLoop}. A failure is not retried in-process: the relay moves to
 * {@link RelayState#FAULTED} and {@link #termination()} fails, leaving the restart to the process
 * supervisor.
 */
public class PostgresOutboxRelay implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresOutboxRelay.class);
  private static final long CLOSE_JOIN_MILLIS = 30_000L;

  private final Context context;
  private final PostgresRelayOptions options;
  private final SubscriptionIdentity identity;
  private final MessageBroker broker;
  private final ReplicationConnector connector;
  private final SlotMetadata metadata;
  private final OutboxPublisher publisher;
  private final List<Handler<RelayStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<RelayMetricsListener<PostgresChangeEvent>> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);
  private final Promise<Void> terminationPromise = Promise.promise();

  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile RelayState state = RelayState.CREATED;

  public PostgresOutboxRelay(Vertx vertx, PostgresRelayOptions options, MessageBroker broker) {
    this(vertx, options, broker, new PgJdbcConnections(options));
  }

  private PostgresOutboxRelay(Vertx vertx,
                              PostgresRelayOptions options,
                              MessageBroker broker,
                              PgJdbcConnections connections) {
    this(vertx, options, broker, connections.replicationConnector(), new JdbcSlotMetadata(connections));
  }

  PostgresOutboxRelay(Vertx vertx,
                      PostgresRelayOptions options,
                      MessageBroker broker,
                      ReplicationConnector connector,
                      SlotMetadata metadata) {
    this.context = Objects.requireNonNull(vertx, "vertx").getOrCreateContext();
    this.options = new PostgresRelayOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.identity = this.options.identity();
    this.broker = Objects.requireNonNull(broker, "broker");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.publisher = new OutboxPublisher(
      broker, new SubjectRouter(this.options.getSubjectPrefix()), this.options.getPublishRetryPolicy());
  }

  /**
   * Starts the worker thread.
   *
   * @return a future completed once the relay is streaming, or failed if it faults first
   */
  public Future<Void> start() {
    synchronized (this) {
      if (state == RelayState.CLOSED || state == RelayState.FAULTED || state == RelayState.SHUTTING_DOWN) {
        return Future.failedFuture("relay is " + state);
      }
      if (state == RelayState.STREAMING) {
        return Future.succeededFuture();
      }
      if (startPromise != null) {
        return startPromise.future();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      transition(RelayState.STARTING, null);

      worker = new Thread(this::runWorker, "outbox-relay-" + identity.slotName());
      worker.setDaemon(true);
      worker.start();
      return startPromise.future();
    }
  }

  /**
   * Succeeds when the relay shut down on request, fails with the fatal cause otherwise.
   */
  public Future<Void> termination() {
    return terminationPromise.future();
  }

  public RelayState state() {
    return state;
  }

  public SubscriptionIdentity identity() {
    return identity;
  }

  /**
   * State changes are delivered in order on the Vert.x context the relay was created on.
   */
  public RelaySubscription onStateChange(Handler<RelayStateChange> handler) {
    Handler<RelayStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  /**
   * Metrics listeners are called synchronously on the relay thread.
   */
  public RelaySubscription addMetricsListener(RelayMetricsListener<PostgresChangeEvent> listener) {
    RelayMetricsListener<PostgresChangeEvent> resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  /**
   * Requests a graceful shutdown and waits for the relay thread to release its connection.
   */
  @Override
  public void close() {
    Thread thread;
    synchronized (this) {
      shouldRun.set(false);
      thread = worker;
    }

    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      try {
        thread.join(CLOSE_JOIN_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        LOG.warn("Relay thread for slot {} did not stop within {} ms", identity.slotName(), CLOSE_JOIN_MILLIS);
      }
    }

    synchronized (this) {
      if (state != RelayState.FAULTED) {
        transition(RelayState.CLOSED, null);
      }
      failStart(new IllegalStateException("relay closed before reaching STREAMING"));
    }
    terminationPromise.tryComplete();
  }

  private void runWorker() {
    try {
      provisionSubjects();
      try (ReplicationSession session = ReplicationSession.open(identity, options, connector, new PositionResolver(metadata))) {
        transition(RelayState.ATTACHED, null);
        StreamingLoop loop = new StreamingLoop(
          identity,
          options,
          session.connection(),
          publisher,
          session.startPosition().asLong(),
          () -> !shouldRun.get(),
          this::onLoopState,
          metricsListeners);
        loop.run();
      }
      transition(RelayState.CLOSED, null);
      failStart(new IllegalStateException("relay closed before reaching STREAMING"));
      terminationPromise.tryComplete();
    } catch (Exception e) {
      if (!shouldRun.get() && state != RelayState.FAULTED) {
        LOG.debug("Relay for slot {} stopped during shutdown", identity.slotName(), e);
        transition(RelayState.CLOSED, null);
        failStart(new IllegalStateException("relay closed before reaching STREAMING"));
        terminationPromise.tryComplete();
        return;
      }
      FatalRelayException fatal = e instanceof FatalRelayException
        ? (FatalRelayException) e
        : new FatalRelayException("Relay for slot " + identity.slotName() + " failed: " + e.getMessage(), e);
      LOG.error("Outbox relay for {} failed", identity, fatal);
      shouldRun.set(false);
      transition(RelayState.FAULTED, fatal);
      failStart(fatal);
      terminationPromise.tryFail(fatal);
    } finally {
      synchronized (this) {
        worker = null;
      }
    }
  }

  private void provisionSubjects() throws Exception {
    List<String> tables;
    try {
      tables = metadata.publicationTables(identity.publicationName());
    } catch (SQLException e) {
      throw new FatalRelayException("Could not list tables of publication " + identity.publicationName(), e);
    }
    if (tables.isEmpty()) {
      LOG.warn("Publication {} has no tables; nothing will be relayed until tables are added",
        identity.publicationName());
    }
    Set<String> subjects = new LinkedHashSet<>();
    for (String table : tables) {
      subjects.add(publisher.router().subjectForQualifiedName(table));
    }
    broker.provision(subjects);
    LOG.info("Provisioned {} subject(s) for publication {}", subjects.size(), identity.publicationName());
  }

  private void onLoopState(RelayState next, Throwable cause) {
    // the worker reports the fault itself once the exception reaches it
    if (next == RelayState.FAULTED) {
      return;
    }
    transition(next, cause);
    if (next == RelayState.STREAMING) {
      completeStart();
    }
  }

  private synchronized void transition(RelayState nextState, Throwable cause) {
    RelayState previous = this.state;
    if (previous == nextState || previous == RelayState.CLOSED || previous == RelayState.FAULTED) {
      return;
    }

    this.state = nextState;
    RelayStateChange change = new RelayStateChange(previous, nextState, cause);

    for (RelayMetricsListener<PostgresChangeEvent> listener : metricsListeners) {
      listener.onStateChange(change);
    }
    for (Handler<RelayStateChange> handler : stateHandlers) {
      context.runOnContext(v -> handler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryFail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryComplete();
    }
  }
}
