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

import dev.arcself.outbox.core.SubscriptionIdentity;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An attached replication stream. Owns the walsender connection until closed.
 */
public final class ReplicationSession implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationSession.class);

  private final SubscriptionIdentity identity;
  private final ReplicationConnection connection;
  private final SystemIdentity system;
  private final LogSequenceNumber startPosition;

  private ReplicationSession(SubscriptionIdentity identity,
                             ReplicationConnection connection,
                             SystemIdentity system,
                             LogSequenceNumber startPosition) {
    this.identity = identity;
    this.connection = connection;
    this.system = system;
    this.startPosition = startPosition;
  }

  /**
   * Creates the slot if needed, identifies the server, resolves the start position and starts
   * streaming. Any failure closes the connection and propagates; there is no retry here.
   */
  public static ReplicationSession open(SubscriptionIdentity identity,
                                        PostgresRelayOptions options,
                                        ReplicationConnector connector,
                                        PositionResolver resolver) throws SQLException {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(options, "options");

    ReplicationConnection connection = connector.connect();
    try {
      ensureSlot(identity, connection);

      SystemIdentity system = connection.identifySystem();
      LOG.info("Attached to {} for slot {}", system, identity.slotName());

      LogSequenceNumber start = resolver.resolve(identity, system.xLogPos());

      Map<String, String> pluginArgs = new LinkedHashMap<>();
      pluginArgs.put("proto_version", String.valueOf(options.getProtoVersion()));
      pluginArgs.put("publication_names", identity.publicationName());
      connection.startReplication(identity.slotName(), start, pluginArgs);
      LOG.info("Streaming slot {} publication {} from {}",
        identity.slotName(), identity.publicationName(), start.asString());

      return new ReplicationSession(identity, connection, system, start);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
  }

  private static void ensureSlot(SubscriptionIdentity identity, ReplicationConnection connection) throws SQLException {
    try {
      connection.createSlot(identity.slotName(), PostgresRelayOptions.OUTPUT_PLUGIN);
      LOG.info("Created replication slot {}", identity.slotName());
    } catch (SQLException createError) {
      if (!isSlotAlreadyExists(createError)) {
        throw createError;
      }
      LOG.info("Replication slot {} already exists", identity.slotName());
    }
  }

  static boolean isSlotAlreadyExists(SQLException error) {
    String state = error.getSQLState();
    if ("42710".equals(state)) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }

  public SubscriptionIdentity identity() {
    return identity;
  }

  public ReplicationConnection connection() {
    return connection;
  }

  public SystemIdentity system() {
    return system;
  }

  public LogSequenceNumber startPosition() {
    return startPosition;
  }

  @Override
  public void close() {
    connection.close();
  }
}
