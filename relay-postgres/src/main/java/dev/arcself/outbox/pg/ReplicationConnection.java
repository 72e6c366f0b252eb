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

import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import org.postgresql.replication.LogSequenceNumber;

/**
 * The replication-protocol commands a session issues over one walsender connection.
 */
public interface ReplicationConnection extends AutoCloseable {

  /**
   * Creates a permanent logical slot. Fails with SQLSTATE {@code 42710} when it already exists.
   */
  void createSlot(String slotName, String outputPlugin) throws SQLException;

  SystemIdentity identifySystem() throws SQLException;

  void startReplication(String slotName, LogSequenceNumber start, Map<String, String> pluginArgs) throws SQLException;

  /**
   * Returns the next CopyData message without blocking, or {@code null} when none is buffered.
   *
   * @throws SQLException on an upstream error response, a broken connection, or when the server ended
   *     the copy stream
   */
  byte[] readPending() throws SQLException;

  void sendStandbyStatus(long position, Instant clientTime, boolean replyRequested) throws SQLException;

  @Override
  void close();
}
