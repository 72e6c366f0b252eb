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

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyDual;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walsender connection driven through PgJDBC. The CopyBoth stream is read raw through
 * {@link CopyDual} so keepalive frames and their reply flag stay visible to the streaming loop.
 */
final class PgJdbcReplicationConnection implements ReplicationConnection {

  private static final Logger LOG = LoggerFactory.getLogger(PgJdbcReplicationConnection.class);

  private final Connection connection;
  private final PGConnection pgConnection;
  private volatile CopyDual copyStream;

  PgJdbcReplicationConnection(Connection connection) throws SQLException {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.pgConnection = connection.unwrap(PGConnection.class);
  }

  @Override
  public void createSlot(String slotName, String outputPlugin) throws SQLException {
    pgConnection.getReplicationAPI()
      .createReplicationSlot()
      .logical()
      .withSlotName(slotName)
      .withOutputPlugin(outputPlugin)
      .make();
  }

  @Override
  public SystemIdentity identifySystem() throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("IDENTIFY_SYSTEM")) {
      if (!rs.next()) {
        throw new SQLException("IDENTIFY_SYSTEM returned no row");
      }
      String xLogPos = rs.getString("xlogpos");
      if (!WalPositions.isWellFormed(xLogPos)) {
        throw new SQLException("IDENTIFY_SYSTEM returned malformed xlogpos '" + xLogPos + "'");
      }
      return new SystemIdentity(
        rs.getString("systemid"),
        rs.getInt("timeline"),
        WalPositions.parse(xLogPos),
        rs.getString("dbname"));
    }
  }

  @Override
  public void startReplication(String slotName,
                               LogSequenceNumber start,
                               Map<String, String> pluginArgs) throws SQLException {
    StringBuilder sql = new StringBuilder("START_REPLICATION SLOT ")
      .append(slotName)
      .append(" LOGICAL ")
      .append(start.asString());
    if (!pluginArgs.isEmpty()) {
      sql.append(" (");
      boolean first = true;
      for (Map.Entry<String, String> arg : pluginArgs.entrySet()) {
        if (!first) {
          sql.append(", ");
        }
        first = false;
        sql.append('"').append(arg.getKey()).append("\" '")
          .append(arg.getValue().replace("'", "''")).append('\'');
      }
      sql.append(')');
    }
    LOG.debug("Issuing {}", sql);
    copyStream = pgConnection.getCopyAPI().copyDual(sql.toString());
  }

  @Override
  public byte[] readPending() throws SQLException {
    CopyDual stream = requireStream();
    if (!stream.isActive()) {
      throw new SQLException("replication stream was ended by the server");
    }
    return stream.readFromCopy(false);
  }

  @Override
  public void sendStandbyStatus(long position, Instant clientTime, boolean replyRequested) throws SQLException {
    CopyDual stream = requireStream();
    byte[] update = ReplicationFrame.standbyStatusUpdate(position, clientTime, replyRequested);
    stream.writeToCopy(update, 0, update.length);
    stream.flushCopy();
  }

  @Override
  public void close() {
    CopyDual stream = copyStream;
    copyStream = null;
    if (stream != null && stream.isActive()) {
      try {
        stream.cancelCopy();
      } catch (SQLException e) {
        LOG.debug("Cancelling replication copy stream failed", e);
      }
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Closing replication connection failed", e);
    }
  }

  private CopyDual requireStream() throws SQLException {
    CopyDual stream = copyStream;
    if (stream == null) {
      throw new SQLException("replication has not been started");
    }
    return stream;
  }
}
