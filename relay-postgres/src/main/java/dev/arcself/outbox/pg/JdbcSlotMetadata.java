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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SlotMetadata} over a fresh ordinary connection per query.
 */
public final class JdbcSlotMetadata implements SlotMetadata {

  private final PgJdbcConnections connections;

  public JdbcSlotMetadata(PgJdbcConnections connections) {
    this.connections = connections;
  }

  @Override
  public Optional<String> confirmedFlushPosition(String slotName) throws SQLException {
    try (Connection conn = connections.openStandardConnection();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT confirmed_flush_lsn::text FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String value = rs.getString(1);
        if (value == null || value.isBlank()) {
          return Optional.empty();
        }
        return Optional.of(value);
      }
    }
  }

  @Override
  public List<String> publicationTables(String publicationName) throws SQLException {
    try (Connection conn = connections.openStandardConnection();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT schemaname, tablename FROM pg_publication_tables WHERE pubname = ? "
             + "ORDER BY schemaname, tablename")) {
      statement.setString(1, publicationName);
      try (ResultSet rs = statement.executeQuery()) {
        List<String> tables = new ArrayList<>();
        while (rs.next()) {
          tables.add(rs.getString(1) + "." + rs.getString(2));
        }
        return tables;
      }
    }
  }
}
