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
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens PgJDBC connections for a relay: walsender connections in {@code replication=database} mode
 * and ordinary ones for metadata queries.
 */
public final class PgJdbcConnections {

  private final PostgresRelayOptions options;

  public PgJdbcConnections(PostgresRelayOptions options) {
    this.options = options;
  }

  public ReplicationConnector replicationConnector() {
    return () -> new PgJdbcReplicationConnection(openReplicationConnection());
  }

  public Connection openReplicationConnection() throws SQLException {
    Properties props = connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    return DriverManager.getConnection(options.effectiveReplicationJdbcUrl(), props);
  }

  public Connection openStandardConnection() throws SQLException {
    return DriverManager.getConnection(options.getJdbcUrl(), connectionProperties());
  }

  private Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}
