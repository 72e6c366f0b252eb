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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.arcself.outbox.core.RelayState;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PostgresOutboxRelayContainerTest {

  private static final String SLOT_NAME = "outbox_it_slot";
  private static final String PUBLICATION_NAME = "outbox_it_pub";
  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void relaysInsertUpdateDeleteAndResumesAfterRestart() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    Vertx vertx = Vertx.vertx();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE orders (id BIGSERIAL PRIMARY KEY, sku TEXT NOT NULL, active BOOLEAN NOT NULL, " +
          "amount NUMERIC(10,2) NOT NULL, meta JSONB NOT NULL)",
        "CREATE PUBLICATION " + PUBLICATION_NAME + " FOR TABLE orders");

      RecordingBroker broker = new RecordingBroker();
      PostgresOutboxRelay relay = new PostgresOutboxRelay(vertx, options(postgres), broker);
      try {
        relay.start().toCompletionStage().toCompletableFuture().get(60, TimeUnit.SECONDS);
        assertEquals(List.of("outbox.orders"), broker.provisioned());
        waitForSlot(postgres);

        execute(postgres,
          "INSERT INTO orders(sku, active, amount, meta) VALUES ('sku-1', true, 12.34, '{\"a\":1}'::jsonb)",
          "UPDATE orders SET active = false WHERE id = 1",
          "DELETE FROM orders WHERE id = 1");

        List<JsonObject> messages = awaitMessages(broker, 3);
        JsonObject insert = messages.get(0);
        assertEquals("insert", insert.getString("operation"));
        assertEquals("orders", insert.getJsonObject("relation").getString("name"));
        assertEquals("sku-1", insert.getJsonObject("columns").getString("sku"));
        assertEquals(true, insert.getJsonObject("columns").getBoolean("active"));
        assertEquals(12.34d, insert.getJsonObject("columns").getDouble("amount"), 0.0001d);
        assertEquals(1, insert.getJsonObject("columns").getJsonObject("meta").getInteger("a"));
        assertEquals("{\"id\":1}", broker.published().get(0).key);

        assertEquals("update", messages.get(1).getString("operation"));
        assertEquals(false, messages.get(1).getJsonObject("columns").getBoolean("active"));

        JsonObject delete = messages.get(2);
        assertEquals("delete", delete.getString("operation"));
        assertEquals(1L, delete.getJsonObject("key_columns").getLong("id"));
        assertEquals("outbox.orders", broker.published().get(2).subject);
      } finally {
        relay.close();
      }
      assertEquals(RelayState.CLOSED, relay.state());

      execute(postgres,
        "INSERT INTO orders(sku, active, amount, meta) VALUES ('sku-2', true, 1.00, '{}'::jsonb)");

      RecordingBroker resumed = new RecordingBroker();
      PostgresOutboxRelay restarted = new PostgresOutboxRelay(vertx, options(postgres), resumed);
      try {
        restarted.start().toCompletionStage().toCompletableFuture().get(60, TimeUnit.SECONDS);
        List<JsonObject> replayed = awaitMessages(resumed, 1);
        JsonObject last = replayed.get(replayed.size() - 1);
        assertEquals("sku-2", last.getJsonObject("columns").getString("sku"));
        for (JsonObject message : replayed) {
          assertTrue(!"sku-1".equals(message.getJsonObject("columns").getString("sku"))
            || !"insert".equals(message.getString("operation")), "acknowledged insert was replayed");
        }
      } finally {
        restarted.close();
      }
    } finally {
      vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      postgres.stop();
    }
  }

  private static PostgresRelayOptions options(GenericContainer<?> postgres) {
    return new PostgresRelayOptions()
      .setJdbcUrl(jdbcUrl(postgres))
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD)
      .setSlotName(SLOT_NAME)
      .setPublicationName(PUBLICATION_NAME)
      .setStandbyInterval(Duration.ofSeconds(1));
  }

  private static List<JsonObject> awaitMessages(RecordingBroker broker, int count) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (broker.published().size() < count) {
      if (System.nanoTime() > deadline) {
        throw new IllegalStateException("Timed out waiting for " + count + " message(s), got "
          + broker.published().size());
      }
      Thread.sleep(50);
    }
    List<JsonObject> messages = new ArrayList<>();
    for (RecordingBroker.Message message : broker.published()) {
      messages.add(new JsonObject(message.payloadText()));
    }
    return messages;
  }

  private static void execute(GenericContainer<?> postgres, String... statements) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    }
  }

  private static void waitForSlot(GenericContainer<?> postgres) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (System.nanoTime() < deadline) {
      try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
           Statement statement = conn.createStatement();
           ResultSet rs = statement.executeQuery(
             "SELECT active FROM pg_replication_slots WHERE slot_name='" + SLOT_NAME + "'")) {
        if (rs.next() && rs.getBoolean(1)) {
          return;
        }
      }
      Thread.sleep(200);
    }
    throw new IllegalStateException("Replication slot was not attached: " + SLOT_NAME);
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=4",
        "-c", "max_wal_senders=4");
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
