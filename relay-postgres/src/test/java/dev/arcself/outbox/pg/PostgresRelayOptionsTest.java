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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PostgresRelayOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    JsonObject json = new JsonObject()
      .put("jdbcUrl", "jdbc:postgresql://db.internal:15432/app")
      .put("replicationJdbcUrl", "jdbc:postgresql://primary.internal:15432/app")
      .put("user", "service")
      .put("passwordEnv", "PG_PASSWORD")
      .put("ssl", true)
      .put("slotName", "app_slot")
      .put("publicationName", "app_pub")
      .put("protoVersion", 1)
      .put("standbyIntervalMs", 4000L)
      .put("pollIntervalMs", 5L)
      .put("subjectPrefix", "events")
      .put("publishRetryPolicy", new JsonObject()
        .put("initialDelayMs", 250L)
        .put("maxDelayMs", 2000L)
        .put("multiplier", 1.5d)
        .put("jitter", 0.1d)
        .put("maxAttempts", 7));

    PostgresRelayOptions options = new PostgresRelayOptions(json);

    assertEquals("jdbc:postgresql://db.internal:15432/app", options.getJdbcUrl());
    assertEquals("jdbc:postgresql://primary.internal:15432/app", options.effectiveReplicationJdbcUrl());
    assertEquals("service", options.getUser());
    assertEquals("PG_PASSWORD", options.getPasswordEnv());
    assertTrue(options.getSsl());
    assertEquals("app_slot", options.identity().slotName());
    assertEquals("app_pub", options.identity().publicationName());
    assertEquals(1, options.getProtoVersion());
    assertEquals(Duration.ofSeconds(4), options.getStandbyInterval());
    assertEquals(Duration.ofMillis(5), options.getPollInterval());
    assertEquals("events", options.getSubjectPrefix());
    assertEquals(7, options.getPublishRetryPolicy().getMaxAttempts());
    assertEquals(Duration.ofMillis(250), options.getPublishRetryPolicy().getInitialDelay());

    JsonObject out = options.toJson();
    assertEquals("app_slot", out.getString("slotName"));
    assertEquals(4000L, out.getLong("standbyIntervalMs"));
    assertEquals(7, out.getJsonObject("publishRetryPolicy").getInteger("maxAttempts"));
  }

  @Test
  void defaultsMatchTheOutboxConvention() {
    PostgresRelayOptions options = new PostgresRelayOptions();

    assertEquals("outbox_slot", options.getSlotName());
    assertEquals("outbox_pub", options.getPublicationName());
    assertEquals(2, options.getProtoVersion());
    assertEquals(Duration.ofSeconds(10), options.getStandbyInterval());
    assertEquals("outbox", options.getSubjectPrefix());
    assertTrue(options.getPublishRetryPolicy().isEnabled());
    assertEquals(5, options.getPublishRetryPolicy().getMaxAttempts());
    assertNull(options.getReplicationJdbcUrl());
  }

  @Test
  void replicationUrlFallsBackToJdbcUrl() {
    PostgresRelayOptions options = new PostgresRelayOptions().setJdbcUrl("jdbc:postgresql://localhost/app");
    assertEquals("jdbc:postgresql://localhost/app", options.effectiveReplicationJdbcUrl());
  }

  @Test
  void mergesWithJsonLikeOtherVertxOptions() {
    PostgresRelayOptions base = new PostgresRelayOptions()
      .setJdbcUrl("jdbc:postgresql://localhost/app")
      .setUser("u");

    PostgresRelayOptions merged = base.merge(new JsonObject()
      .put("slotName", "other_slot")
      .put("ssl", true));

    assertEquals("other_slot", merged.getSlotName());
    assertTrue(merged.getSsl());
    assertEquals("u", merged.getUser());
    assertFalse(base.getSsl());
  }

  @Test
  void copyIsIndependent() {
    PostgresRelayOptions original = new PostgresRelayOptions().setJdbcUrl("jdbc:postgresql://localhost/app");
    PostgresRelayOptions copy = new PostgresRelayOptions(original);
    copy.getPublishRetryPolicy().setMaxAttempts(9);

    assertEquals(5, original.getPublishRetryPolicy().getMaxAttempts());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> valid().setJdbcUrl(null).validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setJdbcUrl("jdbc:mysql://x/app").validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setUser(" ").validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setSlotName("Bad-Slot").validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setPublicationName("pub; DROP").validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setProtoVersion(0).validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setStandbyInterval(Duration.ZERO).validate());
    assertThrows(IllegalArgumentException.class, () -> valid().setSubjectPrefix("").validate());
    valid().validate();
  }

  private static PostgresRelayOptions valid() {
    return new PostgresRelayOptions()
      .setJdbcUrl("jdbc:postgresql://localhost:5432/app")
      .setUser("app");
  }
}
