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

import dev.arcself.outbox.core.RetryPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresRelayOptionsConverter {

  private PostgresRelayOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresRelayOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("jdbcUrl")) {
      options.setJdbcUrl(json.getString("jdbcUrl"));
    }
    if (json.containsKey("replicationJdbcUrl")) {
      options.setReplicationJdbcUrl(json.getString("replicationJdbcUrl"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("publicationName")) {
      options.setPublicationName(json.getString("publicationName"));
    }
    if (json.containsKey("protoVersion")) {
      options.setProtoVersion(json.getInteger("protoVersion"));
    }
    if (json.containsKey("standbyIntervalMs")) {
      options.setStandbyInterval(Duration.ofMillis(json.getLong("standbyIntervalMs")));
    }
    if (json.containsKey("pollIntervalMs")) {
      options.setPollInterval(Duration.ofMillis(json.getLong("pollIntervalMs")));
    }
    if (json.containsKey("subjectPrefix")) {
      options.setSubjectPrefix(json.getString("subjectPrefix"));
    }

    JsonObject retryPolicyJson = json.getJsonObject("publishRetryPolicy");
    if (retryPolicyJson != null) {
      RetryPolicy parsed = retryPolicyJson.getBoolean("enabled", true)
        ? RetryPolicy.exponentialBackoff()
        : RetryPolicy.disabled();
      parsed.setInitialDelay(Duration.ofMillis(retryPolicyJson.getLong("initialDelayMs", RetryPolicy.DEFAULT_INITIAL_DELAY.toMillis())));
      parsed.setMaxDelay(Duration.ofMillis(retryPolicyJson.getLong("maxDelayMs", RetryPolicy.DEFAULT_MAX_DELAY.toMillis())));
      parsed.setMultiplier(retryPolicyJson.getDouble("multiplier", RetryPolicy.DEFAULT_MULTIPLIER));
      parsed.setJitter(retryPolicyJson.getDouble("jitter", RetryPolicy.DEFAULT_JITTER));
      if (parsed.isEnabled()) {
        parsed.setMaxAttempts(retryPolicyJson.getInteger("maxAttempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS));
      }
      options.setPublishRetryPolicy(parsed);
    }
  }

  static void toJson(PostgresRelayOptions options, JsonObject json) {
    json.put("jdbcUrl", options.getJdbcUrl());
    json.put("replicationJdbcUrl", options.getReplicationJdbcUrl());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("publicationName", options.getPublicationName());
    json.put("protoVersion", options.getProtoVersion());
    json.put("standbyIntervalMs", options.getStandbyInterval().toMillis());
    json.put("pollIntervalMs", options.getPollInterval().toMillis());
    json.put("subjectPrefix", options.getSubjectPrefix());

    RetryPolicy retryPolicy = options.getPublishRetryPolicy();
    JsonObject retry = new JsonObject();
    retry.put("enabled", retryPolicy.isEnabled());
    retry.put("initialDelayMs", retryPolicy.getInitialDelay().toMillis());
    retry.put("maxDelayMs", retryPolicy.getMaxDelay().toMillis());
    retry.put("multiplier", retryPolicy.getMultiplier());
    retry.put("jitter", retryPolicy.getJitter());
    retry.put("maxAttempts", retryPolicy.getMaxAttempts());
    json.put("publishRetryPolicy", retry);
  }
}
