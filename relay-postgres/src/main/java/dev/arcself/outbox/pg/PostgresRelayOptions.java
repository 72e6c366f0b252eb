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

import dev.arcself.outbox.core.OptionValidation;
import dev.arcself.outbox.core.RetryPolicy;
import dev.arcself.outbox.core.SubscriptionIdentity;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection, replication slot and publishing configuration of a {@link PostgresOutboxRelay}.
 */
public class PostgresRelayOptions {

  public static final String DEFAULT_SLOT_NAME = "outbox_slot";
  public static final String DEFAULT_PUBLICATION_NAME = "outbox_pub";
  public static final String OUTPUT_PLUGIN = "pgoutput";
  public static final int DEFAULT_PROTO_VERSION = 2;
  public static final Duration DEFAULT_STANDBY_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(20);
  public static final String DEFAULT_SUBJECT_PREFIX = "outbox";

  private String jdbcUrl;
  private String replicationJdbcUrl;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String publicationName;
  private int protoVersion;
  private Duration standbyInterval;
  private Duration pollInterval;
  private String subjectPrefix;
  private RetryPolicy publishRetryPolicy;

  public PostgresRelayOptions() {
    init();
  }

  public PostgresRelayOptions(JsonObject json) {
    init();
    PostgresRelayOptionsConverter.fromJson(json, this);
  }

  public PostgresRelayOptions(PostgresRelayOptions other) {
    this.jdbcUrl = other.jdbcUrl;
    this.replicationJdbcUrl = other.replicationJdbcUrl;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.publicationName = other.publicationName;
    this.protoVersion = other.protoVersion;
    this.standbyInterval = other.standbyInterval;
    this.pollInterval = other.pollInterval;
    this.subjectPrefix = other.subjectPrefix;
    this.publishRetryPolicy = other.publishRetryPolicy.copy();
  }

  /**
   * JDBC URL of the database, used for slot metadata and publication queries.
   */
  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public PostgresRelayOptions setJdbcUrl(String jdbcUrl) {
    this.jdbcUrl = jdbcUrl;
    return this;
  }

  /**
   * JDBC URL for the walsender connection. Falls back to {@link #getJdbcUrl()} when unset.
   */
  public String getReplicationJdbcUrl() {
    return replicationJdbcUrl;
  }

  public PostgresRelayOptions setReplicationJdbcUrl(String replicationJdbcUrl) {
    this.replicationJdbcUrl = replicationJdbcUrl;
    return this;
  }

  public String effectiveReplicationJdbcUrl() {
    return replicationJdbcUrl == null || replicationJdbcUrl.isBlank() ? jdbcUrl : replicationJdbcUrl;
  }

  public String getUser() {
    return user;
  }

  public PostgresRelayOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresRelayOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresRelayOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresRelayOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresRelayOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublicationName() {
    return publicationName;
  }

  public PostgresRelayOptions setPublicationName(String publicationName) {
    this.publicationName = publicationName;
    return this;
  }

  public int getProtoVersion() {
    return protoVersion;
  }

  public PostgresRelayOptions setProtoVersion(int protoVersion) {
    this.protoVersion = protoVersion;
    return this;
  }

  /**
   * Maximum time between two standby status updates.
   */
  public Duration getStandbyInterval() {
    return standbyInterval;
  }

  public PostgresRelayOptions setStandbyInterval(Duration standbyInterval) {
    this.standbyInterval = standbyInterval;
    return this;
  }

  /**
   * Upper bound of the idle wait when no frame is buffered.
   */
  public Duration getPollInterval() {
    return pollInterval;
  }

  public PostgresRelayOptions setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
    return this;
  }

  public String getSubjectPrefix() {
    return subjectPrefix;
  }

  public PostgresRelayOptions setSubjectPrefix(String subjectPrefix) {
    this.subjectPrefix = subjectPrefix;
    return this;
  }

  public RetryPolicy getPublishRetryPolicy() {
    return publishRetryPolicy;
  }

  public PostgresRelayOptions setPublishRetryPolicy(RetryPolicy publishRetryPolicy) {
    this.publishRetryPolicy = Objects.requireNonNull(publishRetryPolicy, "publishRetryPolicy");
    return this;
  }

  public SubscriptionIdentity identity() {
    return new SubscriptionIdentity(slotName, publicationName);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresRelayOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresRelayOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresRelayOptions(json);
  }

  void validate() {
    OptionValidation.require("jdbcUrl", jdbcUrl);
    if (!jdbcUrl.startsWith("jdbc:postgresql:")) {
      throw new IllegalArgumentException("jdbcUrl must start with jdbc:postgresql:");
    }
    OptionValidation.require("user", user);
    OptionValidation.requireIdentifier("slotName", slotName);
    OptionValidation.requireIdentifier("publicationName", publicationName);
    if (protoVersion < 1 || protoVersion > 4) {
      throw new IllegalArgumentException("protoVersion must be between 1 and 4");
    }
    OptionValidation.requirePositive("standbyInterval", standbyInterval);
    OptionValidation.requirePositive("pollInterval", pollInterval);
    OptionValidation.require("subjectPrefix", subjectPrefix);
    Objects.requireNonNull(publishRetryPolicy, "publishRetryPolicy").validate();
  }

  private void init() {
    ssl = false;
    slotName = DEFAULT_SLOT_NAME;
    publicationName = DEFAULT_PUBLICATION_NAME;
    protoVersion = DEFAULT_PROTO_VERSION;
    standbyInterval = DEFAULT_STANDBY_INTERVAL;
    pollInterval = DEFAULT_POLL_INTERVAL;
    subjectPrefix = DEFAULT_SUBJECT_PREFIX;
    publishRetryPolicy = RetryPolicy.exponentialBackoff();
  }
}
