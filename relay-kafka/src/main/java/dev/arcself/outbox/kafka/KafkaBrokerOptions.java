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

package dev.arcself.outbox.kafka;

import dev.arcself.outbox.core.OptionValidation;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Producer and topic provisioning settings of a {@link KafkaMessageBroker}.
 */
public class KafkaBrokerOptions {

  public static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
  public static final String DEFAULT_CLIENT_ID = "outbox-relay";
  public static final Duration DEFAULT_PUBLISH_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_TOPIC_PARTITIONS = 1;
  public static final short DEFAULT_TOPIC_REPLICATION_FACTOR = 1;

  private String bootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
  private String clientId = DEFAULT_CLIENT_ID;
  private Duration publishTimeout = DEFAULT_PUBLISH_TIMEOUT;
  private int topicPartitions = DEFAULT_TOPIC_PARTITIONS;
  private short topicReplicationFactor = DEFAULT_TOPIC_REPLICATION_FACTOR;
  private Map<String, Object> producerProperties = new LinkedHashMap<>();

  public KafkaBrokerOptions() {
  }

  public KafkaBrokerOptions(KafkaBrokerOptions other) {
    this.bootstrapServers = other.bootstrapServers;
    this.clientId = other.clientId;
    this.publishTimeout = other.publishTimeout;
    this.topicPartitions = other.topicPartitions;
    this.topicReplicationFactor = other.topicReplicationFactor;
    this.producerProperties = new LinkedHashMap<>(other.producerProperties);
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public KafkaBrokerOptions setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
    return this;
  }

  public String getClientId() {
    return clientId;
  }

  public KafkaBrokerOptions setClientId(String clientId) {
    this.clientId = clientId;
    return this;
  }

  /**
   * How long a publish waits for the broker acknowledgement before the attempt counts as failed.
   */
  public Duration getPublishTimeout() {
    return publishTimeout;
  }

  public KafkaBrokerOptions setPublishTimeout(Duration publishTimeout) {
    this.publishTimeout = publishTimeout;
    return this;
  }

  public int getTopicPartitions() {
    return topicPartitions;
  }

  public KafkaBrokerOptions setTopicPartitions(int topicPartitions) {
    this.topicPartitions = topicPartitions;
    return this;
  }

  public short getTopicReplicationFactor() {
    return topicReplicationFactor;
  }

  public KafkaBrokerOptions setTopicReplicationFactor(short topicReplicationFactor) {
    this.topicReplicationFactor = topicReplicationFactor;
    return this;
  }

  public Map<String, Object> getProducerProperties() {
    return producerProperties;
  }

  /**
   * Extra producer settings such as security configuration. Durability settings cannot be
   * overridden.
   */
  public KafkaBrokerOptions setProducerProperties(Map<String, Object> producerProperties) {
    this.producerProperties = new LinkedHashMap<>(Objects.requireNonNull(producerProperties, "producerProperties"));
    return this;
  }

  public KafkaBrokerOptions addProducerProperty(String name, Object value) {
    this.producerProperties.put(name, value);
    return this;
  }

  void validate() {
    OptionValidation.require("bootstrapServers", bootstrapServers);
    OptionValidation.require("clientId", clientId);
    OptionValidation.requirePositive("publishTimeout", publishTimeout);
    OptionValidation.requireMin("topicPartitions", topicPartitions, 1);
    OptionValidation.requireMin("topicReplicationFactor", topicReplicationFactor, 1);
  }

  Properties toProducerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, publishTimeout.toMillis());
    props.putAll(producerProperties);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return props;
  }

  Properties toAdminProperties() {
    Properties props = new Properties();
    for (Map.Entry<String, Object> entry : producerProperties.entrySet()) {
      if (AdminClientConfig.configNames().contains(entry.getKey())) {
        props.put(entry.getKey(), entry.getValue());
      }
    }
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId + "-admin");
    return props;
  }

  @Override
  public String toString() {
    return "KafkaBrokerOptions{" +
      "bootstrapServers='" + bootstrapServers + '\'' +
      ", clientId='" + clientId + '\'' +
      ", publishTimeout=" + publishTimeout +
      ", topicPartitions=" + topicPartitions +
      ", topicReplicationFactor=" + topicReplicationFactor +
      '}';
  }
}
