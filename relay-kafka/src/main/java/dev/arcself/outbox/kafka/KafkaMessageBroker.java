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

import dev.arcself.outbox.core.MessageBroker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes relay messages to Kafka topics named after their subject. A publish returns only once
 * all in-sync replicas acknowledged the record.
 */
public class KafkaMessageBroker implements MessageBroker {

  private static final Logger LOG = LoggerFactory.getLogger(KafkaMessageBroker.class);
  private static final Duration ADMIN_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private final KafkaBrokerOptions options;
  private final Producer<String, byte[]> producer;
  private final Supplier<Admin> adminFactory;

  public KafkaMessageBroker(KafkaBrokerOptions options) {
    this(options, null, null);
  }

  KafkaMessageBroker(KafkaBrokerOptions options, Producer<String, byte[]> producer, Supplier<Admin> adminFactory) {
    this.options = new KafkaBrokerOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.producer = producer != null ? producer : new KafkaProducer<>(this.options.toProducerProperties());
    this.adminFactory = adminFactory != null ? adminFactory : () -> Admin.create(this.options.toAdminProperties());
  }

  @Override
  public void provision(Collection<String> subjects) throws Exception {
    if (subjects.isEmpty()) {
      return;
    }
    List<NewTopic> topics = new ArrayList<>();
    for (String subject : subjects) {
      topics.add(new NewTopic(subject, options.getTopicPartitions(), options.getTopicReplicationFactor()));
    }

    try (Admin admin = adminFactory.get()) {
      Map<String, KafkaFuture<Void>> results = admin.createTopics(topics).values();
      for (Map.Entry<String, KafkaFuture<Void>> result : results.entrySet()) {
        try {
          result.getValue().get(ADMIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
          LOG.info("Created topic {}", result.getKey());
        } catch (ExecutionException e) {
          if (!(e.getCause() instanceof TopicExistsException)) {
            throw new IllegalStateException("Could not create topic " + result.getKey(), e.getCause());
          }
          LOG.debug("Topic {} already exists", result.getKey());
        }
      }
    }
  }

  @Override
  public void publish(String subject, String key, byte[] payload) throws Exception {
    Future<RecordMetadata> future = producer.send(new ProducerRecord<>(subject, key, payload));
    try {
      RecordMetadata metadata = future.get(options.getPublishTimeout().toMillis(), TimeUnit.MILLISECONDS);
      LOG.trace("Published to {} partition {} offset {}", subject, metadata.partition(), metadata.offset());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw e;
    }
  }

  @Override
  public void close() {
    producer.close(CLOSE_TIMEOUT);
  }
}
