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

package dev.arcself.outbox.worker;

import dev.arcself.outbox.core.RelayState;
import dev.arcself.outbox.kafka.KafkaMessageBroker;
import dev.arcself.outbox.pg.LoggingMetricsListener;
import dev.arcself.outbox.pg.PostgresOutboxRelay;
import dev.arcself.outbox.pg.ReplicationLogging;
import io.vertx.core.Vertx;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: relays the configured publication to Kafka until the process is signalled or
 * the relay faults. Exits with status 0 after a graceful shutdown and 1 otherwise, so a supervisor
 * restarts it after a fault.
 */
public final class OutboxRelayWorker {

  private static final Logger LOG = LoggerFactory.getLogger(OutboxRelayWorker.class);
  private static final long CLEANUP_WAIT_SECONDS = 15L;

  private OutboxRelayWorker() {
  }

  public static void main(String[] args) {
    WorkerConfig config;
    try {
      config = WorkerConfig.fromEnv();
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid configuration: {}", e.getMessage());
      System.exit(1);
      return;
    }
    System.exit(run(config));
  }

  static int run(WorkerConfig config) {
    LOG.info("Starting outbox relay: slot={} publication={} kafka={}",
      config.slotName(), config.publicationName(), config.bootstrapServers());

    Vertx vertx = Vertx.vertx();
    KafkaMessageBroker broker;
    PostgresOutboxRelay relay;
    try {
      broker = new KafkaMessageBroker(config.toBrokerOptions());
      relay = new PostgresOutboxRelay(vertx, config.toRelayOptions(), broker);
    } catch (RuntimeException e) {
      LOG.error("Could not set up the relay", e);
      vertx.close();
      return 1;
    }

    ReplicationLogging.attachDefaultLogging(relay, LOG, config.slotName());
    LoggingMetricsListener metrics = new LoggingMetricsListener();
    relay.addMetricsListener(metrics);

    CountDownLatch cleanedUp = new CountDownLatch(1);
    Thread shutdownHook = new Thread(() -> {
      LOG.info("Shutdown requested");
      relay.close();
      try {
        cleanedUp.await(CLEANUP_WAIT_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      // a signal would otherwise end the JVM with 128 + signal number
      Runtime.getRuntime().halt(relay.state() == RelayState.FAULTED ? 1 : 0);
    }, "outbox-relay-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    int status;
    try {
      relay.start();
      relay.termination().toCompletionStage().toCompletableFuture().join();
      LOG.info("Outbox relay stopped after publishing {} event(s), last acknowledged position {}",
        metrics.publishedCount(), metrics.lastAcknowledged());
      status = 0;
    } catch (CompletionException e) {
      LOG.error("Outbox relay faulted after publishing {} event(s); exiting for restart",
        metrics.publishedCount(), e.getCause());
      status = 1;
    } finally {
      broker.close();
      vertx.close();
      cleanedUp.countDown();
    }

    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      LOG.debug("Shutdown already in progress", e);
    }
    return status;
  }
}
