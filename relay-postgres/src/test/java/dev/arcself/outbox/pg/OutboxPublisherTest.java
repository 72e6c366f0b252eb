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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.arcself.outbox.core.FatalRelayException;
import dev.arcself.outbox.core.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OutboxPublisherTest {

  private static final RetryPolicy FAST_RETRY = RetryPolicy.exponentialBackoff()
    .setInitialDelay(Duration.ofMillis(1))
    .setMaxDelay(Duration.ofMillis(1))
    .setJitter(0.0d)
    .setMaxAttempts(4);

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void publishesEnvelopeToTableSubject() {
    RecordingBroker broker = new RecordingBroker();
    OutboxPublisher publisher = new OutboxPublisher(broker, new SubjectRouter("outbox"), FAST_RETRY);

    assertEquals("outbox.orders", publisher.publish(orderInsert()));

    RecordingBroker.Message message = broker.published().get(0);
    assertEquals("outbox.orders", message.subject);
    assertEquals("{\"id\":7}", message.key);
    assertTrue(message.payloadText().contains("\"operation\":\"insert\""));
  }

  @Test
  void retriesTransientFailures() {
    RecordingBroker broker = new RecordingBroker().failTimes(3);
    OutboxPublisher publisher = new OutboxPublisher(broker, new SubjectRouter("outbox"), FAST_RETRY);

    publisher.publish(orderInsert());

    assertEquals(4, broker.attempts());
    assertEquals(1, broker.published().size());
  }

  @Test
  void givesUpAfterMaxAttemptsWithFatalError() {
    RecordingBroker broker = new RecordingBroker().failAlways();
    OutboxPublisher publisher = new OutboxPublisher(broker, new SubjectRouter("outbox"), FAST_RETRY);

    PublishFailedException error = assertThrows(PublishFailedException.class, () -> publisher.publish(orderInsert()));

    assertTrue(error instanceof FatalRelayException);
    assertEquals(4, error.getAttempts());
    assertEquals("outbox.orders", error.getSubject());
    assertTrue(broker.published().isEmpty());
  }

  @Test
  void disabledRetryMakesASingleAttempt() {
    RecordingBroker broker = new RecordingBroker().failAlways();
    OutboxPublisher publisher = new OutboxPublisher(broker, new SubjectRouter("outbox"), RetryPolicy.disabled());

    assertThrows(PublishFailedException.class, () -> publisher.publish(orderInsert()));
    assertEquals(1, broker.attempts());
  }

  @Test
  void interruptionDuringBackoffAbortsThePublish() {
    RecordingBroker broker = new RecordingBroker().failAlways();
    RetryPolicy slow = RetryPolicy.exponentialBackoff().setInitialDelay(Duration.ofSeconds(30))
      .setMaxDelay(Duration.ofSeconds(30)).setJitter(0.0d);
    OutboxPublisher publisher = new OutboxPublisher(broker, new SubjectRouter("outbox"), slow);

    Thread.currentThread().interrupt();
    PublishFailedException error = assertThrows(PublishFailedException.class, () -> publisher.publish(orderInsert()));

    assertEquals(1, error.getAttempts());
    assertEquals(1, error.getSuppressed().length);
    assertTrue(Thread.currentThread().isInterrupted());
  }

  private static PostgresChangeEvent orderInsert() {
    return new PostgresChangeEvent("public", "orders", PostgresChangeEvent.Operation.INSERT,
      Map.of("id", 7), Map.of(), List.of("id"), List.of(), null, 0x10L);
  }
}
