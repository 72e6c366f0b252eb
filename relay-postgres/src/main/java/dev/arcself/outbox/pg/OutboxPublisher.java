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

import dev.arcself.outbox.core.MessageBroker;
import dev.arcself.outbox.core.RetryPolicy;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes change events and hands them to the broker, retrying with backoff. Events are never
 * dropped: when retries run out the failure is fatal for the session.
 */
public class OutboxPublisher {

  private static final Logger LOG = LoggerFactory.getLogger(OutboxPublisher.class);

  private final MessageBroker broker;
  private final SubjectRouter router;
  private final RetryPolicy retryPolicy;

  public OutboxPublisher(MessageBroker broker, SubjectRouter router, RetryPolicy retryPolicy) {
    this.broker = Objects.requireNonNull(broker, "broker");
    this.router = Objects.requireNonNull(router, "router");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy").copy();
  }

  /**
   * Blocks until the broker acknowledged the event.
   *
   * @return the subject the event was published to
   * @throws PublishFailedException when every attempt failed or the thread was interrupted
   */
  public String publish(PostgresChangeEvent event) {
    String subject = router.subjectFor(event);
    String key = ChangeEventEnvelope.messageKey(event);
    byte[] payload = ChangeEventEnvelope.encode(event);

    int attempt = 0;
    while (true) {
      attempt++;
      try {
        broker.publish(subject, key, payload);
        return subject;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PublishFailedException(subject, attempt, e);
      } catch (Exception e) {
        if (!retryPolicy.allowsAnotherAttempt(attempt)) {
          throw new PublishFailedException(subject, attempt, e);
        }
        long delay = retryPolicy.backoffMillis(attempt);
        LOG.warn("Publish to {} failed (attempt {}/{}), retrying in {} ms: {}",
          subject, attempt, retryPolicy.getMaxAttempts(), delay, e.toString());
        try {
          Thread.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          PublishFailedException failure = new PublishFailedException(subject, attempt, e);
          failure.addSuppressed(interrupted);
          throw failure;
        }
      }
    }
  }

  public SubjectRouter router() {
    return router;
  }
}
