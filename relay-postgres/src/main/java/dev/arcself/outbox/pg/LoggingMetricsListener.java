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

import dev.arcself.outbox.core.RelayMetricsListener;
import dev.arcself.outbox.core.RelayStateChange;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs relay activity and keeps simple counters.
 */
public class LoggingMetricsListener implements RelayMetricsListener<PostgresChangeEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(LoggingMetricsListener.class);

  private final AtomicLong published = new AtomicLong();
  private final AtomicLong decodeFailures = new AtomicLong();
  private volatile String lastAcknowledged;

  @Override
  public void onEventPublished(PostgresChangeEvent event, String subject) {
    published.incrementAndGet();
    LOG.debug("published {} {} to {} at {}",
      event.getOperation(), event.qualifiedName(), subject, event.walPositionText());
  }

  @Override
  public void onDecodeFailure(String walPosition, Throwable error) {
    decodeFailures.incrementAndGet();
    LOG.warn("decode failure at {}: {}", walPosition, error.toString());
  }

  @Override
  public void onStateChange(RelayStateChange stateChange) {
    LOG.debug("state {} -> {}", stateChange.previousState(), stateChange.state());
  }

  @Override
  public void onPositionAcknowledged(String slotName, String walPosition) {
    lastAcknowledged = walPosition;
    LOG.debug("slot {} acknowledged {}", slotName, walPosition);
  }

  public long publishedCount() {
    return published.get();
  }

  public long decodeFailureCount() {
    return decodeFailures.get();
  }

  public String lastAcknowledged() {
    return lastAcknowledged;
  }
}
