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

import dev.arcself.outbox.core.RelaySubscription;
import java.util.Objects;
import org.slf4j.Logger;

public final class ReplicationLogging {

  private ReplicationLogging() {
  }

  public static RelaySubscription attachDefaultLogging(PostgresOutboxRelay relay, Logger logger, String relayName) {
    Objects.requireNonNull(relay, "relay");
    Objects.requireNonNull(logger, "logger");
    String name = relayName == null || relayName.isBlank() ? relay.identity().toString() : relayName;

    return relay.onStateChange(change -> {
      Throwable cause = change.cause();
      if (cause != null) {
        logger.warn("relay={} state={} prev={} cause={}",
          name,
          change.state(),
          change.previousState(),
          cause.toString());
      } else {
        logger.info("relay={} state={} prev={}",
          name,
          change.state(),
          change.previousState());
      }
    });
  }
}
