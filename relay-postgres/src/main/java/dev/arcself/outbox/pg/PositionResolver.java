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

import dev.arcself.outbox.core.FatalRelayException;
import dev.arcself.outbox.core.SubscriptionIdentity;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses where streaming starts: the slot's confirmed flush position when it has one, the server's
 * current tip for a slot that has never confirmed anything.
 */
public class PositionResolver {

  private static final Logger LOG = LoggerFactory.getLogger(PositionResolver.class);

  private final SlotMetadata metadata;

  public PositionResolver(SlotMetadata metadata) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  /**
   * @param tip the server's current position as reported by {@code IDENTIFY_SYSTEM}
   * @throws FatalRelayException if the metadata query fails or the confirmed position is malformed;
   *     neither case falls back to the tip
   */
  public LogSequenceNumber resolve(SubscriptionIdentity identity, LogSequenceNumber tip) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(tip, "tip");

    Optional<String> confirmed;
    try {
      confirmed = metadata.confirmedFlushPosition(identity.slotName());
    } catch (SQLException e) {
      throw new FatalRelayException(
        "Could not read the confirmed position of slot " + identity.slotName(), e);
    }

    if (confirmed.isEmpty() || confirmed.get().isBlank()) {
      LOG.info("Slot {} has no confirmed position, starting at current tip {}", identity.slotName(), tip.asString());
      return tip;
    }

    String raw = confirmed.get();
    if (!WalPositions.isWellFormed(raw)) {
      throw new FatalRelayException("Slot " + identity.slotName() + " reports malformed confirmed position '"
        + raw + "'; refusing to guess a start position");
    }

    LogSequenceNumber position = WalPositions.parse(raw);
    LOG.info("Resuming slot {} at confirmed position {}", identity.slotName(), position.asString());
    return position;
  }
}
