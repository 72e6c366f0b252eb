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

/**
 * Applied and acknowledged WAL positions of one session. Owned by the streaming thread.
 */
public final class SessionCursor {

  private long lastAppliedPosition;
  private long lastAcknowledgedPosition;

  public SessionCursor(long startPosition) {
    this.lastAppliedPosition = startPosition;
    this.lastAcknowledgedPosition = startPosition;
  }

  /**
   * Moves the applied position forward. Lower positions are ignored.
   *
   * @return whether the position moved
   */
  public boolean advanceApplied(long position) {
    if (Long.compareUnsigned(position, lastAppliedPosition) <= 0) {
      return false;
    }
    lastAppliedPosition = position;
    return true;
  }

  /**
   * Records that the applied position has been reported upstream.
   */
  public long acknowledge() {
    lastAcknowledgedPosition = lastAppliedPosition;
    return lastAcknowledgedPosition;
  }

  public boolean hasUnacknowledged() {
    return Long.compareUnsigned(lastAppliedPosition, lastAcknowledgedPosition) > 0;
  }

  public long lastAppliedPosition() {
    return lastAppliedPosition;
  }

  public long lastAcknowledgedPosition() {
    return lastAcknowledgedPosition;
  }
}
