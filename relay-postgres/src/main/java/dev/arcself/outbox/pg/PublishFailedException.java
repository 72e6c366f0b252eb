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

/**
 * The broker kept rejecting an event after every permitted attempt.
 */
public class PublishFailedException extends FatalRelayException {

  private final String subject;
  private final int attempts;

  public PublishFailedException(String subject, int attempts, Throwable cause) {
    super("Publishing to " + subject + " failed after " + attempts + " attempt(s)", cause);
    this.subject = subject;
    this.attempts = attempts;
  }

  public String getSubject() {
    return subject;
  }

  public int getAttempts() {
    return attempts;
  }
}
