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

import org.postgresql.replication.LogSequenceNumber;

/**
 * Result of {@code IDENTIFY_SYSTEM}.
 */
public final class SystemIdentity {

  private final String systemId;
  private final int timeline;
  private final LogSequenceNumber xLogPos;
  private final String dbName;

  public SystemIdentity(String systemId, int timeline, LogSequenceNumber xLogPos, String dbName) {
    this.systemId = systemId;
    this.timeline = timeline;
    this.xLogPos = xLogPos;
    this.dbName = dbName;
  }

  public String systemId() {
    return systemId;
  }

  public int timeline() {
    return timeline;
  }

  /**
   * Current flush tip of the server.
   */
  public LogSequenceNumber xLogPos() {
    return xLogPos;
  }

  public String dbName() {
    return dbName;
  }

  @Override
  public String toString() {
    return "SystemIdentity{systemId='" + systemId + "', timeline=" + timeline
      + ", xLogPos=" + xLogPos.asString() + ", dbName='" + dbName + "'}";
  }
}
