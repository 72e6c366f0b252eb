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
 * Result of decoding one {@code pgoutput} message.
 */
public final class PgOutputRecord {

  public enum Kind {
    BEGIN,
    COMMIT,
    RELATION,
    CHANGE,
    /** Origin, type, truncate and logical decoding messages. */
    SKIPPED
  }

  private final Kind kind;
  private final char messageType;
  private final RelationDescriptor relation;
  private final PostgresChangeEvent event;

  private PgOutputRecord(Kind kind, char messageType, RelationDescriptor relation, PostgresChangeEvent event) {
    this.kind = kind;
    this.messageType = messageType;
    this.relation = relation;
    this.event = event;
  }

  static PgOutputRecord control(Kind kind, char messageType) {
    return new PgOutputRecord(kind, messageType, null, null);
  }

  static PgOutputRecord relation(RelationDescriptor relation) {
    return new PgOutputRecord(Kind.RELATION, 'R', relation, null);
  }

  static PgOutputRecord change(char messageType, PostgresChangeEvent event) {
    return new PgOutputRecord(Kind.CHANGE, messageType, null, event);
  }

  public Kind kind() {
    return kind;
  }

  public char messageType() {
    return messageType;
  }

  /**
   * Set for {@link Kind#RELATION} records.
   */
  public RelationDescriptor relation() {
    return relation;
  }

  /**
   * Set for {@link Kind#CHANGE} records.
   */
  public PostgresChangeEvent event() {
    return event;
  }
}
