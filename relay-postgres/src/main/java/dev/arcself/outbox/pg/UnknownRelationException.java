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
 * A row change referenced a relation id that no relation message has announced in this session.
 */
public final class UnknownRelationException extends PgOutputDecodeException {

  private final int relationId;

  public UnknownRelationException(int relationId) {
    super("pgoutput relation metadata missing for relation id " + relationId);
    this.relationId = relationId;
  }

  public int relationId() {
    return relationId;
  }
}
