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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Relation id to schema mapping for one replication session. Not thread-safe: it is owned by the
 * streaming thread.
 */
public final class RelationCatalog {

  private final Map<Integer, RelationDescriptor> relations = new HashMap<>();

  /**
   * Registers or replaces the descriptor for its relation id.
   *
   * @return the descriptor it replaced, or {@code null}
   */
  public RelationDescriptor register(RelationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    return relations.put(descriptor.relationId(), descriptor);
  }

  public RelationDescriptor lookup(int relationId) {
    RelationDescriptor descriptor = relations.get(relationId);
    if (descriptor == null) {
      throw new UnknownRelationException(relationId);
    }
    return descriptor;
  }

  boolean contains(int relationId) {
    return relations.containsKey(relationId);
  }

  public int size() {
    return relations.size();
  }
}
