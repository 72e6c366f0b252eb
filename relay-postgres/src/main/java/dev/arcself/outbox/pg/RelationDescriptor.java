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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Schema of a relation for the lifetime of one replication session. The relation id is assigned by
 * the server per session and is not a durable key.
 */
public final class RelationDescriptor {

  private final int relationId;
  private final String namespace;
  private final String name;
  private final char replicaIdentity;
  private final List<ColumnDescriptor> columns;

  public RelationDescriptor(int relationId,
                            String namespace,
                            String name,
                            char replicaIdentity,
                            List<ColumnDescriptor> columns) {
    this.relationId = relationId;
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
    this.replicaIdentity = replicaIdentity;
    this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
  }

  public int relationId() {
    return relationId;
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  public String qualifiedName() {
    return namespace + "." + name;
  }

  /**
   * {@code d} default, {@code n} nothing, {@code f} full row, {@code i} index.
   */
  public char replicaIdentity() {
    return replicaIdentity;
  }

  public List<ColumnDescriptor> columns() {
    return columns;
  }

  public List<String> keyColumnNames() {
    List<String> keys = new ArrayList<>();
    for (ColumnDescriptor column : columns) {
      if (column.isKeyColumn()) {
        keys.add(column.name());
      }
    }
    return keys;
  }

  @Override
  public String toString() {
    return "RelationDescriptor{" +
      "relationId=" + relationId +
      ", relation='" + qualifiedName() + '\'' +
      ", columns=" + columns +
      '}';
  }
}
