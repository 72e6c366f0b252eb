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

import java.util.Objects;

/**
 * One column of a relation as announced by a pgoutput relation message.
 */
public final class ColumnDescriptor {

  private final String name;
  private final int typeOid;
  private final int typeModifier;
  private final boolean keyColumn;

  public ColumnDescriptor(String name, int typeOid, int typeModifier, boolean keyColumn) {
    this.name = Objects.requireNonNull(name, "name");
    this.typeOid = typeOid;
    this.typeModifier = typeModifier;
    this.keyColumn = keyColumn;
  }

  public String name() {
    return name;
  }

  public int typeOid() {
    return typeOid;
  }

  public int typeModifier() {
    return typeModifier;
  }

  /**
   * Whether the column is part of the relation's replica identity.
   */
  public boolean isKeyColumn() {
    return keyColumn;
  }

  @Override
  public String toString() {
    return name + ":" + typeOid + (keyColumn ? "(key)" : "");
  }
}
