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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One committed row mutation decoded from the {@code pgoutput} stream.
 */
public final class PostgresChangeEvent {

  /**
   * The row operation type.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE
  }

  private final String namespace;
  private final String table;
  private final Operation operation;
  private final Map<String, Object> columns;
  private final Map<String, Object> keyColumns;
  private final List<String> keyColumnNames;
  private final List<String> unchangedColumns;
  private final Instant commitTimestamp;
  private final long walPosition;

  public PostgresChangeEvent(String namespace,
                             String table,
                             Operation operation,
                             Map<String, Object> columns,
                             Map<String, Object> keyColumns,
                             List<String> keyColumnNames,
                             List<String> unchangedColumns,
                             Instant commitTimestamp,
                             long walPosition) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.table = Objects.requireNonNull(table, "table");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.columns = unmodifiableCopy(columns);
    this.keyColumns = unmodifiableCopy(keyColumns);
    this.keyColumnNames = unmodifiableCopy(keyColumnNames);
    this.unchangedColumns = unmodifiableCopy(unchangedColumns);
    this.commitTimestamp = commitTimestamp;
    this.walPosition = walPosition;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getTable() {
    return table;
  }

  public String qualifiedName() {
    return namespace + "." + table;
  }

  public Operation getOperation() {
    return operation;
  }

  /**
   * New row values for inserts and updates. Empty for deletes.
   */
  public Map<String, Object> getColumns() {
    return columns;
  }

  /**
   * Old key (or full old row) image for updates and deletes. Empty when the server did not send one.
   */
  public Map<String, Object> getKeyColumns() {
    return keyColumns;
  }

  public List<String> getKeyColumnNames() {
    return keyColumnNames;
  }

  /**
   * Names of TOASTed columns the server did not resend because they did not change.
   */
  public List<String> getUnchangedColumns() {
    return unchangedColumns;
  }

  public Instant getCommitTimestamp() {
    return commitTimestamp;
  }

  public long getWalPosition() {
    return walPosition;
  }

  public String walPositionText() {
    return WalPositions.format(walPosition);
  }

  /**
   * Values of the replica identity columns that identify the affected row: taken from the new row for
   * inserts and updates and from the old image for deletes.
   */
  public Map<String, Object> keyValues() {
    Map<String, Object> source = operation == Operation.DELETE ? keyColumns : columns;
    Map<String, Object> keys = new LinkedHashMap<>();
    for (String name : keyColumnNames) {
      if (source.containsKey(name)) {
        keys.put(name, source.get(name));
      } else if (keyColumns.containsKey(name)) {
        keys.put(name, keyColumns.get(name));
      }
    }
    return keys;
  }

  @Override
  public String toString() {
    return "PostgresChangeEvent{" +
      "relation='" + qualifiedName() + '\'' +
      ", operation=" + operation +
      ", columns=" + columns +
      ", keyColumns=" + keyColumns +
      ", unchangedColumns=" + unchangedColumns +
      ", commitTimestamp=" + commitTimestamp +
      ", walPosition='" + walPositionText() + '\'' +
      '}';
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  private static List<String> unmodifiableCopy(List<String> data) {
    if (data == null || data.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(data));
  }
}
