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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON wire form of a {@link PostgresChangeEvent}.
 *
 * <pre>
 * {"operation":"insert","relation":{"namespace":"public","name":"orders"},
 *  "columns":{...},"key_columns":{...},"occurred_at":"...","wal_position":"0/16B3748"}
 * </pre>
 */
public final class ChangeEventEnvelope {

  private ChangeEventEnvelope() {
  }

  public static JsonObject toJson(PostgresChangeEvent event) {
    JsonObject json = new JsonObject();
    json.put("operation", event.getOperation().name().toLowerCase(Locale.ROOT));
    json.put("relation", new JsonObject()
      .put("namespace", event.getNamespace())
      .put("name", event.getTable()));
    json.put("columns", new JsonObject(portable(event.getColumns())));
    json.put("key_columns", new JsonObject(portable(event.getKeyColumns())));
    if (!event.getUnchangedColumns().isEmpty()) {
      json.put("unchanged_columns", new JsonArray(new ArrayList<>(event.getUnchangedColumns())));
    }
    json.put("occurred_at", event.getCommitTimestamp() == null ? null : event.getCommitTimestamp().toString());
    json.put("wal_position", event.walPositionText());
    return json;
  }

  public static byte[] encode(PostgresChangeEvent event) {
    return toJson(event).toBuffer().getBytes();
  }

  /**
   * Message key: the JSON object of the row's replica identity values, or {@code null} when the
   * relation has no key columns.
   */
  public static String messageKey(PostgresChangeEvent event) {
    Map<String, Object> keys = event.keyValues();
    if (keys.isEmpty()) {
      return null;
    }
    return new JsonObject(portable(keys)).encode();
  }

  private static Map<String, Object> portable(Map<String, Object> values) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      out.put(entry.getKey(), portableValue(entry.getValue()));
    }
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Object portableValue(Object value) {
    if (value instanceof byte[]) {
      return Base64.getEncoder().encodeToString((byte[]) value);
    }
    if (value instanceof Map) {
      return new JsonObject((Map<String, Object>) value);
    }
    if (value instanceof List) {
      return new JsonArray((List<Object>) value);
    }
    return value;
  }
}
