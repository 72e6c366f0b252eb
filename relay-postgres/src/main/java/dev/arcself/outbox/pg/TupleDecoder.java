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

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the tuple section of an insert, update or delete message into a {@link PostgresChangeEvent},
 * using the relation schema registered earlier in the session.
 */
public final class TupleDecoder {

  static final int OID_BOOL = 16;
  static final int OID_BYTEA = 17;
  static final int OID_INT8 = 20;
  static final int OID_INT2 = 21;
  static final int OID_INT4 = 23;
  static final int OID_TEXT = 25;
  static final int OID_OID = 26;
  static final int OID_JSON = 114;
  static final int OID_FLOAT4 = 700;
  static final int OID_FLOAT8 = 701;
  static final int OID_NUMERIC = 1700;
  static final int OID_JSONB = 3802;

  /**
   * Decodes the bytes that follow the relation id of a row change message.
   *
   * @throws UnknownRelationException if the relation was never announced in this session
   * @throws PgOutputDecodeException if the tuple is malformed or a value does not fit its type
   */
  public PostgresChangeEvent decode(RelationCatalog catalog,
                                    int relationId,
                                    PostgresChangeEvent.Operation operation,
                                    byte[] tupleData,
                                    Instant commitTimestamp,
                                    long walPosition) {
    return decode(catalog, relationId, operation, new WireCursor(tupleData), commitTimestamp, walPosition);
  }

  PostgresChangeEvent decode(RelationCatalog catalog,
                             int relationId,
                             PostgresChangeEvent.Operation operation,
                             WireCursor cursor,
                             Instant commitTimestamp,
                             long walPosition) {
    RelationDescriptor relation = catalog.lookup(relationId);
    switch (operation) {
      case INSERT:
        return decodeInsert(relation, cursor, commitTimestamp, walPosition);
      case UPDATE:
        return decodeUpdate(relation, cursor, commitTimestamp, walPosition);
      case DELETE:
        return decodeDelete(relation, cursor, commitTimestamp, walPosition);
      default:
        throw new PgOutputDecodeException("Unsupported operation " + operation);
    }
  }

  private PostgresChangeEvent decodeInsert(RelationDescriptor relation,
                                           WireCursor cursor,
                                           Instant commitTimestamp,
                                           long walPosition) {
    char marker = cursor.readChar();
    if (marker != 'N') {
      throw new PgOutputDecodeException("Unexpected tuple marker for INSERT: " + marker);
    }
    Tuple row = decodeTuple(cursor, relation);
    return new PostgresChangeEvent(
      relation.namespace(),
      relation.name(),
      PostgresChangeEvent.Operation.INSERT,
      row.values,
      Map.of(),
      relation.keyColumnNames(),
      row.unchanged,
      commitTimestamp,
      walPosition
    );
  }

  private PostgresChangeEvent decodeUpdate(RelationDescriptor relation,
                                           WireCursor cursor,
                                           Instant commitTimestamp,
                                           long walPosition) {
    Map<String, Object> oldImage = Map.of();
    char marker = cursor.readChar();
    if (marker == 'K' || marker == 'O') {
      oldImage = oldImage(marker, decodeTuple(cursor, relation), relation);
      marker = cursor.readChar();
    }
    if (marker != 'N') {
      throw new PgOutputDecodeException("Unexpected tuple marker for UPDATE: " + marker);
    }
    Tuple row = decodeTuple(cursor, relation);
    return new PostgresChangeEvent(
      relation.namespace(),
      relation.name(),
      PostgresChangeEvent.Operation.UPDATE,
      row.values,
      oldImage,
      relation.keyColumnNames(),
      row.unchanged,
      commitTimestamp,
      walPosition
    );
  }

  private PostgresChangeEvent decodeDelete(RelationDescriptor relation,
                                           WireCursor cursor,
                                           Instant commitTimestamp,
                                           long walPosition) {
    char marker = cursor.readChar();
    if (marker != 'K' && marker != 'O') {
      throw new PgOutputDecodeException("Unexpected tuple marker for DELETE: " + marker);
    }
    Map<String, Object> oldImage = oldImage(marker, decodeTuple(cursor, relation), relation);
    return new PostgresChangeEvent(
      relation.namespace(),
      relation.name(),
      PostgresChangeEvent.Operation.DELETE,
      Map.of(),
      oldImage,
      relation.keyColumnNames(),
      List.of(),
      commitTimestamp,
      walPosition
    );
  }

  // A 'K' image carries every column but only the key columns hold values.
  private static Map<String, Object> oldImage(char marker, Tuple tuple, RelationDescriptor relation) {
    if (marker == 'O') {
      return tuple.values;
    }
    Map<String, Object> keys = new LinkedHashMap<>();
    for (ColumnDescriptor column : relation.columns()) {
      if (column.isKeyColumn() && tuple.values.containsKey(column.name())) {
        keys.put(column.name(), tuple.values.get(column.name()));
      }
    }
    return keys;
  }

  private Tuple decodeTuple(WireCursor cursor, RelationDescriptor relation) {
    int colCount = cursor.readUnsignedShort();
    List<ColumnDescriptor> columns = relation.columns();
    if (colCount != columns.size()) {
      throw new PgOutputDecodeException("Tuple for " + relation.qualifiedName() + " has " + colCount
        + " columns but the relation declares " + columns.size());
    }

    Tuple tuple = new Tuple();
    for (ColumnDescriptor column : columns) {
      char kind = cursor.readChar();
      switch (kind) {
        case 'n':
          tuple.values.put(column.name(), null);
          break;
        case 'u':
          tuple.unchanged.add(column.name());
          break;
        case 't': {
          int len = cursor.readInt();
          String rawValue = cursor.readString(len);
          tuple.values.put(column.name(), convertTextValue(column, rawValue));
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          tuple.values.put(column.name(), cursor.readBytes(len));
          break;
        }
        default:
          throw new PgOutputDecodeException("Unsupported tuple column kind '" + kind + "' for column "
            + column.name());
      }
    }
    return tuple;
  }

  static Object convertTextValue(ColumnDescriptor column, String raw) {
    try {
      switch (column.typeOid()) {
        case OID_BOOL:
          return parseBoolean(raw);
        case OID_INT2:
        case OID_INT4:
          return Integer.parseInt(raw);
        case OID_INT8:
        case OID_OID:
          return Long.parseLong(raw);
        case OID_FLOAT4:
          return Float.parseFloat(raw);
        case OID_FLOAT8:
          return Double.parseDouble(raw);
        case OID_NUMERIC:
          return parseNumeric(raw);
        case OID_JSON:
        case OID_JSONB:
          return parseJson(raw);
        case OID_BYTEA:
          return parseBytea(raw);
        default:
          return raw;
      }
    } catch (NumberFormatException | DecodeException e) {
      throw new PgOutputDecodeException("Value '" + raw + "' of column " + column.name()
        + " does not match type oid " + column.typeOid(), e);
    }
  }

  private static Boolean parseBoolean(String raw) {
    if ("t".equals(raw) || "true".equalsIgnoreCase(raw)) {
      return Boolean.TRUE;
    }
    if ("f".equals(raw) || "false".equalsIgnoreCase(raw)) {
      return Boolean.FALSE;
    }
    throw new NumberFormatException("not a boolean: " + raw);
  }

  // numeric allows NaN and +/-Infinity, which BigDecimal cannot hold
  private static Object parseNumeric(String raw) {
    if ("NaN".equals(raw) || "Infinity".equals(raw) || "-Infinity".equals(raw)) {
      return raw;
    }
    return new BigDecimal(raw);
  }

  private static Object parseJson(String raw) {
    String trimmed = raw.trim();
    if (trimmed.startsWith("{")) {
      return new JsonObject(trimmed).getMap();
    }
    if (trimmed.startsWith("[")) {
      return new JsonArray(trimmed).getList();
    }
    return raw;
  }

  private static Object parseBytea(String raw) {
    if (!raw.startsWith("\\x")) {
      return raw;
    }
    try {
      return HexFormat.of().parseHex(raw, 2, raw.length());
    } catch (IllegalArgumentException e) {
      throw new NumberFormatException("invalid bytea hex: " + e.getMessage());
    }
  }

  private static final class Tuple {
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> unchanged = new ArrayList<>();
  }
}
