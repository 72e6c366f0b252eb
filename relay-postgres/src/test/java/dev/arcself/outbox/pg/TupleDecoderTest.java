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

import static dev.arcself.outbox.pg.PgOutputMessages.tuple;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TupleDecoderTest {

  private final TupleDecoder decoder = new TupleDecoder();
  private RelationCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = new RelationCatalog();
    catalog.register(new RelationDescriptor(16384, "public", "orders", 'd', Arrays.asList(
      new ColumnDescriptor("id", TupleDecoder.OID_INT4, -1, true),
      new ColumnDescriptor("name", TupleDecoder.OID_TEXT, -1, false),
      new ColumnDescriptor("active", TupleDecoder.OID_BOOL, -1, false))));
  }

  @Test
  void decodesInsertIntoTypedColumns() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT,
      withMarker('N', tuple().text("7").text("acme").text("t")), null, 0x100L);

    assertEquals(PostgresChangeEvent.Operation.INSERT, event.getOperation());
    assertEquals("public", event.getNamespace());
    assertEquals("orders", event.getTable());
    assertEquals(Map.of("id", 7, "name", "acme", "active", true), event.getColumns());
    assertEquals(List.of("id", "name", "active"), List.copyOf(event.getColumns().keySet()));
    assertTrue(event.getKeyColumns().isEmpty());
    assertEquals(List.of("id"), event.getKeyColumnNames());
    assertEquals(0x100L, event.getWalPosition());
  }

  @Test
  void rowChangeForUnregisteredRelationIsRejected() {
    UnknownRelationException error = assertThrows(UnknownRelationException.class, () ->
      decoder.decode(catalog, 99, PostgresChangeEvent.Operation.INSERT,
        withMarker('N', tuple().text("1")), null, 1L));
    assertEquals(99, error.relationId());
  }

  @Test
  void updateWithKeyOnlyOldImageKeepsJustTheKey() {
    byte[] body = concat(
      withMarker('K', tuple().text("7").nul().nul()),
      withMarker('N', tuple().text("8").text("acme").text("f")));

    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.UPDATE,
      body, null, 2L);

    assertEquals(Map.of("id", 7), event.getKeyColumns());
    assertEquals(8, event.getColumns().get("id"));
    assertEquals(false, event.getColumns().get("active"));
    assertEquals(Map.of("id", 8), event.keyValues());
  }

  @Test
  void updateWithoutOldImageOnlyCarriesNewRow() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.UPDATE,
      withMarker('N', tuple().text("7").text("renamed").text("t")), null, 2L);

    assertTrue(event.getKeyColumns().isEmpty());
    assertEquals("renamed", event.getColumns().get("name"));
  }

  @Test
  void updateWithoutNewTupleIsRejected() {
    assertThrows(PgOutputDecodeException.class, () ->
      decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.UPDATE,
        withMarker('K', tuple().text("7").nul().nul()), null, 2L));
  }

  @Test
  void deleteCarriesOldImage() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.DELETE,
      withMarker('O', tuple().text("7").text("acme").text("t")), null, 3L);

    assertTrue(event.getColumns().isEmpty());
    assertEquals(Map.of("id", 7, "name", "acme", "active", true), event.getKeyColumns());
    assertEquals(Map.of("id", 7), event.keyValues());
  }

  @Test
  void deleteRequiresOldImage() {
    assertThrows(PgOutputDecodeException.class, () ->
      decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.DELETE,
        withMarker('N', tuple().text("7").text("acme").text("t")), null, 3L));
  }

  @Test
  void unchangedToastColumnIsReportedNotDropped() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.UPDATE,
      withMarker('N', tuple().text("7").unchanged().text("t")), null, 4L);

    assertFalse(event.getColumns().containsKey("name"));
    assertEquals(List.of("name"), event.getUnchangedColumns());
  }

  @Test
  void nullValueIsKept() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT,
      withMarker('N', tuple().text("7").nul().text("t")), null, 5L);

    assertTrue(event.getColumns().containsKey("name"));
    assertNull(event.getColumns().get("name"));
  }

  @Test
  void binaryValueIsKeptAsBytes() {
    PostgresChangeEvent event = decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT,
      withMarker('N', tuple().text("7").binary(new byte[] {1, 2, 3}).text("t")), null, 6L);

    assertArrayEquals(new byte[] {1, 2, 3}, (byte[]) event.getColumns().get("name"));
  }

  @Test
  void tupleWiderThanRelationIsRejected() {
    assertThrows(PgOutputDecodeException.class, () ->
      decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT,
        withMarker('N', tuple().text("7").text("acme").text("t").text("extra")), null, 7L));
  }

  @Test
  void valueThatDoesNotFitItsTypeIsRejected() {
    PgOutputDecodeException error = assertThrows(PgOutputDecodeException.class, () ->
      decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT,
        withMarker('N', tuple().text("seven").text("acme").text("t")), null, 8L));
    assertTrue(error.getMessage().contains("id"));
  }

  @Test
  void truncatedTupleIsRejected() {
    byte[] full = withMarker('N', tuple().text("7").text("acme").text("t"));
    byte[] truncated = Arrays.copyOf(full, full.length - 2);
    assertThrows(PgOutputDecodeException.class, () ->
      decoder.decode(catalog, 16384, PostgresChangeEvent.Operation.INSERT, truncated, null, 9L));
  }

  @Test
  void convertsTextValuesByTypeOid() {
    assertEquals(5L, convert(TupleDecoder.OID_INT8, "5"));
    assertEquals(16385L, convert(TupleDecoder.OID_OID, "16385"));
    assertEquals((short) 3, ((Integer) convert(TupleDecoder.OID_INT2, "3")).shortValue());
    assertEquals(1.5f, convert(TupleDecoder.OID_FLOAT4, "1.5"));
    assertEquals(2.25d, convert(TupleDecoder.OID_FLOAT8, "2.25"));
    assertEquals(new BigDecimal("12.34"), convert(TupleDecoder.OID_NUMERIC, "12.34"));
    assertEquals("NaN", convert(TupleDecoder.OID_NUMERIC, "NaN"));
    assertEquals(Boolean.FALSE, convert(TupleDecoder.OID_BOOL, "f"));
    assertArrayEquals(new byte[] {(byte) 0xde, (byte) 0xad}, (byte[]) convert(TupleDecoder.OID_BYTEA, "\\xdead"));
    assertEquals("2024-01-01", convert(1082, "2024-01-01"));
  }

  @Test
  void convertsJsonIntoMapsAndLists() {
    Object object = convert(TupleDecoder.OID_JSONB, "{\"a\":1,\"nested\":{\"b\":\"x\"}}");
    assertTrue(object instanceof Map);
    assertEquals(1, ((Map<?, ?>) object).get("a"));

    Object array = convert(TupleDecoder.OID_JSON, "[\"alpha\",\"beta\"]");
    assertEquals(List.of("alpha", "beta"), array);

    assertThrows(PgOutputDecodeException.class, () -> convert(TupleDecoder.OID_JSON, "{broken"));
  }

  private static Object convert(int typeOid, String raw) {
    return TupleDecoder.convertTextValue(new ColumnDescriptor("c", typeOid, -1, false), raw);
  }

  private static byte[] withMarker(char marker, PgOutputMessages.Tuple tuple) {
    return concat(new byte[] {(byte) marker}, tuple.toBytes());
  }

  private static byte[] concat(byte[] first, byte[] second) {
    byte[] out = Arrays.copyOf(first, first.length + second.length);
    System.arraycopy(second, 0, out, first.length, second.length);
    return out;
  }
}
