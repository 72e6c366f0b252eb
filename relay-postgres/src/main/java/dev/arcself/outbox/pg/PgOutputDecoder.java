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
import java.util.List;

/**
 * Decoder for the native PostgreSQL {@code pgoutput} logical replication format (protocol version 1
 * and 2, without streamed transactions). Relation messages are registered in the supplied catalog;
 * row changes are handed to the {@link TupleDecoder}.
 *
 * <p>Instances keep the commit timestamp of the open transaction and are confined to the streaming
 * thread.
 */
public final class PgOutputDecoder {

  private static final long PG_EPOCH_SECONDS = 946684800L;

  private final TupleDecoder tupleDecoder;
  private Instant currentTxTimestamp;

  public PgOutputDecoder() {
    this(new TupleDecoder());
  }

  PgOutputDecoder(TupleDecoder tupleDecoder) {
    this.tupleDecoder = tupleDecoder;
  }

  /**
   * @param walPosition position after this record, stamped on the produced event
   */
  public PgOutputRecord decode(RelationCatalog catalog, byte[] payload, long walPosition) {
    WireCursor cursor = new WireCursor(payload);
    if (!cursor.hasRemaining()) {
      throw new PgOutputDecodeException("Empty pgoutput message");
    }

    char messageType = cursor.readChar();
    switch (messageType) {
      case 'B':
        decodeBegin(cursor);
        return PgOutputRecord.control(PgOutputRecord.Kind.BEGIN, messageType);
      case 'C':
        decodeCommit(cursor);
        return PgOutputRecord.control(PgOutputRecord.Kind.COMMIT, messageType);
      case 'R':
        return PgOutputRecord.relation(decodeRelation(catalog, cursor));
      case 'I':
        return PgOutputRecord.change(messageType, tupleDecoder.decode(
          catalog, cursor.readInt(), PostgresChangeEvent.Operation.INSERT, cursor, currentTxTimestamp, walPosition));
      case 'U':
        return PgOutputRecord.change(messageType, tupleDecoder.decode(
          catalog, cursor.readInt(), PostgresChangeEvent.Operation.UPDATE, cursor, currentTxTimestamp, walPosition));
      case 'D':
        return PgOutputRecord.change(messageType, tupleDecoder.decode(
          catalog, cursor.readInt(), PostgresChangeEvent.Operation.DELETE, cursor, currentTxTimestamp, walPosition));
      case 'T':
      case 'Y':
      case 'O':
      case 'M':
        return PgOutputRecord.control(PgOutputRecord.Kind.SKIPPED, messageType);
      default:
        throw new PgOutputDecodeException("Unsupported pgoutput message type: " + messageType);
    }
  }

  Instant currentTransactionTimestamp() {
    return currentTxTimestamp;
  }

  private void decodeBegin(WireCursor cursor) {
    cursor.readLong();
    currentTxTimestamp = fromPgEpochMicros(cursor.readLong());
    cursor.readInt();
  }

  private void decodeCommit(WireCursor cursor) {
    cursor.readByte();
    cursor.readLong();
    cursor.readLong();
    cursor.readLong();
    currentTxTimestamp = null;
  }

  private static RelationDescriptor decodeRelation(RelationCatalog catalog, WireCursor cursor) {
    int relationId = cursor.readInt();
    String namespace = cursor.readCString();
    String name = cursor.readCString();
    char replicaIdentity = cursor.readChar();
    int columnCount = cursor.readUnsignedShort();
    List<ColumnDescriptor> columns = new ArrayList<>(columnCount);

    for (int i = 0; i < columnCount; i++) {
      int flags = cursor.readByte();
      String columnName = cursor.readCString();
      int typeOid = cursor.readInt();
      int typeModifier = cursor.readInt();
      columns.add(new ColumnDescriptor(columnName, typeOid, typeModifier, (flags & 1) != 0));
    }

    RelationDescriptor descriptor = new RelationDescriptor(relationId, namespace, name, replicaIdentity, columns);
    catalog.register(descriptor);
    return descriptor;
  }

  static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  static long toPgEpochMicros(Instant instant) {
    long seconds = instant.getEpochSecond() - PG_EPOCH_SECONDS;
    return seconds * 1_000_000L + instant.getNano() / 1_000L;
  }
}
