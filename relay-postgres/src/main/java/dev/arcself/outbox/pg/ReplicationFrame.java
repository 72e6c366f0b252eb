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

import java.nio.ByteBuffer;
import java.time.Instant;

/**
 * One CopyData message of the streaming replication sub-protocol.
 *
 * <ul>
 *   <li>{@code w} XLogData: wal start, wal end, send time, then the {@code pgoutput} payload</li>
 *   <li>{@code k} primary keepalive: wal end, send time, reply-requested flag</li>
 * </ul>
 */
public final class ReplicationFrame {

  public enum Type {
    XLOG_DATA,
    KEEPALIVE,
    UNKNOWN
  }

  static final int STANDBY_STATUS_UPDATE_LENGTH = 34;
  private static final int XLOG_HEADER_LENGTH = 25;
  private static final int KEEPALIVE_LENGTH = 18;

  private final Type type;
  private final char typeByte;
  private final long walStart;
  private final long walEnd;
  private final boolean replyRequested;
  private final byte[] payload;

  private ReplicationFrame(Type type,
                           char typeByte,
                           long walStart,
                           long walEnd,
                           boolean replyRequested,
                           byte[] payload) {
    this.type = type;
    this.typeByte = typeByte;
    this.walStart = walStart;
    this.walEnd = walEnd;
    this.replyRequested = replyRequested;
    this.payload = payload;
  }

  /**
   * @throws PgOutputDecodeException if a known frame type is truncated
   */
  public static ReplicationFrame parse(byte[] frame) {
    if (frame == null || frame.length == 0) {
      throw new PgOutputDecodeException("Empty replication frame");
    }
    WireCursor cursor = new WireCursor(frame);
    char typeByte = cursor.readChar();
    switch (typeByte) {
      case 'w': {
        if (frame.length < XLOG_HEADER_LENGTH) {
          throw new PgOutputDecodeException("XLogData frame too short: " + frame.length + " bytes");
        }
        long walStart = cursor.readLong();
        long walEnd = cursor.readLong();
        // server send time, unused
        cursor.readLong();
        return new ReplicationFrame(Type.XLOG_DATA, typeByte, walStart, walEnd, false,
          cursor.readRemaining());
      }
      case 'k': {
        if (frame.length < KEEPALIVE_LENGTH) {
          throw new PgOutputDecodeException("Keepalive frame too short: " + frame.length + " bytes");
        }
        long walEnd = cursor.readLong();
        cursor.readLong();
        boolean reply = cursor.readByte() != 0;
        return new ReplicationFrame(Type.KEEPALIVE, typeByte, 0L, walEnd, reply, new byte[0]);
      }
      default:
        return new ReplicationFrame(Type.UNKNOWN, typeByte, 0L, 0L, false, new byte[0]);
    }
  }

  /**
   * Encodes a standby status update reporting {@code position} as written, flushed and applied.
   */
  public static byte[] standbyStatusUpdate(long position, Instant clientTime, boolean replyRequested) {
    ByteBuffer buffer = ByteBuffer.allocate(STANDBY_STATUS_UPDATE_LENGTH);
    buffer.put((byte) 'r');
    buffer.putLong(position);
    buffer.putLong(position);
    buffer.putLong(position);
    buffer.putLong(PgOutputDecoder.toPgEpochMicros(clientTime));
    buffer.put((byte) (replyRequested ? 1 : 0));
    return buffer.array();
  }

  public Type type() {
    return type;
  }

  public char typeByte() {
    return typeByte;
  }

  long walStart() {
    return walStart;
  }

  public long walEnd() {
    return walEnd;
  }

  public boolean replyRequested() {
    return replyRequested;
  }

  public byte[] payload() {
    return payload;
  }

  /**
   * Position just past this frame's payload.
   */
  public long endPosition() {
    return type == Type.KEEPALIVE ? walEnd : walStart + payload.length;
  }
}
