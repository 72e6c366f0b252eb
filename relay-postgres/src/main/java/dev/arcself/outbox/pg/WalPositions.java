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

import java.util.regex.Pattern;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Conversions between the textual {@code XXXXXXXX/XXXXXXXX} WAL position form and its numeric value.
 */
public final class WalPositions {

  private static final Pattern LSN_TEXT = Pattern.compile("[0-9A-Fa-f]{1,8}/[0-9A-Fa-f]{1,8}");

  private WalPositions() {
  }

  public static boolean isWellFormed(String text) {
    return text != null && LSN_TEXT.matcher(text.trim()).matches();
  }

  /**
   * Strict parse. {@link LogSequenceNumber#valueOf(String)} maps garbage to {@code 0/0}, which would
   * read as a valid position, so the shape is checked first.
   *
   * @throws IllegalArgumentException if the text is not a WAL position
   */
  public static LogSequenceNumber parse(String text) {
    if (!isWellFormed(text)) {
      throw new IllegalArgumentException("Malformed WAL position '" + text + "'");
    }
    return LogSequenceNumber.valueOf(text.trim());
  }

  public static String format(long position) {
    return LogSequenceNumber.valueOf(position).asString();
  }
}
