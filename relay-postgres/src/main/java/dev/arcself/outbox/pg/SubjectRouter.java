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

import dev.arcself.outbox.core.OptionValidation;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a relation to its broker subject, {@code <prefix>.<table>}. The schema does not take part, so
 * consumers subscribe by table name alone.
 */
public final class SubjectRouter {

  private static final Pattern ILLEGAL = Pattern.compile("[^a-z0-9_-]");

  private final String prefix;

  public SubjectRouter(String prefix) {
    OptionValidation.require("subjectPrefix", prefix);
    this.prefix = prefix;
  }

  public String subjectFor(PostgresChangeEvent event) {
    return subjectForTable(event.getTable());
  }

  public String subjectForTable(String table) {
    return prefix + "." + sanitize(table);
  }

  /**
   * @param qualifiedName {@code schema.table}; text before the first dot is dropped
   */
  public String subjectForQualifiedName(String qualifiedName) {
    int dot = qualifiedName.indexOf('.');
    return subjectForTable(dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1));
  }

  static String sanitize(String table) {
    return ILLEGAL.matcher(table.toLowerCase(Locale.ROOT)).replaceAll("_");
  }
}
