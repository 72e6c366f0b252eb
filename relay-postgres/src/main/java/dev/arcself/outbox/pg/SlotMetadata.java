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

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Catalog queries that cannot run on a walsender connection.
 */
public interface SlotMetadata {

  /**
   * Raw {@code confirmed_flush_lsn} text of the slot, empty when the slot does not exist or has never
   * confirmed a position.
   */
  Optional<String> confirmedFlushPosition(String slotName) throws SQLException;

  /**
   * Tables of the publication as {@code schema.table}.
   */
  List<String> publicationTables(String publicationName) throws SQLException;
}
