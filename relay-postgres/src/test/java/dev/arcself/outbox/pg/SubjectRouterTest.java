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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SubjectRouterTest {

  private final SubjectRouter router = new SubjectRouter("outbox");

  @Test
  void subjectIsPrefixPlusTable() {
    assertEquals("outbox.orders", router.subjectForTable("orders"));
    assertEquals("outbox.orders", router.subjectForQualifiedName("sales.orders"));
    assertEquals("outbox.orders", router.subjectForQualifiedName("orders"));
  }

  @Test
  void tableNameIsNormalised() {
    assertEquals("outbox.order_items", router.subjectForTable("Order Items"));
    assertEquals("outbox.line-items_v2", router.subjectForTable("line-items.v2"));
    assertEquals("outbox.caf_", router.subjectForTable("café"));
  }

  @Test
  void requiresPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new SubjectRouter(" "));
  }
}
