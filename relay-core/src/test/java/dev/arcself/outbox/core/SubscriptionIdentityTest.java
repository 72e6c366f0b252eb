package dev.arcself.outbox.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SubscriptionIdentityTest {

  @Test
  void comparesByValue() {
    SubscriptionIdentity a = new SubscriptionIdentity("outbox_slot", "outbox_pub");
    SubscriptionIdentity b = new SubscriptionIdentity("outbox_slot", "outbox_pub");

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new SubscriptionIdentity("tenant_b_slot", "outbox_pub"));
    assertEquals("outbox_slot/outbox_pub", a.toString());
  }

  @Test
  void rejectsNamesThatCannotBeInterpolatedSafely() {
    assertThrows(IllegalArgumentException.class, () -> new SubscriptionIdentity("", "outbox_pub"));
    assertThrows(IllegalArgumentException.class, () -> new SubscriptionIdentity("Outbox", "outbox_pub"));
    assertThrows(IllegalArgumentException.class,
      () -> new SubscriptionIdentity("outbox_slot", "pub'; DROP TABLE orders; --"));
  }
}
