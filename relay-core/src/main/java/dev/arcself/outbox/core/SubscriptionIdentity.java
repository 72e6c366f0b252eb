package dev.arcself.outbox.core;

import java.util.Objects;

/**
 * Names one change-data-capture session to the upstream database: the replication slot that holds its
 * position and the publication that selects its tables.
 */
public final class SubscriptionIdentity {
  private final String slotName;
  private final String publicationName;

  public SubscriptionIdentity(String slotName, String publicationName) {
    OptionValidation.requireIdentifier("slotName", slotName);
    OptionValidation.requireIdentifier("publicationName", publicationName);
    this.slotName = slotName;
    this.publicationName = publicationName;
  }

  public String slotName() {
    return slotName;
  }

  public String publicationName() {
    return publicationName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubscriptionIdentity)) {
      return false;
    }
    SubscriptionIdentity other = (SubscriptionIdentity) o;
    return slotName.equals(other.slotName) && publicationName.equals(other.publicationName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(slotName, publicationName);
  }

  @Override
  public String toString() {
    return slotName + "/" + publicationName;
  }
}
