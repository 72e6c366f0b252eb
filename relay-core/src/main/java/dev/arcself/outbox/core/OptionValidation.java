package dev.arcself.outbox.core;

import java.time.Duration;
import java.util.regex.Pattern;

public final class OptionValidation {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z0-9_]{1,63}");

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  /**
   * Slot and publication names end up inside replication commands, so only plain lower-case
   * identifiers are accepted.
   */
  public static void requireIdentifier(String fieldName, String value) {
    require(fieldName, value);
    if (!IDENTIFIER.matcher(value).matches()) {
      throw new IllegalArgumentException(
        fieldName + " must match " + IDENTIFIER.pattern() + " but was '" + value + "'");
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  public static void requireMin(String fieldName, int value, int minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }
}
