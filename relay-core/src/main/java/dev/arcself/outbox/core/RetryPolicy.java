package dev.arcself.outbox.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between publish attempts. {@code maxAttempts} counts every attempt, the first one included,
 * so a disabled policy makes exactly one.
 */
public final class RetryPolicy {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(200);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
  public static final double DEFAULT_MULTIPLIER = 2.0d;
  public static final double DEFAULT_JITTER = 0.2d;

  private final boolean enabled;
  private Duration initialDelay = DEFAULT_INITIAL_DELAY;
  private Duration maxDelay = DEFAULT_MAX_DELAY;
  private double multiplier = DEFAULT_MULTIPLIER;
  private double jitter = DEFAULT_JITTER;
  private int maxAttempts;

  private RetryPolicy(boolean enabled, int maxAttempts) {
    this.enabled = enabled;
    this.maxAttempts = maxAttempts;
  }

  public static RetryPolicy exponentialBackoff() {
    return new RetryPolicy(true, DEFAULT_MAX_ATTEMPTS);
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1);
  }

  public RetryPolicy copy() {
    RetryPolicy copy = new RetryPolicy(enabled, maxAttempts);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    return copy;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public RetryPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public RetryPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public RetryPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  /**
   * Fraction of the delay by which each backoff is randomly shortened or lengthened.
   */
  public double getJitter() {
    return jitter;
  }

  public RetryPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public RetryPolicy setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public boolean allowsAnotherAttempt(int failedAttempts) {
    return enabled && failedAttempts < maxAttempts;
  }

  /**
   * Delay before the attempt that follows {@code failedAttempts} failures.
   */
  public long backoffMillis(int failedAttempts) {
    long cap = maxDelay.toMillis();
    long delay = Math.min(initialDelay.toMillis(), cap);
    for (int i = 1; i < failedAttempts && delay < cap; i++) {
      delay = Math.min((long) (delay * multiplier), cap);
    }
    long spread = (long) (delay * jitter);
    if (spread > 0) {
      delay += ThreadLocalRandom.current().nextLong(-spread, spread + 1);
    }
    return delay;
  }

  public void validate() {
    OptionValidation.requireMin("maxAttempts", maxAttempts, 1);
    if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maxDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
  }
}
