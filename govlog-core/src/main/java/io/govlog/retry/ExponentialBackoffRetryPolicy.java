package io.govlog.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 * With jitter enabled the capped delay is scaled by a random factor in [0.5, 1.5) and
 * capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_BASE_DELAY_MS = 100L;
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final long DEFAULT_MAX_DELAY_MS = 1000L;
  public static final long DEFAULT_MAX_TOTAL_DELAY_MS = 5000L;

  private final int maxAttempts;
  private final long baseDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final long maxTotalDelayMs;
  private final boolean jitter;

  private ExponentialBackoffRetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.baseDelayMs = builder.baseDelayMs;
    this.multiplier = builder.multiplier;
    this.maxDelayMs = builder.maxDelayMs;
    this.maxTotalDelayMs = builder.maxTotalDelayMs;
    this.jitter = builder.jitter;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a policy with all defaults: 3 attempts, 100 ms base, multiplier 2.0,
   * 1000 ms cap, 5000 ms budget, no jitter.
   */
  public static ExponentialBackoffRetryPolicy defaults() {
    return builder().build();
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public long maxTotalDelayMs() {
    return maxTotalDelayMs;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public double multiplier() {
    return multiplier;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public boolean jitter() {
    return jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    double expDelay = baseDelayMs * Math.pow(multiplier, attempts - 1);
    // NaN and infinity both fall through to the cap
    long capped = !(expDelay < maxDelayMs) ? maxDelayMs : (long) expDelay;
    if (!jitter) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    long withJitter = (long) (capped * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy{maxAttempts=" + maxAttempts
        + ", baseDelayMs=" + baseDelayMs
        + ", multiplier=" + multiplier
        + ", maxDelayMs=" + maxDelayMs
        + ", maxTotalDelayMs=" + maxTotalDelayMs
        + ", jitter=" + jitter + '}';
  }

  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
    private double multiplier = DEFAULT_MULTIPLIER;
    private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
    private long maxTotalDelayMs = DEFAULT_MAX_TOTAL_DELAY_MS;
    private boolean jitter;

    private Builder() {
    }

    /**
     * Maximum attempts including the first one.
     *
     * <p>Optional. Defaults to {@value ExponentialBackoffRetryPolicy#DEFAULT_MAX_ATTEMPTS}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Delay before the second attempt.
     *
     * <p>Optional. Defaults to {@value ExponentialBackoffRetryPolicy#DEFAULT_BASE_DELAY_MS} ms.
     */
    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    /**
     * Growth factor between consecutive delays.
     *
     * <p>Optional. Defaults to {@value ExponentialBackoffRetryPolicy#DEFAULT_MULTIPLIER}.
     */
    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    /**
     * Upper bound for a single delay.
     *
     * <p>Optional. Defaults to {@value ExponentialBackoffRetryPolicy#DEFAULT_MAX_DELAY_MS} ms.
     */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /**
     * Upper bound for the sum of all delays of one operation.
     *
     * <p>Optional. Defaults to {@value ExponentialBackoffRetryPolicy#DEFAULT_MAX_TOTAL_DELAY_MS} ms.
     */
    public Builder maxTotalDelayMs(long maxTotalDelayMs) {
      this.maxTotalDelayMs = maxTotalDelayMs;
      return this;
    }

    /**
     * Randomizes each delay by a factor in [0.5, 1.5).
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder jitter(boolean jitter) {
      this.jitter = jitter;
      return this;
    }

    /**
     * Builds the policy.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public ExponentialBackoffRetryPolicy build() {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
      }
      if (baseDelayMs <= 0) {
        throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
      }
      if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
        throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
      }
      if (maxDelayMs < baseDelayMs) {
        throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
      }
      if (maxTotalDelayMs < 0) {
        throw new IllegalArgumentException("maxTotalDelayMs must be >= 0, got: " + maxTotalDelayMs);
      }
      return new ExponentialBackoffRetryPolicy(this);
    }
  }
}
