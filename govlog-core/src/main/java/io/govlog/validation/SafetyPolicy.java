package io.govlog.validation;

/**
 * Limits enforced by {@link GovernanceInvariants}. Immutable.
 */
public final class SafetyPolicy {
  public static final int DEFAULT_MAX_DELEGATION_TTL_DAYS = 365;
  public static final int DEFAULT_MAX_DAYS_WITHOUT_REVIEW = 365;

  private static final SafetyPolicy DEFAULTS = builder().build();

  private final int maxDelegationTtlDays;
  private final int maxDaysWithoutReview;

  private SafetyPolicy(Builder builder) {
    this.maxDelegationTtlDays = builder.maxDelegationTtlDays;
    this.maxDaysWithoutReview = builder.maxDaysWithoutReview;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the policy with every limit at its default.
   */
  public static SafetyPolicy defaults() {
    return DEFAULTS;
  }

  public int maxDelegationTtlDays() {
    return maxDelegationTtlDays;
  }

  public int maxDaysWithoutReview() {
    return maxDaysWithoutReview;
  }

  @Override
  public String toString() {
    return "SafetyPolicy{maxDelegationTtlDays=" + maxDelegationTtlDays
        + ", maxDaysWithoutReview=" + maxDaysWithoutReview + '}';
  }

  public static final class Builder {
    private int maxDelegationTtlDays = DEFAULT_MAX_DELEGATION_TTL_DAYS;
    private int maxDaysWithoutReview = DEFAULT_MAX_DAYS_WITHOUT_REVIEW;

    private Builder() {
    }

    /**
     * Longest lifetime a delegation may be granted for.
     *
     * <p>Optional. Defaults to {@value #DEFAULT_MAX_DELEGATION_TTL_DAYS}.
     */
    public Builder maxDelegationTtlDays(int maxDelegationTtlDays) {
      this.maxDelegationTtlDays = maxDelegationTtlDays;
      return this;
    }

    /**
     * Longest a newly created law may wait for its first review checkpoint.
     *
     * <p>Optional. Defaults to {@value #DEFAULT_MAX_DAYS_WITHOUT_REVIEW}.
     */
    public Builder maxDaysWithoutReview(int maxDaysWithoutReview) {
      this.maxDaysWithoutReview = maxDaysWithoutReview;
      return this;
    }

    /**
     * Builds the policy.
     *
     * @throws IllegalArgumentException if a limit is not positive
     */
    public SafetyPolicy build() {
      if (maxDelegationTtlDays <= 0) {
        throw new IllegalArgumentException("maxDelegationTtlDays must be > 0, got: " + maxDelegationTtlDays);
      }
      if (maxDaysWithoutReview <= 0) {
        throw new IllegalArgumentException("maxDaysWithoutReview must be > 0, got: " + maxDaysWithoutReview);
      }
      return new SafetyPolicy(this);
    }
  }
}
