package io.govlog.retry;

/**
 * Strategy for bounding and spacing retries of a failed storage operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Returns the maximum number of attempts, including the first one.
   *
   * @return attempts, at least 1
   */
  int maxAttempts();

  /**
   * Computes the delay in milliseconds before the next retry attempt.
   *
   * @param attempts the number of attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);

  /**
   * Returns the total time that may be spent sleeping between attempts of one operation.
   * A retry whose delay would exceed the remaining budget is not attempted.
   *
   * @return budget in milliseconds
   */
  long maxTotalDelayMs();
}
