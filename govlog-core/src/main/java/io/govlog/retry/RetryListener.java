package io.govlog.retry;

/**
 * Notified before each backoff sleep.
 */
@FunctionalInterface
public interface RetryListener {

  RetryListener NONE = (attempt, delayMs, failure) -> { };

  /**
   * Called after attempt {@code attempt} failed transiently and before sleeping.
   *
   * @param attempt the attempt that just failed (1-based)
   * @param delayMs how long the executor will sleep
   * @param failure the transient failure
   */
  void onRetry(int attempt, long delayMs, Throwable failure);
}
