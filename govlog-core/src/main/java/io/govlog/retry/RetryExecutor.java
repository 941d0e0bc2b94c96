package io.govlog.retry;

import io.govlog.spi.TransientStorageException;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link StorageOperation}, retrying transient failures under a {@link RetryPolicy}.
 *
 * <p>Only failures accepted by the transient predicate are retried; the default accepts a
 * {@link TransientStorageException} anywhere in the cause chain. Everything else ends the
 * run as {@link RetryOutcome.Fatal} after one attempt. {@link Error}s are not caught.
 *
 * <p>Thread-safe; holds no per-call state.
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final RetryPolicy policy;
  private final Predicate<Throwable> transientFailure;
  private final Sleeper sleeper;
  private final RetryListener listener;

  private RetryExecutor(Builder builder) {
    this.policy = builder.policy;
    this.transientFailure = builder.transientFailure;
    this.sleeper = builder.sleeper;
    this.listener = builder.listener;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns {@code true} if {@code failure} or one of its causes is a
   * {@link TransientStorageException}.
   */
  public static boolean isTransientStorageFailure(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof TransientStorageException) {
        return true;
      }
    }
    return false;
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs the operation until it succeeds, fails fatally, or retries are exhausted.
   *
   * <p>If the thread is interrupted while backing off, the run ends as
   * {@link RetryOutcome.Fatal} carrying the {@link InterruptedException} and the interrupt
   * flag is restored.
   *
   * @param operation the operation to run
   * @param <T>       the result type
   * @return the outcome, never {@code null}
   */
  public <T> RetryOutcome<T> execute(StorageOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    int maxAttempts = policy.maxAttempts();
    long slept = 0L;
    for (int attempt = 1; ; attempt++) {
      Exception failure;
      try {
        return new RetryOutcome.Success<>(operation.run(), attempt);
      } catch (Exception e) {
        failure = e;
      }
      if (!transientFailure.test(failure)) {
        return new RetryOutcome.Fatal<>(failure, attempt);
      }
      if (attempt >= maxAttempts) {
        logger.log(Level.WARNING, "Storage operation failed after " + attempt + " attempts", failure);
        return new RetryOutcome.Exhausted<>(attempt, failure);
      }
      long delayMs = policy.computeDelayMs(attempt);
      if (slept + delayMs > policy.maxTotalDelayMs()) {
        logger.log(Level.WARNING, "Retry delay budget of " + policy.maxTotalDelayMs()
            + "ms exhausted after " + attempt + " attempts", failure);
        return new RetryOutcome.Exhausted<>(attempt, failure);
      }
      logger.log(Level.WARNING, "Transient storage failure on attempt {0}/{1}, retrying in {2}ms: {3}",
          new Object[]{attempt, maxAttempts, delayMs, failure.getMessage()});
      notifyListener(attempt, delayMs, failure);
      try {
        sleeper.sleep(delayMs);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        ie.addSuppressed(failure);
        return new RetryOutcome.Fatal<>(ie, attempt);
      }
      slept += delayMs;
    }
  }

  private void notifyListener(int attempt, long delayMs, Throwable failure) {
    try {
      listener.onRetry(attempt, delayMs, failure);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "RetryListener.onRetry failed", e);
    }
  }

  public static final class Builder {
    private RetryPolicy policy = ExponentialBackoffRetryPolicy.defaults();
    private Predicate<Throwable> transientFailure = RetryExecutor::isTransientStorageFailure;
    private Sleeper sleeper = Sleeper.THREAD;
    private RetryListener listener = RetryListener.NONE;

    private Builder() {
    }

    /**
     * Bounds and spacing of retries.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy#defaults()}.
     */
    public Builder policy(RetryPolicy policy) {
      this.policy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Decides which failures are worth retrying.
     *
     * <p>Optional. Defaults to {@link #isTransientStorageFailure(Throwable)}.
     */
    public Builder retryOn(Predicate<Throwable> transientFailure) {
      this.transientFailure = Objects.requireNonNull(transientFailure, "transientFailure");
      return this;
    }

    /**
     * Optional. Defaults to {@link Sleeper#THREAD}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    /**
     * Optional. Defaults to {@link RetryListener#NONE}.
     */
    public Builder listener(RetryListener listener) {
      this.listener = Objects.requireNonNull(listener, "listener");
      return this;
    }

    public RetryExecutor build() {
      if (policy.maxAttempts() < 1) {
        throw new IllegalArgumentException("policy.maxAttempts must be >= 1, got: " + policy.maxAttempts());
      }
      return new RetryExecutor(this);
    }
  }
}
