package io.govlog.retry;

import java.util.Objects;

/**
 * Result of {@link RetryExecutor#execute(StorageOperation)}.
 *
 * @param <T> the operation's result type
 */
public sealed interface RetryOutcome<T>
    permits RetryOutcome.Success, RetryOutcome.Exhausted, RetryOutcome.Fatal {

  /**
   * Number of attempts made, at least 1.
   */
  int attempts();

  /**
   * The operation completed.
   *
   * @param value    the operation's result, may be {@code null}
   * @param attempts attempts taken
   */
  record Success<T>(T value, int attempts) implements RetryOutcome<T> {
  }

  /**
   * Every attempt failed transiently, or the delay budget ran out.
   *
   * @param attempts    attempts made
   * @param lastFailure the failure of the last attempt
   */
  record Exhausted<T>(int attempts, Throwable lastFailure) implements RetryOutcome<T> {
    public Exhausted {
      Objects.requireNonNull(lastFailure, "lastFailure");
    }
  }

  /**
   * The operation failed with a non-transient error, or the wait was interrupted.
   *
   * @param failure  the failure
   * @param attempts attempts made
   */
  record Fatal<T>(Throwable failure, int attempts) implements RetryOutcome<T> {
    public Fatal {
      Objects.requireNonNull(failure, "failure");
    }
  }
}
