package io.govlog;

import io.govlog.validation.Verdict;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of {@link io.govlog.store.EventStore#append(CandidateEvent)}. Exactly one of:
 *
 * <ul>
 *   <li>{@link Committed}: the event is durable and visible at its position.</li>
 *   <li>{@link Rejected}: an invariant failed; nothing was written.</li>
 *   <li>{@link RetryExhausted}: storage stayed contended for every attempt; nothing is visible.</li>
 *   <li>{@link Fatal}: a non-retryable storage failure; nothing is visible.</li>
 * </ul>
 */
public sealed interface AppendOutcome
    permits AppendOutcome.Committed, AppendOutcome.Rejected,
    AppendOutcome.RetryExhausted, AppendOutcome.Fatal {

  /**
   * Returns the outcome category.
   */
  Status status();

  /**
   * Returns {@code true} only for {@link Committed}.
   */
  default boolean isCommitted() {
    return this instanceof Committed;
  }

  /**
   * Outcome category, used as the metrics tag.
   */
  enum Status {
    COMMITTED,
    REJECTED,
    RETRY_EXHAUSTED,
    FATAL;

    /**
     * Returns the lower-case tag value, e.g. {@code "retry_exhausted"}.
     */
    public String tag() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * The event was admitted.
   *
   * @param event the committed event with its assigned position and timestamp
   */
  record Committed(CommittedEvent event) implements AppendOutcome {
    public Committed {
      Objects.requireNonNull(event, "event");
    }

    @Override
    public Status status() {
      return Status.COMMITTED;
    }
  }

  /**
   * The candidate violated an invariant.
   *
   * @param violation the first violated invariant
   */
  record Rejected(Verdict.Violation violation) implements AppendOutcome {
    public Rejected {
      Objects.requireNonNull(violation, "violation");
    }

    @Override
    public Status status() {
      return Status.REJECTED;
    }
  }

  /**
   * Every storage attempt failed with a transient error.
   *
   * @param attempts number of attempts made
   * @param cause    the last transient failure
   */
  record RetryExhausted(int attempts, Throwable cause) implements AppendOutcome {
    public RetryExhausted {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public Status status() {
      return Status.RETRY_EXHAUSTED;
    }
  }

  /**
   * Storage failed in a way retrying cannot fix.
   *
   * @param cause the failure
   */
  record Fatal(Throwable cause) implements AppendOutcome {
    public Fatal {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public Status status() {
      return Status.FATAL;
    }
  }
}
