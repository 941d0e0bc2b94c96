package io.govlog.store;

import io.govlog.AppendOutcome;
import io.govlog.CandidateEvent;
import io.govlog.CommittedEvent;
import io.govlog.projection.GovernanceProjection;
import io.govlog.projection.GovernanceState;
import io.govlog.projection.Projection;
import io.govlog.projection.ReplayEngine;
import io.govlog.retry.ExponentialBackoffRetryPolicy;
import io.govlog.retry.RetryExecutor;
import io.govlog.retry.RetryOutcome;
import io.govlog.retry.RetryPolicy;
import io.govlog.retry.Sleeper;
import io.govlog.spi.EventLog;
import io.govlog.spi.EventLogException;
import io.govlog.spi.MetricsExporter;
import io.govlog.time.TimeSource;
import io.govlog.validation.InvariantValidator;
import io.govlog.validation.SafetyPolicy;
import io.govlog.validation.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only governance event store.
 *
 * <p>Appends are serialized by a single lock. Inside it the store catches up with the log,
 * stamps the candidate, validates it against the current {@link GovernanceState}, assigns
 * the next position and persists the event through a {@link RetryExecutor}. When every
 * attempt failed, the position is read back: an event found there committed after all and
 * is reported as Committed. The head is published only once the event is known to be
 * stored, so readers, which never take the lock, see a consistent prefix of the log.
 *
 * <p>Timestamps are truncated to {@link TimeSource#PRECISION} before validation, so the
 * folded state matches what a replay of the durable log produces.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventStore store = EventStore.builder()
 *     .eventLog(new InMemoryEventLog())
 *     .build()) {
 *   AppendOutcome outcome = store.append(
 *       CandidateEvent.of(new WorkspaceCreated("ws-1", "Health", null)));
 * }
 * }</pre>
 *
 * @see EventLog
 * @see InvariantValidator
 */
public final class EventStore implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventStore.class.getName());

  private final EventLog eventLog;
  private final InvariantValidator validator;
  private final ReplayEngine<GovernanceState> replayEngine;
  private final RetryExecutor retryExecutor;
  private final TimeSource timeSource;
  private final MetricsExporter metrics;
  private final int readPageSize;

  private final ReentrantLock appendLock = new ReentrantLock();
  // written under appendLock; state before head so a reader of head never sees a stale state
  private volatile GovernanceState state;
  private volatile long head;

  private EventStore(Builder builder) {
    this.eventLog = builder.eventLog;
    this.validator = builder.validator != null
        ? builder.validator : InvariantValidator.standard(builder.safetyPolicy);
    this.metrics = builder.metrics;
    this.readPageSize = builder.readPageSize;
    this.timeSource = builder.timeSource;
    this.replayEngine = new ReplayEngine<>(eventLog, GovernanceProjection.INSTANCE,
        builder.readPageSize, builder.snapshotInterval, metrics);
    this.retryExecutor = RetryExecutor.builder()
        .policy(builder.retryPolicy)
        .sleeper(builder.sleeper)
        .listener((attempt, delayMs, failure) -> incrementRetry())
        .build();
    this.state = GovernanceState.EMPTY;
    this.head = 0L;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Proposes a candidate event.
   *
   * @param candidate the event to admit
   * @return exactly one of Committed, Rejected, RetryExhausted or Fatal; never throws for
   *     storage failures
   */
  public AppendOutcome append(CandidateEvent candidate) {
    Objects.requireNonNull(candidate, "candidate");
    long start = System.nanoTime();
    AppendOutcome outcome;
    appendLock.lock();
    try {
      outcome = appendLocked(candidate);
    } finally {
      appendLock.unlock();
    }
    recordAppend(outcome.status(), System.nanoTime() - start);
    return outcome;
  }

  private AppendOutcome appendLocked(CandidateEvent candidate) {
    GovernanceState current;
    try {
      current = catchUp();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read event log before appending " + candidate.eventId(), e);
      return new AppendOutcome.Fatal(e);
    }

    Instant occurredAt = candidate.occurredAt() == null
        ? stampTime(current)
        : candidate.occurredAt().truncatedTo(TimeSource.PRECISION);
    CandidateEvent stamped = candidate.withOccurredAt(occurredAt);

    Verdict verdict;
    try {
      verdict = validator.validate(stamped, current);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Validator failed for " + candidate.eventId(), e);
      return new AppendOutcome.Fatal(e);
    }
    if (verdict instanceof Verdict.Violation violation) {
      logger.log(Level.FINE, "Rejected {0}: {1} {2}",
          new Object[]{candidate, violation.kind(), violation.reason()});
      return new AppendOutcome.Rejected(violation);
    }

    CommittedEvent event = stamped.commitAt(head);
    RetryOutcome<Void> written = retryExecutor.execute(() -> {
      eventLog.write(event);
      return null;
    });

    if (written instanceof RetryOutcome.Success<Void> success) {
      publish(event, current);
      logger.log(Level.FINE, "Committed {0} at position {1} after {2} attempt(s)",
          new Object[]{event.eventId(), event.position(), success.attempts()});
      return new AppendOutcome.Committed(event);
    }
    if (isStored(event, written)) {
      publish(event, current);
      logger.log(Level.WARNING, "Write of {0} reported failure but committed at position {1}",
          new Object[]{event.eventId(), event.position()});
      return new AppendOutcome.Committed(event);
    }
    if (written instanceof RetryOutcome.Exhausted<Void> exhausted) {
      return new AppendOutcome.RetryExhausted(exhausted.attempts(), exhausted.lastFailure());
    }
    RetryOutcome.Fatal<Void> fatal = (RetryOutcome.Fatal<Void>) written;
    logger.log(Level.SEVERE, "Failed to persist " + event.eventId() + " at position " + event.position(),
        fatal.failure());
    return new AppendOutcome.Fatal(fatal.failure());
  }

  /**
   * Reads back the event's position after a failed write. A commit whose acknowledgement
   * was lost is found there.
   */
  private boolean isStored(CommittedEvent event, RetryOutcome<Void> written) {
    try {
      List<CommittedEvent> stored = eventLog.read(event.position(), 1);
      return !stored.isEmpty() && stored.get(0).eventId().equals(event.eventId());
    } catch (RuntimeException e) {
      Throwable failure = written instanceof RetryOutcome.Exhausted<Void> exhausted
          ? exhausted.lastFailure()
          : ((RetryOutcome.Fatal<Void>) written).failure();
      failure.addSuppressed(e);
      return false;
    }
  }

  private Instant stampTime(GovernanceState current) {
    Instant now = timeSource.now().truncatedTo(TimeSource.PRECISION);
    Instant last = current.lastOccurredAt();
    return last != null && now.isBefore(last) ? last : now;
  }

  private void publish(CommittedEvent event, GovernanceState prior) {
    GovernanceState next = GovernanceProjection.INSTANCE.fold(prior, event);
    state = next;
    head = event.position() + 1;
    replayEngine.offerSnapshot(head, next);
  }

  /**
   * Folds events written to the log since the last publish: on first use, and when another
   * writer or a lost acknowledgement left events this store has not folded.
   */
  private GovernanceState catchUp() {
    long size = eventLog.size();
    long published = head;
    if (size < published) {
      throw new EventLogException("Event log shrank from " + published + " to " + size + " events");
    }
    if (size == published) {
      return state;
    }
    logger.log(Level.FINE, "Catching up event log from position {0} to {1}", new Object[]{published, size});
    GovernanceState caughtUp = published == 0
        ? replayEngine.stateAt(size)
        : replayEngine.replay(state, published, size);
    state = caughtUp;
    head = size;
    return caughtUp;
  }

  /**
   * Loads the existing log. Called by {@link Builder#build()}.
   */
  private void recover() {
    appendLock.lock();
    try {
      catchUp();
    } finally {
      appendLock.unlock();
    }
  }

  /**
   * Returns the number of committed events visible to readers; also the next position.
   */
  public long head() {
    return head;
  }

  /**
   * Returns the state after every committed event.
   */
  public GovernanceState currentState() {
    return state;
  }

  /**
   * Returns the state after the first {@code position} events.
   *
   * @param position number of events to fold, at most {@link #head()}
   * @return the derived state
   * @throws IllegalArgumentException if {@code position} is negative or beyond the head
   */
  public GovernanceState stateAt(long position) {
    checkPosition(position);
    GovernanceState latest = state;
    if (latest.position() == position) {
      return latest;
    }
    return replayEngine.stateAt(position);
  }

  /**
   * Folds the first {@code asOfPosition} events through an arbitrary projection.
   *
   * @param projection   the fold to apply
   * @param asOfPosition number of events to fold, at most {@link #head()}
   * @param <S>          the projection's state type
   * @return the derived state
   */
  @SuppressWarnings("unchecked")
  public <S> S query(Projection<S> projection, long asOfPosition) {
    Objects.requireNonNull(projection, "projection");
    if (projection == replayEngine.projection()) {
      return (S) stateAt(asOfPosition);
    }
    checkPosition(asOfPosition);
    return new ReplayEngine<>(eventLog, projection, readPageSize, Integer.MAX_VALUE, metrics)
        .replay(0, asOfPosition);
  }

  /**
   * Folds every currently visible event through {@code projection}.
   */
  public <S> S query(Projection<S> projection) {
    return query(projection, head);
  }

  /**
   * Returns a lazy, restartable stream of events from {@code fromPosition} up to the
   * head at the time of this call.
   *
   * @param fromPosition first position to read
   * @return the event stream
   */
  public EventStream read(long fromPosition) {
    if (fromPosition < 0) {
      throw new IllegalArgumentException("fromPosition must be >= 0, got: " + fromPosition);
    }
    return new EventStream(eventLog, fromPosition, head, readPageSize);
  }

  /**
   * Closes the metrics exporter if it is {@link AutoCloseable}. The event log is owned
   * by the caller and left open.
   */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw (e instanceof RuntimeException r) ? r : new IllegalStateException(e);
      }
    }
  }

  private void checkPosition(long position) {
    long visible = head;
    if (position < 0 || position > visible) {
      throw new IllegalArgumentException("position must be in [0, " + visible + "], got: " + position);
    }
  }

  private void recordAppend(AppendOutcome.Status status, long durationNanos) {
    try {
      metrics.recordAppend(status, durationNanos);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "MetricsExporter.recordAppend failed", e);
    }
  }

  private void incrementRetry() {
    try {
      metrics.incrementRetry();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "MetricsExporter.incrementRetry failed", e);
    }
  }

  /**
   * Builder for {@link EventStore}.
   */
  public static final class Builder {
    public static final int DEFAULT_READ_PAGE_SIZE = 500;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 1000;

    private EventLog eventLog;
    private InvariantValidator validator;
    private SafetyPolicy safetyPolicy = SafetyPolicy.defaults();
    private RetryPolicy retryPolicy = ExponentialBackoffRetryPolicy.defaults();
    private Sleeper sleeper = Sleeper.THREAD;
    private TimeSource timeSource = TimeSource.system();
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private int readPageSize = DEFAULT_READ_PAGE_SIZE;
    private int snapshotInterval = DEFAULT_SNAPSHOT_INTERVAL;

    private Builder() {
    }

    /**
     * <b>Required.</b> Storage for committed events.
     */
    public Builder eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /**
     * Replaces the invariant checks run before each append.
     *
     * <p>Optional. Defaults to {@link InvariantValidator#standard(SafetyPolicy)} with the
     * configured {@link #safetyPolicy}.
     */
    public Builder validator(InvariantValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Limits used by the default validator. Ignored when {@link #validator} is set.
     *
     * <p>Optional. Defaults to {@link SafetyPolicy#defaults()}.
     */
    public Builder safetyPolicy(SafetyPolicy safetyPolicy) {
      this.safetyPolicy = Objects.requireNonNull(safetyPolicy, "safetyPolicy");
      return this;
    }

    /**
     * Retry policy for the persistence step.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy#defaults()}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
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
     * Clock used to stamp candidates without an explicit {@code occurredAt}.
     *
     * <p>Optional. Defaults to {@link TimeSource#system()}.
     */
    public Builder timeSource(TimeSource timeSource) {
      this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
      return this;
    }

    /**
     * Events fetched per {@link EventLog#read} call.
     *
     * <p>Optional. Defaults to {@value #DEFAULT_READ_PAGE_SIZE}.
     */
    public Builder readPageSize(int readPageSize) {
      this.readPageSize = readPageSize;
      return this;
    }

    /**
     * Positions between cached state snapshots.
     *
     * <p>Optional. Defaults to {@value #DEFAULT_SNAPSHOT_INTERVAL}.
     */
    public Builder snapshotInterval(int snapshotInterval) {
      this.snapshotInterval = snapshotInterval;
      return this;
    }

    /**
     * Builds the store and folds any events already in the log.
     *
     * @return a ready event store
     * @throws NullPointerException     if {@code eventLog} is not set
     * @throws IllegalArgumentException if a numeric setting is not positive
     * @throws EventLogException        if the existing log cannot be read
     */
    public EventStore build() {
      Objects.requireNonNull(eventLog, "eventLog");
      EventStore store = new EventStore(this);
      store.recover();
      return store;
    }
  }
}
