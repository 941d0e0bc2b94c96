package io.govlog.projection;

import io.govlog.CommittedEvent;
import io.govlog.spi.EventLog;
import io.govlog.spi.EventLogException;
import io.govlog.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives projection state by folding ranges of the event log.
 *
 * <p>{@link #stateAt} starts from the nearest cached snapshot and stores a new snapshot
 * every {@code snapshotInterval} positions on the way. {@link #rebuild} ignores the cache
 * and always agrees with it.
 *
 * <p>Thread-safe: the engine keeps no mutable state apart from the concurrent cache,
 * and projections are pure.
 *
 * @param <S> the state type
 */
public final class ReplayEngine<S> {
  private static final Logger logger = Logger.getLogger(ReplayEngine.class.getName());

  static final int DEFAULT_MAX_SNAPSHOTS = 64;

  private final EventLog eventLog;
  private final Projection<S> projection;
  private final int pageSize;
  private final int snapshotInterval;
  private final SnapshotCache<S> cache;
  private final MetricsExporter metrics;

  /**
   * Creates a replay engine.
   *
   * @param eventLog         source of committed events
   * @param projection       the fold to apply
   * @param pageSize         events per {@link EventLog#read} call
   * @param snapshotInterval cache a snapshot whenever the folded position is a multiple of this
   * @param metrics          receives replay durations
   */
  public ReplayEngine(EventLog eventLog, Projection<S> projection, int pageSize,
      int snapshotInterval, MetricsExporter metrics) {
    this(eventLog, projection, pageSize, snapshotInterval,
        new SnapshotCache<>(DEFAULT_MAX_SNAPSHOTS), metrics);
  }

  ReplayEngine(EventLog eventLog, Projection<S> projection, int pageSize,
      int snapshotInterval, SnapshotCache<S> cache, MetricsExporter metrics) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.projection = Objects.requireNonNull(projection, "projection");
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0, got: " + pageSize);
    }
    if (snapshotInterval <= 0) {
      throw new IllegalArgumentException("snapshotInterval must be > 0, got: " + snapshotInterval);
    }
    this.pageSize = pageSize;
    this.snapshotInterval = snapshotInterval;
    this.cache = Objects.requireNonNull(cache, "cache");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public Projection<S> projection() {
    return projection;
  }

  /**
   * Folds events {@code [fromPosition, toPosition)} onto the projection's initial state.
   */
  public S replay(long fromPosition, long toPosition) {
    return replay(projection.initial(), fromPosition, toPosition);
  }

  /**
   * Folds events {@code [fromPosition, toPosition)} onto {@code prior}.
   *
   * <p>For any {@code 0 <= n <= m}: {@code replay(replay(0, n), n, m)} equals {@code replay(0, m)}.
   *
   * @param prior        state to start from
   * @param fromPosition first position to fold (inclusive)
   * @param toPosition   position to stop at (exclusive)
   * @return the folded state
   * @throws IllegalArgumentException if the range is invalid
   * @throws EventLogException        if the log has fewer than {@code toPosition} events or a gap
   */
  public S replay(S prior, long fromPosition, long toPosition) {
    checkRange(fromPosition, toPosition);
    long start = System.nanoTime();
    S state = foldRange(prior, fromPosition, toPosition, false);
    report(toPosition - fromPosition, System.nanoTime() - start);
    return state;
  }

  /**
   * Returns the state after folding the first {@code position} events, using cached
   * snapshots where available.
   *
   * @param position number of events to fold
   * @return the derived state
   */
  public S stateAt(long position) {
    checkRange(0, position);
    Optional<Map.Entry<Long, S>> snapshot = cache.floor(position);
    long from = snapshot.map(Map.Entry::getKey).orElse(0L);
    S prior = snapshot.map(Map.Entry::getValue).orElseGet(projection::initial);
    if (from == position) {
      return prior;
    }
    long start = System.nanoTime();
    S state = foldRange(prior, from, position, true);
    report(position - from, System.nanoTime() - start);
    return state;
  }

  /**
   * Recomputes the state at {@code position} from position 0, bypassing the cache.
   */
  public S rebuild(long position) {
    return replay(0, position);
  }

  /**
   * Offers a state the caller folded itself so later {@link #stateAt} calls can start from it.
   * Only positions on a snapshot boundary are kept.
   */
  public void offerSnapshot(long position, S state) {
    if (position > 0 && position % snapshotInterval == 0) {
      cache.put(position, state);
    }
  }

  public void clearSnapshots() {
    cache.clear();
  }

  SnapshotCache<S> cache() {
    return cache;
  }

  private S foldRange(S prior, long fromPosition, long toPosition, boolean snapshot) {
    S state = prior;
    long next = fromPosition;
    while (next < toPosition) {
      long boundary = snapshot ? nextBoundary(next) : Long.MAX_VALUE;
      int limit = (int) Math.min(pageSize, Math.min(toPosition, boundary) - next);
      List<CommittedEvent> page = eventLog.read(next, limit);
      if (page.isEmpty()) {
        throw new EventLogException("Event log ends at position " + next
            + ", cannot replay to " + toPosition);
      }
      for (CommittedEvent event : page) {
        if (event.position() != next) {
          throw new EventLogException("Gap in event log: expected position " + next
              + ", found " + event.position());
        }
        next++;
      }
      state = projection.foldAll(state, page);
      if (snapshot && next == boundary) {
        cache.put(next, state);
      }
    }
    return state;
  }

  private long nextBoundary(long position) {
    return (position / snapshotInterval + 1) * snapshotInterval;
  }

  private void report(long events, long durationNanos) {
    if (events <= 0) {
      return;
    }
    try {
      metrics.recordReplay(events, durationNanos);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "MetricsExporter.recordReplay failed", e);
    }
  }

  private static void checkRange(long fromPosition, long toPosition) {
    if (fromPosition < 0 || toPosition < fromPosition) {
      throw new IllegalArgumentException("Invalid replay range [" + fromPosition + ", " + toPosition + ")");
    }
  }
}
