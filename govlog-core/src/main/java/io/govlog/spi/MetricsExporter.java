package io.govlog.spi;

import io.govlog.AppendOutcome;

/**
 * Observability hook for exporting append and replay measurements to a metrics backend.
 *
 * <p>Called from inside the append path; implementations must be cheap and thread-safe.
 * Exceptions thrown here are logged by the caller and never change an append outcome.
 * The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records one finished append attempt.
   *
   * @param status        the outcome of the append
   * @param durationNanos wall time spent in {@code append}, including lock wait
   */
  void recordAppend(AppendOutcome.Status status, long durationNanos);

  /**
   * Increments the count of storage retries caused by transient failures.
   */
  void incrementRetry();

  /**
   * Records a replay pass.
   *
   * @param events        number of events folded
   * @param durationNanos time spent folding
   */
  default void recordReplay(long events, long durationNanos) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordAppend(AppendOutcome.Status status, long durationNanos) {
    }

    @Override
    public void incrementRetry() {
    }
  }
}
