package io.govlog.time;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Source of wall-clock time for stamping committed events.
 *
 * <p>Committed timestamps are kept at {@link #PRECISION}, the finest unit SQL
 * {@code TIMESTAMP(6)} columns store. The event store truncates whatever this source
 * returns, so custom sources need not.
 */
@FunctionalInterface
public interface TimeSource {

  ChronoUnit PRECISION = ChronoUnit.MICROS;

  Instant now();

  /**
   * Returns a time source backed by the UTC system clock, truncated to {@link #PRECISION}.
   */
  static TimeSource system() {
    return of(Clock.systemUTC());
  }

  /**
   * Adapts a {@link Clock}, truncating its readings to {@link #PRECISION}.
   *
   * @param clock the clock to read
   * @return a time source reading {@code clock}
   */
  static TimeSource of(Clock clock) {
    Objects.requireNonNull(clock, "clock");
    return () -> clock.instant().truncatedTo(PRECISION);
  }
}
