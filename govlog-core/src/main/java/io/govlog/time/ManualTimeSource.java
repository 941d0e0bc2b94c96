package io.govlog.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link TimeSource} that only moves when told to. Safe for concurrent use.
 */
public final class ManualTimeSource implements TimeSource {
  private final AtomicReference<Instant> current;

  public ManualTimeSource(Instant start) {
    this.current = new AtomicReference<>(Objects.requireNonNull(start, "start"));
  }

  @Override
  public Instant now() {
    return current.get();
  }

  public void set(Instant instant) {
    current.set(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * Moves the clock by {@code delta}; a negative delta steps it backwards.
   *
   * @param delta amount to move
   * @return the new current instant
   */
  public Instant advance(Duration delta) {
    Objects.requireNonNull(delta, "delta");
    return current.updateAndGet(now -> now.plus(delta));
  }
}
