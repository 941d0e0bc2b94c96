package io.govlog.store;

import io.govlog.CommittedEvent;
import io.govlog.spi.EventLog;
import io.govlog.spi.PositionConflictException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Non-durable {@link EventLog} kept in memory.
 *
 * <p>Events live in a growable array. A write stores the event before publishing the new
 * size, and readers only look below the size they saw, so readers never lock and never
 * see a half-applied write. Intended for tests and embedded use.
 */
public final class InMemoryEventLog implements EventLog {
  private static final int INITIAL_CAPACITY = 64;

  private final Object writeLock = new Object();
  private volatile CommittedEvent[] events = new CommittedEvent[INITIAL_CAPACITY];
  private volatile int size;

  @Override
  public long size() {
    return size;
  }

  @Override
  public void write(CommittedEvent event) {
    Objects.requireNonNull(event, "event");
    synchronized (writeLock) {
      int current = size;
      long position = event.position();
      if (position < current) {
        CommittedEvent existing = events[(int) position];
        if (existing.eventId().equals(event.eventId())) {
          return;
        }
        throw new PositionConflictException(position, existing.eventId(), event.eventId());
      }
      if (position != current) {
        throw new IllegalArgumentException("Write at position " + position
            + " would leave a gap; next position is " + current);
      }
      CommittedEvent[] array = events;
      if (current == array.length) {
        array = Arrays.copyOf(array, current * 2);
        events = array;
      }
      array[current] = event;
      size = current + 1;
    }
  }

  @Override
  public List<CommittedEvent> read(long fromPosition, int maxEvents) {
    if (fromPosition < 0) {
      throw new IllegalArgumentException("fromPosition must be >= 0, got: " + fromPosition);
    }
    if (maxEvents <= 0) {
      throw new IllegalArgumentException("maxEvents must be > 0, got: " + maxEvents);
    }
    int visible = size;
    CommittedEvent[] array = events;
    if (fromPosition >= visible) {
      return List.of();
    }
    int from = (int) fromPosition;
    int to = (int) Math.min(visible, fromPosition + maxEvents);
    return List.of(Arrays.copyOfRange(array, from, to));
  }
}
