package io.govlog.store;

import io.govlog.CommittedEvent;
import io.govlog.spi.EventLog;
import io.govlog.spi.EventLogException;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable view of the committed events in {@code [fromPosition, toPosition)}.
 *
 * <p>The upper bound is fixed when the stream is created, so events committed later are
 * never observed. Each call to {@link #iterator()} starts over from {@code fromPosition},
 * reading the log page by page.
 */
public final class EventStream implements Iterable<CommittedEvent> {
  private final EventLog eventLog;
  private final long fromPosition;
  private final long toPosition;
  private final int pageSize;

  EventStream(EventLog eventLog, long fromPosition, long toPosition, int pageSize) {
    this.eventLog = eventLog;
    this.fromPosition = fromPosition;
    this.toPosition = Math.max(fromPosition, toPosition);
    this.pageSize = pageSize;
  }

  public long fromPosition() {
    return fromPosition;
  }

  /**
   * Returns the exclusive upper bound: the head at the time the stream was created.
   */
  public long toPosition() {
    return toPosition;
  }

  public Stream<CommittedEvent> stream() {
    return StreamSupport.stream(
        Spliterators.spliterator(iterator(), toPosition - fromPosition,
            Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
        false);
  }

  @Override
  public Iterator<CommittedEvent> iterator() {
    return new PagingIterator();
  }

  private final class PagingIterator implements Iterator<CommittedEvent> {
    private long next = fromPosition;
    private List<CommittedEvent> page = List.of();
    private int index;

    @Override
    public boolean hasNext() {
      return next < toPosition;
    }

    @Override
    public CommittedEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (index >= page.size()) {
        int limit = (int) Math.min(pageSize, toPosition - next);
        page = eventLog.read(next, limit);
        index = 0;
        if (page.isEmpty()) {
          throw new EventLogException("Event log ends at position " + next + ", expected " + toPosition);
        }
      }
      CommittedEvent event = page.get(index++);
      if (event.position() != next) {
        throw new EventLogException("Gap in event log: expected position " + next
            + ", found " + event.position());
      }
      next++;
      return event;
    }
  }
}
