package io.govlog.spi;

import io.govlog.CommittedEvent;

import java.util.List;

/**
 * Durable, append-only storage of committed events.
 *
 * <p>The log is ordered by position; positions start at 0 and have no gaps. The kernel
 * is the single writer: it serializes {@link #write} calls and always writes at
 * {@code position == size()}. Reads may run concurrently with a write.
 *
 * <p>Implementations: {@link io.govlog.store.InMemoryEventLog} and
 * {@code io.govlog.jdbc.JdbcEventLog}.
 */
public interface EventLog {

  /**
   * Returns the number of events durably stored, which is also the next free position.
   *
   * @return the current log size
   * @throws EventLogException if the size cannot be determined
   */
  long size();

  /**
   * Atomically stores one event. Either the whole event becomes durable, or nothing does.
   *
   * <p>Writing an event whose id already occupies {@code event.position()} is a no-op, so
   * a retry after an ambiguous failure is safe.
   *
   * @param event the event to store
   * @throws TransientStorageException on lock contention or timeout
   * @throws PositionConflictException if a different event occupies the position
   * @throws EventLogException on any other storage failure
   */
  void write(CommittedEvent event);

  /**
   * Reads up to {@code maxEvents} events starting at {@code fromPosition}, in position order.
   *
   * @param fromPosition first position to read (inclusive)
   * @param maxEvents    maximum number of events to return
   * @return events in ascending position order, possibly empty
   * @throws UnknownEventTypeException if a stored event cannot be decoded
   * @throws EventLogException on storage failure
   */
  List<CommittedEvent> read(long fromPosition, int maxEvents);
}
