package io.govlog.spi;

/**
 * Thrown when a write targets a position already occupied by a different event.
 * Indicates a second writer on the same log.
 */
public final class PositionConflictException extends EventLogException {
  private final long position;
  private final String existingEventId;
  private final String attemptedEventId;

  public PositionConflictException(long position, String existingEventId, String attemptedEventId) {
    super("Position " + position + " already holds event " + existingEventId
        + ", cannot write " + attemptedEventId);
    this.position = position;
    this.existingEventId = existingEventId;
    this.attemptedEventId = attemptedEventId;
  }

  public long position() {
    return position;
  }

  public String existingEventId() {
    return existingEventId;
  }

  public String attemptedEventId() {
    return attemptedEventId;
  }
}
