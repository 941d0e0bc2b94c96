package io.govlog;

import io.govlog.event.EventPayload;
import io.govlog.event.GovernanceEventType;

import java.time.Instant;
import java.util.Objects;

/**
 * An event admitted to the log. Immutable once created.
 *
 * @param position      0-based, gapless ordering key
 * @param eventId       unique event id
 * @param occurredAt    commit timestamp, non-decreasing along the log
 * @param payload       typed event body
 * @param causationId   id of the event that caused this one, may be {@code null}
 * @param correlationId correlation id, may be {@code null}
 * @param actorId       proposing actor, may be {@code null}
 */
public record CommittedEvent(
    long position,
    String eventId,
    Instant occurredAt,
    EventPayload payload,
    String causationId,
    String correlationId,
    String actorId
) {

  public CommittedEvent {
    if (position < 0) {
      throw new IllegalArgumentException("position must be >= 0, got: " + position);
    }
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Returns the kind tag of the payload.
   */
  public GovernanceEventType type() {
    return payload.type();
  }
}
