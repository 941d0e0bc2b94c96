package io.govlog;

import io.govlog.event.EventPayload;
import io.govlog.time.IdGenerator;

import java.time.Instant;
import java.util.Objects;

/**
 * A proposed event that has not yet been admitted to the log.
 *
 * <p>Each candidate is assigned a ULID-based {@code eventId} by default; a custom
 * {@link IdGenerator} can be supplied through the builder. The commit
 * timestamp is normally stamped by the {@link io.govlog.store.EventStore} inside its
 * critical section; a caller-supplied {@code occurredAt} is truncated to
 * {@link io.govlog.time.TimeSource#PRECISION} on admission and must not precede the last
 * committed timestamp. A rejected candidate leaves no trace in the log.
 *
 * @see CommittedEvent
 */
public final class CandidateEvent {
  private final String eventId;
  private final EventPayload payload;
  private final Instant occurredAt;
  private final String causationId;
  private final String correlationId;
  private final String actorId;

  private CandidateEvent(Builder builder) {
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    this.eventId = builder.eventId == null ? builder.idGenerator.newId() : builder.eventId;
    if (this.eventId == null) {
      throw new IllegalArgumentException("idGenerator returned null");
    }
    if (this.eventId.isEmpty()) {
      throw new IllegalArgumentException("eventId cannot be empty");
    }
    if (this.eventId.length() > 36) {
      throw new IllegalArgumentException("eventId exceeds 36 characters: " + this.eventId);
    }
    this.occurredAt = builder.occurredAt;
    this.causationId = builder.causationId;
    this.correlationId = builder.correlationId;
    this.actorId = builder.actorId;
  }

  /**
   * Creates a builder for the given payload.
   *
   * @param payload the typed event body
   * @return a new builder
   */
  public static Builder builder(EventPayload payload) {
    return new Builder(Objects.requireNonNull(payload, "payload"));
  }

  /**
   * Creates a candidate with a generated id and no metadata.
   *
   * @param payload the typed event body
   * @return a new candidate
   */
  public static CandidateEvent of(EventPayload payload) {
    return builder(payload).build();
  }

  public String eventId() {
    return eventId;
  }

  public EventPayload payload() {
    return payload;
  }

  /**
   * Returns the caller-supplied timestamp, or {@code null} if the store should stamp it.
   */
  public Instant occurredAt() {
    return occurredAt;
  }

  public String causationId() {
    return causationId;
  }

  public String correlationId() {
    return correlationId;
  }

  public String actorId() {
    return actorId;
  }

  /**
   * Returns a copy of this candidate carrying the given commit timestamp.
   *
   * @param stampedAt the commit timestamp
   * @return a stamped candidate
   */
  public CandidateEvent withOccurredAt(Instant stampedAt) {
    return new Builder(this).occurredAt(Objects.requireNonNull(stampedAt, "stampedAt")).build();
  }

  /**
   * Converts this candidate into a committed event at the given position.
   *
   * @param position the log position assigned inside the critical section
   * @return the committed event
   * @throws IllegalStateException if the candidate has not been stamped
   */
  public CommittedEvent commitAt(long position) {
    if (occurredAt == null) {
      throw new IllegalStateException("Candidate " + eventId + " has not been stamped");
    }
    return new CommittedEvent(position, eventId, occurredAt, payload,
        causationId, correlationId, actorId);
  }

  @Override
  public String toString() {
    return "CandidateEvent{eventId=" + eventId + ", type=" + payload.type().wireName() + '}';
  }

  /**
   * Builder for {@link CandidateEvent}.
   */
  public static final class Builder {
    private final EventPayload payload;
    private String eventId;
    private IdGenerator idGenerator = IdGenerator.ulid();
    private Instant occurredAt;
    private String causationId;
    private String correlationId;
    private String actorId;

    private Builder(EventPayload payload) {
      this.payload = payload;
    }

    private Builder(CandidateEvent source) {
      this.payload = source.payload;
      this.eventId = source.eventId;
      this.occurredAt = source.occurredAt;
      this.causationId = source.causationId;
      this.correlationId = source.correlationId;
      this.actorId = source.actorId;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID. At most 36 characters.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the generator used when no {@link #eventId} is given.
     *
     * <p>Optional. Defaults to {@link IdGenerator#ulid()}.
     *
     * @param idGenerator the id generator
     * @return this builder
     */
    public Builder idGenerator(IdGenerator idGenerator) {
      this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
      return this;
    }

    /**
     * Sets the event timestamp.
     *
     * <p>Optional. Defaults to the store's clock at admission time.
     *
     * @param occurredAt the event timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Sets the id of the committed event that caused this one.
     *
     * <p>Optional. When set, the referenced event must already be in the log.
     *
     * @param causationId the causing event id
     * @return this builder
     */
    public Builder causationId(String causationId) {
      this.causationId = causationId;
      return this;
    }

    /**
     * Sets a correlation id grouping events of one logical operation.
     *
     * <p>Optional. Defaults to {@code null}.
     *
     * @param correlationId the correlation id
     * @return this builder
     */
    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    /**
     * Sets the actor on whose behalf the event is proposed.
     *
     * <p>Optional. Defaults to {@code null}.
     *
     * @param actorId the actor id
     * @return this builder
     */
    public Builder actorId(String actorId) {
      this.actorId = actorId;
      return this;
    }

    /**
     * Builds an immutable {@link CandidateEvent}.
     *
     * @return a new candidate
     * @throws IllegalArgumentException if the event id is null, empty or longer than 36 characters
     */
    public CandidateEvent build() {
      return new CandidateEvent(this);
    }
  }
}
