package io.govlog.projection;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of governance state after folding the first {@code position} events.
 *
 * <p>Lookups by id are constant time. The collection accessors ({@link #eventIds()},
 * {@link #workspaces()}, {@link #delegations()}, {@link #laws()}) build a fresh unmodifiable
 * copy on every call. States folded from the same events are {@link #equals equal}.
 */
public final class GovernanceState {

  /**
   * The state of an empty log.
   */
  public static final GovernanceState EMPTY = new GovernanceState(0, null, null);

  private final long position;
  private final Instant lastOccurredAt;
  private final StateHistory history;

  GovernanceState(long position, Instant lastOccurredAt, StateHistory history) {
    this.position = position;
    this.lastOccurredAt = lastOccurredAt;
    this.history = history;
  }

  /**
   * Returns the number of events folded, i.e. the next log position.
   */
  public long position() {
    return position;
  }

  /**
   * Returns the commit time of the last folded event, or {@code null} for the empty state.
   */
  public Instant lastOccurredAt() {
    return lastOccurredAt;
  }

  StateHistory history() {
    return history;
  }

  public boolean containsEvent(String eventId) {
    return eventId != null && history != null && history.containsEvent(eventId, position);
  }

  public Optional<Workspace> workspace(String workspaceId) {
    if (workspaceId == null || history == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(history.workspaces.get(workspaceId, position));
  }

  public Optional<Delegation> delegation(String delegationId) {
    if (delegationId == null || history == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(history.delegations.get(delegationId, position));
  }

  public Optional<Law> law(String lawId) {
    if (lawId == null || history == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(history.laws.get(lawId, position));
  }

  /**
   * Ids of every folded event.
   */
  public Set<String> eventIds() {
    return history == null ? Set.of() : history.eventIds(position);
  }

  /**
   * Workspaces by id.
   */
  public Map<String, Workspace> workspaces() {
    return history == null ? Map.of() : history.workspaces.view(position);
  }

  /**
   * Delegations by id, including revoked and expired ones.
   */
  public Map<String, Delegation> delegations() {
    return history == null ? Map.of() : history.delegations.view(position);
  }

  /**
   * Laws by id.
   */
  public Map<String, Law> laws() {
    return history == null ? Map.of() : history.laws.view(position);
  }

  /**
   * Returns delegations that are neither revoked nor expired at {@code at}.
   *
   * @param at the instant to evaluate expiry against
   * @return active delegations, in no particular order
   */
  public Set<Delegation> activeDelegationsAt(Instant at) {
    Objects.requireNonNull(at, "at");
    return delegations().values().stream()
        .filter(d -> d.isActiveAt(at))
        .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Returns active laws whose next review checkpoint has passed at {@code at}.
   */
  public Set<Law> lawsDueForReviewAt(Instant at) {
    Objects.requireNonNull(at, "at");
    return laws().values().stream()
        .filter(law -> law.isReviewDueAt(at))
        .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GovernanceState other)) {
      return false;
    }
    if (position != other.position || !Objects.equals(lastOccurredAt, other.lastOccurredAt)) {
      return false;
    }
    if (history == other.history) {
      return true;
    }
    return eventIds().equals(other.eventIds())
        && workspaces().equals(other.workspaces())
        && delegations().equals(other.delegations())
        && laws().equals(other.laws());
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, lastOccurredAt, workspaces(), delegations(), laws());
  }

  @Override
  public String toString() {
    return "GovernanceState{position=" + position
        + ", workspaces=" + workspaces().size()
        + ", delegations=" + delegations().size()
        + ", laws=" + laws().size() + '}';
  }
}
