package io.govlog.validation;

import io.govlog.CandidateEvent;
import io.govlog.projection.GovernanceState;

import java.time.Instant;

/**
 * Checks that hold for every event regardless of kind: unique event ids, causes that
 * already exist, and non-decreasing commit timestamps.
 */
public final class KernelInvariants implements InvariantValidator {

  @Override
  public Verdict validate(CandidateEvent candidate, GovernanceState state) {
    if (state.containsEvent(candidate.eventId())) {
      return Verdict.violation(ViolationKind.DUPLICATE_EVENT,
          "Event " + candidate.eventId() + " is already committed");
    }
    String causationId = candidate.causationId();
    if (causationId != null && !state.containsEvent(causationId)) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE,
          "Causation event " + causationId + " is not in the log");
    }
    Instant occurredAt = candidate.occurredAt();
    if (occurredAt == null) {
      throw new IllegalArgumentException("Candidate " + candidate.eventId() + " has not been stamped");
    }
    Instant last = state.lastOccurredAt();
    if (last != null && occurredAt.isBefore(last)) {
      return Verdict.violation(ViolationKind.TIME_BOUND,
          "occurredAt " + occurredAt + " precedes last committed event at " + last);
    }
    return Verdict.OK;
  }
}
