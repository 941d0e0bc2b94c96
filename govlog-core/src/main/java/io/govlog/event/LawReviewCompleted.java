package io.govlog.event;

import java.util.Objects;

/**
 * A review of a law was closed.
 *
 * @param lawId   the reviewed law
 * @param outcome whether the law continues to its next checkpoint or is sunset
 * @param notes   optional reviewer notes, may be {@code null}
 */
public record LawReviewCompleted(String lawId, ReviewOutcome outcome, String notes)
    implements EventPayload {

  public LawReviewCompleted {
    Objects.requireNonNull(lawId, "lawId");
    Objects.requireNonNull(outcome, "outcome");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.LAW_REVIEW_COMPLETED;
  }
}
