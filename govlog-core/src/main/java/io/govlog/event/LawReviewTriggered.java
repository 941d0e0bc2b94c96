package io.govlog.event;

import java.util.Objects;

/**
 * An active law was put under review, either because a checkpoint passed or on request.
 *
 * @param lawId  the law under review
 * @param reason why the review was opened, e.g. {@code "checkpoint_overdue"}
 */
public record LawReviewTriggered(String lawId, String reason) implements EventPayload {

  public LawReviewTriggered {
    Objects.requireNonNull(lawId, "lawId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.LAW_REVIEW_TRIGGERED;
  }
}
