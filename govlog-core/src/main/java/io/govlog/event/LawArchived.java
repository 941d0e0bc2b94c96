package io.govlog.event;

import java.util.Objects;

/**
 * A law reached its final state.
 */
public record LawArchived(String lawId, String reason) implements EventPayload {

  public LawArchived {
    Objects.requireNonNull(lawId, "lawId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.LAW_ARCHIVED;
  }
}
