package io.govlog.event;

import java.util.Objects;

/**
 * A drafted law became enforceable. Its review clock starts at the commit timestamp.
 */
public record LawActivated(String lawId) implements EventPayload {

  public LawActivated {
    Objects.requireNonNull(lawId, "lawId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.LAW_ACTIVATED;
  }
}
