package io.govlog.event;

import java.util.List;
import java.util.Objects;

/**
 * A law was drafted inside a workspace.
 *
 * @param lawId       new law identifier
 * @param workspaceId owning workspace
 * @param title       law title
 * @param checkpoints mandatory review points, in days after activation
 */
public record LawCreated(String lawId, String workspaceId, String title, List<Integer> checkpoints)
    implements EventPayload {

  public LawCreated {
    Objects.requireNonNull(lawId, "lawId");
    Objects.requireNonNull(workspaceId, "workspaceId");
    checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.LAW_CREATED;
  }
}
