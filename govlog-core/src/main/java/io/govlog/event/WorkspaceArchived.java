package io.govlog.event;

import java.util.Objects;

/**
 * A workspace was closed; no new delegations or laws may reference it.
 */
public record WorkspaceArchived(String workspaceId, String reason) implements EventPayload {

  public WorkspaceArchived {
    Objects.requireNonNull(workspaceId, "workspaceId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.WORKSPACE_ARCHIVED;
  }
}
