package io.govlog.event;

import java.util.Objects;

/**
 * A workspace (scope of authority) was opened, optionally nested under a parent.
 *
 * @param workspaceId       new workspace identifier
 * @param name              display name
 * @param parentWorkspaceId enclosing workspace, or {@code null} for a root workspace
 */
public record WorkspaceCreated(String workspaceId, String name, String parentWorkspaceId)
    implements EventPayload {

  public WorkspaceCreated {
    Objects.requireNonNull(workspaceId, "workspaceId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.WORKSPACE_CREATED;
  }
}
