package io.govlog.projection;

import java.time.Instant;
import java.util.Objects;

/**
 * A scope of authority.
 *
 * @param workspaceId       workspace identifier
 * @param name              display name
 * @param parentWorkspaceId parent workspace, or {@code null} for a root workspace
 * @param createdAt         commit time of the creating event
 * @param archivedAt        commit time of the archiving event, or {@code null} while active
 */
public record Workspace(
    String workspaceId,
    String name,
    String parentWorkspaceId,
    Instant createdAt,
    Instant archivedAt
) {

  public Workspace {
    Objects.requireNonNull(workspaceId, "workspaceId");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public boolean isActive() {
    return archivedAt == null;
  }

  Workspace archive(Instant at) {
    return new Workspace(workspaceId, name, parentWorkspaceId, createdAt, at);
  }
}
