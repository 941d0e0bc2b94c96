package io.govlog.event;

import java.util.Objects;

/**
 * Decision rights were delegated from one actor to another inside a workspace.
 *
 * <p>The delegation expires {@code ttlDays} days after the commit timestamp of
 * the event that grants it.
 *
 * @param delegationId new delegation identifier
 * @param workspaceId  workspace the delegation applies to
 * @param fromActor    delegating actor
 * @param toActor      receiving actor
 * @param ttlDays      lifetime in days
 */
public record DelegationGranted(
    String delegationId,
    String workspaceId,
    String fromActor,
    String toActor,
    int ttlDays
) implements EventPayload {

  public DelegationGranted {
    Objects.requireNonNull(delegationId, "delegationId");
    Objects.requireNonNull(workspaceId, "workspaceId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.DELEGATION_GRANTED;
  }
}
