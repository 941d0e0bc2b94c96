package io.govlog.event;

import java.util.Objects;

/**
 * An active delegation was withdrawn before it expired.
 *
 * @param delegationId the delegation to revoke
 * @param reason       optional free-text reason, may be {@code null}
 */
public record DelegationRevoked(String delegationId, String reason) implements EventPayload {

  public DelegationRevoked {
    Objects.requireNonNull(delegationId, "delegationId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.DELEGATION_REVOKED;
  }
}
