package io.govlog.event;

import java.util.Objects;

/**
 * An active delegation was extended. The new expiry is {@code ttlDays} days after the
 * commit timestamp of the renewing event.
 *
 * @param delegationId the delegation to renew
 * @param ttlDays      new lifetime in days, counted from the renewal
 */
public record DelegationRenewed(String delegationId, int ttlDays) implements EventPayload {

  public DelegationRenewed {
    Objects.requireNonNull(delegationId, "delegationId");
  }

  @Override
  public GovernanceEventType type() {
    return GovernanceEventType.DELEGATION_RENEWED;
  }
}
