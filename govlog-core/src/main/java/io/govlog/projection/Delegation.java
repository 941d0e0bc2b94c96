package io.govlog.projection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decision rights held by {@code toActor} on behalf of {@code fromActor}.
 *
 * @param delegationId delegation identifier
 * @param workspaceId  workspace the delegation applies to
 * @param fromActor    delegating actor
 * @param toActor      receiving actor
 * @param grantedAt    commit time of the granting event
 * @param expiresAt    {@code grantedAt} plus the granted ttl, or the last renewal plus its ttl
 * @param revokedAt    commit time of the revoking event, or {@code null}
 */
public record Delegation(
    String delegationId,
    String workspaceId,
    String fromActor,
    String toActor,
    Instant grantedAt,
    Instant expiresAt,
    Instant revokedAt
) {

  public Delegation {
    Objects.requireNonNull(delegationId, "delegationId");
    Objects.requireNonNull(grantedAt, "grantedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }

  /**
   * Returns {@code true} if the delegation is neither revoked nor expired at {@code at}.
   */
  public boolean isActiveAt(Instant at) {
    return revokedAt == null && at.isBefore(expiresAt);
  }

  Delegation renew(Instant at, int ttlDays) {
    return new Delegation(delegationId, workspaceId, fromActor, toActor, grantedAt,
        at.plus(Duration.ofDays(ttlDays)), revokedAt);
  }

  Delegation revoke(Instant at) {
    return new Delegation(delegationId, workspaceId, fromActor, toActor, grantedAt, expiresAt, at);
  }
}
