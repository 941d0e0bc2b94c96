package io.govlog.event;

/**
 * Typed body of a governance event.
 *
 * <p>The hierarchy is sealed: the projection and the validators switch over it
 * exhaustively, so adding a kind is a compile-time change everywhere it matters.
 * Payloads carry no timestamps; the commit timestamp of the enclosing event is the
 * single source of time.
 */
public sealed interface EventPayload permits
    WorkspaceCreated, WorkspaceArchived,
    DelegationGranted, DelegationRenewed, DelegationRevoked,
    LawCreated, LawActivated, LawReviewTriggered, LawReviewCompleted, LawArchived {

  /**
   * Returns the kind tag of this payload.
   */
  GovernanceEventType type();
}
