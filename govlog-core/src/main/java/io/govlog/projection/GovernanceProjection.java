package io.govlog.projection;

import io.govlog.CommittedEvent;
import io.govlog.event.DelegationGranted;
import io.govlog.event.DelegationRenewed;
import io.govlog.event.DelegationRevoked;
import io.govlog.event.EventPayload;
import io.govlog.event.LawActivated;
import io.govlog.event.LawArchived;
import io.govlog.event.LawCreated;
import io.govlog.event.LawReviewCompleted;
import io.govlog.event.LawReviewTriggered;
import io.govlog.event.WorkspaceArchived;
import io.govlog.event.WorkspaceCreated;

import java.time.Duration;
import java.time.Instant;

/**
 * Folds committed events into a {@link GovernanceState}.
 *
 * <p>Every event kind is handled. Events are assumed to have passed validation when
 * they were committed; an event that references a missing entity is recorded in
 * {@link GovernanceState#eventIds()} and otherwise has no effect, so folding never fails.
 *
 * <p>Folding the newest state of a history only adds versions for the entities the
 * event touches. Folding an older state first copies what that state sees, so it costs
 * time proportional to the state's size.
 */
public final class GovernanceProjection implements Projection<GovernanceState> {

  /**
   * Shared instance; the projection is stateless.
   */
  public static final GovernanceProjection INSTANCE = new GovernanceProjection();

  private GovernanceProjection() {
  }

  @Override
  public GovernanceState initial() {
    return GovernanceState.EMPTY;
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if {@code event} is positioned before {@code prior}
   */
  @Override
  public GovernanceState fold(GovernanceState prior, CommittedEvent event) {
    long before = prior.position();
    long since = event.position() + 1;
    if (since <= before) {
      throw new IllegalArgumentException("Event at position " + event.position()
          + " cannot follow state at position " + before);
    }
    StateHistory history = claim(prior, since);
    apply(history, event, before, since);
    return new GovernanceState(since, event.occurredAt(), history);
  }

  private static StateHistory claim(GovernanceState prior, long since) {
    StateHistory history = prior.history();
    if (history != null && history.advance(prior.position(), since)) {
      return history;
    }
    StateHistory branch = history == null
        ? new StateHistory(prior.position())
        : history.copyAt(prior.position());
    branch.advance(prior.position(), since);
    return branch;
  }

  private static void apply(StateHistory h, CommittedEvent event, long before, long since) {
    Instant at = event.occurredAt();
    EventPayload payload = event.payload();
    switch (payload.type()) {
      case WORKSPACE_CREATED -> {
        WorkspaceCreated created = (WorkspaceCreated) payload;
        h.workspaces.putIfAbsent(created.workspaceId(), new Workspace(
            created.workspaceId(), created.name(), created.parentWorkspaceId(), at, null), before, since);
      }
      case WORKSPACE_ARCHIVED -> {
        WorkspaceArchived archived = (WorkspaceArchived) payload;
        h.workspaces.update(archived.workspaceId(), ws -> ws.archive(at), before, since);
      }
      case DELEGATION_GRANTED -> {
        DelegationGranted granted = (DelegationGranted) payload;
        h.delegations.putIfAbsent(granted.delegationId(), new Delegation(
            granted.delegationId(), granted.workspaceId(), granted.fromActor(), granted.toActor(),
            at, at.plus(Duration.ofDays(granted.ttlDays())), null), before, since);
      }
      case DELEGATION_RENEWED -> {
        DelegationRenewed renewed = (DelegationRenewed) payload;
        h.delegations.update(renewed.delegationId(), d -> d.renew(at, renewed.ttlDays()), before, since);
      }
      case DELEGATION_REVOKED -> {
        DelegationRevoked revoked = (DelegationRevoked) payload;
        h.delegations.update(revoked.delegationId(), d -> d.revoke(at), before, since);
      }
      case LAW_CREATED -> {
        LawCreated created = (LawCreated) payload;
        h.laws.putIfAbsent(created.lawId(), Law.draft(
            created.lawId(), created.workspaceId(), created.title(), created.checkpoints(), at),
            before, since);
      }
      case LAW_ACTIVATED -> {
        LawActivated activated = (LawActivated) payload;
        h.laws.update(activated.lawId(), law -> law.activate(at), before, since);
      }
      case LAW_REVIEW_TRIGGERED -> {
        LawReviewTriggered triggered = (LawReviewTriggered) payload;
        h.laws.update(triggered.lawId(), law -> law.openReview(at), before, since);
      }
      case LAW_REVIEW_COMPLETED -> {
        LawReviewCompleted completed = (LawReviewCompleted) payload;
        h.laws.update(completed.lawId(), law -> law.completeReview(completed.outcome()), before, since);
      }
      case LAW_ARCHIVED -> {
        LawArchived archived = (LawArchived) payload;
        h.laws.update(archived.lawId(), law -> law.archive(at), before, since);
      }
      default -> throw new IllegalStateException("Unhandled event type: " + payload.type());
    }
    h.recordEvent(event.eventId(), since);
  }
}
