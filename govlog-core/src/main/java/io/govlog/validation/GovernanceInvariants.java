package io.govlog.validation;

import io.govlog.CandidateEvent;
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
import io.govlog.projection.Delegation;
import io.govlog.projection.GovernanceState;
import io.govlog.projection.Law;
import io.govlog.projection.LawStatus;
import io.govlog.projection.Workspace;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Business rules for workspaces, delegations and laws.
 *
 * <p>Time-relative rules (delegation expiry, active delegations for cycle detection) are
 * evaluated at the candidate's stamped {@code occurredAt}.
 */
public final class GovernanceInvariants implements InvariantValidator {
  private final SafetyPolicy policy;

  public GovernanceInvariants(SafetyPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  public Verdict validate(CandidateEvent candidate, GovernanceState state) {
    EventPayload payload = candidate.payload();
    Instant at = Objects.requireNonNull(candidate.occurredAt(), "occurredAt");
    return switch (payload.type()) {
      case WORKSPACE_CREATED -> workspaceCreated((WorkspaceCreated) payload, state);
      case WORKSPACE_ARCHIVED -> workspaceArchived((WorkspaceArchived) payload, state);
      case DELEGATION_GRANTED -> delegationGranted((DelegationGranted) payload, state, at);
      case DELEGATION_RENEWED -> delegationRenewed((DelegationRenewed) payload, state, at);
      case DELEGATION_REVOKED -> delegationRevoked((DelegationRevoked) payload, state, at);
      case LAW_CREATED -> lawCreated((LawCreated) payload, state);
      case LAW_ACTIVATED -> lawActivated((LawActivated) payload, state);
      case LAW_REVIEW_TRIGGERED -> lawReviewTriggered((LawReviewTriggered) payload, state);
      case LAW_REVIEW_COMPLETED -> lawReviewCompleted((LawReviewCompleted) payload, state);
      case LAW_ARCHIVED -> lawArchived((LawArchived) payload, state);
    };
  }

  private Verdict workspaceCreated(WorkspaceCreated event, GovernanceState state) {
    if (isBlank(event.name())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Workspace name is required");
    }
    if (state.workspace(event.workspaceId()).isPresent()) {
      return Verdict.violation(ViolationKind.DUPLICATE_ENTITY,
          "Workspace " + event.workspaceId() + " already exists");
    }
    if (event.parentWorkspaceId() != null) {
      return requireActiveWorkspace(state, event.parentWorkspaceId());
    }
    return Verdict.OK;
  }

  private Verdict workspaceArchived(WorkspaceArchived event, GovernanceState state) {
    Verdict workspace = requireActiveWorkspace(state, event.workspaceId());
    if (!workspace.isOk()) {
      return workspace;
    }
    if (isBlank(event.reason())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Archive reason is required");
    }
    return Verdict.OK;
  }

  private Verdict delegationGranted(DelegationGranted event, GovernanceState state, Instant at) {
    if (state.delegation(event.delegationId()).isPresent()) {
      return Verdict.violation(ViolationKind.DUPLICATE_ENTITY,
          "Delegation " + event.delegationId() + " already exists");
    }
    Verdict workspace = requireActiveWorkspace(state, event.workspaceId());
    if (!workspace.isOk()) {
      return workspace;
    }
    if (isBlank(event.fromActor()) || isBlank(event.toActor())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Delegating and receiving actors are required");
    }
    if (event.ttlDays() < 1 || event.ttlDays() > policy.maxDelegationTtlDays()) {
      return Verdict.violation(ViolationKind.POLICY_LIMIT,
          "ttlDays must be between 1 and " + policy.maxDelegationTtlDays() + ", got: " + event.ttlDays());
    }
    DelegationGraph graph = new DelegationGraph(state.activeDelegationsAt(at));
    if (graph.wouldCycle(event.fromActor(), event.toActor())) {
      return Verdict.violation(ViolationKind.DELEGATION_CYCLE,
          "Delegation " + event.fromActor() + " -> " + event.toActor() + " would create a cycle");
    }
    return Verdict.OK;
  }

  private Verdict delegationRenewed(DelegationRenewed event, GovernanceState state, Instant at) {
    Optional<Delegation> found = state.delegation(event.delegationId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE,
          "Delegation " + event.delegationId() + " does not exist");
    }
    Delegation delegation = found.get();
    if (delegation.isRevoked()) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION,
          "Delegation " + event.delegationId() + " is revoked");
    }
    if (!at.isBefore(delegation.expiresAt())) {
      return Verdict.violation(ViolationKind.TIME_BOUND,
          "Delegation " + event.delegationId() + " expired at " + delegation.expiresAt());
    }
    if (event.ttlDays() < 1 || event.ttlDays() > policy.maxDelegationTtlDays()) {
      return Verdict.violation(ViolationKind.POLICY_LIMIT,
          "ttlDays must be between 1 and " + policy.maxDelegationTtlDays() + ", got: " + event.ttlDays());
    }
    return requireActiveWorkspace(state, delegation.workspaceId());
  }

  private Verdict delegationRevoked(DelegationRevoked event, GovernanceState state, Instant at) {
    Optional<Delegation> found = state.delegation(event.delegationId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE,
          "Delegation " + event.delegationId() + " does not exist");
    }
    Delegation delegation = found.get();
    if (delegation.isRevoked()) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION,
          "Delegation " + event.delegationId() + " is already revoked");
    }
    if (!at.isBefore(delegation.expiresAt())) {
      return Verdict.violation(ViolationKind.TIME_BOUND,
          "Delegation " + event.delegationId() + " expired at " + delegation.expiresAt());
    }
    return Verdict.OK;
  }

  private Verdict lawCreated(LawCreated event, GovernanceState state) {
    if (state.law(event.lawId()).isPresent()) {
      return Verdict.violation(ViolationKind.DUPLICATE_ENTITY, "Law " + event.lawId() + " already exists");
    }
    if (isBlank(event.title())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Law title is required");
    }
    Verdict workspace = requireActiveWorkspace(state, event.workspaceId());
    if (!workspace.isOk()) {
      return workspace;
    }
    return checkpointSchedule(event.checkpoints());
  }

  private Verdict lawActivated(LawActivated event, GovernanceState state) {
    Optional<Law> found = state.law(event.lawId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE, "Law " + event.lawId() + " does not exist");
    }
    Law law = found.get();
    if (law.status() != LawStatus.DRAFT) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION,
          "Law " + event.lawId() + " is " + law.status() + ", expected DRAFT");
    }
    return requireActiveWorkspace(state, law.workspaceId());
  }

  private Verdict lawReviewTriggered(LawReviewTriggered event, GovernanceState state) {
    Optional<Law> found = state.law(event.lawId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE, "Law " + event.lawId() + " does not exist");
    }
    if (found.get().status() != LawStatus.ACTIVE) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION,
          "Law " + event.lawId() + " is " + found.get().status() + ", expected ACTIVE");
    }
    if (isBlank(event.reason())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Review reason is required");
    }
    return Verdict.OK;
  }

  private Verdict lawReviewCompleted(LawReviewCompleted event, GovernanceState state) {
    Optional<Law> found = state.law(event.lawId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE, "Law " + event.lawId() + " does not exist");
    }
    if (found.get().status() != LawStatus.REVIEW) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION,
          "Law " + event.lawId() + " is " + found.get().status() + ", expected REVIEW");
    }
    return Verdict.OK;
  }

  private Verdict lawArchived(LawArchived event, GovernanceState state) {
    Optional<Law> found = state.law(event.lawId());
    if (found.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE, "Law " + event.lawId() + " does not exist");
    }
    if (found.get().status() == LawStatus.ARCHIVED) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION, "Law " + event.lawId() + " is already archived");
    }
    if (isBlank(event.reason())) {
      return Verdict.violation(ViolationKind.MISSING_EVIDENCE, "Archive reason is required");
    }
    return Verdict.OK;
  }

  private Verdict checkpointSchedule(List<Integer> checkpoints) {
    if (checkpoints.isEmpty()) {
      return Verdict.violation(ViolationKind.POLICY_LIMIT, "At least one review checkpoint is required");
    }
    int previous = 0;
    for (Integer checkpoint : checkpoints) {
      if (checkpoint <= 0) {
        return Verdict.violation(ViolationKind.POLICY_LIMIT, "Checkpoints must be positive, got: " + checkpoints);
      }
      if (checkpoint <= previous) {
        return Verdict.violation(ViolationKind.POLICY_LIMIT,
            "Checkpoints must be strictly ascending, got: " + checkpoints);
      }
      previous = checkpoint;
    }
    if (checkpoints.get(0) > policy.maxDaysWithoutReview()) {
      return Verdict.violation(ViolationKind.POLICY_LIMIT,
          "First checkpoint " + checkpoints.get(0) + " exceeds maxDaysWithoutReview "
              + policy.maxDaysWithoutReview());
    }
    return Verdict.OK;
  }

  private static Verdict requireActiveWorkspace(GovernanceState state, String workspaceId) {
    Optional<Workspace> workspace = state.workspace(workspaceId);
    if (workspace.isEmpty()) {
      return Verdict.violation(ViolationKind.MISSING_REFERENCE, "Workspace " + workspaceId + " does not exist");
    }
    if (!workspace.get().isActive()) {
      return Verdict.violation(ViolationKind.INVALID_TRANSITION, "Workspace " + workspaceId + " is archived");
    }
    return Verdict.OK;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
