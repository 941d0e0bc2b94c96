package io.govlog.projection;

import io.govlog.event.ReviewOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A rule adopted inside a workspace, with mandatory review checkpoints.
 *
 * @param lawId             law identifier
 * @param workspaceId       owning workspace
 * @param title             law title
 * @param checkpoints       review points in days after activation, ascending
 * @param status            lifecycle status
 * @param createdAt         commit time of the creating event
 * @param activatedAt       commit time of activation, or {@code null}
 * @param checkpointIndex   index into {@code checkpoints} of the next review
 * @param nextReviewAt      activation time plus the checkpoint at {@code checkpointIndex}, or
 *                          {@code null} while not active or once every checkpoint has passed
 * @param reviewOpenedAt    commit time of the open review, or {@code null}
 * @param archivedAt        commit time of archiving, or {@code null}
 */
public record Law(
    String lawId,
    String workspaceId,
    String title,
    List<Integer> checkpoints,
    LawStatus status,
    Instant createdAt,
    Instant activatedAt,
    int checkpointIndex,
    Instant nextReviewAt,
    Instant reviewOpenedAt,
    Instant archivedAt
) {

  public Law {
    Objects.requireNonNull(lawId, "lawId");
    Objects.requireNonNull(status, "status");
    checkpoints = List.copyOf(checkpoints);
  }

  static Law draft(String lawId, String workspaceId, String title, List<Integer> checkpoints,
      Instant createdAt) {
    return new Law(lawId, workspaceId, title, checkpoints, LawStatus.DRAFT, createdAt,
        null, 0, null, null, null);
  }

  /**
   * Returns {@code true} if the law is active and its next checkpoint is before {@code at}.
   */
  public boolean isReviewDueAt(Instant at) {
    return status == LawStatus.ACTIVE && nextReviewAt != null && at.isAfter(nextReviewAt);
  }

  Law activate(Instant at) {
    return new Law(lawId, workspaceId, title, checkpoints, LawStatus.ACTIVE, createdAt,
        at, 0, checkpointAt(at, 0), null, archivedAt);
  }

  Law openReview(Instant at) {
    return new Law(lawId, workspaceId, title, checkpoints, LawStatus.REVIEW, createdAt,
        activatedAt, checkpointIndex, nextReviewAt, at, archivedAt);
  }

  Law completeReview(ReviewOutcome outcome) {
    if (outcome == ReviewOutcome.SUNSET) {
      return new Law(lawId, workspaceId, title, checkpoints, LawStatus.SUNSET, createdAt,
          activatedAt, checkpointIndex, null, null, archivedAt);
    }
    int next = checkpointIndex + 1;
    return new Law(lawId, workspaceId, title, checkpoints, LawStatus.ACTIVE, createdAt,
        activatedAt, next, checkpointAt(activatedAt, next), null, archivedAt);
  }

  Law archive(Instant at) {
    return new Law(lawId, workspaceId, title, checkpoints, LawStatus.ARCHIVED, createdAt,
        activatedAt, checkpointIndex, null, reviewOpenedAt, at);
  }

  private Instant checkpointAt(Instant activation, int index) {
    if (activation == null || index >= checkpoints.size()) {
      return null;
    }
    return activation.plus(Duration.ofDays(checkpoints.get(index)));
  }
}
