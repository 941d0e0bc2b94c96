package io.govlog.projection;

/**
 * Lifecycle of a law: DRAFT, then ACTIVE. An active law moves to REVIEW at each
 * checkpoint and back to ACTIVE, or to SUNSET, when the review completes. Any law that is
 * not yet ARCHIVED may be archived.
 */
public enum LawStatus {
  DRAFT,
  ACTIVE,
  REVIEW,
  SUNSET,
  ARCHIVED
}
