package io.govlog.event;

/**
 * Result of a completed law review.
 */
public enum ReviewOutcome {
  /** The law returns to ACTIVE and its next checkpoint is scheduled. */
  CONTINUE,
  /** The law stops being enforceable and waits to be archived. */
  SUNSET
}
