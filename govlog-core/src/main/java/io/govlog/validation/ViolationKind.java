package io.govlog.validation;

/**
 * Category of a failed invariant.
 */
public enum ViolationKind {
  /** The candidate references an entity or event that does not exist. */
  MISSING_REFERENCE,
  /** The candidate creates an entity whose id is already taken. */
  DUPLICATE_ENTITY,
  /** The candidate's event id is already committed. */
  DUPLICATE_EVENT,
  /** A required field (name, title, reason) is blank. */
  MISSING_EVIDENCE,
  /** The referenced entity is not in a state that allows this event. */
  INVALID_TRANSITION,
  /** The candidate's timestamp breaks time ordering or an expiry. */
  TIME_BOUND,
  /** A value exceeds a {@link SafetyPolicy} limit or is malformed. */
  POLICY_LIMIT,
  /** The delegation would close a cycle among active delegations. */
  DELEGATION_CYCLE
}
