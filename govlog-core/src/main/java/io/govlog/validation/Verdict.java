package io.govlog.validation;

import java.util.Objects;

/**
 * Result of running an {@link InvariantValidator}.
 */
public sealed interface Verdict permits Verdict.Ok, Verdict.Violation {

  /**
   * Singleton indicating every invariant holds.
   */
  Ok OK = new Ok();

  static Ok ok() {
    return OK;
  }

  /**
   * Creates a violation.
   *
   * @param kind   violation category
   * @param reason human-readable explanation
   * @return a violation verdict
   */
  static Violation violation(ViolationKind kind, String reason) {
    return new Violation(kind, reason);
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  /**
   * All invariants hold.
   */
  record Ok() implements Verdict {
  }

  /**
   * An invariant failed.
   *
   * @param kind   violation category
   * @param reason human-readable explanation
   */
  record Violation(ViolationKind kind, String reason) implements Verdict {
    public Violation {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
