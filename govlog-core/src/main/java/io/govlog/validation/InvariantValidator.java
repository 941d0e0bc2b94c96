package io.govlog.validation;

import io.govlog.CandidateEvent;
import io.govlog.projection.GovernanceState;

import java.util.List;
import java.util.Objects;

/**
 * Checks a stamped candidate against the state derived from every committed event.
 *
 * <p>Implementations must be pure: no I/O, no mutation of {@code state}, and the same
 * verdict for the same inputs. The candidate passed in always carries its commit
 * timestamp.
 */
@FunctionalInterface
public interface InvariantValidator {

  /**
   * Validates a candidate.
   *
   * @param candidate the stamped candidate
   * @param state     state as of the current head
   * @return {@link Verdict#OK} or the first violation found
   */
  Verdict validate(CandidateEvent candidate, GovernanceState state);

  /**
   * Composes validators; they run in order and the first violation wins.
   *
   * @param validators the validators to run
   * @return the composite validator
   */
  static InvariantValidator allOf(InvariantValidator... validators) {
    List<InvariantValidator> chain = List.of(validators);
    return (candidate, state) -> {
      for (InvariantValidator validator : chain) {
        Verdict verdict = validator.validate(candidate, state);
        if (!verdict.isOk()) {
          return verdict;
        }
      }
      return Verdict.OK;
    };
  }

  /**
   * Returns the kernel checks followed by the governance rules under {@code policy}.
   *
   * @param policy safety limits
   * @return the standard validator
   */
  static InvariantValidator standard(SafetyPolicy policy) {
    Objects.requireNonNull(policy, "policy");
    return allOf(new KernelInvariants(), new GovernanceInvariants(policy));
  }
}
