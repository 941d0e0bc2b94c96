package io.govlog.event;

import java.util.Optional;

/**
 * The closed set of event kinds the kernel understands. Each constant maps to exactly
 * one {@link EventPayload} record.
 */
public enum GovernanceEventType {
  WORKSPACE_CREATED("WorkspaceCreated"),
  WORKSPACE_ARCHIVED("WorkspaceArchived"),
  DELEGATION_GRANTED("DelegationGranted"),
  DELEGATION_RENEWED("DelegationRenewed"),
  DELEGATION_REVOKED("DelegationRevoked"),
  LAW_CREATED("LawCreated"),
  LAW_ACTIVATED("LawActivated"),
  LAW_REVIEW_TRIGGERED("LawReviewTriggered"),
  LAW_REVIEW_COMPLETED("LawReviewCompleted"),
  LAW_ARCHIVED("LawArchived");

  private final String wireName;

  GovernanceEventType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name stored in the {@code event_type} column, e.g. {@code "LawCreated"}.
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Looks up a type by its stored name.
   *
   * @param wireName the persisted type name
   * @return the matching type, or empty for names this kernel does not know
   */
  public static Optional<GovernanceEventType> fromWireName(String wireName) {
    for (GovernanceEventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
