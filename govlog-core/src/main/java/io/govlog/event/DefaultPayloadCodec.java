package io.govlog.event;

import io.govlog.spi.EventLogException;
import io.govlog.spi.UnknownEventTypeException;
import io.govlog.util.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stores each payload as a flat JSON object of string fields. Integer fields are written
 * in decimal and enums by constant name; {@code checkpoints} is comma-joined. Absent
 * optional fields are omitted.
 */
public final class DefaultPayloadCodec implements PayloadCodec {
  static final DefaultPayloadCodec INSTANCE = new DefaultPayloadCodec(JsonCodec.getDefault());

  private final JsonCodec jsonCodec;

  public DefaultPayloadCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public String encode(EventPayload payload) {
    Map<String, String> fields = new LinkedHashMap<>();
    switch (payload.type()) {
      case WORKSPACE_CREATED -> {
        WorkspaceCreated e = (WorkspaceCreated) payload;
        fields.put("workspaceId", e.workspaceId());
        fields.put("name", e.name());
        fields.put("parentWorkspaceId", e.parentWorkspaceId());
      }
      case WORKSPACE_ARCHIVED -> {
        WorkspaceArchived e = (WorkspaceArchived) payload;
        fields.put("workspaceId", e.workspaceId());
        fields.put("reason", e.reason());
      }
      case DELEGATION_GRANTED -> {
        DelegationGranted e = (DelegationGranted) payload;
        fields.put("delegationId", e.delegationId());
        fields.put("workspaceId", e.workspaceId());
        fields.put("fromActor", e.fromActor());
        fields.put("toActor", e.toActor());
        fields.put("ttlDays", Integer.toString(e.ttlDays()));
      }
      case DELEGATION_RENEWED -> {
        DelegationRenewed e = (DelegationRenewed) payload;
        fields.put("delegationId", e.delegationId());
        fields.put("ttlDays", Integer.toString(e.ttlDays()));
      }
      case DELEGATION_REVOKED -> {
        DelegationRevoked e = (DelegationRevoked) payload;
        fields.put("delegationId", e.delegationId());
        fields.put("reason", e.reason());
      }
      case LAW_CREATED -> {
        LawCreated e = (LawCreated) payload;
        fields.put("lawId", e.lawId());
        fields.put("workspaceId", e.workspaceId());
        fields.put("title", e.title());
        fields.put("checkpoints", joinInts(e.checkpoints()));
      }
      case LAW_ACTIVATED -> fields.put("lawId", ((LawActivated) payload).lawId());
      case LAW_REVIEW_TRIGGERED -> {
        LawReviewTriggered e = (LawReviewTriggered) payload;
        fields.put("lawId", e.lawId());
        fields.put("reason", e.reason());
      }
      case LAW_REVIEW_COMPLETED -> {
        LawReviewCompleted e = (LawReviewCompleted) payload;
        fields.put("lawId", e.lawId());
        fields.put("outcome", e.outcome().name());
        fields.put("notes", e.notes());
      }
      case LAW_ARCHIVED -> {
        LawArchived e = (LawArchived) payload;
        fields.put("lawId", e.lawId());
        fields.put("reason", e.reason());
      }
      default -> throw new IllegalStateException("Unhandled event type: " + payload.type());
    }
    return jsonCodec.toJson(fields);
  }

  @Override
  public EventPayload decode(String typeName, String encoded) {
    GovernanceEventType type = GovernanceEventType.fromWireName(typeName)
        .orElseThrow(() -> new UnknownEventTypeException(typeName));
    Map<String, String> f;
    try {
      f = jsonCodec.parseObject(encoded);
    } catch (IllegalArgumentException e) {
      throw new EventLogException("Malformed " + typeName + " payload: " + e.getMessage(), e);
    }
    try {
      return switch (type) {
        case WORKSPACE_CREATED -> new WorkspaceCreated(
            required(f, "workspaceId"), f.get("name"), f.get("parentWorkspaceId"));
        case WORKSPACE_ARCHIVED -> new WorkspaceArchived(required(f, "workspaceId"), f.get("reason"));
        case DELEGATION_GRANTED -> new DelegationGranted(
            required(f, "delegationId"), required(f, "workspaceId"),
            f.get("fromActor"), f.get("toActor"), Integer.parseInt(required(f, "ttlDays")));
        case DELEGATION_RENEWED -> new DelegationRenewed(
            required(f, "delegationId"), Integer.parseInt(required(f, "ttlDays")));
        case DELEGATION_REVOKED -> new DelegationRevoked(required(f, "delegationId"), f.get("reason"));
        case LAW_CREATED -> new LawCreated(
            required(f, "lawId"), required(f, "workspaceId"), f.get("title"),
            splitInts(f.get("checkpoints")));
        case LAW_ACTIVATED -> new LawActivated(required(f, "lawId"));
        case LAW_REVIEW_TRIGGERED -> new LawReviewTriggered(required(f, "lawId"), f.get("reason"));
        case LAW_REVIEW_COMPLETED -> new LawReviewCompleted(
            required(f, "lawId"), ReviewOutcome.valueOf(required(f, "outcome")), f.get("notes"));
        case LAW_ARCHIVED -> new LawArchived(required(f, "lawId"), f.get("reason"));
      };
    } catch (IllegalArgumentException e) {
      throw new EventLogException("Malformed " + typeName + " payload: " + e.getMessage(), e);
    }
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null) {
      throw new EventLogException("Stored payload is missing field '" + name + "'");
    }
    return value;
  }

  private static String joinInts(List<Integer> values) {
    StringBuilder sb = new StringBuilder();
    for (Integer value : values) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(value);
    }
    return sb.toString();
  }

  private static List<Integer> splitInts(String joined) {
    List<Integer> values = new ArrayList<>();
    if (joined == null || joined.isEmpty()) {
      return values;
    }
    for (String part : joined.split(",")) {
      values.add(Integer.parseInt(part.trim()));
    }
    return values;
  }
}
