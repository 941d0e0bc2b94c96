package io.govlog.jdbc.store;

import io.govlog.event.PayloadCodec;

import java.util.List;

/**
 * H2 event table. Primarily for testing and embedded use.
 */
public final class H2EventTable extends AbstractJdbcEventTable {

  public H2EventTable() {
    super();
  }

  public H2EventTable(String tableName, PayloadCodec payloadCodec) {
    super(tableName, payloadCodec);
  }

  @Override
  public AbstractJdbcEventTable withTableName(String tableName) {
    return new H2EventTable(tableName, payloadCodec());
  }

  @Override
  public AbstractJdbcEventTable withPayloadCodec(PayloadCodec payloadCodec) {
    return new H2EventTable(tableName(), payloadCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "position BIGINT PRIMARY KEY," +
            "event_id VARCHAR(36) NOT NULL UNIQUE," +
            "occurred_at TIMESTAMP(6) NOT NULL," +
            "event_type VARCHAR(64) NOT NULL," +
            "payload CLOB NOT NULL," +
            "causation_id VARCHAR(36)," +
            "correlation_id VARCHAR(128)," +
            "actor_id VARCHAR(128)" +
            ")");
  }
}
