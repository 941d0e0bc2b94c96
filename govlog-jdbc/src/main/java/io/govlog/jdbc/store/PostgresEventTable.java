package io.govlog.jdbc.store;

import io.govlog.event.PayloadCodec;

import java.util.List;

/**
 * PostgreSQL event table.
 */
public final class PostgresEventTable extends AbstractJdbcEventTable {

  public PostgresEventTable() {
    super();
  }

  public PostgresEventTable(String tableName, PayloadCodec payloadCodec) {
    super(tableName, payloadCodec);
  }

  @Override
  public AbstractJdbcEventTable withTableName(String tableName) {
    return new PostgresEventTable(tableName, payloadCodec());
  }

  @Override
  public AbstractJdbcEventTable withPayloadCodec(PayloadCodec payloadCodec) {
    return new PostgresEventTable(tableName(), payloadCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "position BIGINT PRIMARY KEY," +
            "event_id VARCHAR(36) NOT NULL UNIQUE," +
            "occurred_at TIMESTAMP(6) NOT NULL," +
            "event_type VARCHAR(64) NOT NULL," +
            "payload TEXT NOT NULL," +
            "causation_id VARCHAR(36)," +
            "correlation_id VARCHAR(128)," +
            "actor_id VARCHAR(128)" +
            ")");
  }
}
