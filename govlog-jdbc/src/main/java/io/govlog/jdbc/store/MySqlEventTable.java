package io.govlog.jdbc.store;

import io.govlog.event.PayloadCodec;

import java.util.List;

/**
 * MySQL event table. Also compatible with TiDB and MariaDB.
 *
 * <p>{@code occurred_at} is {@code DATETIME(6)}: MySQL {@code TIMESTAMP} columns are
 * session-time-zone dependent and end in 2038.
 */
public final class MySqlEventTable extends AbstractJdbcEventTable {

  public MySqlEventTable() {
    super();
  }

  public MySqlEventTable(String tableName, PayloadCodec payloadCodec) {
    super(tableName, payloadCodec);
  }

  @Override
  public AbstractJdbcEventTable withTableName(String tableName) {
    return new MySqlEventTable(tableName, payloadCodec());
  }

  @Override
  public AbstractJdbcEventTable withPayloadCodec(PayloadCodec payloadCodec) {
    return new MySqlEventTable(tableName(), payloadCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "position BIGINT NOT NULL PRIMARY KEY," +
            "event_id VARCHAR(36) NOT NULL," +
            "occurred_at DATETIME(6) NOT NULL," +
            "event_type VARCHAR(64) NOT NULL," +
            "payload LONGTEXT NOT NULL," +
            "causation_id VARCHAR(36)," +
            "correlation_id VARCHAR(128)," +
            "actor_id VARCHAR(128)," +
            "UNIQUE KEY uk_" + tableName() + "_event_id (event_id)" +
            ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4");
  }
}
