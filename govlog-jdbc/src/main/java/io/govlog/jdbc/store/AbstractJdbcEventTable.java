package io.govlog.jdbc.store;

import io.govlog.CommittedEvent;
import io.govlog.event.EventPayload;
import io.govlog.event.PayloadCodec;
import io.govlog.jdbc.JdbcTemplate;
import io.govlog.jdbc.TableNames;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC event table with standard SQL implementations.
 *
 * <p>Rows map one-to-one to {@link CommittedEvent}s. {@code position} is the primary key
 * and {@code event_id} is unique, so a second writer racing for the same position fails
 * with a duplicate key instead of forking the log.
 *
 * <p>Subclasses supply the dialect's DDL. Register custom implementations via
 * {@code META-INF/services/io.govlog.jdbc.store.AbstractJdbcEventTable}.
 *
 * @see JdbcEventTables
 */
public abstract class AbstractJdbcEventTable {
  protected static final String COLUMNS =
      "position, event_id, occurred_at, event_type, payload, causation_id, correlation_id, actor_id";

  private final String tableName;
  private final PayloadCodec payloadCodec;

  protected AbstractJdbcEventTable() {
    this(TableNames.DEFAULT_TABLE, PayloadCodec.getDefault());
  }

  protected AbstractJdbcEventTable(String tableName, PayloadCodec payloadCodec) {
    this.tableName = TableNames.validate(tableName);
    this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
  }

  /**
   * Unique identifier for this table dialect (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this dialect bound to another table.
   */
  public abstract AbstractJdbcEventTable withTableName(String tableName);

  /**
   * Returns a copy of this dialect using another payload codec.
   */
  public abstract AbstractJdbcEventTable withPayloadCodec(PayloadCodec payloadCodec);

  /**
   * {@code CREATE TABLE IF NOT EXISTS} statements for this dialect, in execution order.
   */
  protected abstract List<String> createTableStatements();

  public String tableName() {
    return tableName;
  }

  protected PayloadCodec payloadCodec() {
    return payloadCodec;
  }

  /**
   * Creates the table and its indexes if they do not exist yet.
   */
  public void createTable(Connection conn) {
    for (String statement : createTableStatements()) {
      JdbcTemplate.execute(conn, statement);
    }
  }

  public void insert(Connection conn, CommittedEvent event) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)";
    EventPayload payload = event.payload();
    JdbcTemplate.update(conn, sql,
        event.position(), event.eventId(), Timestamp.from(event.occurredAt()),
        payloadCodec.typeName(payload), payloadCodec.encode(payload),
        event.causationId(), event.correlationId(), event.actorId());
  }

  /**
   * Returns the next free position: one past the highest stored position, or 0.
   */
  public long nextPosition(Connection conn) {
    String sql = "SELECT MAX(position) AS max_position FROM " + tableName();
    List<Long> rows = JdbcTemplate.query(conn, sql, rs -> {
      long max = rs.getLong("max_position");
      return rs.wasNull() ? 0L : max + 1;
    });
    return rows.isEmpty() ? 0L : rows.get(0);
  }

  public List<CommittedEvent> selectRange(Connection conn, long fromPosition, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE position >= ? ORDER BY position LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapRow, fromPosition, limit);
  }

  public Optional<String> findEventId(Connection conn, long position) {
    String sql = "SELECT event_id FROM " + tableName() + " WHERE position = ?";
    List<String> rows = JdbcTemplate.query(conn, sql, rs -> rs.getString("event_id"), position);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  protected CommittedEvent mapRow(ResultSet rs) throws SQLException {
    EventPayload payload = payloadCodec.decode(rs.getString("event_type"), rs.getString("payload"));
    return new CommittedEvent(
        rs.getLong("position"),
        rs.getString("event_id"),
        JdbcTemplate.getTimestamp(rs, "occurred_at").toInstant(),
        payload,
        rs.getString("causation_id"),
        rs.getString("correlation_id"),
        rs.getString("actor_id"));
  }
}
