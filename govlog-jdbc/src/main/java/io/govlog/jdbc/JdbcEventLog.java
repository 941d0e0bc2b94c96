package io.govlog.jdbc;

import io.govlog.CommittedEvent;
import io.govlog.jdbc.store.AbstractJdbcEventTable;
import io.govlog.spi.EventLog;
import io.govlog.spi.EventLogException;
import io.govlog.spi.PositionConflictException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable {@link EventLog} stored in a relational table.
 *
 * <p>Each {@link #write} runs in its own transaction on a fresh connection. A duplicate key
 * on the position is resolved by re-reading the row: if it holds the same event id an
 * earlier, ambiguous attempt already committed and the write succeeds; otherwise a
 * {@link PositionConflictException} is thrown.
 *
 * <p>Timestamps are stored with microsecond precision.
 *
 * <pre>{@code
 * JdbcEventLog log = JdbcEventLog.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .table(JdbcEventTables.detect(dataSource))
 *     .build();
 * }</pre>
 */
public final class JdbcEventLog implements EventLog {
  private static final Logger logger = Logger.getLogger(JdbcEventLog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventTable table;

  private JdbcEventLog(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.table = Objects.requireNonNull(builder.table, "table");
  }

  public static Builder builder() {
    return new Builder();
  }

  public AbstractJdbcEventTable table() {
    return table;
  }

  /**
   * Creates the event table if it does not exist.
   */
  public void createTableIfMissing() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      table.createTable(conn);
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to create table " + table.tableName(), e);
    }
  }

  @Override
  public long size() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return table.nextPosition(conn);
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to read size of " + table.tableName(), e);
    }
  }

  @Override
  public void write(CommittedEvent event) {
    Objects.requireNonNull(event, "event");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        insert(conn, event);
      } finally {
        restoreAutoCommit(conn);
      }
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to write event at position " + event.position(), e);
    }
  }

  private void insert(Connection conn, CommittedEvent event) throws SQLException {
    try {
      long next = table.nextPosition(conn);
      if (event.position() > next) {
        throw new IllegalArgumentException("Write at position " + event.position()
            + " would leave a gap; next position is " + next);
      }
      table.insert(conn, event);
      conn.commit();
    } catch (DuplicateKeyException e) {
      rollback(conn, e);
      resolveDuplicate(conn, event, e);
    } catch (RuntimeException e) {
      rollback(conn, e);
      throw e;
    } catch (SQLException e) {
      rollback(conn, e);
      throw e;
    }
  }

  private void resolveDuplicate(Connection conn, CommittedEvent event, DuplicateKeyException e) {
    Optional<String> existing = table.findEventId(conn, event.position());
    if (existing.isEmpty()) {
      throw new EventLogException("Event " + event.eventId()
          + " is already stored at another position", e);
    }
    if (!existing.get().equals(event.eventId())) {
      throw new PositionConflictException(event.position(), existing.get(), event.eventId());
    }
    logger.log(Level.FINE, "Event {0} already committed at position {1}",
        new Object[]{event.eventId(), event.position()});
  }

  @Override
  public List<CommittedEvent> read(long fromPosition, int maxEvents) {
    if (fromPosition < 0) {
      throw new IllegalArgumentException("fromPosition must be >= 0, got: " + fromPosition);
    }
    if (maxEvents <= 0) {
      throw new IllegalArgumentException("maxEvents must be > 0, got: " + maxEvents);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return table.selectRange(conn, fromPosition, maxEvents);
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to read events from position " + fromPosition, e);
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit", e);
    }
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventTable table;

    private Builder() {}

    /** <b>Required.</b> Source of connections; one is borrowed per operation. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b> Dialect and table to use, typically from
     * {@link io.govlog.jdbc.store.JdbcEventTables#detect}.
     */
    public Builder table(AbstractJdbcEventTable table) {
      this.table = table;
      return this;
    }

    public JdbcEventLog build() {
      return new JdbcEventLog(this);
    }
  }
}
