package io.govlog.jdbc;

import io.govlog.spi.EventLogException;
import io.govlog.spi.TransientStorageException;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Translates {@link SQLException}s into the storage exception hierarchy.
 *
 * <p>Transient (worth retrying):
 * <ul>
 *   <li>SQLState class {@code 40}: serialization failure, deadlock</li>
 *   <li>{@code 55P03}: lock not available (PostgreSQL)</li>
 *   <li>{@code HYT00}: timeout</li>
 *   <li>any {@link SQLTransientException}</li>
 *   <li>H2 lock timeout and concurrent update, MySQL lock wait timeout (vendor codes)</li>
 * </ul>
 * Class {@code 23} becomes {@link DuplicateKeyException}; everything else is a plain
 * {@link EventLogException}.
 */
public final class SqlErrors {
  private static final Set<String> TRANSIENT_STATES = Set.of("55P03", "HYT00");
  // 50200 = H2 LOCK_TIMEOUT_1, 90131 = H2 CONCURRENT_UPDATE_1, 1205 = MySQL ER_LOCK_WAIT_TIMEOUT
  private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(50200, 90131, 1205);

  private SqlErrors() {}

  /**
   * Wraps {@code e} in the matching storage exception.
   *
   * @param message description of the failed operation
   * @param e       the driver exception
   * @return the translated exception, never {@code null}
   */
  public static EventLogException translate(String message, SQLException e) {
    if (isTransient(e)) {
      return new TransientStorageException(message + ": " + e.getMessage(), e);
    }
    if (isDuplicateKey(e)) {
      return new DuplicateKeyException(message + ": " + e.getMessage(), e);
    }
    return new EventLogException(message + ": " + e.getMessage(), e);
  }

  /**
   * Returns whether {@code e}, or any SQL exception in its cause chain, signals contention
   * or a timeout.
   */
  public static boolean isTransient(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLTransientException) {
        return true;
      }
      if (t instanceof SQLException sql) {
        String state = sql.getSQLState();
        if (state != null && (state.startsWith("40") || TRANSIENT_STATES.contains(state))) {
          return true;
        }
        if (TRANSIENT_VENDOR_CODES.contains(sql.getErrorCode())) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Returns whether {@code e} is an integrity constraint violation.
   */
  public static boolean isDuplicateKey(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
