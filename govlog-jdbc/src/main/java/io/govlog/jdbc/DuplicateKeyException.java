package io.govlog.jdbc;

import io.govlog.spi.EventLogException;

/**
 * A write violated a unique constraint (SQLState class {@code 23}).
 *
 * <p>{@link JdbcEventLog} resolves this by re-reading the occupied position.
 */
public final class DuplicateKeyException extends EventLogException {

  public DuplicateKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
