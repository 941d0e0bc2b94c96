package io.govlog.jdbc;

import io.govlog.spi.EventLogException;
import io.govlog.spi.TransientStorageException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;

import static org.junit.jupiter.api.Assertions.*;

class SqlErrorsTest {

  @Test
  void serializationFailureAndDeadlockAreTransient() {
    assertTrue(SqlErrors.isTransient(new SQLException("could not serialize", "40001")));
    assertTrue(SqlErrors.isTransient(new SQLException("deadlock detected", "40P01")));
  }

  @Test
  void lockNotAvailableAndTimeoutAreTransient() {
    assertTrue(SqlErrors.isTransient(new SQLException("lock not available", "55P03")));
    assertTrue(SqlErrors.isTransient(new SQLException("timeout", "HYT00")));
  }

  @Test
  void transientSubclassesAreTransient() {
    assertTrue(SqlErrors.isTransient(new SQLTimeoutException("statement timeout")));
    assertTrue(SqlErrors.isTransient(new SQLTransactionRollbackException("rolled back")));
  }

  @Test
  void vendorLockTimeoutCodesAreTransient() {
    assertTrue(SqlErrors.isTransient(new SQLException("Timeout trying to lock table", "HY000", 50200)));
    assertTrue(SqlErrors.isTransient(new SQLException("Lock wait timeout exceeded", "HY000", 1205)));
  }

  @Test
  void transientCauseIsFoundInChain() {
    SQLException outer = new SQLException("batch failed", "HY000",
        new SQLException("deadlock", "40001"));
    assertTrue(SqlErrors.isTransient(outer));
  }

  @Test
  void otherFailuresAreNotTransient() {
    assertFalse(SqlErrors.isTransient(new SQLException("syntax error", "42601")));
    assertFalse(SqlErrors.isTransient(new SQLException("connection refused", "08001")));
    assertFalse(SqlErrors.isTransient(new SQLException("no state")));
  }

  @Test
  void translateMapsToStorageHierarchy() {
    EventLogException transientFailure = SqlErrors.translate("write", new SQLException("x", "40001"));
    assertInstanceOf(TransientStorageException.class, transientFailure);
    assertTrue(transientFailure.getMessage().startsWith("write: "));

    EventLogException duplicate = SqlErrors.translate("write", new SQLException("dup", "23505"));
    assertInstanceOf(DuplicateKeyException.class, duplicate);

    EventLogException fatal = SqlErrors.translate("write", new SQLException("disk full", "53100"));
    assertEquals(EventLogException.class, fatal.getClass());
    assertInstanceOf(SQLException.class, fatal.getCause());
  }
}
