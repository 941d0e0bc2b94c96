package io.govlog.jdbc.store;

import io.govlog.event.PayloadCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventTablesTest {

  @Test
  void allReturnsBuiltInDialects() {
    List<AbstractJdbcEventTable> tables = JdbcEventTables.all();

    assertTrue(tables.size() >= 3);
    assertTrue(tables.stream().anyMatch(t -> t.name().equals("mysql")));
    assertTrue(tables.stream().anyMatch(t -> t.name().equals("postgresql")));
    assertTrue(tables.stream().anyMatch(t -> t.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcEventTables.get("MySQL").name());
    assertEquals("postgresql", JdbcEventTables.get("POSTGRESQL").name());
    assertEquals("h2", JdbcEventTables.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcEventTables.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown event table dialect"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcEventTables.detect("jdbc:mysql://localhost:3306/gov").name());
    assertEquals("mysql", JdbcEventTables.detect("jdbc:tidb://localhost:4000/gov").name());
    assertEquals("mysql", JdbcEventTables.detect("jdbc:mariadb://localhost:3306/gov").name());
    assertEquals("postgresql", JdbcEventTables.detect("jdbc:postgresql://localhost:5432/gov").name());
    assertEquals("h2", JdbcEventTables.detect("JDBC:H2:mem:gov").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcEventTables.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No event table dialect found"));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventTables.detect((String) null));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventTables.detect(""));
  }

  @Test
  void detectFromDataSourceBindsTableAndCodec() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_detect;DB_CLOSE_DELAY=-1");

    AbstractJdbcEventTable table = JdbcEventTables.detect(ds, "audit_event", PayloadCodec.getDefault());
    assertEquals("h2", table.name());
    assertEquals("audit_event", table.tableName());
  }

  @Test
  void withTableNameKeepsDialectAndValidates() {
    AbstractJdbcEventTable base = JdbcEventTables.get("postgresql");
    AbstractJdbcEventTable renamed = base.withTableName("gov_log");

    assertInstanceOf(PostgresEventTable.class, renamed);
    assertEquals("gov_log", renamed.tableName());
    assertEquals("governance_event", base.tableName());
    assertThrows(IllegalArgumentException.class, () -> base.withTableName("gov-log"));
  }
}
