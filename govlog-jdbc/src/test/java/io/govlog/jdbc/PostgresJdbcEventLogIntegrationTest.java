package io.govlog.jdbc;

import io.govlog.jdbc.store.AbstractJdbcEventTable;
import io.govlog.jdbc.store.JdbcEventTables;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DockerAvailable
class PostgresJdbcEventLogIntegrationTest extends AbstractJdbcEventLogTest {

  private static PostgreSQLContainer<?> postgres;
  private static DataSource dataSource;

  @BeforeAll
  static void startContainer() {
    postgres = new PostgreSQLContainer<>("postgres:16-alpine");
    postgres.start();
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
  }

  @AfterAll
  static void stopContainer() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventTable dialect() {
    return JdbcEventTables.detect(dataSource);
  }

  @Test
  void detectsPostgresDialect() {
    assertEquals("postgresql", dialect().name());
  }
}
