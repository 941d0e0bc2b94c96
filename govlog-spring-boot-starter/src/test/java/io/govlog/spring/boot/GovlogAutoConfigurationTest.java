package io.govlog.spring.boot;

import io.govlog.AppendOutcome;
import io.govlog.CandidateEvent;
import io.govlog.event.DelegationGranted;
import io.govlog.event.WorkspaceCreated;
import io.govlog.jdbc.ConnectionProvider;
import io.govlog.jdbc.DataSourceConnectionProvider;
import io.govlog.jdbc.JdbcEventLog;
import io.govlog.jdbc.store.AbstractJdbcEventTable;
import io.govlog.jdbc.store.H2EventTable;
import io.govlog.retry.ExponentialBackoffRetryPolicy;
import io.govlog.retry.RetryPolicy;
import io.govlog.spi.EventLog;
import io.govlog.store.EventStore;
import io.govlog.store.InMemoryEventLog;
import io.govlog.validation.SafetyPolicy;
import io.govlog.validation.ViolationKind;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GovlogAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          GovlogAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("governanceEventTable"));
      assertTrue(ctx.containsBean("governanceConnectionProvider"));
      assertTrue(ctx.containsBean("governanceEventLog"));
      assertTrue(ctx.containsBean("governanceRetryPolicy"));
      assertTrue(ctx.containsBean("governanceSafetyPolicy"));
      assertTrue(ctx.containsBean("eventStore"));

      assertInstanceOf(H2EventTable.class, ctx.getBean(AbstractJdbcEventTable.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcEventLog.class, ctx.getBean(EventLog.class));
      assertEquals(3, ctx.getBean(RetryPolicy.class).maxAttempts());
    });
  }

  @Test
  void storeAppendsToCreatedTable() {
    runner.run(ctx -> {
      EventStore store = ctx.getBean(EventStore.class);
      AppendOutcome outcome = store.append(CandidateEvent.of(new WorkspaceCreated("ws-1", "Root", null)));

      assertTrue(outcome.isCommitted(), () -> "expected commit, got " + outcome);
      assertEquals(1, ctx.getBean(EventLog.class).size());
    });
  }

  @Test
  void customTableName() {
    runner.withPropertyValues("govlog.table-name=audit_event").run(ctx -> {
      assertEquals("audit_event", ctx.getBean(AbstractJdbcEventTable.class).tableName());
      EventStore store = ctx.getBean(EventStore.class);
      assertTrue(store.append(CandidateEvent.of(new WorkspaceCreated("ws-1", "Root", null))).isCommitted());
    });
  }

  @Test
  void missingTableFailsStartupWhenSchemaInitDisabled() {
    runner.withPropertyValues("govlog.initialize-schema=false").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
    });
  }

  @Test
  void policyPropertiesReachTheValidator() {
    runner.withPropertyValues("govlog.policy.max-delegation-ttl-days=10").run(ctx -> {
      assertEquals(10, ctx.getBean(SafetyPolicy.class).maxDelegationTtlDays());

      EventStore store = ctx.getBean(EventStore.class);
      store.append(CandidateEvent.of(new WorkspaceCreated("ws-1", "Root", null)));
      AppendOutcome outcome = store.append(CandidateEvent.of(
          new DelegationGranted("del-1", "ws-1", "alice", "bob", 30)));

      AppendOutcome.Rejected rejected = assertInstanceOf(AppendOutcome.Rejected.class, outcome);
      assertEquals(ViolationKind.POLICY_LIMIT, rejected.violation().kind());
    });
  }

  @Test
  void invalidRetryPropertiesFailStartup() {
    runner.withPropertyValues("govlog.retry.max-attempts=0").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(GovlogAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("eventStore")));
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomBeansConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("governanceEventLog"));
      assertFalse(ctx.containsBean("governanceRetryPolicy"));
      assertInstanceOf(InMemoryEventLog.class, ctx.getBean(EventLog.class));
      assertEquals(1, ctx.getBean(RetryPolicy.class).maxAttempts());

      EventStore store = ctx.getBean(EventStore.class);
      assertTrue(store.append(CandidateEvent.of(new WorkspaceCreated("ws-1", "Root", null))).isCommitted());
      assertEquals(1, ctx.getBean(EventLog.class).size());
    });
  }

  private static Throwable findRootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null) {
      root = root.getCause();
    }
    return root;
  }

  @Configuration
  static class CustomBeansConfig {
    @Bean
    EventLog inMemoryEventLog() {
      return new InMemoryEventLog();
    }

    @Bean
    RetryPolicy singleAttemptPolicy() {
      return ExponentialBackoffRetryPolicy.builder().maxAttempts(1).build();
    }
  }
}
