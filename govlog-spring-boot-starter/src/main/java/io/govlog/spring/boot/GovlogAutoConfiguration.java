package io.govlog.spring.boot;

import io.govlog.jdbc.ConnectionProvider;
import io.govlog.jdbc.DataSourceConnectionProvider;
import io.govlog.jdbc.JdbcEventLog;
import io.govlog.jdbc.store.AbstractJdbcEventTable;
import io.govlog.jdbc.store.JdbcEventTables;
import io.govlog.retry.ExponentialBackoffRetryPolicy;
import io.govlog.retry.RetryPolicy;
import io.govlog.spi.EventLog;
import io.govlog.spi.MetricsExporter;
import io.govlog.store.EventStore;
import io.govlog.time.TimeSource;
import io.govlog.validation.InvariantValidator;
import io.govlog.validation.SafetyPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the governance event store.
 *
 * <p>Wires an {@link EventStore} over a {@link JdbcEventLog} from a {@link DataSource}
 * and {@link GovlogProperties}. The table dialect is detected from the JDBC URL. Any
 * bean defined by the application (event log, retry policy, safety policy, validator,
 * time source, metrics exporter) replaces the default.
 *
 * @see GovlogProperties
 * @see GovlogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(GovlogProperties.class)
public class GovlogAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(GovlogAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcEventTable governanceEventTable(DataSource dataSource, GovlogProperties props) {
        AbstractJdbcEventTable detected = JdbcEventTables.detect(dataSource);
        log.info("Using {} event table '{}'", detected.name(), props.getTableName());
        return detected.withTableName(props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider governanceConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(EventLog.class)
    public JdbcEventLog governanceEventLog(ConnectionProvider connectionProvider,
                                           AbstractJdbcEventTable table,
                                           GovlogProperties props) {
        JdbcEventLog eventLog = JdbcEventLog.builder()
                .connectionProvider(connectionProvider)
                .table(table)
                .build();
        if (props.isInitializeSchema()) {
            eventLog.createTableIfMissing();
        }
        return eventLog;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy governanceRetryPolicy(GovlogProperties props) {
        GovlogProperties.Retry retry = props.getRetry();
        return ExponentialBackoffRetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .baseDelayMs(retry.getBaseDelayMs())
                .multiplier(retry.getMultiplier())
                .maxDelayMs(retry.getMaxDelayMs())
                .maxTotalDelayMs(retry.getMaxTotalDelayMs())
                .jitter(retry.isJitter())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SafetyPolicy governanceSafetyPolicy(GovlogProperties props) {
        return SafetyPolicy.builder()
                .maxDelegationTtlDays(props.getPolicy().getMaxDelegationTtlDays())
                .maxDaysWithoutReview(props.getPolicy().getMaxDaysWithoutReview())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventStore eventStore(GovlogProperties props,
                                 EventLog eventLog,
                                 RetryPolicy retryPolicy,
                                 SafetyPolicy safetyPolicy,
                                 ObjectProvider<InvariantValidator> validatorProvider,
                                 ObjectProvider<TimeSource> timeSourceProvider,
                                 ObjectProvider<MetricsExporter> metricsProvider) {
        EventStore.Builder builder = EventStore.builder()
                .eventLog(eventLog)
                .retryPolicy(retryPolicy)
                .safetyPolicy(safetyPolicy)
                .readPageSize(props.getReadPageSize())
                .snapshotInterval(props.getSnapshotInterval());
        validatorProvider.ifAvailable(builder::validator);
        timeSourceProvider.ifAvailable(builder::timeSource);
        metricsProvider.ifAvailable(builder::metrics);
        EventStore store = builder.build();
        log.info("Event store ready at head {}", store.head());
        return store;
    }
}
