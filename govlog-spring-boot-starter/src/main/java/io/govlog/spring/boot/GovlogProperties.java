package io.govlog.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the governance event store.
 *
 * @see GovlogAutoConfiguration
 */
@ConfigurationProperties(prefix = "govlog")
public class GovlogProperties {

    /**
     * Database table name for committed events.
     */
    private String tableName = "governance_event";

    /**
     * Whether to create the event table on startup if it does not exist.
     */
    private boolean initializeSchema = true;

    /**
     * Page size used when streaming events from storage.
     */
    private int readPageSize = 500;

    /**
     * Number of events between cached projection snapshots.
     */
    private int snapshotInterval = 1000;

    private final Retry retry = new Retry();
    private final Policy policy = new Policy();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public int getReadPageSize() {
        return readPageSize;
    }

    public void setReadPageSize(int readPageSize) {
        this.readPageSize = readPageSize;
    }

    public int getSnapshotInterval() {
        return snapshotInterval;
    }

    public void setSnapshotInterval(int snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    public Retry getRetry() {
        return retry;
    }

    public Policy getPolicy() {
        return policy;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 100;
        private double multiplier = 2.0;
        private long maxDelayMs = 1000;
        private long maxTotalDelayMs = 5000;
        private boolean jitter = false;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public long getMaxTotalDelayMs() {
            return maxTotalDelayMs;
        }

        public void setMaxTotalDelayMs(long maxTotalDelayMs) {
            this.maxTotalDelayMs = maxTotalDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Policy {
        private int maxDelegationTtlDays = 365;
        private int maxDaysWithoutReview = 365;

        public int getMaxDelegationTtlDays() {
            return maxDelegationTtlDays;
        }

        public void setMaxDelegationTtlDays(int maxDelegationTtlDays) {
            this.maxDelegationTtlDays = maxDelegationTtlDays;
        }

        public int getMaxDaysWithoutReview() {
            return maxDaysWithoutReview;
        }

        public void setMaxDaysWithoutReview(int maxDaysWithoutReview) {
            this.maxDaysWithoutReview = maxDaysWithoutReview;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "govlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
