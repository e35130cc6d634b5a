package io.jobqueue.spring.boot;

import io.jobqueue.jdbc.JdbcTransport;
import io.jobqueue.jdbc.TableNames;
import io.jobqueue.retry.PolynomialBackoffRetryPolicy;
import io.jobqueue.routing.QueueNames;
import io.jobqueue.routing.QueueRouter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the job queue.
 *
 * @see JobQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobqueue")
public class JobQueueProperties {

    /**
     * Whether this instance executes jobs. Producer-only instances set this to false.
     */
    private boolean workersEnabled = true;

    /**
     * Prefix of physical queue names.
     */
    private String queuePrefix = QueueNames.DEFAULT_PREFIX;

    /**
     * Jobs with a timeout above this go to the long-running queue.
     */
    private Duration longRunningThreshold = QueueRouter.DEFAULT_LONG_RUNNING_THRESHOLD;

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Transport transport = new Transport();
    private final Metrics metrics = new Metrics();

    public boolean isWorkersEnabled() {
        return workersEnabled;
    }

    public void setWorkersEnabled(boolean workersEnabled) {
        this.workersEnabled = workersEnabled;
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    public void setQueuePrefix(String queuePrefix) {
        this.queuePrefix = queuePrefix;
    }

    public Duration getLongRunningThreshold() {
        return longRunningThreshold;
    }

    public void setLongRunningThreshold(Duration longRunningThreshold) {
        this.longRunningThreshold = longRunningThreshold;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Transport getTransport() {
        return transport;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum TransportType {
        /** JDBC when a DataSource bean exists, in-memory otherwise. */
        AUTO,
        JDBC,
        IN_MEMORY
    }

    public static class Worker {
        private int regularConcurrency = 10;
        private int longRunningConcurrency = 2;
        private int retryConcurrency = 4;
        private int periodicConcurrency = 1;
        private int batchSize = 100;
        private int publishBatchLimit = 100;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration periodicTickInterval = Duration.ofSeconds(1);
        private long drainTimeoutMs = 5000;

        public int getRegularConcurrency() {
            return regularConcurrency;
        }

        public void setRegularConcurrency(int regularConcurrency) {
            this.regularConcurrency = regularConcurrency;
        }

        public int getLongRunningConcurrency() {
            return longRunningConcurrency;
        }

        public void setLongRunningConcurrency(int longRunningConcurrency) {
            this.longRunningConcurrency = longRunningConcurrency;
        }

        public int getRetryConcurrency() {
            return retryConcurrency;
        }

        public void setRetryConcurrency(int retryConcurrency) {
            this.retryConcurrency = retryConcurrency;
        }

        public int getPeriodicConcurrency() {
            return periodicConcurrency;
        }

        public void setPeriodicConcurrency(int periodicConcurrency) {
            this.periodicConcurrency = periodicConcurrency;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getPublishBatchLimit() {
            return publishBatchLimit;
        }

        public void setPublishBatchLimit(int publishBatchLimit) {
            this.publishBatchLimit = publishBatchLimit;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getPeriodicTickInterval() {
            return periodicTickInterval;
        }

        public void setPeriodicTickInterval(Duration periodicTickInterval) {
            this.periodicTickInterval = periodicTickInterval;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        private int maxRetries = PolynomialBackoffRetryPolicy.DEFAULT_MAX_RETRIES;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class Transport {
        private TransportType type = TransportType.AUTO;
        private Duration visibilityTimeout = JdbcTransport.DEFAULT_VISIBILITY_TIMEOUT;
        private Duration deduplicationRetention = JdbcTransport.DEFAULT_DEDUPLICATION_RETENTION;
        private final Jdbc jdbc = new Jdbc();

        public TransportType getType() {
            return type;
        }

        public void setType(TransportType type) {
            this.type = type;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getDeduplicationRetention() {
            return deduplicationRetention;
        }

        public void setDeduplicationRetention(Duration deduplicationRetention) {
            this.deduplicationRetention = deduplicationRetention;
        }

        public Jdbc getJdbc() {
            return jdbc;
        }
    }

    public static class Jdbc {
        private String messageTable = TableNames.DEFAULT_MESSAGE_TABLE;
        private String deduplicationTable = TableNames.DEFAULT_DEDUPLICATION_TABLE;
        private Duration pollInterval = JdbcTransport.DEFAULT_POLL_INTERVAL;
        private final Purge purge = new Purge();

        public String getMessageTable() {
            return messageTable;
        }

        public void setMessageTable(String messageTable) {
            this.messageTable = messageTable;
        }

        public String getDeduplicationTable() {
            return deduplicationTable;
        }

        public void setDeduplicationTable(String deduplicationTable) {
            this.deduplicationTable = deduplicationTable;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Purge getPurge() {
            return purge;
        }
    }

    public static class Purge {
        private boolean enabled = true;
        private int batchSize = 500;
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobqueue";

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
