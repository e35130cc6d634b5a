package io.jobqueue.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobQueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(JobQueueProperties.class);
            assertTrue(props.isWorkersEnabled());
            assertEquals("jobs.", props.getQueuePrefix());
            assertEquals(Duration.ofSeconds(10), props.getLongRunningThreshold());
            assertEquals(10, props.getWorker().getRegularConcurrency());
            assertEquals(2, props.getWorker().getLongRunningConcurrency());
            assertEquals(4, props.getWorker().getRetryConcurrency());
            assertEquals(1, props.getWorker().getPeriodicConcurrency());
            assertEquals(100, props.getWorker().getBatchSize());
            assertEquals(Duration.ofSeconds(1), props.getWorker().getPollTimeout());
            assertEquals(5000, props.getWorker().getDrainTimeoutMs());
            assertEquals(25, props.getRetry().getMaxRetries());
            assertEquals(JobQueueProperties.TransportType.AUTO, props.getTransport().getType());
            assertEquals(Duration.ofMinutes(5), props.getTransport().getVisibilityTimeout());
            assertEquals(Duration.ofHours(24), props.getTransport().getDeduplicationRetention());
            assertEquals("job_message", props.getTransport().getJdbc().getMessageTable());
            assertEquals("job_dedup", props.getTransport().getJdbc().getDeduplicationTable());
            assertEquals(Duration.ofMillis(200), props.getTransport().getJdbc().getPollInterval());
            assertTrue(props.getTransport().getJdbc().getPurge().isEnabled());
            assertEquals(500, props.getTransport().getJdbc().getPurge().getBatchSize());
            assertEquals(Duration.ofHours(1), props.getTransport().getJdbc().getPurge().getInterval());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("jobqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "jobqueue.workers-enabled=false",
                "jobqueue.queue-prefix=billing.",
                "jobqueue.long-running-threshold=30s",
                "jobqueue.worker.regular-concurrency=3",
                "jobqueue.worker.poll-timeout=250ms",
                "jobqueue.retry.max-retries=5",
                "jobqueue.transport.type=in-memory",
                "jobqueue.transport.visibility-timeout=PT2M",
                "jobqueue.transport.jdbc.message-table=billing_message",
                "jobqueue.transport.jdbc.purge.enabled=false",
                "jobqueue.metrics.name-prefix=billing.jobs"
        ).run(ctx -> {
            var props = ctx.getBean(JobQueueProperties.class);
            assertFalse(props.isWorkersEnabled());
            assertEquals("billing.", props.getQueuePrefix());
            assertEquals(Duration.ofSeconds(30), props.getLongRunningThreshold());
            assertEquals(3, props.getWorker().getRegularConcurrency());
            assertEquals(Duration.ofMillis(250), props.getWorker().getPollTimeout());
            assertEquals(5, props.getRetry().getMaxRetries());
            assertEquals(JobQueueProperties.TransportType.IN_MEMORY, props.getTransport().getType());
            assertEquals(Duration.ofMinutes(2), props.getTransport().getVisibilityTimeout());
            assertEquals("billing_message", props.getTransport().getJdbc().getMessageTable());
            assertFalse(props.getTransport().getJdbc().getPurge().isEnabled());
            assertEquals("billing.jobs", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(JobQueueProperties.class)
    static class PropsConfig {
    }
}
