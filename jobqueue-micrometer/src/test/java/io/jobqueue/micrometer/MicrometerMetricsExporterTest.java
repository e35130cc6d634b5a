package io.jobqueue.micrometer;

import io.jobqueue.FailureKind;
import io.jobqueue.routing.QueueClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void publishedIsTaggedByQueueClass() {
    exporter.incrementPublished(QueueClass.REGULAR);
    exporter.incrementPublished(QueueClass.REGULAR);
    exporter.incrementPublished(QueueClass.DELAYED);

    assertEquals(2.0, registry.get("jobqueue.published").tag("queue", "regular").counter().count());
    assertEquals(1.0, registry.get("jobqueue.published").tag("queue", "delayed").counter().count());
    assertEquals(0.0, registry.get("jobqueue.published").tag("queue", "long-running").counter().count());
  }

  @Test
  void executionOutcomes() {
    exporter.incrementExecutionSuccess();
    exporter.incrementExecutionFailure(FailureKind.TIMEOUT);
    exporter.incrementExecutionFailure(FailureKind.EXECUTION);
    exporter.incrementExecutionFailure(FailureKind.EXECUTION);

    assertEquals(1.0, counter("jobqueue.execution.success").count());
    assertEquals(2.0, registry.get("jobqueue.execution.failure").tag("kind", "execution").counter().count());
    assertEquals(1.0, registry.get("jobqueue.execution.failure").tag("kind", "timeout").counter().count());
  }

  @Test
  void retriesAndFailedQueue() {
    exporter.incrementRetryScheduled();
    exporter.incrementMovedToFailed(FailureKind.RETRIES_EXHAUSTED);
    exporter.incrementMovedToFailed(FailureKind.UNKNOWN_JOB_TYPE);

    assertEquals(1.0, counter("jobqueue.retry.scheduled").count());
    assertEquals(1.0, registry.get("jobqueue.failed").tag("kind", "retries_exhausted").counter().count());
    assertEquals(1.0, registry.get("jobqueue.failed").tag("kind", "unknown_job_type").counter().count());
  }

  @Test
  void periodicCounters() {
    exporter.incrementPeriodicPublished();
    exporter.incrementPeriodicDuplicate();
    exporter.incrementPeriodicDuplicate();

    assertEquals(1.0, counter("jobqueue.periodic.published").count());
    assertEquals(2.0, counter("jobqueue.periodic.duplicate").count());
  }

  @Test
  void executionDurationIsTimed() {
    exporter.recordExecutionDurationMs(120);
    exporter.recordExecutionDurationMs(80);

    Timer timer = registry.get("jobqueue.execution.duration").timer();
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter billing = new MicrometerMetricsExporter(custom, "billing.jobs");
    billing.incrementExecutionSuccess();

    assertEquals(1.0, custom.get("billing.jobs.execution.success").counter().count());
    assertNull(custom.find("jobqueue.execution.success").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "jobs."));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementExecutionSuccess();
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementExecutionSuccess();
    exporter.incrementPublished(QueueClass.RETRY);
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }
}
