package io.jobqueue;

import io.jobqueue.registry.DefaultJobRegistry;
import io.jobqueue.retry.RetryDecision;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.schedule.Schedule;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.transport.InMemoryTransport;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueTest {

  private final InMemoryTransport transport = new InMemoryTransport();

  private JobQueue.Builder builder(DefaultJobRegistry registry) {
    return JobQueue.builder()
        .transport(transport)
        .jobFactory(registry)
        .pollTimeout(Duration.ofMillis(50))
        .periodicTickInterval(Duration.ofMillis(20))
        .drainTimeoutMs(1000);
  }

  @Test
  void publishesAndRunsJobs() {
    List<String> seen = new CopyOnWriteArrayList<>();
    DefaultJobRegistry registry = new DefaultJobRegistry()
        .register("echo", (args, scope) -> seen.add(new String(args, StandardCharsets.UTF_8)));

    try (JobQueue jobs = builder(registry).build()) {
      jobs.start();
      jobs.publish("echo", "one".getBytes(StandardCharsets.UTF_8));
      jobs.runBatch(() -> {
        jobs.publish("echo", "two".getBytes(StandardCharsets.UTF_8));
        jobs.publish("echo", "three".getBytes(StandardCharsets.UTF_8),
            PublishOptions.timeout(Duration.ofSeconds(30)));
      });

      Await.until(() -> seen.size() == 3, "all jobs executed");
    }
    assertTrue(seen.containsAll(List.of("one", "two", "three")));
  }

  @Test
  void periodicJobsRunRepeatedly() {
    AtomicInteger runs = new AtomicInteger();
    DefaultJobRegistry registry = new DefaultJobRegistry().register("tick", (args, scope) -> runs.incrementAndGet());

    try (JobQueue jobs = builder(registry).build()) {
      jobs.publishPeriodic("ticker", "tick", null, Schedule.every(Duration.ofMillis(100)));
      jobs.start();

      Await.until(() -> runs.get() >= 3, "periodic job ran three times");
      assertEquals(1, jobs.periodicRegistrations().size());
      assertThrows(IllegalStateException.class,
          () -> jobs.publishPeriodic("late", "tick", null, Schedule.everySeconds(1)));
    }
  }

  @Test
  void periodicJobSharedByThreeInstancesRunsOncePerOccurrence() throws Exception {
    AtomicInteger runs = new AtomicInteger();
    RecordingMetrics metrics = new RecordingMetrics();
    List<JobQueue> instances = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      DefaultJobRegistry registry = new DefaultJobRegistry().register("tick", (args, scope) -> runs.incrementAndGet());
      JobQueue jobs = builder(registry).metrics(metrics).build();
      jobs.publishPeriodic("heartbeat", "tick", null, Schedule.parse("@every PT0.2S"));
      instances.add(jobs);
    }
    instances.forEach(JobQueue::start);

    Thread.sleep(2100);
    instances.forEach(JobQueue::close);

    int occurrences = metrics.count("periodic.published");
    long pending = transport.depth("jobs.periodic.heartbeat") + transport.depth("jobs.regular");
    assertTrue(occurrences >= 8 && occurrences <= 12, "occurrences: " + occurrences);
    assertTrue(metrics.count("periodic.duplicate") > 0);
    assertEquals(0, transport.inFlight("jobs.periodic.heartbeat"));
    assertEquals(0, transport.inFlight("jobs.regular"));
    assertEquals(occurrences, runs.get() + pending);
  }

  @Test
  void failedJobsCanBeRepublished() {
    AtomicBoolean healthy = new AtomicBoolean();
    AtomicInteger successes = new AtomicInteger();
    DefaultJobRegistry registry = new DefaultJobRegistry().register("fragile", (args, scope) -> {
      if (!healthy.get()) {
        throw new IllegalStateException("dependency down");
      }
      successes.incrementAndGet();
    });

    try (JobQueue jobs = builder(registry).retryPolicy((envelope, error) -> RetryDecision.exhausted("no retries"))
        .build()) {
      jobs.start();
      jobs.publish("fragile", new byte[0]);

      Await.until(() -> jobs.failedJobs().count() == 1, "job failed");
      healthy.set(true);
      assertEquals(1, jobs.failedJobs().republish(10));

      Await.until(() -> successes.get() == 1, "republished job succeeded");
      assertEquals(0, jobs.failedJobs().count());
    }
  }

  @Test
  void producerOnlyInstanceExecutesNothing() throws Exception {
    try (JobQueue jobs = JobQueue.builder().transport(transport).workersEnabled(false).build()) {
      jobs.start();
      jobs.publish("anything", new byte[0]);

      Thread.sleep(100);
      assertFalse(jobs.workersEnabled());
      assertEquals(1, transport.depth("jobs.regular"));
    }
  }

  @Test
  void customPrefixAndThreshold() {
    try (JobQueue jobs = JobQueue.builder()
        .transport(transport)
        .workersEnabled(false)
        .queuePrefix("billing.")
        .longRunningThreshold(Duration.ofSeconds(2))
        .build()) {
      jobs.publish("report", new byte[0], PublishOptions.timeout(Duration.ofSeconds(3)));

      assertEquals(1, transport.depth("billing.long-running"));
      assertEquals("billing.failed", jobs.publisher().queueNames().name(QueueClass.FAILED));
    }
  }

  @Test
  void builderIsSingleUse() {
    JobQueue.Builder builder = JobQueue.builder().transport(transport).workersEnabled(false);
    builder.build().close();

    assertThrows(IllegalStateException.class, builder::build);
    assertThrows(NullPointerException.class, () -> JobQueue.builder().transport(transport).build());
  }

  @Test
  void closeClosesCloseableMetrics() {
    AtomicBoolean closed = new AtomicBoolean();
    CloseableMetrics metrics = new CloseableMetrics(closed);

    JobQueue jobs = JobQueue.builder().transport(transport).workersEnabled(false).metrics(metrics).build();
    jobs.close();

    assertTrue(closed.get());
  }

  private static final class CloseableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    CloseableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void incrementPublished(QueueClass queueClass) {
    }

    @Override
    public void incrementExecutionSuccess() {
    }

    @Override
    public void incrementExecutionFailure(FailureKind kind) {
    }

    @Override
    public void incrementRetryScheduled() {
    }

    @Override
    public void incrementMovedToFailed(FailureKind kind) {
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
