package io.jobqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.jobqueue.JobQueue;
import io.jobqueue.registry.DefaultJobRegistry;
import io.jobqueue.retry.RetryDecision;
import io.jobqueue.routing.QueueClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two job queue instances sharing one pooled database, as two processes would.
 */
class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcTransport transport;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(1);
    config.setPoolName("jobqueue-test-pool");
    hikariDs = new HikariDataSource(config);
    Schemas.apply(hikariDs, "/schema/h2.sql");

    transport = JdbcTransport.builder()
        .dataSource(hikariDs)
        .pollInterval(Duration.ofMillis(20))
        .build();
  }

  @AfterEach
  void teardown() {
    transport.close();
    hikariDs.close();
  }

  private JobQueue.Builder instance(DefaultJobRegistry registry) {
    return JobQueue.builder()
        .transport(transport)
        .jobFactory(registry)
        .concurrency(QueueClass.REGULAR, 2)
        .pollTimeout(Duration.ofMillis(100))
        .drainTimeoutMs(2000);
  }

  @Test
  void jobsAreSharedAcrossInstances() throws Exception {
    Set<String> seen = ConcurrentHashMap.newKeySet();
    DefaultJobRegistry registry = new DefaultJobRegistry()
        .register("record", (args, scope) -> seen.add(new String(args, StandardCharsets.UTF_8)));

    try (JobQueue first = instance(registry).build(); JobQueue second = instance(registry).build()) {
      first.runBatch(() -> {
        for (int i = 0; i < 30; i++) {
          first.publish("record", ("job-" + i).getBytes(StandardCharsets.UTF_8));
        }
      });
      first.start();
      second.start();

      long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
      while (seen.size() < 30 && System.nanoTime() < deadline) {
        Thread.sleep(20);
      }
    }
    assertEquals(30, seen.size());
    assertEquals(0, transport.depth("jobs.regular"));
  }

  @Test
  void failingJobIsRetriedThroughDelayedQueue() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    DefaultJobRegistry registry = new DefaultJobRegistry().register("flaky", (args, scope) -> {
      if (attempts.incrementAndGet() < 3) {
        throw new IllegalStateException("not yet");
      }
    });

    try (JobQueue jobs = instance(registry)
        .retryPolicy((envelope, error) -> RetryDecision.retryAfter(Duration.ofMillis(200)))
        .build()) {
      jobs.start();
      jobs.publish("flaky", new byte[0]);

      long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
      while (attempts.get() < 3 && System.nanoTime() < deadline) {
        Thread.sleep(20);
      }
    }
    assertEquals(3, attempts.get());
    assertEquals(0, transport.depth("jobs.failed"));
  }
}
