package io.jobqueue.worker;

import io.jobqueue.FailureKind;
import io.jobqueue.FailingTransport;
import io.jobqueue.JobEnvelope;
import io.jobqueue.JobPublisher;
import io.jobqueue.MutableClock;
import io.jobqueue.TransportException;
import io.jobqueue.routing.QueueRouter;
import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.TransportMessage;
import io.jobqueue.transport.InMemoryTransport;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FailedJobManagerTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemoryTransport transport = InMemoryTransport.builder().clock(clock).build();
  private final JobPublisher publisher = JobPublisher.builder()
      .transport(transport)
      .router(new QueueRouter(clock))
      .build();
  private final FailedJobManager manager = new FailedJobManager(transport, publisher);

  private JobEnvelope fail(String jobType) {
    JobEnvelope failed = JobEnvelope.builder(jobType)
        .attempt(25)
        .enqueuedAt(NOW.minusSeconds(3600))
        .build()
        .asFailed(NOW, "gave up");
    publisher.publishFailed(failed, FailureKind.RETRIES_EXHAUSTED);
    return failed;
  }

  @Test
  void listsWithoutRemoving() {
    JobEnvelope a = fail("a");
    JobEnvelope b = fail("b");

    List<JobEnvelope> listed = manager.list(10);

    assertEquals(List.of(a, b), listed);
    assertEquals(2, manager.count());
    assertEquals(List.of(a), manager.list(1));
    assertEquals(List.of(a, b), manager.list(10));
  }

  @Test
  void republishStartsOverWithSameId() throws Exception {
    JobEnvelope failed = fail("report");
    clock.advance(Duration.ofMinutes(5));

    assertEquals(1, manager.republish(10));

    assertEquals(0, manager.count());
    Delivery delivery = transport.consume("jobs.regular", Duration.ZERO);
    JobEnvelope republished = publisher.serializer().deserialize(delivery.message().body());
    assertEquals(failed.jobId(), republished.jobId());
    assertEquals(0, republished.attempt());
    assertFalse(republished.isFailed());
    assertNull(republished.lastError());
    assertEquals(NOW.plus(Duration.ofMinutes(5)), republished.enqueuedAt());
  }

  @Test
  void filterAndLimitLeaveOthersInOrder() {
    fail("a");
    fail("b");
    fail("a");
    JobEnvelope d = fail("a");

    assertEquals(2, manager.republish(2, envelope -> envelope.jobType().equals("a")));

    assertEquals(2, transport.depth("jobs.regular"));
    List<JobEnvelope> remaining = manager.list(10);
    assertEquals(2, remaining.size());
    assertEquals("b", remaining.get(0).jobType());
    assertEquals(d, remaining.get(1));
  }

  @Test
  void undecodableMessagesStayPut() {
    transport.publish("jobs.failed", new TransportMessage("garbage".getBytes(StandardCharsets.UTF_8), Map.of()));
    fail("a");

    assertEquals(1, manager.list(10).size());
    assertEquals(1, manager.republish(10));
    assertEquals(1, manager.count());
  }

  @Test
  void publishFailureRestoresTheMessage() {
    FailingTransport failing = new FailingTransport(transport);
    JobPublisher failingPublisher = JobPublisher.builder().transport(failing).router(new QueueRouter(clock)).build();
    FailedJobManager failingManager = new FailedJobManager(failing, failingPublisher);
    fail("a");
    failing.failFromPublish(1);

    assertThrows(TransportException.class, () -> failingManager.republish(10));

    assertEquals(1, manager.count());
    assertEquals(0, transport.depth("jobs.regular"));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> manager.list(0));
    assertThrows(IllegalArgumentException.class, () -> manager.republish(-1));
  }
}
