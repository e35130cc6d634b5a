package io.jobqueue;

import io.jobqueue.schedule.Schedule;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobEnvelopeTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void defaults() {
    JobEnvelope envelope = JobEnvelope.of("send-invoice", bytes("42"), NOW);

    assertNotNull(envelope.jobId());
    assertEquals(26, envelope.jobId().length());
    assertEquals("send-invoice", envelope.jobType());
    assertEquals(Duration.ofSeconds(5), envelope.timeout());
    assertEquals(0, envelope.attempt());
    assertNull(envelope.notBefore());
    assertFalse(envelope.isPeriodic());
    assertFalse(envelope.isFailed());
  }

  @Test
  void argumentsAreCopiedInAndOut() {
    byte[] args = bytes("abc");
    JobEnvelope envelope = JobEnvelope.of("t", args, NOW);
    args[0] = 'x';

    byte[] out = envelope.arguments();
    out[1] = 'y';

    assertArrayEquals(bytes("abc"), envelope.arguments());
  }

  @Test
  void rejectsOversizedArguments() {
    byte[] tooBig = new byte[JobEnvelope.MAX_ARGUMENT_BYTES + 1];

    assertThrows(IllegalArgumentException.class, () -> JobEnvelope.of("t", tooBig, NOW));
  }

  @Test
  void rejectsInvalidFields() {
    assertThrows(NullPointerException.class, () -> JobEnvelope.builder((String) null).build());
    assertThrows(IllegalArgumentException.class, () -> JobEnvelope.builder("").build());
    assertThrows(NullPointerException.class, () -> JobEnvelope.builder("t").build());
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").timeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").attempt(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").periodic("p", null).build());
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").enqueuedAt(NOW).notBefore(NOW).delay(Duration.ofSeconds(1)).build());
  }

  @Test
  void delayIsRelativeToEnqueuedAt() {
    JobEnvelope envelope = JobEnvelope.builder("t")
        .enqueuedAt(NOW)
        .delay(Duration.ofMinutes(5))
        .build();

    assertEquals(NOW.plusSeconds(300), envelope.notBefore());
  }

  @Test
  void nextAttemptKeepsIdentity() {
    JobEnvelope first = JobEnvelope.builder("t").arguments(bytes("a")).timeout(Duration.ofSeconds(30))
        .enqueuedAt(NOW).build();

    JobEnvelope second = first.nextAttempt(NOW.plusSeconds(25), "boom");

    assertEquals(first.jobId(), second.jobId());
    assertEquals(first.jobType(), second.jobType());
    assertArrayEquals(first.arguments(), second.arguments());
    assertEquals(first.timeout(), second.timeout());
    assertEquals(1, second.attempt());
    assertEquals(NOW.plusSeconds(25), second.notBefore());
    assertEquals("boom", second.lastError());
    assertEquals(0, first.attempt());
  }

  @Test
  void asFailedAndRepublish() {
    JobEnvelope retried = JobEnvelope.builder("t").enqueuedAt(NOW).build()
        .nextAttempt(NOW.plusSeconds(25), "boom");

    JobEnvelope failed = retried.asFailed(NOW.plusSeconds(60), "gave up");
    assertTrue(failed.isFailed());
    assertEquals("gave up", failed.lastError());

    JobEnvelope republished = failed.forRepublish(NOW.plusSeconds(120));
    assertEquals(failed.jobId(), republished.jobId());
    assertEquals(0, republished.attempt());
    assertNull(republished.notBefore());
    assertNull(republished.lastError());
    assertFalse(republished.isFailed());
    assertEquals(NOW.plusSeconds(120), republished.enqueuedAt());
  }

  @Test
  void occurrenceJobDropsPeriodicIdentity() {
    JobEnvelope occurrence = JobEnvelope.builder("report")
        .arguments(bytes("x"))
        .timeout(Duration.ofSeconds(20))
        .periodic("nightly", Schedule.everySeconds(60))
        .enqueuedAt(NOW)
        .build();

    JobEnvelope job = occurrence.toOccurrenceJob(NOW.plusSeconds(1));

    assertFalse(job.isPeriodic());
    assertNull(job.schedule());
    assertNotEquals(occurrence.jobId(), job.jobId());
    assertEquals("report", job.jobType());
    assertEquals(Duration.ofSeconds(20), job.timeout());
    assertArrayEquals(bytes("x"), job.arguments());
  }

  @Test
  void valueEquality() {
    JobEnvelope a = JobEnvelope.builder("t").jobId("01HX").arguments(bytes("a")).enqueuedAt(NOW).build();
    JobEnvelope b = JobEnvelope.builder("t").jobId("01HX").arguments(bytes("a")).enqueuedAt(NOW).build();
    JobEnvelope c = JobEnvelope.builder("t").jobId("01HX").arguments(bytes("b")).enqueuedAt(NOW).build();

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  void typedBuilderUsesName() {
    JobEnvelope envelope = JobEnvelope.builder(StringJobType.of("charge-card")).enqueuedAt(NOW).build();

    assertEquals("charge-card", envelope.jobType());
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
