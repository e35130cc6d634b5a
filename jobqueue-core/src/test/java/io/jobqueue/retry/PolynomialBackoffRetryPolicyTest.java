package io.jobqueue.retry;

import io.jobqueue.JobEnvelope;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PolynomialBackoffRetryPolicyTest {

  private final PolynomialBackoffRetryPolicy policy = new PolynomialBackoffRetryPolicy();

  @Test
  void firstDelays() {
    assertEquals(Duration.ofSeconds(25), policy.delayFor(0));
    assertEquals(Duration.ofSeconds(36), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(61), policy.delayFor(2));
  }

  @Test
  void delaysAreStrictlyIncreasing() {
    for (int a = 1; a < 25; a++) {
      assertTrue(policy.delayFor(a).compareTo(policy.delayFor(a - 1)) > 0, "attempt " + a);
    }
  }

  @Test
  void totalScheduleSpansAboutTwentyDays() {
    Duration total = Duration.ZERO;
    for (int a = 0; a < 25; a++) {
      total = total.plus(policy.delayFor(a));
    }

    assertEquals(1_766_645, total.getSeconds());
    assertEquals(20, total.toDays());
  }

  @Test
  void retriesUntilMaxThenExhausts() {
    JobEnvelope envelope = JobEnvelope.of("t", new byte[0], Instant.EPOCH);
    for (int a = 0; a < 25; a++) {
      RetryDecision decision = policy.nextAttempt(envelope.toBuilder().attempt(a).build(), new RuntimeException());
      assertInstanceOf(RetryDecision.Retry.class, decision, "attempt " + a);
      assertEquals(policy.delayFor(a), ((RetryDecision.Retry) decision).delay());
    }

    RetryDecision last = policy.nextAttempt(envelope.toBuilder().attempt(25).build(), new RuntimeException());
    assertInstanceOf(RetryDecision.Exhausted.class, last);
  }

  @Test
  void configurableMaxRetries() {
    PolynomialBackoffRetryPolicy none = new PolynomialBackoffRetryPolicy(0);

    assertInstanceOf(RetryDecision.Exhausted.class,
        none.nextAttempt(JobEnvelope.of("t", new byte[0], Instant.EPOCH), new RuntimeException()));
    assertThrows(IllegalArgumentException.class, () -> new PolynomialBackoffRetryPolicy(-1));
  }

  @Test
  void retryDecisionRejectsNegativeDelay() {
    assertThrows(IllegalArgumentException.class, () -> RetryDecision.retryAfter(Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> RetryDecision.exhausted(null));
  }
}
