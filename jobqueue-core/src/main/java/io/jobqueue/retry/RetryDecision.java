package io.jobqueue.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a {@link RetryPolicy} consultation.
 *
 * <ul>
 *   <li>{@link Retry}: run the job again after {@code delay}.</li>
 *   <li>{@link Exhausted}: give up; the job moves to the failed queue.</li>
 * </ul>
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.Exhausted {

  static Retry retryAfter(Duration delay) {
    return new Retry(delay);
  }

  static Exhausted exhausted(String reason) {
    return new Exhausted(reason);
  }

  /**
   * Retry after a delay.
   *
   * @param delay time to wait before the next attempt (not negative)
   */
  record Retry(Duration delay) implements RetryDecision {
    public Retry {
      Objects.requireNonNull(delay, "delay must not be null");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delay must not be negative");
      }
    }
  }

  /**
   * No further attempts.
   *
   * @param reason why the policy gave up
   */
  record Exhausted(String reason) implements RetryDecision {
    public Exhausted {
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }
}
