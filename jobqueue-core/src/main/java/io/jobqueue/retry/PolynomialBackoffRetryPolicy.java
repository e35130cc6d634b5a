package io.jobqueue.retry;

import io.jobqueue.JobEnvelope;

import java.time.Duration;

/**
 * Deterministic polynomial backoff: after attempt {@code a} fails, the next
 * attempt waits {@code a^4 + 15 + 10 * (a + 1)} seconds, i.e. 25 s, 36 s,
 * 61 s, ... up to about 3.8 days before the 25th retry. With the default of 25
 * retries the whole schedule spans roughly 20.4 days.
 *
 * <p>No jitter is applied, so delays are strictly increasing in the attempt
 * number.
 */
public final class PolynomialBackoffRetryPolicy implements RetryPolicy {
  public static final int DEFAULT_MAX_RETRIES = 25;

  private final int maxRetries;

  public PolynomialBackoffRetryPolicy() {
    this(DEFAULT_MAX_RETRIES);
  }

  public PolynomialBackoffRetryPolicy(int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
  }

  @Override
  public RetryDecision nextAttempt(JobEnvelope envelope, Throwable failure) {
    int attempt = envelope.attempt();
    if (attempt >= maxRetries) {
      return RetryDecision.exhausted("Gave up after " + (attempt + 1) + " attempts");
    }
    return RetryDecision.retryAfter(delayFor(attempt));
  }

  /**
   * Returns the wait before the attempt following {@code attempt}.
   *
   * @param attempt the zero-based attempt that failed
   * @return the delay
   */
  public Duration delayFor(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0");
    }
    long a = attempt;
    return Duration.ofSeconds(a * a * a * a + 15 + 10 * (a + 1));
  }

  public int maxRetries() {
    return maxRetries;
  }
}
