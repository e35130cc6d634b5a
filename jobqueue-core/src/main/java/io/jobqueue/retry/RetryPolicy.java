package io.jobqueue.retry;

import io.jobqueue.JobEnvelope;

/**
 * Decides whether and when a failed job runs again.
 *
 * <p>Policies are stateless: the retry history is the envelope's
 * {@link JobEnvelope#attempt()}.
 *
 * @see PolynomialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Decides the next step for a job whose attempt just failed.
   *
   * @param envelope the envelope of the failed attempt
   * @param failure what went wrong
   * @return retry with a delay, or exhausted
   */
  RetryDecision nextAttempt(JobEnvelope envelope, Throwable failure);
}
