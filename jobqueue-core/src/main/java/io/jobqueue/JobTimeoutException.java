package io.jobqueue;

import java.time.Duration;

/**
 * Raised by the worker when a job did not finish within its timeout. Treated
 * like any other execution failure by the retry policy.
 */
public class JobTimeoutException extends RuntimeException {

  private final String jobId;
  private final Duration timeout;

  public JobTimeoutException(String jobId, Duration timeout) {
    super("Job " + jobId + " exceeded its timeout of " + timeout.toMillis() + " ms");
    this.jobId = jobId;
    this.timeout = timeout;
  }

  public String jobId() {
    return jobId;
  }

  public Duration timeout() {
    return timeout;
  }
}
