package io.jobqueue;

/**
 * Why a job execution failed. Terminal failures are recorded on messages in the
 * failed queue under the {@link io.jobqueue.spi.MessageHeaders#FAILURE_KIND}
 * header.
 */
public enum FailureKind {
  /** The payload could not be decoded into an envelope. */
  SERIALIZATION,
  /** The job threw an exception. */
  EXECUTION,
  /** The job exceeded its timeout and was interrupted. */
  TIMEOUT,
  /** The retry policy gave up on the job. */
  RETRIES_EXHAUSTED,
  /** No job implementation is registered for the envelope's type. */
  UNKNOWN_JOB_TYPE
}
