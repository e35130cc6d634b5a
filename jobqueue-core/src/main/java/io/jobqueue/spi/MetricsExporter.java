package io.jobqueue.spi;

import io.jobqueue.FailureKind;
import io.jobqueue.routing.QueueClass;

/**
 * Observability hook for job dispatch counters and timings.
 *
 * <p>The {@link #NOOP} instance discards everything. See the Micrometer module
 * for a ready-made bridge.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of envelopes published, by routed class.
   *
   * @param queueClass the class the envelope was routed to
   */
  void incrementPublished(QueueClass queueClass);

  void incrementExecutionSuccess();

  /**
   * Increments the count of failed executions.
   *
   * @param kind what kind of failure occurred
   */
  void incrementExecutionFailure(FailureKind kind);

  void incrementRetryScheduled();

  /**
   * Increments the count of jobs moved to the failed queue.
   *
   * @param kind the terminal failure kind
   */
  void incrementMovedToFailed(FailureKind kind);

  /**
   * Increments the count of periodic occurrences this instance published and
   * the transport accepted.
   */
  default void incrementPeriodicPublished() {
  }

  /**
   * Increments the count of periodic occurrences discarded as duplicates of one
   * already published by another instance.
   */
  default void incrementPeriodicDuplicate() {
  }

  /**
   * Records how long a job body ran.
   *
   * @param durationMs execution time in milliseconds
   */
  default void recordExecutionDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements MetricsExporter {
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
  }
}
