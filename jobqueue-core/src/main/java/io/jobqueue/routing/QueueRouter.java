package io.jobqueue.routing;

import io.jobqueue.JobEnvelope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides which queue class an envelope belongs to. Routing is a pure function
 * of the envelope and the current time; the first matching rule wins:
 *
 * <ol>
 *   <li>failed marker present: {@link QueueClass#FAILED}</li>
 *   <li>periodic id present: {@link QueueClass#PERIODIC}</li>
 *   <li>{@code notBefore} after now: {@link QueueClass#DELAYED}</li>
 *   <li>{@code attempt > 0}: {@link QueueClass#RETRY}</li>
 *   <li>timeout above the long-running threshold (10 s): {@link QueueClass#LONG_RUNNING}</li>
 *   <li>otherwise {@link QueueClass#REGULAR}</li>
 * </ol>
 */
public final class QueueRouter {
  public static final Duration DEFAULT_LONG_RUNNING_THRESHOLD = Duration.ofSeconds(10);

  private final Clock clock;
  private final Duration longRunningThreshold;

  public QueueRouter() {
    this(Clock.systemUTC(), DEFAULT_LONG_RUNNING_THRESHOLD);
  }

  public QueueRouter(Clock clock) {
    this(clock, DEFAULT_LONG_RUNNING_THRESHOLD);
  }

  public QueueRouter(Clock clock, Duration longRunningThreshold) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.longRunningThreshold = Objects.requireNonNull(longRunningThreshold, "longRunningThreshold");
    if (longRunningThreshold.isNegative() || longRunningThreshold.isZero()) {
      throw new IllegalArgumentException("longRunningThreshold must be positive");
    }
  }

  public QueueClass route(JobEnvelope envelope) {
    return route(envelope, clock.instant());
  }

  public QueueClass route(JobEnvelope envelope, Instant now) {
    Objects.requireNonNull(envelope, "envelope");
    if (envelope.isFailed()) {
      return QueueClass.FAILED;
    }
    if (envelope.isPeriodic()) {
      return QueueClass.PERIODIC;
    }
    if (envelope.notBefore() != null && envelope.notBefore().isAfter(now)) {
      return QueueClass.DELAYED;
    }
    return releaseTarget(envelope);
  }

  /**
   * Returns the class a delayed envelope moves into once its {@code notBefore}
   * has passed.
   *
   * @param envelope the delayed envelope
   * @return {@link QueueClass#RETRY}, {@link QueueClass#LONG_RUNNING} or {@link QueueClass#REGULAR}
   */
  public QueueClass releaseTarget(JobEnvelope envelope) {
    if (envelope.attempt() > 0) {
      return QueueClass.RETRY;
    }
    if (envelope.timeout().compareTo(longRunningThreshold) > 0) {
      return QueueClass.LONG_RUNNING;
    }
    return QueueClass.REGULAR;
  }

  public Clock clock() {
    return clock;
  }
}
