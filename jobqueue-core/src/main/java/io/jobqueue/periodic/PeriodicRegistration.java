package io.jobqueue.periodic;

import io.jobqueue.JobEnvelope;
import io.jobqueue.schedule.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A periodic job registered with a {@link PeriodicScheduler}. Only the owning
 * scheduler advances {@link #nextDueAt()}.
 */
public final class PeriodicRegistration {
  private final String periodicId;
  private final String jobType;
  private final byte[] arguments;
  private final Schedule schedule;
  private final Duration timeout;
  private volatile Instant nextDueAt;

  PeriodicRegistration(String periodicId, String jobType, byte[] arguments, Schedule schedule,
      Duration timeout, Instant firstDueAt) {
    this.periodicId = Objects.requireNonNull(periodicId, "periodicId");
    this.jobType = Objects.requireNonNull(jobType, "jobType");
    this.arguments = arguments == null ? new byte[0] : Arrays.copyOf(arguments, arguments.length);
    this.schedule = Objects.requireNonNull(schedule, "schedule");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.nextDueAt = Objects.requireNonNull(firstDueAt, "firstDueAt");
  }

  public String periodicId() {
    return periodicId;
  }

  public String jobType() {
    return jobType;
  }

  public byte[] arguments() {
    return Arrays.copyOf(arguments, arguments.length);
  }

  public Schedule schedule() {
    return schedule;
  }

  public Duration timeout() {
    return timeout;
  }

  public Instant nextDueAt() {
    return nextDueAt;
  }

  void advance(Instant next) {
    this.nextDueAt = next;
  }

  /**
   * Builds the occurrence envelope for one due instant.
   */
  JobEnvelope occurrence(Instant enqueuedAt) {
    return JobEnvelope.builder(jobType)
        .arguments(arguments)
        .timeout(timeout)
        .periodic(periodicId, schedule)
        .enqueuedAt(enqueuedAt)
        .build();
  }

  /**
   * Returns the deduplication id shared by every instance publishing the
   * occurrence due at {@code dueAt}.
   */
  static String deduplicationId(String periodicId, Instant dueAt) {
    return periodicId + "@" + dueAt.toEpochMilli();
  }

  @Override
  public String toString() {
    return "PeriodicRegistration{periodicId=" + periodicId + ", jobType=" + jobType
        + ", schedule=" + schedule.asText() + ", nextDueAt=" + nextDueAt + '}';
  }
}
