package io.jobqueue;

import com.github.f4b6a3.ulid.UlidCreator;
import io.jobqueue.schedule.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable description of one job: what to run, with which arguments, within
 * which time budget, and where it stands in its retry history.
 *
 * <p>Each envelope gets a ULID {@code jobId} unless one is supplied. The id is
 * preserved by {@link #nextAttempt(Instant, String)}, so all attempts of one job
 * share it. Arguments are opaque bytes limited to {@value #MAX_ARGUMENT_BYTES}
 * bytes and copied on the way in and out. {@code enqueuedAt} is always given
 * by the caller, read from the clock the rest of the library runs on.
 *
 * <p>Envelopes are never mutated; retries, failures and republishing derive new
 * envelopes.
 *
 * @see JobPublisher
 * @see io.jobqueue.routing.QueueRouter
 */
public final class JobEnvelope {
  public static final int MAX_ARGUMENT_BYTES = 1024 * 1024;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private static final byte[] NO_ARGUMENTS = new byte[0];

  private final String jobId;
  private final String jobType;
  private final byte[] arguments;
  private final Duration timeout;
  private final int attempt;
  private final Instant notBefore;
  private final String periodicId;
  private final Schedule schedule;
  private final Instant enqueuedAt;
  private final String lastError;
  private final Instant failedAt;

  private JobEnvelope(Builder builder) {
    this.jobId = builder.jobId == null ? newJobId() : builder.jobId;
    if (this.jobId.isEmpty()) {
      throw new IllegalArgumentException("jobId cannot be empty");
    }
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    if (this.jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }

    byte[] args = builder.arguments == null ? NO_ARGUMENTS : builder.arguments;
    if (args.length > MAX_ARGUMENT_BYTES) {
      throw new IllegalArgumentException("Arguments exceed maximum size of " + MAX_ARGUMENT_BYTES + " bytes");
    }
    this.arguments = Arrays.copyOf(args, args.length);

    this.timeout = builder.timeout == null ? DEFAULT_TIMEOUT : builder.timeout;
    if (this.timeout.isZero() || this.timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (builder.attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0");
    }
    this.attempt = builder.attempt;

    if ((builder.periodicId == null) != (builder.schedule == null)) {
      throw new IllegalArgumentException("periodicId and schedule must be set together");
    }
    if (builder.periodicId != null && builder.periodicId.isEmpty()) {
      throw new IllegalArgumentException("periodicId cannot be empty");
    }
    this.periodicId = builder.periodicId;
    this.schedule = builder.schedule;

    this.enqueuedAt = Objects.requireNonNull(builder.enqueuedAt, "enqueuedAt");
    if (builder.notBefore != null && builder.delay != null) {
      throw new IllegalArgumentException("Set either notBefore or delay, not both");
    }
    if (builder.delay != null) {
      if (builder.delay.isNegative()) {
        throw new IllegalArgumentException("delay must not be negative");
      }
      this.notBefore = builder.delay.isZero() ? null : this.enqueuedAt.plus(builder.delay);
    } else {
      this.notBefore = builder.notBefore;
    }

    this.lastError = builder.lastError;
    this.failedAt = builder.failedAt;
  }

  /**
   * Creates a builder for a typed job.
   *
   * @param jobType the job type
   * @return a new builder
   */
  public static Builder builder(JobType jobType) {
    Objects.requireNonNull(jobType, "jobType");
    return new Builder(jobType.name());
  }

  /**
   * Creates a builder for a job type given by name.
   *
   * @param jobType the job type name
   * @return a new builder
   */
  public static Builder builder(String jobType) {
    return new Builder(jobType);
  }

  public static JobEnvelope of(String jobType, byte[] arguments, Instant enqueuedAt) {
    return builder(jobType).arguments(arguments).enqueuedAt(enqueuedAt).build();
  }

  private static String newJobId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  public String jobId() {
    return jobId;
  }

  public String jobType() {
    return jobType;
  }

  public byte[] arguments() {
    return Arrays.copyOf(arguments, arguments.length);
  }

  public int argumentLength() {
    return arguments.length;
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the zero-based attempt number; {@code 0} for the first execution.
   *
   * @return the attempt number
   */
  public int attempt() {
    return attempt;
  }

  /**
   * Returns the earliest instant the job may run, or {@code null} if it may run
   * immediately.
   *
   * @return the not-before instant, or {@code null}
   */
  public Instant notBefore() {
    return notBefore;
  }

  public String periodicId() {
    return periodicId;
  }

  public Schedule schedule() {
    return schedule;
  }

  public boolean isPeriodic() {
    return periodicId != null;
  }

  public Instant enqueuedAt() {
    return enqueuedAt;
  }

  public String lastError() {
    return lastError;
  }

  /**
   * Returns when the job was declared permanently failed, or {@code null} for a
   * live job. Only envelopes in the failed queue carry this marker.
   *
   * @return the failure instant, or {@code null}
   */
  public Instant failedAt() {
    return failedAt;
  }

  public boolean isFailed() {
    return failedAt != null;
  }

  /**
   * Derives the envelope for the next attempt of this job: same id, type,
   * arguments and timeout, attempt incremented.
   *
   * @param notBefore earliest instant the retry may run
   * @param error message of the failure that triggered the retry
   * @return the successor envelope
   */
  public JobEnvelope nextAttempt(Instant notBefore, String error) {
    return toBuilder()
        .attempt(attempt + 1)
        .notBefore(notBefore)
        .lastError(error)
        .build();
  }

  /**
   * Derives the terminal envelope stored in the failed queue.
   *
   * @param at when the job was given up on
   * @param error the final failure message
   * @return the failed envelope
   */
  public JobEnvelope asFailed(Instant at, String error) {
    Objects.requireNonNull(at, "at");
    return toBuilder().failedAt(at).lastError(error).build();
  }

  /**
   * Derives a fresh first attempt of a failed job, keeping its id.
   *
   * @param now the republish instant
   * @return the envelope to publish again
   */
  public JobEnvelope forRepublish(Instant now) {
    return toBuilder()
        .attempt(0)
        .notBefore(null)
        .failedAt(null)
        .lastError(null)
        .enqueuedAt(now)
        .build();
  }

  /**
   * Converts a periodic occurrence into an ordinary job with a new id and no
   * periodic identity, so that it follows the regular retry path.
   *
   * @param now the hand-off instant
   * @return the regular job envelope
   */
  public JobEnvelope toOccurrenceJob(Instant now) {
    return builder(jobType)
        .arguments(arguments)
        .timeout(timeout)
        .enqueuedAt(now)
        .build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder(jobType);
    builder.jobId = jobId;
    builder.arguments = arguments;
    builder.timeout = timeout;
    builder.attempt = attempt;
    builder.notBefore = notBefore;
    builder.periodicId = periodicId;
    builder.schedule = schedule;
    builder.enqueuedAt = enqueuedAt;
    builder.lastError = lastError;
    builder.failedAt = failedAt;
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof JobEnvelope)) return false;
    JobEnvelope that = (JobEnvelope) o;
    return attempt == that.attempt
        && jobId.equals(that.jobId)
        && jobType.equals(that.jobType)
        && Arrays.equals(arguments, that.arguments)
        && timeout.equals(that.timeout)
        && Objects.equals(notBefore, that.notBefore)
        && Objects.equals(periodicId, that.periodicId)
        && Objects.equals(schedule, that.schedule)
        && enqueuedAt.equals(that.enqueuedAt)
        && Objects.equals(lastError, that.lastError)
        && Objects.equals(failedAt, that.failedAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(jobId, jobType, timeout, attempt, notBefore, periodicId,
        schedule, enqueuedAt, lastError, failedAt);
    return 31 * result + Arrays.hashCode(arguments);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("JobEnvelope{jobId=").append(jobId)
        .append(", jobType=").append(jobType)
        .append(", attempt=").append(attempt)
        .append(", timeout=").append(timeout)
        .append(", arguments=").append(arguments.length).append(" bytes");
    if (notBefore != null) {
      sb.append(", notBefore=").append(notBefore);
    }
    if (periodicId != null) {
      sb.append(", periodicId=").append(periodicId);
    }
    if (failedAt != null) {
      sb.append(", failedAt=").append(failedAt);
    }
    return sb.append('}').toString();
  }

  /** Builder for {@link JobEnvelope}. */
  public static final class Builder {
    private String jobId;
    private final String jobType;
    private byte[] arguments;
    private Duration timeout;
    private int attempt;
    private Instant notBefore;
    private Duration delay;
    private String periodicId;
    private Schedule schedule;
    private Instant enqueuedAt;
    private String lastError;
    private Instant failedAt;

    private Builder(String jobType) {
      this.jobType = jobType;
    }

    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    public Builder arguments(byte[] arguments) {
      this.arguments = arguments;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder attempt(int attempt) {
      this.attempt = attempt;
      return this;
    }

    /**
     * Sets the earliest execution instant. Mutually exclusive with {@link #delay(Duration)}.
     *
     * @param notBefore the not-before instant, or {@code null}
     * @return this builder
     */
    public Builder notBefore(Instant notBefore) {
      this.notBefore = notBefore;
      return this;
    }

    /**
     * Sets the execution delay relative to {@code enqueuedAt}. Mutually exclusive with
     * {@link #notBefore(Instant)}.
     *
     * @param delay the delay, or {@code null}
     * @return this builder
     */
    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    public Builder periodic(String periodicId, Schedule schedule) {
      this.periodicId = periodicId;
      this.schedule = schedule;
      return this;
    }

    /**
     * Sets when the job was enqueued; a {@link #delay(Duration)} counts from it.
     *
     * <p><b>Required.</b>
     *
     * @param enqueuedAt the enqueue instant
     * @return this builder
     */
    public Builder enqueuedAt(Instant enqueuedAt) {
      this.enqueuedAt = enqueuedAt;
      return this;
    }

    public Builder lastError(String lastError) {
      this.lastError = lastError;
      return this;
    }

    public Builder failedAt(Instant failedAt) {
      this.failedAt = failedAt;
      return this;
    }

    /**
     * Builds the envelope.
     *
     * @return a new envelope
     * @throws NullPointerException if {@code jobType} or {@code enqueuedAt} is null
     * @throws IllegalArgumentException if any field is out of range or
     *     {@code periodicId}/{@code schedule} are not set together
     */
    public JobEnvelope build() {
      return new JobEnvelope(this);
    }
  }
}
