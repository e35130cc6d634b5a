package io.jobqueue.periodic;

import io.jobqueue.DuplicatePeriodicIdException;
import io.jobqueue.JobEnvelope;
import io.jobqueue.JobPublisher;
import io.jobqueue.routing.QueueNames;
import io.jobqueue.schedule.Schedule;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.Transport;
import io.jobqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes occurrences of periodic jobs when they fall due.
 *
 * <p>Every instance of a cluster registers the same periodic jobs and runs its
 * own scheduler. Each occurrence is published to the job's own queue
 * ({@code jobs.periodic.<periodicId>}) with the deduplication id
 * {@code <periodicId>@<dueEpochMillis>}. Since all instances compute the same
 * due instants, the transport keeps one message per occurrence and drops the
 * rest; the single remaining message is consumed by one worker, which hands it
 * off as a regular job.
 *
 * <p>Registrations are only accepted before {@link #start()}. A failed publish
 * leaves the registration's due instant unchanged, so the occurrence is tried
 * again on the next tick.
 */
public final class PeriodicScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PeriodicScheduler.class.getName());

  private final JobPublisher publisher;
  private final Transport transport;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration tickInterval;
  private final Map<String, PeriodicRegistration> registrations = new LinkedHashMap<>();
  private final Object tickLock = new Object();

  private volatile List<PeriodicRegistration> snapshot = List.of();
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> tickTask;
  private volatile boolean started;
  private volatile boolean closed;

  private PeriodicScheduler(Builder builder) {
    this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : publisher.router().clock();
    if (builder.tickInterval.isZero() || builder.tickInterval.isNegative()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
    this.tickInterval = builder.tickInterval;
  }

  public static Builder builder() {
    return new Builder();
  }

  public PeriodicRegistration register(String periodicId, String jobType, byte[] arguments, Schedule schedule) {
    return register(periodicId, jobType, arguments, schedule, JobEnvelope.DEFAULT_TIMEOUT);
  }

  /**
   * Registers a periodic job and declares its occurrence queue.
   *
   * @param periodicId cluster-wide identity of the periodic job
   * @param jobType the job type each occurrence runs as
   * @param arguments arguments passed to every occurrence
   * @param schedule when occurrences fall due
   * @param timeout execution budget of each occurrence
   * @return the registration
   * @throws DuplicatePeriodicIdException if {@code periodicId} is already registered here
   * @throws IllegalStateException if the scheduler has been started or closed
   */
  public synchronized PeriodicRegistration register(String periodicId, String jobType, byte[] arguments,
      Schedule schedule, Duration timeout) {
    if (started || closed) {
      throw new IllegalStateException("Periodic jobs must be registered before the scheduler starts");
    }
    QueueNames.validatePeriodicId(periodicId);
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(schedule, "schedule");
    Objects.requireNonNull(timeout, "timeout");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (arguments != null && arguments.length > JobEnvelope.MAX_ARGUMENT_BYTES) {
      throw new IllegalArgumentException("Arguments exceed maximum size of " + JobEnvelope.MAX_ARGUMENT_BYTES + " bytes");
    }
    if (registrations.containsKey(periodicId)) {
      throw new DuplicatePeriodicIdException(periodicId);
    }
    PeriodicRegistration registration = new PeriodicRegistration(periodicId, jobType, arguments,
        schedule, timeout, schedule.firstDue(clock.instant()));
    transport.declareQueue(publisher.queueNames().periodic(periodicId));
    registrations.put(periodicId, registration);
    snapshot = List.copyOf(registrations.values());
    logger.log(Level.FINE, "Registered {0}", registration);
    return registration;
  }

  public List<PeriodicRegistration> registrations() {
    return snapshot;
  }

  /**
   * Returns the registered periodic ids in registration order.
   *
   * @return the periodic ids
   */
  public List<String> periodicIds() {
    List<String> ids = new ArrayList<>(snapshot.size());
    for (PeriodicRegistration registration : snapshot) {
      ids.add(registration.periodicId());
    }
    return Collections.unmodifiableList(ids);
  }

  /**
   * Starts ticking at the configured interval. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PeriodicScheduler has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-periodic-"));
    long intervalMs = tickInterval.toMillis();
    tickTask = scheduler.scheduleWithFixedDelay(this::tickSafely, 0, Math.max(1, intervalMs), TimeUnit.MILLISECONDS);
  }

  /**
   * Publishes one occurrence for every registration that is due, then moves
   * its due instant forward. May be invoked directly for testing.
   */
  public void tick() {
    synchronized (tickLock) {
      Instant now = clock.instant();
      for (PeriodicRegistration registration : snapshot) {
        Instant due = registration.nextDueAt();
        if (due.isAfter(now)) {
          continue;
        }
        String deduplicationId = PeriodicRegistration.deduplicationId(registration.periodicId(), due);
        try {
          boolean accepted = publisher.publishDeduplicated(registration.occurrence(now), deduplicationId);
          if (accepted) {
            metrics.incrementPeriodicPublished();
            logger.log(Level.FINE, "Published occurrence {0}", deduplicationId);
          } else {
            metrics.incrementPeriodicDuplicate();
            logger.log(Level.FINE, "Occurrence {0} already published by another instance", deduplicationId);
          }
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Failed to publish occurrence " + deduplicationId
              + "; retrying on the next tick", e);
          continue;
        }
        registration.advance(registration.schedule().nextDue(due, now));
      }
    }
  }

  private void tickSafely() {
    if (closed) {
      return;
    }
    try {
      tick();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Periodic tick failed", t);
    }
  }

  /** Cancels the tick schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link PeriodicScheduler}. */
  public static final class Builder {
    private JobPublisher publisher;
    private Transport transport;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration tickInterval = Duration.ofSeconds(1);

    private Builder() {}

    /**
     * Sets the publisher occurrences are published through.
     *
     * <p><b>Required.</b>
     *
     * @param publisher the publisher
     * @return this builder
     */
    public Builder publisher(JobPublisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /**
     * Sets the transport on which occurrence queues are declared.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the delay between ticks.
     *
     * <p>Optional. Defaults to 1 second.
     *
     * @param tickInterval the tick interval
     * @return this builder
     */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
      return this;
    }

    public PeriodicScheduler build() {
      return new PeriodicScheduler(this);
    }
  }
}
