package io.jobqueue;

import io.jobqueue.periodic.PeriodicRegistration;
import io.jobqueue.periodic.PeriodicScheduler;
import io.jobqueue.retry.RetryPolicy;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.routing.QueueNames;
import io.jobqueue.routing.QueueRouter;
import io.jobqueue.schedule.Schedule;
import io.jobqueue.spi.JobFactory;
import io.jobqueue.spi.JobSerializer;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.Transport;
import io.jobqueue.worker.FailedJobManager;
import io.jobqueue.worker.JobInterceptor;
import io.jobqueue.worker.WorkerPool;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link JobPublisher}, a
 * {@link PeriodicScheduler}, a {@link WorkerPool} and a
 * {@link FailedJobManager} on one {@link Transport}.
 *
 * <p>Building does not start anything: register periodic jobs, then call
 * {@link #start()}. A producer-only instance ({@code workersEnabled(false)})
 * publishes jobs and periodic occurrences but executes nothing.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultJobRegistry registry = new DefaultJobRegistry()
 *     .register("send-invoice", (args, scope) -> invoices.send(args));
 *
 * try (JobQueue jobs = JobQueue.builder()
 *     .transport(transport)
 *     .jobFactory(registry)
 *     .build()) {
 *   jobs.publishPeriodic("nightly-report", "build-report", new byte[0], Schedule.cron("0 0 2 * * *"));
 *   jobs.start();
 *   jobs.publish("send-invoice", invoiceId);
 * }
 * }</pre>
 *
 * <p>The transport is owned by the caller and is not closed by {@link #close()}.
 */
public final class JobQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  private final JobPublisher publisher;
  private final PeriodicScheduler periodicScheduler;
  private final WorkerPool workerPool;
  private final FailedJobManager failedJobs;
  private final MetricsExporter metrics;
  private final AtomicBoolean started = new AtomicBoolean();

  private JobQueue(JobPublisher publisher, PeriodicScheduler periodicScheduler, WorkerPool workerPool,
      FailedJobManager failedJobs, MetricsExporter metrics) {
    this.publisher = publisher;
    this.periodicScheduler = periodicScheduler;
    this.workerPool = workerPool;
    this.failedJobs = failedJobs;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String publish(String jobType, byte[] arguments) {
    return publisher.publish(jobType, arguments);
  }

  public String publish(String jobType, byte[] arguments, PublishOptions options) {
    return publisher.publish(jobType, arguments, options);
  }

  public String publish(JobType jobType, byte[] arguments, PublishOptions options) {
    return publisher.publish(jobType, arguments, options);
  }

  public String publish(JobEnvelope envelope) {
    return publisher.publish(envelope);
  }

  public PeriodicRegistration publishPeriodic(String periodicId, String jobType, byte[] arguments,
      Schedule schedule) {
    return periodicScheduler.register(periodicId, jobType, arguments, schedule);
  }

  /**
   * Registers a periodic job. Must be called before {@link #start()}.
   *
   * @param periodicId cluster-wide identity of the periodic job
   * @param jobType the job type each occurrence runs as
   * @param arguments arguments passed to every occurrence
   * @param schedule when occurrences fall due
   * @param timeout execution budget of each occurrence
   * @return the registration
   * @throws DuplicatePeriodicIdException if the id is already registered
   */
  public PeriodicRegistration publishPeriodic(String periodicId, String jobType, byte[] arguments,
      Schedule schedule, Duration timeout) {
    return periodicScheduler.register(periodicId, jobType, arguments, schedule, timeout);
  }

  public <E extends Exception> void runBatch(JobPublisher.BatchBody<E> body) throws E {
    publisher.runBatch(body);
  }

  public JobPublisher publisher() {
    return publisher;
  }

  public FailedJobManager failedJobs() {
    return failedJobs;
  }

  public List<PeriodicRegistration> periodicRegistrations() {
    return periodicScheduler.registrations();
  }

  public boolean workersEnabled() {
    return workerPool != null;
  }

  /**
   * Starts the periodic scheduler and, unless producer-only, the worker pool.
   * Subsequent calls are no-ops.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    periodicScheduler.start();
    if (workerPool != null) {
      workerPool.start();
    }
    logger.log(Level.INFO, "Job queue started ({0} periodic jobs, workers {1})",
        new Object[]{periodicScheduler.registrations().size(), workerPool != null ? "enabled" : "disabled"});
  }

  /**
   * Shuts down components in order: periodic scheduler, worker pool, metrics
   * exporter (if closeable).
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      periodicScheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (workerPool != null) {
      try {
        workerPool.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link JobQueue}. */
  public static final class Builder {
    private Transport transport;
    private JobFactory jobFactory;
    private JobSerializer serializer;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private String queuePrefix = QueueNames.DEFAULT_PREFIX;
    private Duration longRunningThreshold = QueueRouter.DEFAULT_LONG_RUNNING_THRESHOLD;
    private final List<JobInterceptor> interceptors = new ArrayList<>();
    private final Map<QueueClass, Integer> concurrency = new EnumMap<>(QueueClass.class);
    private int batchSize = WorkerPool.DEFAULT_BATCH_SIZE;
    private int publishBatchLimit = JobPublisher.DEFAULT_BATCH_LIMIT;
    private Duration pollTimeout = WorkerPool.DEFAULT_POLL_TIMEOUT;
    private Duration periodicTickInterval = Duration.ofSeconds(1);
    private long drainTimeoutMs = 5000;
    private boolean workersEnabled = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the message transport.
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

    /**
     * Sets the factory that creates jobs by type.
     *
     * <p><b>Required</b> unless workers are disabled.
     *
     * @param jobFactory the job factory
     * @return this builder
     */
    public Builder jobFactory(JobFactory jobFactory) {
      this.jobFactory = jobFactory;
      return this;
    }

    public Builder serializer(JobSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for routing, delays and periodic due instants.
     *
     * <p>Optional. Defaults to the UTC system clock.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the prefix of physical queue names.
     *
     * <p>Optional. Defaults to {@code "jobs."}.
     *
     * @param queuePrefix the prefix
     * @return this builder
     */
    public Builder queuePrefix(String queuePrefix) {
      this.queuePrefix = queuePrefix;
      return this;
    }

    public Builder longRunningThreshold(Duration longRunningThreshold) {
      this.longRunningThreshold = longRunningThreshold;
      return this;
    }

    public Builder interceptor(JobInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder concurrency(QueueClass queueClass, int loops) {
      this.concurrency.put(Objects.requireNonNull(queueClass, "queueClass"), loops);
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder publishBatchLimit(int publishBatchLimit) {
      this.publishBatchLimit = publishBatchLimit;
      return this;
    }

    public Builder pollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
      return this;
    }

    public Builder periodicTickInterval(Duration periodicTickInterval) {
      this.periodicTickInterval = periodicTickInterval;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Enables or disables job execution on this instance.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param workersEnabled {@code false} for a producer-only instance
     * @return this builder
     */
    public Builder workersEnabled(boolean workersEnabled) {
      this.workersEnabled = workersEnabled;
      return this;
    }

    /**
     * Builds the job queue without starting it.
     *
     * @return a new job queue
     * @throws IllegalStateException if build() was already called
     * @throws NullPointerException if {@code transport} is null, or
     *     {@code jobFactory} is null while workers are enabled
     */
    public JobQueue build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(transport, "transport");
      if (workersEnabled) {
        Objects.requireNonNull(jobFactory, "jobFactory");
      }
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

      JobPublisher publisher = JobPublisher.builder()
          .transport(transport)
          .serializer(serializer)
          .router(new QueueRouter(effectiveClock, longRunningThreshold))
          .queueNames(new QueueNames(queuePrefix))
          .metrics(effectiveMetrics)
          .batchLimit(publishBatchLimit)
          .build();

      PeriodicScheduler periodicScheduler = PeriodicScheduler.builder()
          .publisher(publisher)
          .transport(transport)
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .tickInterval(periodicTickInterval)
          .build();

      WorkerPool workerPool = null;
      if (workersEnabled) {
        WorkerPool.Builder pool = WorkerPool.builder()
            .transport(transport)
            .jobFactory(jobFactory)
            .publisher(publisher)
            .retryPolicy(retryPolicy)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .interceptors(interceptors)
            .periodicIds(periodicScheduler::periodicIds)
            .batchSize(batchSize)
            .pollTimeout(pollTimeout)
            .drainTimeoutMs(drainTimeoutMs);
        concurrency.forEach(pool::concurrency);
        workerPool = pool.build();
      }

      return new JobQueue(publisher, periodicScheduler, workerPool,
          new FailedJobManager(transport, publisher), effectiveMetrics);
    }
  }
}
