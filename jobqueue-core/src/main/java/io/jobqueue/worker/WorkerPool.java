package io.jobqueue.worker;

import io.jobqueue.FailureKind;
import io.jobqueue.Job;
import io.jobqueue.JobEnvelope;
import io.jobqueue.JobPublisher;
import io.jobqueue.JobScope;
import io.jobqueue.JobSerializationException;
import io.jobqueue.JobTimeoutException;
import io.jobqueue.TransportException;
import io.jobqueue.UnknownJobTypeException;
import io.jobqueue.retry.PolynomialBackoffRetryPolicy;
import io.jobqueue.retry.RetryDecision;
import io.jobqueue.retry.RetryPolicy;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.routing.QueueNames;
import io.jobqueue.routing.QueueRouter;
import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.JobFactory;
import io.jobqueue.spi.JobSerializer;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.Transport;
import io.jobqueue.spi.TransportMessage;
import io.jobqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes the job queues and executes jobs.
 *
 * <p>Each consumable queue class gets its own pool of consumer loops
 * (defaults: regular 10, long-running 2, retry 4, periodic 1). A loop fetches up
 * to {@code batchSize} deliveries, opens one {@link JobScope} for them and
 * handles each delivery on its own:
 * <ul>
 *   <li>undecodable payload: moved to the failed queue unchanged</li>
 *   <li>periodic occurrence: handed off as a regular job</li>
 *   <li>envelope released before its {@code notBefore}: published again</li>
 *   <li>otherwise the job runs on an execution thread, bounded by its timeout.
 *       Success acknowledges the delivery; failure publishes the successor
 *       chosen by the {@link RetryPolicy} (or a failed envelope) and then
 *       removes the delivery. If that publish fails, the delivery is requeued.</li>
 * </ul>
 *
 * <p>Every fetched delivery keeps its lease until it is settled: the lease is
 * extended right before the delivery is handled and then every
 * {@code leaseRenewInterval} while a job runs. A delivery whose lease was lost
 * is left to whichever consumer holds it now, and no successor is published
 * for it.
 *
 * <p>Consumer loops back off exponentially, up to 30 seconds, while the
 * transport is unavailable.
 *
 * <p>Create instances via {@link #builder()} and call {@link #start()}.
 * {@link #close()} stops fetching, lets in-flight jobs finish within the drain
 * timeout and requeues deliveries that were fetched but not started.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

  private static final long INITIAL_BACKOFF_MS = 100;
  private static final long MAX_BACKOFF_MS = 30_000;
  private static final long MIN_PERIODIC_WAIT_MS = 10;

  private final Transport transport;
  private final JobSerializer serializer;
  private final JobFactory jobFactory;
  private final JobPublisher publisher;
  private final RetryPolicy retryPolicy;
  private final QueueNames queueNames;
  private final MetricsExporter metrics;
  private final List<JobInterceptor> interceptors;
  private final Map<QueueClass, Integer> concurrency;
  private final int batchSize;
  private final Duration pollTimeout;
  private final long drainTimeoutMs;
  private final Clock clock;
  private final Supplier<Collection<String>> periodicIds;
  private final Duration leaseRenewInterval;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicInteger periodicCursor = new AtomicInteger();
  private final Map<QueueClass, ExecutorService> consumers = new EnumMap<>(QueueClass.class);
  private final Set<Delivery> held = ConcurrentHashMap.newKeySet();
  private ExecutorService executions;
  private ScheduledExecutorService leases;
  private boolean started;
  private boolean closed;

  private WorkerPool(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.jobFactory = Objects.requireNonNull(builder.jobFactory, "jobFactory");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.publisher = builder.publisher != null ? builder.publisher
        : JobPublisher.builder()
            .transport(transport)
            .serializer(builder.serializer)
            .router(builder.clock != null ? new QueueRouter(builder.clock) : null)
            .metrics(metrics)
            .build();
    this.serializer = builder.serializer != null ? builder.serializer : publisher.serializer();
    this.queueNames = publisher.queueNames();
    this.clock = builder.clock != null ? builder.clock : publisher.router().clock();
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new PolynomialBackoffRetryPolicy();
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.periodicIds = builder.periodicIds != null ? builder.periodicIds : List::of;

    for (Map.Entry<QueueClass, Integer> entry : builder.concurrency.entrySet()) {
      if (!entry.getKey().consumable()) {
        throw new IllegalArgumentException("Queue class " + entry.getKey().id() + " is not consumed by workers");
      }
      if (entry.getValue() < 0) {
        throw new IllegalArgumentException("concurrency for " + entry.getKey().id() + " must be >= 0");
      }
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.pollTimeout.isNegative() || builder.pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be positive");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.concurrency = Collections.unmodifiableMap(new EnumMap<>(builder.concurrency));
    this.batchSize = builder.batchSize;
    this.pollTimeout = builder.pollTimeout;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    Duration visibilityTimeout = transport.visibilityTimeout();
    this.leaseRenewInterval = builder.leaseRenewInterval != null
        ? builder.leaseRenewInterval : visibilityTimeout.dividedBy(3);
    if (leaseRenewInterval.toMillis() <= 0 || leaseRenewInterval.compareTo(visibilityTimeout) >= 0) {
      throw new IllegalArgumentException("leaseRenewInterval must be at least 1 ms and shorter than the "
          + "transport's visibility timeout of " + visibilityTimeout);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumer loops. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the pool has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WorkerPool has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    running.set(true);
    executions = Executors.newCachedThreadPool(new DaemonThreadFactory("jobqueue-exec-"));
    leases = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-lease-"));
    long renewMs = leaseRenewInterval.toMillis();
    leases.scheduleWithFixedDelay(this::renewLeases, renewMs, renewMs, TimeUnit.MILLISECONDS);
    for (Map.Entry<QueueClass, Integer> entry : concurrency.entrySet()) {
      QueueClass queueClass = entry.getKey();
      int loops = entry.getValue();
      if (loops == 0) {
        continue;
      }
      if (queueClass != QueueClass.PERIODIC) {
        transport.declareQueue(queueNames.name(queueClass));
      }
      ExecutorService executor = Executors.newFixedThreadPool(loops,
          new DaemonThreadFactory("jobqueue-" + queueClass.id() + "-"));
      consumers.put(queueClass, executor);
      for (int i = 0; i < loops; i++) {
        executor.submit(() -> consumeLoop(queueClass));
      }
    }
    logger.log(Level.INFO, "Worker pool started with concurrency {0}", concurrency);
  }

  public boolean isRunning() {
    return running.get();
  }

  private void consumeLoop(QueueClass queueClass) {
    long backoffMs = 0;
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      String queue = null;
      try {
        Duration wait = pollTimeout;
        if (queueClass == QueueClass.PERIODIC) {
          List<String> ids = new ArrayList<>(periodicIds.get());
          if (ids.isEmpty()) {
            Thread.sleep(pollTimeout.toMillis());
            continue;
          }
          queue = queueNames.periodic(ids.get(Math.floorMod(periodicCursor.getAndIncrement(), ids.size())));
          wait = Duration.ofMillis(Math.max(MIN_PERIODIC_WAIT_MS, pollTimeout.toMillis() / ids.size()));
        } else {
          queue = queueNames.name(queueClass);
        }
        List<Delivery> batch = transport.consumeBatch(queue, batchSize, wait);
        backoffMs = 0;
        if (!batch.isEmpty()) {
          processBatch(batch);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (TransportException e) {
        backoffMs = backoffMs == 0 ? INITIAL_BACKOFF_MS : Math.min(backoffMs * 2, MAX_BACKOFF_MS);
        logger.log(Level.WARNING, "Transport unavailable while consuming " + queue
            + "; retrying in " + backoffMs + " ms", e);
        pause(backoffMs);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Worker loop error on " + queue, t);
      }
    }
  }

  private void processBatch(List<Delivery> batch) {
    held.addAll(batch);
    try (JobScope scope = new JobScope(batch.get(0).queue())) {
      for (int i = 0; i < batch.size(); i++) {
        if (!running.get() || Thread.currentThread().isInterrupted()) {
          requeue(batch.subList(i, batch.size()));
          return;
        }
        Delivery delivery = batch.get(i);
        if (renew(delivery)) {
          process(delivery, scope);
        }
      }
    } finally {
      batch.forEach(held::remove);
    }
  }

  private void renewLeases() {
    for (Delivery delivery : held) {
      try {
        renew(delivery);
      } catch (TransportException e) {
        logger.log(Level.WARNING, "Failed to extend lease of delivery " + delivery.deliveryTag()
            + " on " + delivery.queue() + "; trying again in " + leaseRenewInterval, e);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Lease renewal error on " + delivery.queue(), e);
      }
    }
  }

  /**
   * Extends the lease of a fetched delivery.
   *
   * @return {@code false} if the lease was lost and the delivery must not be
   *     worked on any further
   */
  private boolean renew(Delivery delivery) {
    if (!held.contains(delivery)) {
      return false;
    }
    if (transport.extendLease(delivery)) {
      return true;
    }
    if (held.remove(delivery)) {
      logger.log(Level.WARNING, "Lost the lease of delivery {0} on {1}; leaving it to its current holder",
          new Object[]{delivery.deliveryTag(), delivery.queue()});
    }
    return false;
  }

  private void process(Delivery delivery, JobScope scope) {
    TransportMessage message = delivery.message();
    JobEnvelope envelope;
    try {
      envelope = serializer.deserialize(message.body());
    } catch (JobSerializationException e) {
      logger.log(Level.SEVERE, "Cannot decode payload from " + delivery.queue()
          + "; moving it to the failed queue", e);
      metrics.incrementExecutionFailure(FailureKind.SERIALIZATION);
      if (forward(delivery, () -> publisher.publishFailed(message.body(), message.headers(), delivery.queue()), true)) {
        metrics.incrementMovedToFailed(FailureKind.SERIALIZATION);
      }
      return;
    }

    Instant now = clock.instant();
    if (envelope.isPeriodic()) {
      JobEnvelope job = envelope.toOccurrenceJob(now);
      if (forward(delivery, () -> publisher.publish(job), true)) {
        logger.log(Level.FINE, "Periodic {0} occurrence handed off as job {1}",
            new Object[]{envelope.periodicId(), job.jobId()});
      }
      return;
    }
    if (envelope.notBefore() != null && envelope.notBefore().isAfter(now)) {
      forward(delivery, () -> publisher.publish(envelope), true);
      return;
    }
    execute(delivery, envelope, scope);
  }

  private void execute(Delivery delivery, JobEnvelope envelope, JobScope scope) {
    long startNanos = System.nanoTime();
    Exception failure = null;
    try {
      invoke(envelope, scope);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while running job {0}; returning it to {1}",
          new Object[]{envelope.jobId(), delivery.queue()});
      settle(delivery, false, true);
      return;
    } catch (Exception e) {
      failure = e;
    } finally {
      metrics.recordExecutionDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    if (failure == null) {
      if (settle(delivery, true, false)) {
        metrics.incrementExecutionSuccess();
      }
      return;
    }
    handleFailure(delivery, envelope, failure);
  }

  private void invoke(JobEnvelope envelope, JobScope scope) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeExecute(envelope);
        completedBefore = i + 1;
      }
      Job job = jobFactory.create(envelope.jobType(), scope);
      runWithTimeout(job, envelope);
      runAfterExecute(envelope, null, completedBefore);
    } catch (Exception e) {
      runAfterExecute(envelope, e, completedBefore);
      throw e;
    }
  }

  private void runWithTimeout(Job job, JobEnvelope envelope) throws Exception {
    Future<Object> future = executions.submit(() -> {
      job.execute(envelope.arguments());
      return null;
    });
    try {
      future.get(envelope.timeout().toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new JobTimeoutException(envelope.jobId(), envelope.timeout());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  private void runAfterExecute(JobEnvelope envelope, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterExecute(envelope, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterExecute failed", ex);
      }
    }
  }

  private void handleFailure(Delivery delivery, JobEnvelope envelope, Exception failure) {
    FailureKind kind = classify(failure);
    metrics.incrementExecutionFailure(kind);
    Instant now = clock.instant();
    String error = describe(failure);

    if (kind == FailureKind.UNKNOWN_JOB_TYPE) {
      moveToFailed(delivery, envelope.asFailed(now, error), kind, failure);
      return;
    }

    RetryDecision decision = retryPolicy.nextAttempt(envelope, failure);
    if (decision instanceof RetryDecision.Retry retry) {
      JobEnvelope successor = envelope.nextAttempt(now.plus(retry.delay()), error);
      if (forward(delivery, () -> publisher.publish(successor), false)) {
        metrics.incrementRetryScheduled();
        logger.log(Level.WARNING, "Job " + envelope.jobId() + " (" + envelope.jobType()
            + ") failed on attempt " + envelope.attempt() + "; retrying in " + retry.delay(), failure);
      }
    } else {
      RetryDecision.Exhausted exhausted = (RetryDecision.Exhausted) decision;
      logger.log(Level.FINE, "Retries exhausted for job {0}: {1}",
          new Object[]{envelope.jobId(), exhausted.reason()});
      moveToFailed(delivery, envelope.asFailed(now, error), FailureKind.RETRIES_EXHAUSTED, failure);
    }
  }

  private void moveToFailed(Delivery delivery, JobEnvelope failed, FailureKind kind, Exception failure) {
    if (forward(delivery, () -> publisher.publishFailed(failed, kind), false)) {
      metrics.incrementMovedToFailed(kind);
      logger.log(Level.SEVERE, "Job " + failed.jobId() + " (" + failed.jobType()
          + ") moved to the failed queue: " + kind, failure);
    }
  }

  private static FailureKind classify(Exception failure) {
    if (failure instanceof UnknownJobTypeException) {
      return FailureKind.UNKNOWN_JOB_TYPE;
    }
    if (failure instanceof JobTimeoutException) {
      return FailureKind.TIMEOUT;
    }
    return FailureKind.EXECUTION;
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : failure.getClass().getName() + ": " + message;
  }

  /**
   * Publishes the follow-up message for a delivery, then settles the delivery:
   * ack or nack without requeue on success, nack with requeue when the publish
   * failed so the transport delivers it again. Nothing is published once the
   * lease has been lost.
   */
  private boolean forward(Delivery delivery, Runnable publish, boolean ack) {
    try {
      if (!renew(delivery)) {
        return false;
      }
      publish.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to forward delivery " + delivery.deliveryTag()
          + " on " + delivery.queue() + "; requeueing it", e);
      settle(delivery, false, true);
      return false;
    }
    return settle(delivery, ack, false);
  }

  private boolean settle(Delivery delivery, boolean ack, boolean requeue) {
    held.remove(delivery);
    try {
      if (ack ? transport.ack(delivery) : transport.nack(delivery, requeue)) {
        return true;
      }
      logger.log(Level.WARNING, "Could not settle delivery {0} on {1}: its lease was lost",
          new Object[]{delivery.deliveryTag(), delivery.queue()});
      return false;
    } catch (TransportException e) {
      logger.log(Level.WARNING, "Failed to settle delivery " + delivery.deliveryTag() + " on "
          + delivery.queue() + "; it will be redelivered after its lease expires", e);
      return false;
    }
  }

  private void requeue(List<Delivery> deliveries) {
    for (int i = deliveries.size() - 1; i >= 0; i--) {
      settle(deliveries.get(i), false, true);
    }
    logger.log(Level.FINE, "Requeued {0} deliveries that were not started", deliveries.size());
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stops fetching, waits up to the drain timeout for consumer loops to finish
   * their current job, then interrupts whatever is left.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    running.set(false);
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
    consumers.values().forEach(ExecutorService::shutdown);
    try {
      for (Map.Entry<QueueClass, ExecutorService> entry : consumers.entrySet()) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        if (!entry.getValue().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded for {0} consumers; forcing shutdown",
              entry.getKey().id());
          entry.getValue().shutdownNow();
          entry.getValue().awaitTermination(5, TimeUnit.SECONDS);
        }
      }
    } catch (InterruptedException e) {
      consumers.values().forEach(ExecutorService::shutdownNow);
      Thread.currentThread().interrupt();
    }
    if (executions != null) {
      executions.shutdownNow();
    }
    if (leases != null) {
      leases.shutdownNow();
    }
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private Transport transport;
    private JobFactory jobFactory;
    private JobPublisher publisher;
    private JobSerializer serializer;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private Supplier<Collection<String>> periodicIds;
    private final List<JobInterceptor> interceptors = new ArrayList<>();
    private final Map<QueueClass, Integer> concurrency = new EnumMap<>(QueueClass.class);
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;
    private long drainTimeoutMs = 5000;
    private Duration leaseRenewInterval;

    private Builder() {
      concurrency.put(QueueClass.REGULAR, 10);
      concurrency.put(QueueClass.LONG_RUNNING, 2);
      concurrency.put(QueueClass.RETRY, 4);
      concurrency.put(QueueClass.PERIODIC, 1);
    }

    /**
     * Sets the transport to consume from.
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
     * <p><b>Required.</b>
     *
     * @param jobFactory the job factory
     * @return this builder
     */
    public Builder jobFactory(JobFactory jobFactory) {
      this.jobFactory = jobFactory;
      return this;
    }

    /**
     * Sets the publisher used for retries, hand-offs and failed jobs. Its queue
     * names, serializer and clock are shared with the pool.
     *
     * <p>Optional. Defaults to a publisher on the same transport.
     *
     * @param publisher the publisher
     * @return this builder
     */
    public Builder publisher(JobPublisher publisher) {
      this.publisher = publisher;
      return this;
    }

    public Builder serializer(JobSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Optional. Defaults to {@link PolynomialBackoffRetryPolicy} with 25 retries.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
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

    public Builder interceptor(JobInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<JobInterceptor> interceptors) {
      for (JobInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the number of consumer loops for a queue class. Zero disables the
     * class on this instance.
     *
     * @param queueClass a consumable class
     * @param loops number of consumer loops, &ge; 0
     * @return this builder
     */
    public Builder concurrency(QueueClass queueClass, int loops) {
      this.concurrency.put(Objects.requireNonNull(queueClass, "queueClass"), loops);
      return this;
    }

    /**
     * Sets the supplier of periodic ids whose occurrence queues the periodic
     * consumers poll.
     *
     * @param periodicIds supplies the registered periodic ids
     * @return this builder
     */
    public Builder periodicIds(Supplier<Collection<String>> periodicIds) {
      this.periodicIds = periodicIds;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long a consumer waits for a message before checking for
     * shutdown.
     *
     * <p>Optional. Defaults to 1 second.
     *
     * @param pollTimeout the wait bound
     * @return this builder
     */
    public Builder pollTimeout(Duration pollTimeout) {
      this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
      return this;
    }

    /**
     * Sets how long {@link WorkerPool#close()} waits for in-flight jobs.
     *
     * <p>Optional. Defaults to {@code 5000}.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets how often the leases of fetched, unsettled deliveries are extended.
     *
     * <p>Optional. Defaults to a third of the transport's visibility timeout.
     *
     * @param leaseRenewInterval the renewal period, shorter than the visibility timeout
     * @return this builder
     */
    public Builder leaseRenewInterval(Duration leaseRenewInterval) {
      this.leaseRenewInterval = leaseRenewInterval;
      return this;
    }

    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
