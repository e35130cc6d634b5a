package io.jobqueue;

import io.jobqueue.routing.QueueClass;
import io.jobqueue.routing.QueueNames;
import io.jobqueue.routing.QueueRouter;
import io.jobqueue.serial.JsonJobSerializer;
import io.jobqueue.spi.JobSerializer;
import io.jobqueue.spi.MessageHeaders;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.OutboundMessage;
import io.jobqueue.spi.Transport;
import io.jobqueue.spi.TransportMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes envelopes to their queues and publishes them, either immediately or
 * buffered inside a batch scope.
 *
 * <p>Delayed envelopes go to the {@code delayed} queue carrying an expiry at
 * {@code notBefore} and their release queue as dead-letter target, so the
 * transport moves them when they become due.
 *
 * <h2>Batch scopes</h2>
 * <p>{@link #runBatch(BatchBody)} opens a scope confined to the calling thread.
 * Publishes made inside it are buffered and flushed as one grouped transport
 * write when the body returns, or earlier whenever the buffer reaches the batch
 * limit. Nested calls join the outermost scope. If the body throws, the jobs
 * still buffered are discarded and the exception propagates; jobs flushed
 * before the failure stay published. Grouped writes are not atomic.
 *
 * <p>This class is thread-safe.
 */
public final class JobPublisher {
  private static final Logger logger = Logger.getLogger(JobPublisher.class.getName());

  public static final int DEFAULT_BATCH_LIMIT = 100;

  private final Transport transport;
  private final JobSerializer serializer;
  private final QueueRouter router;
  private final QueueNames queueNames;
  private final MetricsExporter metrics;
  private final int batchLimit;
  private final ThreadLocal<BatchScope> currentBatch = new ThreadLocal<>();
  private final Set<String> declaredQueues = ConcurrentHashMap.newKeySet();

  private JobPublisher(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.serializer = builder.serializer != null ? builder.serializer : new JsonJobSerializer();
    this.router = builder.router != null ? builder.router : new QueueRouter();
    this.queueNames = builder.queueNames != null ? builder.queueNames : new QueueNames();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.batchLimit <= 0) {
      throw new IllegalArgumentException("batchLimit must be > 0");
    }
    this.batchLimit = builder.batchLimit;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String publish(String jobType, byte[] arguments) {
    return publish(jobType, arguments, PublishOptions.DEFAULT);
  }

  public String publish(JobType jobType, byte[] arguments, PublishOptions options) {
    Objects.requireNonNull(jobType, "jobType");
    return publish(jobType.name(), arguments, options);
  }

  /**
   * Publishes a new job.
   *
   * @param jobType the job type name
   * @param arguments opaque job arguments
   * @param options delay and timeout
   * @return the job id
   * @throws TransportException if the transport rejects the write (outside a batch scope)
   */
  public String publish(String jobType, byte[] arguments, PublishOptions options) {
    Objects.requireNonNull(options, "options");
    JobEnvelope envelope = JobEnvelope.builder(jobType)
        .arguments(arguments)
        .timeout(options.timeout())
        .delay(options.delay())
        .notBefore(options.notBefore())
        .enqueuedAt(router.clock().instant())
        .build();
    return publish(envelope);
  }

  /**
   * Publishes an envelope to the queue its routing selects.
   *
   * @param envelope the envelope
   * @return the envelope's job id
   */
  public String publish(JobEnvelope envelope) {
    Routed routed = route(envelope, Map.of());
    BatchScope scope = currentBatch.get();
    if (scope != null) {
      scope.buffer.add(routed);
      if (scope.buffer.size() >= batchLimit) {
        flush(scope);
      }
    } else {
      send(routed);
    }
    return envelope.jobId();
  }

  /**
   * Publishes an envelope immediately, bypassing any batch scope, with a
   * deduplication id. Used for periodic occurrences, where several instances
   * publish the same due instant.
   *
   * @param envelope the envelope
   * @param deduplicationId the deduplication key
   * @return {@code false} if the transport discarded it as a duplicate
   */
  public boolean publishDeduplicated(JobEnvelope envelope, String deduplicationId) {
    Objects.requireNonNull(deduplicationId, "deduplicationId");
    return send(route(envelope, Map.of(MessageHeaders.DEDUPLICATION_ID, deduplicationId)));
  }

  /**
   * Publishes a terminal envelope to the failed queue, immediately.
   *
   * @param envelope an envelope carrying a failed marker
   * @param kind why the job failed
   */
  public void publishFailed(JobEnvelope envelope, FailureKind kind) {
    if (!envelope.isFailed()) {
      throw new IllegalArgumentException("Envelope " + envelope.jobId() + " has no failed marker");
    }
    send(route(envelope, Map.of(MessageHeaders.FAILURE_KIND, kind.name())));
  }

  /**
   * Moves a payload that could not be decoded to the failed queue unchanged,
   * keeping its headers and recording the failure kind and source queue.
   *
   * @param body the raw payload
   * @param headers the original headers
   * @param originalQueue the queue the payload was consumed from
   */
  public void publishFailed(byte[] body, Map<String, String> headers, String originalQueue) {
    Map<String, String> failedHeaders = new LinkedHashMap<>(headers);
    failedHeaders.remove(MessageHeaders.EXPIRES_AT);
    failedHeaders.remove(MessageHeaders.DEAD_LETTER_QUEUE);
    failedHeaders.remove(MessageHeaders.DEDUPLICATION_ID);
    failedHeaders.put(MessageHeaders.FAILURE_KIND, FailureKind.SERIALIZATION.name());
    failedHeaders.put(MessageHeaders.ORIGINAL_QUEUE, originalQueue);
    String queue = queueNames.name(QueueClass.FAILED);
    declare(queue);
    transport.publish(queue, new TransportMessage(body, failedHeaders));
    metrics.incrementPublished(QueueClass.FAILED);
  }

  /**
   * Runs {@code body} inside a batch scope on the calling thread.
   *
   * @param body the code that publishes
   * @param <E> the checked exception the body may throw
   * @throws E whatever the body throws, after discarding its unflushed jobs
   */
  public <E extends Exception> void runBatch(BatchBody<E> body) throws E {
    Objects.requireNonNull(body, "body");
    if (currentBatch.get() != null) {
      body.run();
      return;
    }
    BatchScope scope = new BatchScope();
    currentBatch.set(scope);
    boolean completed = false;
    try {
      body.run();
      completed = true;
    } finally {
      currentBatch.remove();
      if (!completed && !scope.buffer.isEmpty()) {
        logger.log(Level.WARNING, "Batch failed; discarded {0} unflushed jobs ({1} already published)",
            new Object[]{scope.buffer.size(), scope.flushed});
        scope.buffer.clear();
      }
    }
    flush(scope);
  }

  /**
   * Returns whether the calling thread is inside a batch scope.
   *
   * @return {@code true} inside {@link #runBatch(BatchBody)}
   */
  public boolean inBatch() {
    return currentBatch.get() != null;
  }

  public QueueNames queueNames() {
    return queueNames;
  }

  public QueueRouter router() {
    return router;
  }

  public JobSerializer serializer() {
    return serializer;
  }

  private void flush(BatchScope scope) {
    if (scope.buffer.isEmpty()) {
      return;
    }
    List<Routed> pending = new ArrayList<>(scope.buffer);
    scope.buffer.clear();
    List<OutboundMessage> messages = new ArrayList<>(pending.size());
    for (Routed routed : pending) {
      declare(routed.outbound().queue());
      messages.add(routed.outbound());
    }
    transport.publishBatch(messages);
    scope.flushed += pending.size();
    for (Routed routed : pending) {
      metrics.incrementPublished(routed.target());
    }
  }

  private boolean send(Routed routed) {
    OutboundMessage outbound = routed.outbound();
    declare(outbound.queue());
    boolean accepted = transport.publish(outbound.queue(), outbound.message());
    if (accepted) {
      metrics.incrementPublished(routed.target());
    }
    return accepted;
  }

  private Routed route(JobEnvelope envelope, Map<String, String> extraHeaders) {
    Objects.requireNonNull(envelope, "envelope");
    QueueClass target = router.route(envelope);
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(MessageHeaders.JOB_ID, envelope.jobId());
    headers.put(MessageHeaders.JOB_TYPE, envelope.jobType());
    String queue;
    if (target == QueueClass.PERIODIC) {
      queue = queueNames.periodic(envelope.periodicId());
    } else if (target == QueueClass.DELAYED) {
      queue = queueNames.name(QueueClass.DELAYED);
      headers.put(MessageHeaders.EXPIRES_AT, Long.toString(envelope.notBefore().toEpochMilli()));
      headers.put(MessageHeaders.DEAD_LETTER_QUEUE, queueNames.name(router.releaseTarget(envelope)));
    } else {
      queue = queueNames.name(target);
    }
    headers.putAll(extraHeaders);
    byte[] body = serializer.serialize(envelope);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Routed job " + envelope.jobId() + " (" + envelope.jobType() + ") to " + queue);
    }
    return new Routed(target, new OutboundMessage(queue, new TransportMessage(body, headers)));
  }

  private void declare(String queue) {
    if (declaredQueues.add(queue)) {
      try {
        transport.declareQueue(queue);
      } catch (RuntimeException e) {
        declaredQueues.remove(queue);
        throw e;
      }
    }
  }

  /**
   * Body of a batch scope.
   *
   * @param <E> checked exception type the body may throw
   */
  @FunctionalInterface
  public interface BatchBody<E extends Exception> {
    void run() throws E;
  }

  private record Routed(QueueClass target, OutboundMessage outbound) {
  }

  private static final class BatchScope {
    private final List<Routed> buffer = new ArrayList<>();
    private int flushed;
  }

  /** Builder for {@link JobPublisher}. */
  public static final class Builder {
    private Transport transport;
    private JobSerializer serializer;
    private QueueRouter router;
    private QueueNames queueNames;
    private MetricsExporter metrics;
    private int batchLimit = DEFAULT_BATCH_LIMIT;

    private Builder() {}

    /**
     * Sets the transport messages are published to.
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

    public Builder serializer(JobSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    /**
     * Sets the router, which also supplies the clock. Optional; defaults to a
     * UTC system-clock router.
     *
     * @param router the router
     * @return this builder
     */
    public Builder router(QueueRouter router) {
      this.router = router;
      return this;
    }

    public Builder queueNames(QueueNames queueNames) {
      this.queueNames = queueNames;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how many buffered jobs trigger an early flush inside a batch scope.
     *
     * <p>Optional. Defaults to {@value JobPublisher#DEFAULT_BATCH_LIMIT}. Must be &gt; 0.
     *
     * @param batchLimit the flush threshold
     * @return this builder
     */
    public Builder batchLimit(int batchLimit) {
      this.batchLimit = batchLimit;
      return this;
    }

    public JobPublisher build() {
      return new JobPublisher(this);
    }
  }
}
