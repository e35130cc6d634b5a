package io.jobqueue.micrometer;

import io.jobqueue.FailureKind;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobqueue.published} (tag {@code queue}): envelopes published, by routed queue class</li>
 *   <li>{@code jobqueue.execution.success}: job bodies that completed</li>
 *   <li>{@code jobqueue.execution.failure} (tag {@code kind}): failed executions</li>
 *   <li>{@code jobqueue.retry.scheduled}: retries published to the delayed queue</li>
 *   <li>{@code jobqueue.failed} (tag {@code kind}): jobs moved to the failed queue</li>
 *   <li>{@code jobqueue.periodic.published}: periodic occurrences published by this instance</li>
 *   <li>{@code jobqueue.periodic.duplicate}: periodic occurrences another instance published first</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code jobqueue.execution.duration}: time spent in job bodies</li>
 * </ul>
 *
 * <p>All meters are registered up front so dashboards see zeros rather than gaps.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<QueueClass, Counter> published = new EnumMap<>(QueueClass.class);
  private final Map<FailureKind, Counter> executionFailures = new EnumMap<>(FailureKind.class);
  private final Map<FailureKind, Counter> movedToFailed = new EnumMap<>(FailureKind.class);
  private final Counter executionSuccess;
  private final Counter retryScheduled;
  private final Counter periodicPublished;
  private final Counter periodicDuplicate;
  private final Timer executionDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * job queues in one application.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.jobs"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (QueueClass queueClass : QueueClass.values()) {
      published.put(queueClass, Counter.builder(namePrefix + ".published")
          .description("Job envelopes published")
          .tag("queue", queueClass.id())
          .register(registry));
    }
    for (FailureKind kind : FailureKind.values()) {
      String tag = kind.name().toLowerCase(Locale.ROOT);
      executionFailures.put(kind, Counter.builder(namePrefix + ".execution.failure")
          .description("Job executions that failed")
          .tag("kind", tag)
          .register(registry));
      movedToFailed.put(kind, Counter.builder(namePrefix + ".failed")
          .description("Jobs moved to the failed queue")
          .tag("kind", tag)
          .register(registry));
    }
    this.executionSuccess = Counter.builder(namePrefix + ".execution.success")
        .description("Job executions that completed")
        .register(registry);
    this.retryScheduled = Counter.builder(namePrefix + ".retry.scheduled")
        .description("Retries scheduled through the delayed queue")
        .register(registry);
    this.periodicPublished = Counter.builder(namePrefix + ".periodic.published")
        .description("Periodic occurrences published by this instance")
        .register(registry);
    this.periodicDuplicate = Counter.builder(namePrefix + ".periodic.duplicate")
        .description("Periodic occurrences already published by another instance")
        .register(registry);
    this.executionDuration = Timer.builder(namePrefix + ".execution.duration")
        .description("Time spent running job bodies")
        .register(registry);
  }

  @Override
  public void incrementPublished(QueueClass queueClass) {
    if (closed) return;
    published.get(queueClass).increment();
  }

  @Override
  public void incrementExecutionSuccess() {
    if (closed) return;
    executionSuccess.increment();
  }

  @Override
  public void incrementExecutionFailure(FailureKind kind) {
    if (closed) return;
    executionFailures.get(kind).increment();
  }

  @Override
  public void incrementRetryScheduled() {
    if (closed) return;
    retryScheduled.increment();
  }

  @Override
  public void incrementMovedToFailed(FailureKind kind) {
    if (closed) return;
    movedToFailed.get(kind).increment();
  }

  @Override
  public void incrementPeriodicPublished() {
    if (closed) return;
    periodicPublished.increment();
  }

  @Override
  public void incrementPeriodicDuplicate() {
    if (closed) return;
    periodicDuplicate.increment();
  }

  @Override
  public void recordExecutionDurationMs(long durationMs) {
    if (closed) return;
    executionDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.jobqueue.JobQueue#close()} calls this.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.addAll(published.values());
    meters.addAll(executionFailures.values());
    meters.addAll(movedToFailed.values());
    meters.addAll(List.of(executionSuccess, retryScheduled, periodicPublished, periodicDuplicate,
        executionDuration));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
