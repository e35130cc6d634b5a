package io.jobqueue.registry;

import io.jobqueue.Job;
import io.jobqueue.JobScope;
import io.jobqueue.JobType;
import io.jobqueue.UnknownJobTypeException;
import io.jobqueue.spi.JobFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Thread-safe {@link JobFactory} mapping job type names to handlers.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultJobRegistry registry = new DefaultJobRegistry()
 *     .register("send-invoice", (args, scope) -> invoices.send(args))
 *     .register(BillingJobs.CHARGE_CARD, (args, scope) -> payments.charge(args))
 *     .registerFactory("reindex", scope -> new ReindexJob(scope.resource("index", indexClient::open)));
 * }</pre>
 *
 * <p>Each type has exactly one handler; registering a type twice fails.
 */
public final class DefaultJobRegistry implements JobFactory {

  private final Map<String, Function<JobScope, Job>> factories = new ConcurrentHashMap<>();

  public DefaultJobRegistry register(JobType jobType, JobHandler handler) {
    return register(jobType.name(), handler);
  }

  /**
   * Registers a handler for a job type name.
   *
   * @param jobType the job type name
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if the type is already registered
   */
  public DefaultJobRegistry register(String jobType, JobHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return registerFactory(jobType, scope -> arguments -> handler.handle(arguments, scope));
  }

  /**
   * Registers a factory that builds a fresh {@link Job} for every delivery.
   *
   * @param jobType the job type name
   * @param factory creates the job for a batch scope
   * @return this registry for chaining
   * @throws IllegalStateException if the type is already registered
   */
  public DefaultJobRegistry registerFactory(String jobType, Function<JobScope, ? extends Job> factory) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(factory, "factory");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    Function<JobScope, Job> previous = factories.putIfAbsent(jobType, factory::apply);
    if (previous != null) {
      throw new IllegalStateException("Job type already registered: " + jobType);
    }
    return this;
  }

  @Override
  public Job create(String jobType, JobScope scope) {
    Function<JobScope, Job> factory = factories.get(jobType);
    if (factory == null) {
      throw new UnknownJobTypeException(jobType);
    }
    return factory.apply(scope);
  }

  public boolean contains(String jobType) {
    return factories.containsKey(jobType);
  }

  public Set<String> jobTypes() {
    return Collections.unmodifiableSet(factories.keySet());
  }
}
