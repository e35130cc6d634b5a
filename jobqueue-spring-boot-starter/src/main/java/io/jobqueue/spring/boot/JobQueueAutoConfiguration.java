package io.jobqueue.spring.boot;

import io.jobqueue.JobPublisher;
import io.jobqueue.JobQueue;
import io.jobqueue.jdbc.JdbcTransport;
import io.jobqueue.jdbc.purge.DeduplicationPurgeScheduler;
import io.jobqueue.registry.DefaultJobRegistry;
import io.jobqueue.retry.PolynomialBackoffRetryPolicy;
import io.jobqueue.retry.RetryPolicy;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.spi.JobSerializer;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.Transport;
import io.jobqueue.transport.InMemoryTransport;
import io.jobqueue.worker.FailedJobManager;
import io.jobqueue.worker.JobInterceptor;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the job queue.
 *
 * <p>Wires a {@link JobQueue} from {@link JobQueueProperties}, a
 * {@link Transport} and the {@link JobHandler} beans of the context. The
 * transport is a {@link JdbcTransport} over the application's
 * {@link DataSource} when one exists, and an {@link InMemoryTransport}
 * otherwise, unless {@code jobqueue.transport.type} says differently or the
 * application defines its own {@link Transport} bean.
 *
 * @see JobQueueProperties
 * @see JobQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobQueue.class)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueAutoConfiguration {
  private static final Logger logger = Logger.getLogger(JobQueueAutoConfiguration.class.getName());

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(Transport.class)
  @DependsOnDatabaseInitialization
  public Transport jobQueueTransport(JobQueueProperties props, ObjectProvider<DataSource> dataSourceProvider) {
    JobQueueProperties.Transport transport = props.getTransport();
    DataSource dataSource = dataSourceProvider.getIfAvailable();
    JobQueueProperties.TransportType type = transport.getType();
    if (type == JobQueueProperties.TransportType.AUTO) {
      type = dataSource != null ? JobQueueProperties.TransportType.JDBC : JobQueueProperties.TransportType.IN_MEMORY;
    }
    if (type == JobQueueProperties.TransportType.IN_MEMORY) {
      logger.log(Level.INFO, "Using in-memory job transport; jobs do not survive restarts");
      return InMemoryTransport.builder()
          .visibilityTimeout(transport.getVisibilityTimeout())
          .deduplicationRetention(transport.getDeduplicationRetention())
          .build();
    }
    if (dataSource == null) {
      throw new IllegalStateException("jobqueue.transport.type=JDBC requires a DataSource bean");
    }
    return JdbcTransport.builder()
        .dataSource(dataSource)
        .messageTable(transport.getJdbc().getMessageTable())
        .deduplicationTable(transport.getJdbc().getDeduplicationTable())
        .pollInterval(transport.getJdbc().getPollInterval())
        .visibilityTimeout(transport.getVisibilityTimeout())
        .deduplicationRetention(transport.getDeduplicationRetention())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultJobRegistry jobRegistry() {
    return new DefaultJobRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy jobRetryPolicy(JobQueueProperties props) {
    return new PolynomialBackoffRetryPolicy(props.getRetry().getMaxRetries());
  }

  @Bean
  @ConditionalOnMissingBean
  public JobHandlerRegistrar jobHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultJobRegistry jobRegistry, ObjectProvider<JobQueue> jobQueue) {
    return new JobHandlerRegistrar(beanFactory, jobRegistry, jobQueue);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public JobQueue jobQueue(JobQueueProperties props,
      Transport transport,
      DefaultJobRegistry jobRegistry,
      RetryPolicy retryPolicy,
      ObjectProvider<JobSerializer> serializerProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JobInterceptor> interceptorProvider) {
    JobQueueProperties.Worker worker = props.getWorker();
    JobQueue.Builder builder = JobQueue.builder()
        .transport(transport)
        .jobFactory(jobRegistry)
        .retryPolicy(retryPolicy)
        .queuePrefix(props.getQueuePrefix())
        .longRunningThreshold(props.getLongRunningThreshold())
        .workersEnabled(props.isWorkersEnabled())
        .concurrency(QueueClass.REGULAR, worker.getRegularConcurrency())
        .concurrency(QueueClass.LONG_RUNNING, worker.getLongRunningConcurrency())
        .concurrency(QueueClass.RETRY, worker.getRetryConcurrency())
        .concurrency(QueueClass.PERIODIC, worker.getPeriodicConcurrency())
        .batchSize(worker.getBatchSize())
        .publishBatchLimit(worker.getPublishBatchLimit())
        .pollTimeout(worker.getPollTimeout())
        .periodicTickInterval(worker.getPeriodicTickInterval())
        .drainTimeoutMs(worker.getDrainTimeoutMs());
    serializerProvider.ifAvailable(builder::serializer);
    metricsProvider.ifAvailable(builder::metrics);
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobPublisher jobPublisher(JobQueue jobQueue) {
    return jobQueue.publisher();
  }

  @Bean
  @ConditionalOnMissingBean
  public FailedJobManager failedJobManager(JobQueue jobQueue) {
    return jobQueue.failedJobs();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobQueueLifecycle jobQueueLifecycle(JobQueue jobQueue, Transport transport, JobQueueProperties props) {
    DeduplicationPurgeScheduler purge = null;
    JobQueueProperties.Purge purgeProps = props.getTransport().getJdbc().getPurge();
    if (transport instanceof JdbcTransport jdbc && purgeProps.isEnabled()) {
      purge = DeduplicationPurgeScheduler.builder()
          .transport(jdbc)
          .batchSize(purgeProps.getBatchSize())
          .interval(purgeProps.getInterval())
          .build();
    }
    return new JobQueueLifecycle(jobQueue, purge);
  }
}
