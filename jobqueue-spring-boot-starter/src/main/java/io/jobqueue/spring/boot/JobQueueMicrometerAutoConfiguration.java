package io.jobqueue.spring.boot;

import io.jobqueue.micrometer.MicrometerMetricsExporter;
import io.jobqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the
 * classpath, a {@link MeterRegistry} bean exists and
 * {@code jobqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link JobQueueAutoConfiguration} so the exporter is
 * available to the job queue.
 */
@AutoConfiguration(
    before = JobQueueAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "jobqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter jobQueueMetricsExporter(MeterRegistry meterRegistry, JobQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
