package io.jobqueue.spring.boot;

import io.jobqueue.JobPublisher;
import io.jobqueue.JobQueue;
import io.jobqueue.JobScope;
import io.jobqueue.jdbc.JdbcTransport;
import io.jobqueue.periodic.PeriodicRegistration;
import io.jobqueue.registry.DefaultJobRegistry;
import io.jobqueue.retry.PolynomialBackoffRetryPolicy;
import io.jobqueue.retry.RetryPolicy;
import io.jobqueue.spi.Transport;
import io.jobqueue.transport.InMemoryTransport;
import io.jobqueue.worker.FailedJobManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueAutoConfigurationTest {

  private final ApplicationContextRunner inMemory = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(JobQueueAutoConfiguration.class))
      .withPropertyValues("jobqueue.worker.poll-timeout=50ms", "jobqueue.worker.drain-timeout-ms=1000");

  private final ApplicationContextRunner jdbc = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          JobQueueAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:jobqueue_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "jobqueue.worker.poll-timeout=50ms",
          "jobqueue.worker.drain-timeout-ms=1000",
          "jobqueue.transport.jdbc.poll-interval=20ms");

  @Test
  void createsAllBeans() {
    inMemory.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("jobQueueTransport"));
      assertTrue(ctx.containsBean("jobRegistry"));
      assertTrue(ctx.containsBean("jobRetryPolicy"));
      assertTrue(ctx.containsBean("jobHandlerRegistrar"));
      assertTrue(ctx.containsBean("jobQueue"));
      assertTrue(ctx.containsBean("jobPublisher"));
      assertTrue(ctx.containsBean("failedJobManager"));
      assertTrue(ctx.containsBean("jobQueueLifecycle"));

      assertInstanceOf(PolynomialBackoffRetryPolicy.class, ctx.getBean(RetryPolicy.class));
      assertNotNull(ctx.getBean(FailedJobManager.class));
      assertTrue(ctx.getBean(JobQueueLifecycle.class).isRunning());
    });
  }

  @Test
  void usesInMemoryTransportWithoutDataSource() {
    inMemory.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertInstanceOf(InMemoryTransport.class, ctx.getBean(Transport.class));
    });
  }

  @Test
  void usesJdbcTransportWithDataSource() {
    jdbc.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      JdbcTransport transport = assertInstanceOf(JdbcTransport.class, ctx.getBean(Transport.class));
      assertEquals("h2", transport.dialect().name());
    });
  }

  @Test
  void transportTypeOverridesDetection() {
    jdbc.withPropertyValues("jobqueue.transport.type=in-memory")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          assertInstanceOf(InMemoryTransport.class, ctx.getBean(Transport.class));
        });
  }

  @Test
  void jdbcTransportRequiresDataSource() {
    inMemory.withPropertyValues("jobqueue.transport.type=jdbc").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void annotatedHandlersRunPublishedJobs() {
    jdbc.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertTrue(ctx.getBean(DefaultJobRegistry.class).contains("greet"));

      ctx.getBean(JobPublisher.class).publish("greet", "world".getBytes(StandardCharsets.UTF_8));

      Greeter greeter = ctx.getBean(Greeter.class);
      awaitUntil(() -> greeter.greeted.contains("world"));
    });
  }

  @Test
  void scheduledHandlersAreRegisteredAsPeriodicJobs() {
    inMemory.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      List<PeriodicRegistration> registrations = ctx.getBean(JobQueue.class).periodicRegistrations();
      assertEquals(1, registrations.size());
      PeriodicRegistration registration = registrations.get(0);
      assertEquals("hourly-cleanup", registration.periodicId());
      assertEquals("cleanup", registration.jobType());
      assertEquals(Duration.ofMinutes(2), registration.timeout());
    });
  }

  @Test
  void handlerMustImplementJobHandler() {
    inMemory.withUserConfiguration(BrokenHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void invalidScheduleFailsStartup() {
    inMemory.withUserConfiguration(BadScheduleConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void backsOffForUserTransport() {
    inMemory.withUserConfiguration(CustomTransportConfig.class).run(ctx -> {
      assertSame(ctx.getBean("customTransport"), ctx.getBean(Transport.class));
      assertFalse(ctx.containsBean("jobQueueTransport"));
    });
  }

  @Test
  void producerOnlyInstance() {
    inMemory.withPropertyValues("jobqueue.workers-enabled=false", "jobqueue.queue-prefix=billing.")
        .run(ctx -> {
          JobQueue jobQueue = ctx.getBean(JobQueue.class);
          assertFalse(jobQueue.workersEnabled());
          jobQueue.publish("report", new byte[0]);
          assertEquals(1, ctx.getBean(Transport.class).depth("billing.regular"));
        });
  }

  private static void awaitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not met within 10s");
      }
      Thread.sleep(20);
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  static class Greeter implements io.jobqueue.registry.JobHandler {
    final List<String> greeted = new CopyOnWriteArrayList<>();

    @Override
    public void handle(byte[] arguments, JobScope scope) {
      greeted.add(new String(arguments, StandardCharsets.UTF_8));
    }
  }

  @JobHandler(type = "greet")
  static class AnnotatedGreeter extends Greeter {
  }

  @JobHandler(type = "cleanup", schedule = "@every PT1H", periodicId = "hourly-cleanup", timeout = "PT2M")
  static class Cleanup implements io.jobqueue.registry.JobHandler {
    @Override
    public void handle(byte[] arguments, JobScope scope) {
    }
  }

  @JobHandler(type = "broken")
  static class NotAHandler {
  }

  @JobHandler(type = "bad", schedule = "every now and then")
  static class BadSchedule implements io.jobqueue.registry.JobHandler {
    @Override
    public void handle(byte[] arguments, JobScope scope) {
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    AnnotatedGreeter greeter() {
      return new AnnotatedGreeter();
    }

    @Bean
    Cleanup cleanup() {
      return new Cleanup();
    }
  }

  @Configuration
  static class BrokenHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class BadScheduleConfig {
    @Bean
    BadSchedule badSchedule() {
      return new BadSchedule();
    }
  }

  @Configuration
  static class CustomTransportConfig {
    @Bean
    Transport customTransport() {
      return new InMemoryTransport();
    }
  }
}
