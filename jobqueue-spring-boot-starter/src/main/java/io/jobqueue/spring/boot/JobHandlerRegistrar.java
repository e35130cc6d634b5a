package io.jobqueue.spring.boot;

import io.jobqueue.JobQueue;
import io.jobqueue.registry.DefaultJobRegistry;
import io.jobqueue.schedule.Schedule;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link JobHandler}, registers them in the
 * {@link DefaultJobRegistry} and registers scheduled ones as periodic jobs.
 *
 * <p>Runs after all singleton beans are initialized via
 * {@link SmartInitializingSingleton}, which is before the job queue starts.
 */
public class JobHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(JobHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final DefaultJobRegistry registry;
    private final ObjectProvider<JobQueue> jobQueue;

    public JobHandlerRegistrar(ListableBeanFactory beanFactory, DefaultJobRegistry registry,
            ObjectProvider<JobQueue> jobQueue) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.jobQueue = jobQueue;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JobHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof io.jobqueue.registry.JobHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JobHandler must implement io.jobqueue.registry.JobHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }
            // proxies may hide the annotation
            JobHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), JobHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @JobHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.type().isBlank()) {
                throw new BeanCreationException(beanName, "@JobHandler type must not be blank");
            }

            registry.register(annotation.type(), handler);
            if (!annotation.schedule().isEmpty()) {
                registerPeriodic(beanName, annotation);
            }
            logger.log(Level.FINE, "Registered @JobHandler bean {0} for {1}",
                    new Object[]{beanName, annotation.type()});
        }
    }

    private void registerPeriodic(String beanName, JobHandler annotation) {
        JobQueue queue = jobQueue.getIfAvailable();
        if (queue == null) {
            throw new BeanCreationException(beanName,
                    "@JobHandler schedule requires a JobQueue bean");
        }
        Schedule schedule;
        Duration timeout;
        try {
            schedule = Schedule.parse(annotation.schedule());
            timeout = annotation.timeout().isEmpty() ? null : Duration.parse(annotation.timeout());
        } catch (RuntimeException e) {
            throw new BeanCreationException(beanName, "Invalid @JobHandler schedule or timeout", e);
        }
        String periodicId = annotation.periodicId().isEmpty() ? annotation.type() : annotation.periodicId();
        byte[] arguments = annotation.arguments().getBytes(StandardCharsets.UTF_8);
        if (timeout == null) {
            queue.publishPeriodic(periodicId, annotation.type(), arguments, schedule);
        } else {
            queue.publishPeriodic(periodicId, annotation.type(), arguments, schedule, timeout);
        }
    }
}
