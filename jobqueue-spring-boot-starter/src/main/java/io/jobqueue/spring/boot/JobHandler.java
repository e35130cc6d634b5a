package io.jobqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of one job type.
 *
 * <p>The annotated bean must implement {@link io.jobqueue.registry.JobHandler}.
 *
 * <pre>{@code
 * @Component
 * @JobHandler(type = "send-welcome-email")
 * public class WelcomeEmail implements io.jobqueue.registry.JobHandler {
 *   public void handle(byte[] arguments, JobScope scope) { ... }
 * }
 *
 * @Component
 * @JobHandler(type = "nightly-report", schedule = "CRON_TZ=Europe/Berlin 0 2 * * *")
 * public class NightlyReport implements io.jobqueue.registry.JobHandler { ... }
 * }</pre>
 *
 * <p>A non-empty {@link #schedule()} also registers the type as a periodic job
 * before the queue starts.
 *
 * @see JobHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobHandler {

    /**
     * Job type name.
     */
    String type();

    /**
     * Periodic schedule in text form: {@code @every <ISO-8601 duration>} or a
     * cron expression, optionally prefixed with {@code CRON_TZ=<zone> }.
     * Empty for on-demand jobs.
     */
    String schedule() default "";

    /**
     * Periodic id. Defaults to the job type.
     */
    String periodicId() default "";

    /**
     * UTF-8 arguments passed to every periodic occurrence.
     */
    String arguments() default "";

    /**
     * ISO-8601 execution budget of each periodic occurrence. Empty for the default.
     */
    String timeout() default "";
}
