/**
 * Spring Boot auto-configuration for the job queue.
 *
 * <p>Add the starter, annotate handler beans with
 * {@link io.jobqueue.spring.boot.JobHandler} and inject
 * {@link io.jobqueue.JobPublisher} to publish jobs.
 */
package io.jobqueue.spring.boot;
