/**
 * Fixed-interval and cron schedules for periodic jobs.
 */
package io.jobqueue.schedule;
