/**
 * Cluster-wide deduplicated periodic jobs.
 *
 * @see io.jobqueue.periodic.PeriodicScheduler
 */
package io.jobqueue.periodic;
