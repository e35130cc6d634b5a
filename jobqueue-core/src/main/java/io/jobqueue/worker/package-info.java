/**
 * Job execution: the {@link io.jobqueue.worker.WorkerPool}, execution
 * interceptors and the failed-job manager.
 */
package io.jobqueue.worker;
