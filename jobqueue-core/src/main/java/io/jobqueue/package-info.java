/**
 * Public API of the job dispatcher.
 *
 * <p>{@link io.jobqueue.JobQueue} is the usual entry point: it wires a
 * {@link io.jobqueue.JobPublisher}, a periodic scheduler and a worker pool on
 * top of a {@link io.jobqueue.spi.Transport}. Jobs travel as immutable
 * {@link io.jobqueue.JobEnvelope}s.
 */
package io.jobqueue;
