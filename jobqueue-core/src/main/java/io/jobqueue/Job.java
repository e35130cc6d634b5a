package io.jobqueue;

/**
 * A unit of work created by a {@link io.jobqueue.spi.JobFactory} for one
 * delivery. Throwing from {@link #execute(byte[])} fails the attempt and hands
 * the job to the retry policy.
 *
 * <p>Implementations run on a worker execution thread that is interrupted when
 * the job's timeout elapses; long-running jobs should honour interruption.
 */
@FunctionalInterface
public interface Job {

  /**
   * Executes the job.
   *
   * @param arguments the opaque argument bytes carried by the envelope
   * @throws Exception any failure, counted as a failed attempt
   */
  void execute(byte[] arguments) throws Exception;
}
