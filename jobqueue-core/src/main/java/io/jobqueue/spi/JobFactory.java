package io.jobqueue.spi;

import io.jobqueue.Job;
import io.jobqueue.JobScope;

/**
 * Creates the {@link Job} that handles one delivery of a given type.
 *
 * @see io.jobqueue.registry.DefaultJobRegistry
 */
@FunctionalInterface
public interface JobFactory {

  /**
   * Creates a job instance.
   *
   * @param jobType the job type name from the envelope
   * @param scope resources shared by the jobs of the current delivery batch
   * @return the job
   * @throws io.jobqueue.UnknownJobTypeException if the type is not known
   */
  Job create(String jobType, JobScope scope);
}
