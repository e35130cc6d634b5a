package io.jobqueue;

/**
 * Thrown by a {@link io.jobqueue.spi.JobFactory} when no job is registered for
 * a type. Jobs failing this way go straight to the failed queue.
 */
public class UnknownJobTypeException extends RuntimeException {

  private final String jobType;

  public UnknownJobTypeException(String jobType) {
    super("No job registered for type " + jobType);
    this.jobType = jobType;
  }

  public String jobType() {
    return jobType;
  }
}
