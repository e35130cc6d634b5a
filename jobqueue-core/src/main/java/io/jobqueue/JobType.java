package io.jobqueue;

/**
 * Names a kind of job. The name is written into every envelope and used by the
 * {@link io.jobqueue.spi.JobFactory} to pick the implementation.
 *
 * <p>Enums are the usual implementation:
 * <pre>{@code
 * public enum BillingJobs implements JobType {
 *   SEND_INVOICE,
 *   CHARGE_CARD
 * }
 * }</pre>
 *
 * <p>Use {@link StringJobType} when types are only known at runtime.
 */
public interface JobType {

  /**
   * Returns the job type name, never {@code null} or empty.
   *
   * @return the job type name
   */
  String name();
}
