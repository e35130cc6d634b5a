package io.jobqueue.worker;

import io.jobqueue.JobEnvelope;

/**
 * Hook around each job execution.
 *
 * <p>{@link #beforeExecute} runs in registration order before the job is
 * created; {@link #afterExecute} runs in reverse order for every interceptor
 * whose {@code beforeExecute} completed, with the failure if there was one.
 * A throwing {@code beforeExecute} fails the attempt like a throwing job.
 * Exceptions from {@code afterExecute} are logged and do not change the
 * outcome.
 *
 * <pre>{@code
 * WorkerPool.builder()
 *     .interceptor(JobInterceptor.before(job -> tenantContext.enter(job)))
 *     .interceptor(JobInterceptor.after((job, error) -> tenantContext.leave()))
 *     ...
 * }</pre>
 */
public interface JobInterceptor {

  /**
   * Called before the job runs.
   *
   * @param envelope the job about to run
   * @throws Exception to fail the attempt without running the job
   */
  default void beforeExecute(JobEnvelope envelope) throws Exception {
  }

  /**
   * Called after the job ran or failed.
   *
   * @param envelope the job
   * @param error {@code null} on success, the failure otherwise
   */
  default void afterExecute(JobEnvelope envelope, Exception error) {
  }

  static JobInterceptor before(BeforeHook hook) {
    return new JobInterceptor() {
      @Override
      public void beforeExecute(JobEnvelope envelope) throws Exception {
        hook.accept(envelope);
      }
    };
  }

  static JobInterceptor after(AfterHook hook) {
    return new JobInterceptor() {
      @Override
      public void afterExecute(JobEnvelope envelope, Exception error) {
        hook.accept(envelope, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(JobEnvelope envelope) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(JobEnvelope envelope, Exception error);
  }
}
