package io.jobqueue.spi;

/**
 * Header names understood by transports and workers.
 */
public final class MessageHeaders {

  /** Epoch milliseconds after which a message leaves its queue. */
  public static final String EXPIRES_AT = "x-expires-at";

  /** Queue that receives a message once it expires. */
  public static final String DEAD_LETTER_QUEUE = "x-dead-letter-queue";

  /**
   * Publish deduplication key. A transport accepts at most one message per key
   * and queue within its retention window.
   */
  public static final String DEDUPLICATION_ID = "x-deduplication-id";

  public static final String JOB_ID = "x-job-id";

  public static final String JOB_TYPE = "x-job-type";

  /** {@link io.jobqueue.FailureKind} name on messages in the failed queue. */
  public static final String FAILURE_KIND = "x-failure-kind";

  /** Queue an undecodable payload was taken from. */
  public static final String ORIGINAL_QUEUE = "x-original-queue";

  private MessageHeaders() {
  }
}
