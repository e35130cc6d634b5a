package io.jobqueue;

/**
 * Signals that the message transport is unreachable or rejected an operation.
 *
 * <p>Publishing surfaces it to the caller. Consumer loops catch it, back off and
 * retry; it never counts as a job failure.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
