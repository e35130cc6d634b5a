package io.jobqueue;

/**
 * Thrown when an envelope cannot be encoded, or a payload cannot be decoded
 * back into an envelope. Undecodable payloads are moved to the failed queue
 * without retry.
 */
public class JobSerializationException extends RuntimeException {

  public JobSerializationException(String message) {
    super(message);
  }

  public JobSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
