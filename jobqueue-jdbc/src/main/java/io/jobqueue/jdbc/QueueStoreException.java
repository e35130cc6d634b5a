package io.jobqueue.jdbc;

import io.jobqueue.TransportException;

/**
 * Wraps a {@link java.sql.SQLException} raised while reading or writing queue tables.
 */
public class QueueStoreException extends TransportException {

  public QueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
