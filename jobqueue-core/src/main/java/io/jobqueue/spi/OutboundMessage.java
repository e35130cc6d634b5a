package io.jobqueue.spi;

import java.util.Objects;

/**
 * A message paired with its destination queue, as handed to
 * {@link Transport#publishBatch(java.util.List)}.
 *
 * @param queue the destination queue
 * @param message the message
 */
public record OutboundMessage(String queue, TransportMessage message) {
  public OutboundMessage {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(message, "message");
  }
}
