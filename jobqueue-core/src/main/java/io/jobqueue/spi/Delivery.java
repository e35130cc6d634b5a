package io.jobqueue.spi;

import java.util.Objects;

/**
 * A message handed to a consumer. It stays leased to that consumer until
 * acknowledged, negatively acknowledged, or until the transport's visibility
 * timeout returns it to the queue.
 *
 * @param queue the queue the message was consumed from
 * @param deliveryTag transport-specific handle used to settle the delivery
 * @param message the message
 * @param deliveryCount how many times this message has been delivered, starting at 1
 */
public record Delivery(String queue, String deliveryTag, TransportMessage message, int deliveryCount) {
  public Delivery {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(deliveryTag, "deliveryTag");
    Objects.requireNonNull(message, "message");
  }

  public boolean redelivered() {
    return deliveryCount > 1;
  }
}
