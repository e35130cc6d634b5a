package io.jobqueue.spi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable named FIFO queues with at-least-once delivery.
 *
 * <p>Beyond plain queueing a transport must support:
 * <ul>
 *   <li>per-message expiry ({@link MessageHeaders#EXPIRES_AT}) with release into
 *       the queue named by {@link MessageHeaders#DEAD_LETTER_QUEUE}; expired
 *       messages without a dead-letter queue are dropped. Messages waiting for
 *       expiry are never handed to consumers of their holding queue.</li>
 *   <li>keyed publish deduplication ({@link MessageHeaders#DEDUPLICATION_ID}):
 *       a second publish with the same key to the same queue within the
 *       retention window is accepted but discarded.</li>
 *   <li>leases: unsettled deliveries return to their queue after a visibility
 *       timeout, which is what recovers work from crashed consumers. The holder
 *       of a delivery can extend its lease.</li>
 * </ul>
 *
 * <p>Operational failures are reported as {@link io.jobqueue.TransportException}.
 * Implementations must be safe for concurrent use.
 */
public interface Transport extends AutoCloseable {

  /**
   * Creates the queue if it does not exist. Idempotent.
   *
   * @param queue the queue name
   */
  void declareQueue(String queue);

  /**
   * Publishes one message.
   *
   * @param queue the destination queue
   * @param message the message
   * @return {@code false} if the message was discarded as a duplicate of its
   *     deduplication id, {@code true} otherwise
   */
  boolean publish(String queue, TransportMessage message);

  /**
   * Publishes several messages as one grouped write. Not atomic: if it fails
   * part-way, messages written before the failure stay published.
   *
   * @param messages the messages in publish order
   */
  default void publishBatch(List<OutboundMessage> messages) {
    for (OutboundMessage outbound : messages) {
      publish(outbound.queue(), outbound.message());
    }
  }

  /**
   * Takes the next available message, waiting up to {@code maxWait}.
   *
   * @param queue the queue to consume from
   * @param maxWait how long to wait for a message
   * @return the delivery, or {@code null} if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  Delivery consume(String queue, Duration maxWait) throws InterruptedException;

  /**
   * Takes up to {@code maxMessages} messages, waiting up to {@code maxWait} for
   * the first one only.
   *
   * @param queue the queue to consume from
   * @param maxMessages upper bound on the batch size
   * @param maxWait how long to wait for the first message
   * @return the deliveries, empty if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  default List<Delivery> consumeBatch(String queue, int maxMessages, Duration maxWait)
      throws InterruptedException {
    Delivery first = consume(queue, maxWait);
    if (first == null) {
      return List.of();
    }
    List<Delivery> deliveries = new ArrayList<>();
    deliveries.add(first);
    while (deliveries.size() < maxMessages) {
      Delivery next = consume(queue, Duration.ZERO);
      if (next == null) {
        break;
      }
      deliveries.add(next);
    }
    return deliveries;
  }

  /**
   * Removes a delivered message from its queue.
   *
   * @param delivery the delivery to settle
   * @return {@code false} if this consumer no longer held the lease, because the
   *     delivery was already settled or its message went back to the queue
   */
  boolean ack(Delivery delivery);

  /**
   * Settles a delivery negatively.
   *
   * @param delivery the delivery to settle
   * @param requeue {@code true} to return the message to the head of its queue,
   *     {@code false} to remove it
   * @return {@code false} if this consumer no longer held the lease
   */
  boolean nack(Delivery delivery, boolean requeue);

  /**
   * Moves the end of a delivery's lease to one {@link #visibilityTimeout()}
   * from now. Consumers call it while they work on a delivery that may outlive
   * its lease.
   *
   * @param delivery the delivery to keep
   * @return {@code false} if the lease is no longer held: the delivery was
   *     settled, or its message was returned to the queue and may already be
   *     leased to another consumer
   */
  boolean extendLease(Delivery delivery);

  /**
   * Returns how long a delivery stays leased without being settled or extended.
   *
   * @return the lease duration
   */
  Duration visibilityTimeout();

  /**
   * Returns the number of messages in the queue that are not currently leased,
   * including messages waiting for expiry.
   *
   * @param queue the queue name
   * @return the message count
   */
  long depth(String queue);

  @Override
  default void close() {
  }
}
