package io.jobqueue.worker;

import io.jobqueue.JobEnvelope;
import io.jobqueue.JobPublisher;
import io.jobqueue.JobSerializationException;
import io.jobqueue.routing.QueueClass;
import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.Transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Inspects and republishes jobs in the failed queue.
 *
 * <p>Republished jobs start over at attempt 0 with their original job id.
 * Messages that are skipped, or whose payload cannot be decoded, are returned
 * to the failed queue in their original order.
 */
public final class FailedJobManager {
  private static final Logger logger = Logger.getLogger(FailedJobManager.class.getName());

  private final Transport transport;
  private final JobPublisher publisher;
  private final String failedQueue;

  public FailedJobManager(Transport transport, JobPublisher publisher) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.failedQueue = publisher.queueNames().name(QueueClass.FAILED);
  }

  /**
   * Returns the number of messages in the failed queue.
   *
   * @return the failed job count
   */
  public long count() {
    return transport.depth(failedQueue);
  }

  /**
   * Returns up to {@code limit} decodable failed envelopes from the head of
   * the failed queue without removing them.
   *
   * @param limit maximum envelopes to return
   * @return the failed envelopes
   */
  public List<JobEnvelope> list(int limit) {
    validateLimit(limit);
    List<JobEnvelope> envelopes = new ArrayList<>();
    List<Delivery> taken = new ArrayList<>();
    try {
      while (envelopes.size() < limit) {
        Delivery delivery = transport.consume(failedQueue, Duration.ZERO);
        if (delivery == null) {
          break;
        }
        taken.add(delivery);
        try {
          envelopes.add(publisher.serializer().deserialize(delivery.message().body()));
        } catch (JobSerializationException e) {
          logger.log(Level.FINE, "Skipping undecodable failed message " + delivery.deliveryTag(), e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      restore(taken);
    }
    return envelopes;
  }

  public int republish(int limit) {
    return republish(limit, envelope -> true);
  }

  /**
   * Republishes up to {@code limit} failed jobs accepted by {@code filter}.
   *
   * @param limit maximum jobs to republish
   * @param filter selects the jobs to republish
   * @return the number of jobs republished
   */
  public int republish(int limit, Predicate<JobEnvelope> filter) {
    validateLimit(limit);
    Objects.requireNonNull(filter, "filter");
    List<Delivery> skipped = new ArrayList<>();
    int republished = 0;
    try {
      while (republished < limit) {
        Delivery delivery = transport.consume(failedQueue, Duration.ZERO);
        if (delivery == null) {
          break;
        }
        JobEnvelope envelope;
        try {
          envelope = publisher.serializer().deserialize(delivery.message().body());
        } catch (JobSerializationException e) {
          logger.log(Level.FINE, "Leaving undecodable failed message " + delivery.deliveryTag() + " in place", e);
          skipped.add(delivery);
          continue;
        }
        if (!filter.test(envelope)) {
          skipped.add(delivery);
          continue;
        }
        try {
          publisher.publish(envelope.forRepublish(publisher.router().clock().instant()));
        } catch (RuntimeException e) {
          skipped.add(delivery);
          throw e;
        }
        transport.ack(delivery);
        republished++;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      restore(skipped);
    }
    if (republished > 0) {
      logger.log(Level.INFO, "Republished {0} failed jobs", republished);
    }
    return republished;
  }

  private void restore(List<Delivery> deliveries) {
    for (int i = deliveries.size() - 1; i >= 0; i--) {
      transport.nack(deliveries.get(i), true);
    }
  }

  private static void validateLimit(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
  }
}
