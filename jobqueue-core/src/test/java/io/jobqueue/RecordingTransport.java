package io.jobqueue;

import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.OutboundMessage;
import io.jobqueue.spi.Transport;
import io.jobqueue.spi.TransportMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Transport that only records what is published to it. */
public final class RecordingTransport implements Transport {
  public final List<OutboundMessage> published = new CopyOnWriteArrayList<>();

  @Override
  public void declareQueue(String queue) {
  }

  @Override
  public boolean publish(String queue, TransportMessage message) {
    published.add(new OutboundMessage(queue, message));
    return true;
  }

  @Override
  public Delivery consume(String queue, Duration maxWait) {
    return null;
  }

  @Override
  public boolean ack(Delivery delivery) {
    return true;
  }

  @Override
  public boolean nack(Delivery delivery, boolean requeue) {
    return true;
  }

  @Override
  public boolean extendLease(Delivery delivery) {
    return true;
  }

  @Override
  public Duration visibilityTimeout() {
    return Duration.ofMinutes(5);
  }

  @Override
  public long depth(String queue) {
    return published.stream().filter(m -> m.queue().equals(queue)).count();
  }
}
