package io.jobqueue.transport;

import io.jobqueue.TransportException;
import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.Transport;
import io.jobqueue.spi.TransportMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} held in the memory of one JVM.
 *
 * <p>Honours the whole transport contract: expiry with dead-letter release,
 * deduplication ids kept for a retention window, and leases that return
 * unsettled deliveries to their queue after the visibility timeout. Expiry,
 * leases and retention are evaluated against the configured {@link Clock}
 * whenever a queue is accessed, so tests can drive them with a fixed clock.
 *
 * <p>Queues are created on first use. All state is guarded by one lock.
 */
public final class InMemoryTransport implements Transport {
  private static final Logger logger = Logger.getLogger(InMemoryTransport.class.getName());

  public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_DEDUPLICATION_RETENTION = Duration.ofHours(24);

  private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

  private final Clock clock;
  private final Duration visibilityTimeout;
  private final Duration deduplicationRetention;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Map<String, QueueState> queues = new HashMap<>();
  private final AtomicLong tagSequence = new AtomicLong();
  private volatile boolean closed;

  public InMemoryTransport() {
    this(builder());
  }

  private InMemoryTransport(Builder builder) {
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.visibilityTimeout = builder.visibilityTimeout != null
        ? builder.visibilityTimeout : DEFAULT_VISIBILITY_TIMEOUT;
    this.deduplicationRetention = builder.deduplicationRetention != null
        ? builder.deduplicationRetention : DEFAULT_DEDUPLICATION_RETENTION;
    if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) {
      throw new IllegalArgumentException("visibilityTimeout must be positive");
    }
    if (deduplicationRetention.isNegative()) {
      throw new IllegalArgumentException("deduplicationRetention must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void declareQueue(String queue) {
    Objects.requireNonNull(queue, "queue");
    lock.lock();
    try {
      ensureOpen();
      queue(queue);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean publish(String queue, TransportMessage message) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(message, "message");
    lock.lock();
    try {
      ensureOpen();
      Instant now = clock.instant();
      QueueState state = queue(queue);
      String deduplicationId = message.deduplicationId();
      if (deduplicationId != null) {
        state.forgetDeduplicationIdsBefore(now.minus(deduplicationRetention));
        if (state.deduplicationIds.putIfAbsent(deduplicationId, now) != null) {
          logger.log(Level.FINE, "Discarded duplicate {0} on {1}", new Object[]{deduplicationId, queue});
          return false;
        }
      }
      state.ready.addLast(new Stored(message, 0));
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Delivery consume(String queue, Duration maxWait) throws InterruptedException {
    Objects.requireNonNull(queue, "queue");
    long deadline = System.nanoTime() + Math.max(0, maxWait.toNanos());
    lock.lockInterruptibly();
    try {
      while (true) {
        ensureOpen();
        Instant now = clock.instant();
        maintain(now);
        QueueState state = queue(queue);
        Iterator<Stored> candidates = state.ready.iterator();
        while (candidates.hasNext()) {
          Stored stored = candidates.next();
          if (stored.message.expiresAt() != null) {
            continue;
          }
          candidates.remove();
          Stored delivered = new Stored(stored.message, stored.deliveryCount + 1);
          String tag = Long.toString(tagSequence.incrementAndGet());
          state.leased.put(tag, new Lease(delivered, now.plus(visibilityTimeout)));
          return new Delivery(queue, tag, delivered.message, delivered.deliveryCount);
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return null;
        }
        changed.awaitNanos(Math.min(remaining, MAX_WAIT_SLICE_NANOS));
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean ack(Delivery delivery) {
    return settle(delivery, false);
  }

  @Override
  public boolean nack(Delivery delivery, boolean requeue) {
    return settle(delivery, requeue);
  }

  /**
   * A lease that ran out is still held until the next queue access hands its
   * message back.
   */
  @Override
  public boolean extendLease(Delivery delivery) {
    Objects.requireNonNull(delivery, "delivery");
    lock.lock();
    try {
      ensureOpen();
      QueueState state = queue(delivery.queue());
      Lease lease = state.leased.get(delivery.deliveryTag());
      if (lease == null) {
        return false;
      }
      state.leased.put(delivery.deliveryTag(), new Lease(lease.stored, clock.instant().plus(visibilityTimeout)));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Duration visibilityTimeout() {
    return visibilityTimeout;
  }

  private boolean settle(Delivery delivery, boolean requeue) {
    Objects.requireNonNull(delivery, "delivery");
    lock.lock();
    try {
      ensureOpen();
      QueueState state = queue(delivery.queue());
      Lease lease = state.leased.remove(delivery.deliveryTag());
      if (lease == null) {
        logger.log(Level.FINE, "Delivery {0} on {1} was already settled or its lease expired",
            new Object[]{delivery.deliveryTag(), delivery.queue()});
        return false;
      }
      if (requeue) {
        state.ready.addFirst(lease.stored);
        changed.signalAll();
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long depth(String queue) {
    lock.lock();
    try {
      ensureOpen();
      maintain(clock.instant());
      QueueState state = queues.get(queue);
      return state == null ? 0 : state.ready.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns how many deliveries of {@code queue} are leased and not yet settled.
   *
   * @param queue the queue name
   * @return the number of unsettled deliveries
   */
  public int inFlight(String queue) {
    lock.lock();
    try {
      QueueState state = queues.get(queue);
      return state == null ? 0 : state.leased.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      closed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void maintain(Instant now) {
    for (QueueState state : queues.values().toArray(new QueueState[0])) {
      releaseExpired(state, now);
      reclaimExpiredLeases(state, now);
    }
  }

  private void releaseExpired(QueueState state, Instant now) {
    Iterator<Stored> messages = state.ready.iterator();
    while (messages.hasNext()) {
      Stored stored = messages.next();
      Instant expiresAt = stored.message.expiresAt();
      if (expiresAt == null || expiresAt.isAfter(now)) {
        continue;
      }
      messages.remove();
      String target = stored.message.deadLetterQueue();
      if (target == null) {
        logger.log(Level.FINE, "Dropped expired message without dead-letter queue from {0}", state.name);
        continue;
      }
      queue(target).ready.addLast(new Stored(stored.message.released(), stored.deliveryCount));
      changed.signalAll();
    }
  }

  private void reclaimExpiredLeases(QueueState state, Instant now) {
    Iterator<Lease> leases = state.leased.values().iterator();
    while (leases.hasNext()) {
      Lease lease = leases.next();
      if (lease.expiresAt.isAfter(now)) {
        continue;
      }
      leases.remove();
      state.ready.addFirst(lease.stored);
      logger.log(Level.WARNING, "Lease expired on {0}; message returned for redelivery", state.name);
      changed.signalAll();
    }
  }

  private QueueState queue(String name) {
    return queues.computeIfAbsent(name, QueueState::new);
  }

  private void ensureOpen() {
    if (closed) {
      throw new TransportException("InMemoryTransport is closed");
    }
  }

  private static final class QueueState {
    private final String name;
    private final Deque<Stored> ready = new ArrayDeque<>();
    private final Map<String, Lease> leased = new LinkedHashMap<>();
    private final Map<String, Instant> deduplicationIds = new LinkedHashMap<>();

    QueueState(String name) {
      this.name = name;
    }

    void forgetDeduplicationIdsBefore(Instant cutoff) {
      Iterator<Instant> recorded = deduplicationIds.values().iterator();
      while (recorded.hasNext() && recorded.next().isBefore(cutoff)) {
        recorded.remove();
      }
    }
  }

  private record Stored(TransportMessage message, int deliveryCount) {
  }

  private record Lease(Stored stored, Instant expiresAt) {
  }

  /** Builder for {@link InMemoryTransport}. */
  public static final class Builder {
    private Clock clock;
    private Duration visibilityTimeout;
    private Duration deduplicationRetention;

    private Builder() {}

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long a delivery may stay unsettled before it is returned to its
     * queue for redelivery.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param visibilityTimeout the lease duration
     * @return this builder
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * Sets how long deduplication ids are remembered.
     *
     * <p>Optional. Defaults to 24 hours.
     *
     * @param deduplicationRetention the retention window
     * @return this builder
     */
    public Builder deduplicationRetention(Duration deduplicationRetention) {
      this.deduplicationRetention = deduplicationRetention;
      return this;
    }

    public InMemoryTransport build() {
      return new InMemoryTransport(this);
    }
  }
}
