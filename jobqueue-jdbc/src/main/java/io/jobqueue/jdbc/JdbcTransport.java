package io.jobqueue.jdbc;

import com.github.f4b6a3.ulid.UlidCreator;
import io.jobqueue.TransportException;
import io.jobqueue.jdbc.dialect.Dialects;
import io.jobqueue.jdbc.spi.ClaimedRow;
import io.jobqueue.jdbc.spi.Dialect;
import io.jobqueue.spi.Delivery;
import io.jobqueue.spi.MessageHeaders;
import io.jobqueue.spi.OutboundMessage;
import io.jobqueue.spi.Transport;
import io.jobqueue.spi.TransportMessage;
import io.jobqueue.util.FlatJson;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} that keeps queues in two database tables, so that any
 * number of processes sharing the database can publish and consume.
 *
 * <p>Every queue lives in the message table, ordered by creation time and
 * message id. Consumers lease rows by writing a lock token and a lease end;
 * settling requires the token, so a delivery whose lease expired and was
 * claimed again can no longer be acknowledged by its first consumer. Messages
 * carrying an expiry sit in their holding queue invisible to consumers until
 * expired rows are released into their dead-letter queue, which happens before
 * every claim and depth query. Deduplication ids are recorded in the
 * deduplication table inside the publishing transaction.
 *
 * <p>Each operation borrows its own connection from the
 * {@link ConnectionProvider}; the transport never closes the underlying pool.
 * All time comparisons use the configured {@link Clock}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcTransport transport = JdbcTransport.builder()
 *     .dataSource(dataSource)
 *     .visibilityTimeout(Duration.ofMinutes(2))
 *     .build();
 * }</pre>
 *
 * @see Dialect
 */
public final class JdbcTransport implements Transport {
  private static final Logger logger = Logger.getLogger(JdbcTransport.class.getName());

  public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);
  public static final Duration DEFAULT_DEDUPLICATION_RETENTION = Duration.ofHours(24);

  private static final char TAG_SEPARATOR = ':';

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String messageTable;
  private final String deduplicationTable;
  private final Clock clock;
  private final Duration visibilityTimeout;
  private final Duration pollInterval;
  private final Duration deduplicationRetention;
  private volatile boolean closed;

  private JdbcTransport(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.dialect = builder.dialect != null ? builder.dialect : Dialects.detect(connectionProvider);
    this.messageTable = TableNames.validate(builder.messageTable);
    this.deduplicationTable = TableNames.validate(builder.deduplicationTable);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.visibilityTimeout = builder.visibilityTimeout != null
        ? builder.visibilityTimeout : DEFAULT_VISIBILITY_TIMEOUT;
    this.pollInterval = builder.pollInterval != null ? builder.pollInterval : DEFAULT_POLL_INTERVAL;
    this.deduplicationRetention = builder.deduplicationRetention != null
        ? builder.deduplicationRetention : DEFAULT_DEDUPLICATION_RETENTION;
    if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) {
      throw new IllegalArgumentException("visibilityTimeout must be positive");
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (deduplicationRetention.isNegative()) {
      throw new IllegalArgumentException("deduplicationRetention must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public Dialect dialect() {
    return dialect;
  }

  public ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  public String deduplicationTable() {
    return deduplicationTable;
  }

  public Duration deduplicationRetention() {
    return deduplicationRetention;
  }

  /**
   * Queues are rows keyed by name, so there is nothing to create.
   */
  @Override
  public void declareQueue(String queue) {
    Objects.requireNonNull(queue, "queue");
    ensureOpen();
  }

  @Override
  public boolean publish(String queue, TransportMessage message) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(message, "message");
    ensureOpen();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return insert(conn, queue, message);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to publish to " + queue, e);
    }
  }

  /**
   * Writes all messages over one connection, each in its own transaction.
   */
  @Override
  public void publishBatch(List<OutboundMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) {
      return;
    }
    ensureOpen();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      for (OutboundMessage outbound : messages) {
        insert(conn, outbound.queue(), outbound.message());
      }
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to publish batch of " + messages.size(), e);
    }
  }

  @Override
  public Delivery consume(String queue, Duration maxWait) throws InterruptedException {
    List<Delivery> deliveries = claimWithin(queue, 1, maxWait);
    return deliveries.isEmpty() ? null : deliveries.get(0);
  }

  /**
   * Claims up to {@code maxMessages} rows in one statement.
   */
  @Override
  public List<Delivery> consumeBatch(String queue, int maxMessages, Duration maxWait)
      throws InterruptedException {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    return claimWithin(queue, maxMessages, maxWait);
  }

  @Override
  public boolean ack(Delivery delivery) {
    Objects.requireNonNull(delivery, "delivery");
    return settle(delivery, "DELETE FROM " + messageTable + " WHERE message_id=? AND lock_token=?");
  }

  /**
   * Requeued messages keep their original position, which puts them ahead of
   * everything published after them.
   */
  @Override
  public boolean nack(Delivery delivery, boolean requeue) {
    Objects.requireNonNull(delivery, "delivery");
    return settle(delivery, requeue
        ? "UPDATE " + messageTable + " SET lock_token=NULL, locked_until=NULL WHERE message_id=? AND lock_token=?"
        : "DELETE FROM " + messageTable + " WHERE message_id=? AND lock_token=?");
  }

  /**
   * Succeeds as long as the row still carries this delivery's lock token,
   * even past its lease end, since no other consumer has claimed it yet.
   */
  @Override
  public boolean extendLease(Delivery delivery) {
    Objects.requireNonNull(delivery, "delivery");
    ensureOpen();
    String[] tag = parseTag(delivery);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return JdbcTemplate.update(conn, "UPDATE " + messageTable +
              " SET locked_until=? WHERE message_id=? AND lock_token=?",
          clock.instant().plus(visibilityTimeout), tag[1], tag[0]) > 0;
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to extend lease on " + delivery.queue(), e);
    }
  }

  @Override
  public Duration visibilityTimeout() {
    return visibilityTimeout;
  }

  @Override
  public long depth(String queue) {
    Objects.requireNonNull(queue, "queue");
    ensureOpen();
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      dialect.releaseExpired(conn, messageTable, now);
      return JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + messageTable +
              " WHERE queue_name=? AND (lock_token IS NULL OR locked_until <= ?)",
          rs -> rs.getLong(1), queue, now).get(0);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to count messages in " + queue, e);
    }
  }

  /**
   * Returns how many messages of {@code queue} are leased and whose lease has not ended.
   *
   * @param queue the queue name
   * @return the number of unsettled deliveries
   */
  public long inFlight(String queue) {
    Objects.requireNonNull(queue, "queue");
    ensureOpen();
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + messageTable +
              " WHERE queue_name=? AND lock_token IS NOT NULL AND locked_until > ?",
          rs -> rs.getLong(1), queue, clock.instant()).get(0);
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to count leased messages in " + queue, e);
    }
  }

  /**
   * Stops accepting operations. The connection provider stays open.
   */
  @Override
  public void close() {
    closed = true;
  }

  private boolean insert(Connection conn, String queue, TransportMessage message) throws SQLException {
    Instant now = clock.instant();
    String deduplicationId = message.deduplicationId();
    if (deduplicationId == null) {
      insertMessage(conn, queue, message, now);
      return true;
    }
    // both rows commit together, or neither does
    return JdbcTemplate.inTransaction(conn, tx -> {
      JdbcTemplate.update(tx, "DELETE FROM " + deduplicationTable +
              " WHERE queue_name=? AND dedup_id=? AND created_at < ?",
          queue, deduplicationId, now.minus(deduplicationRetention));
      if (!dialect.insertDeduplicationId(tx, deduplicationTable, queue, deduplicationId, now)) {
        logger.log(Level.FINE, "Discarded duplicate {0} on {1}", new Object[]{deduplicationId, queue});
        return false;
      }
      insertMessage(tx, queue, message, now);
      return true;
    });
  }

  private void insertMessage(Connection conn, String queue, TransportMessage message, Instant now) {
    Map<String, String> headers = new LinkedHashMap<>(message.headers());
    headers.remove(MessageHeaders.EXPIRES_AT);
    headers.remove(MessageHeaders.DEAD_LETTER_QUEUE);
    Instant expiresAt = message.expiresAt();
    JdbcTemplate.update(conn, dialect.insertMessageSql(messageTable),
        UlidCreator.getMonotonicUlid().toString(),
        queue,
        message.body(),
        FlatJson.write(headers),
        expiresAt == null ? null : expiresAt,
        expiresAt == null ? null : message.deadLetterQueue(),
        now);
  }

  private List<Delivery> claimWithin(String queue, int limit, Duration maxWait) throws InterruptedException {
    Objects.requireNonNull(queue, "queue");
    long deadline = System.nanoTime() + Math.max(0, maxWait.toNanos());
    while (true) {
      ensureOpen();
      List<Delivery> deliveries = claim(queue, limit);
      if (!deliveries.isEmpty()) {
        return deliveries;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return List.of();
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollInterval.toNanos()));
    }
  }

  private List<Delivery> claim(String queue, int limit) {
    Instant now = clock.instant();
    String lockToken = UlidCreator.getMonotonicUlid().toString();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int released = dialect.releaseExpired(conn, messageTable, now);
      if (released > 0) {
        logger.log(Level.FINE, "Released {0} expired messages", released);
      }
      List<ClaimedRow> rows = JdbcTemplate.inTransaction(conn, tx ->
          dialect.claim(tx, messageTable, queue, lockToken, now, now.plus(visibilityTimeout), limit));
      List<Delivery> deliveries = new ArrayList<>(rows.size());
      for (ClaimedRow row : rows) {
        if (row.deliveryCount() > 1) {
          logger.log(Level.FINE, "Redelivering {0} on {1} (delivery {2})",
              new Object[]{row.messageId(), queue, row.deliveryCount()});
        }
        Map<String, String> headers = row.headers() == null ? Map.of() : FlatJson.read(row.headers());
        deliveries.add(new Delivery(queue, row.lockToken() + TAG_SEPARATOR + row.messageId(),
            new TransportMessage(row.body(), headers), row.deliveryCount()));
      }
      return deliveries;
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to claim messages from " + queue, e);
    }
  }

  private boolean settle(Delivery delivery, String sql) {
    ensureOpen();
    String[] tag = parseTag(delivery);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (JdbcTemplate.update(conn, sql, tag[1], tag[0]) == 0) {
        logger.log(Level.FINE, "Delivery {0} on {1} was already settled or its lease expired",
            new Object[]{delivery.deliveryTag(), delivery.queue()});
        return false;
      }
      return true;
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to settle delivery on " + delivery.queue(), e);
    }
  }

  /** Splits a delivery tag into lock token and message id. */
  private static String[] parseTag(Delivery delivery) {
    String tag = delivery.deliveryTag();
    int separator = tag.indexOf(TAG_SEPARATOR);
    if (separator < 0) {
      throw new IllegalArgumentException("Not a JdbcTransport delivery tag: " + tag);
    }
    return new String[]{tag.substring(0, separator), tag.substring(separator + 1)};
  }

  private void ensureOpen() {
    if (closed) {
      throw new TransportException("JdbcTransport is closed");
    }
  }

  /** Builder for {@link JdbcTransport}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private String messageTable = TableNames.DEFAULT_MESSAGE_TABLE;
    private String deduplicationTable = TableNames.DEFAULT_DEDUPLICATION_TABLE;
    private Clock clock;
    private Duration visibilityTimeout;
    private Duration pollInterval;
    private Duration deduplicationRetention;

    private Builder() {}

    /**
     * Sets the source of connections.
     *
     * <p><b>Required</b> unless {@link #dataSource(DataSource)} is set.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Shorthand for {@code connectionProvider(ConnectionProvider.of(dataSource))}.
     *
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = ConnectionProvider.of(dataSource);
      return this;
    }

    /**
     * Optional. Detected from the connection URL when not set.
     *
     * @param dialect the dialect
     * @return this builder
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Optional. Defaults to {@value TableNames#DEFAULT_MESSAGE_TABLE}.
     *
     * @param messageTable the message table name
     * @return this builder
     */
    public Builder messageTable(String messageTable) {
      this.messageTable = messageTable;
      return this;
    }

    /**
     * Optional. Defaults to {@value TableNames#DEFAULT_DEDUPLICATION_TABLE}.
     *
     * @param deduplicationTable the deduplication table name
     * @return this builder
     */
    public Builder deduplicationTable(String deduplicationTable) {
      this.deduplicationTable = deduplicationTable;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long a claimed message stays leased before it can be claimed again.
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
     * Sets how often an empty queue is polled while a consumer waits.
     *
     * <p>Optional. Defaults to 200 milliseconds.
     *
     * @param pollInterval the polling interval
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets how long a deduplication id blocks republishing. Older ids are
     * replaced on publish and removed by
     * {@link io.jobqueue.jdbc.purge.DeduplicationPurgeScheduler}.
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

    public JdbcTransport build() {
      return new JdbcTransport(this);
    }
  }
}
