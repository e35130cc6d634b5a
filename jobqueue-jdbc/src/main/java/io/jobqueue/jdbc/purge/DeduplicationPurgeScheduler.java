package io.jobqueue.jdbc.purge;

import io.jobqueue.jdbc.ConnectionProvider;
import io.jobqueue.jdbc.JdbcTransport;
import io.jobqueue.jdbc.TableNames;
import io.jobqueue.jdbc.spi.Dialect;
import io.jobqueue.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes deduplication ids older than the retention window.
 *
 * <p>{@link JdbcTransport} already ignores and replaces stale ids when the same
 * key is published again; this scheduler removes the ids nobody republishes,
 * so the table stays proportional to one retention window of traffic.
 *
 * <p>A cycle deletes up to {@code batchSize} rows per statement, each statement
 * auto-committed on its own connection, and stops at the first short batch.
 *
 * <pre>{@code
 * DeduplicationPurgeScheduler purge = DeduplicationPurgeScheduler.builder()
 *     .transport(jdbcTransport)
 *     .interval(Duration.ofMinutes(30))
 *     .build();
 * purge.start();
 * }</pre>
 */
public final class DeduplicationPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeduplicationPurgeScheduler.class.getName());

  public static final int DEFAULT_BATCH_SIZE = 500;
  public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String table;
  private final Clock clock;
  private final Duration retention;
  private final int batchSize;
  private final Duration interval;

  private ScheduledExecutorService executor;
  private volatile boolean closed;

  private DeduplicationPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
    this.table = TableNames.validate(builder.table);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.retention = builder.retention != null ? builder.retention : JdbcTransport.DEFAULT_DEDUPLICATION_RETENTION;
    this.interval = builder.interval != null ? builder.interval : DEFAULT_INTERVAL;
    this.batchSize = builder.batchSize;
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules a cycle every {@code interval}, the first one after one interval.
   * Calling it again while running has no effect.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeduplicationPurgeScheduler has been closed");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-dedup-purge-"));
    long millis = interval.toMillis();
    executor.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
    logger.log(Level.FINE, "Purging {0} every {1}", new Object[]{table, interval});
  }

  /**
   * Runs one cycle on the calling thread. Failures are logged, not thrown,
   * and the next cycle tries again.
   *
   * @return how many ids were deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(retention);
    long purged = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int deleted = batchSize;
      while (deleted == batchSize && !closed) {
        deleted = dialect.purgeDeduplicationIds(conn, table, cutoff, batchSize);
        purged += deleted;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Purging " + table + " failed after " + purged + " ids", e);
    }
    if (purged > 0) {
      logger.log(Level.INFO, "Purged {0} ids from {1} recorded before {2}", new Object[]{purged, table, cutoff});
    }
    return purged;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Purge of {0} did not stop within 5s", table);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link DeduplicationPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private String table = TableNames.DEFAULT_DEDUPLICATION_TABLE;
    private Clock clock;
    private Duration retention;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration interval;

    private Builder() {}

    /**
     * Takes connections, dialect, table and retention from {@code transport}.
     *
     * @param transport the transport whose deduplication ids are purged
     * @return this builder
     */
    public Builder transport(JdbcTransport transport) {
      Objects.requireNonNull(transport, "transport");
      this.connectionProvider = transport.connectionProvider();
      this.dialect = transport.dialect();
      this.table = transport.deduplicationTable();
      this.retention = transport.deduplicationRetention();
      return this;
    }

    /**
     * <p><b>Required</b> unless {@link #transport(JdbcTransport)} is set.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required</b> unless {@link #transport(JdbcTransport)} is set.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public Builder table(String table) {
      this.table = table;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Ids recorded longer ago than this are deleted. Keep it equal to the
     * transport's deduplication retention.
     *
     * <p>Optional. Defaults to 24 hours.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /** Optional. Defaults to {@value #DEFAULT_BATCH_SIZE} rows per statement. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to one hour between cycles. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public DeduplicationPurgeScheduler build() {
      return new DeduplicationPurgeScheduler(this);
    }
  }
}
