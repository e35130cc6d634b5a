package io.jobqueue.jdbc.spi;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the message and
 * deduplication tables. Register custom dialects via
 * {@code META-INF/services/io.jobqueue.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see io.jobqueue.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL for inserting a message.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>message_id (String)</li>
   *   <li>queue_name (String)</li>
   *   <li>body (byte[])</li>
   *   <li>headers (String/JSON)</li>
   *   <li>expires_at (Timestamp, nullable)</li>
   *   <li>dead_letter_queue (String, nullable)</li>
   *   <li>created_at (Timestamp)</li>
   * </ol>
   */
  String insertMessageSql(String table);

  /**
   * Records a deduplication id for a queue.
   *
   * @return {@code false} if the id is already recorded for that queue
   */
  boolean insertDeduplicationId(Connection conn, String table, String queue,
      String deduplicationId, Instant now);

  /**
   * Moves expired messages into their dead-letter queue and deletes expired
   * messages that have none. A released message takes its expiry instant as
   * its queue position.
   *
   * @return number of rows released or deleted
   */
  int releaseExpired(Connection conn, String table, Instant now);

  /**
   * Leases up to {@code limit} available messages of a queue, oldest first.
   *
   * <p>A message is available when it has no expiry and is either unleased or
   * its lease ended at or before {@code now}. Claimed rows get the lock token,
   * {@code lockedUntil} and an incremented delivery count.
   *
   * @return claimed rows ordered by queue position
   */
  List<ClaimedRow> claim(Connection conn, String table, String queue, String lockToken,
      Instant now, Instant lockedUntil, int limit);

  /**
   * Deletes up to {@code limit} deduplication ids recorded before {@code before}.
   *
   * @return number of rows deleted
   */
  int purgeDeduplicationIds(Connection conn, String table, Instant before, int limit);
}
