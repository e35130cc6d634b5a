package io.jobqueue.jdbc.dialect;

import io.jobqueue.jdbc.JdbcTemplate;
import io.jobqueue.jdbc.spi.ClaimedRow;
import io.jobqueue.jdbc.spi.Dialect;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String CLAIMED_COLUMNS =
      "message_id, lock_token, body, headers, delivery_count, created_at";

  protected static final JdbcTemplate.RowMapper<ClaimedRow> CLAIMED_ROW_MAPPER = rs -> new ClaimedRow(
      rs.getString("message_id"),
      rs.getString("lock_token"),
      rs.getBytes("body"),
      rs.getString("headers"),
      rs.getInt("delivery_count"),
      rs.getTimestamp("created_at").toInstant());

  protected static final String AVAILABLE =
      "queue_name=? AND expires_at IS NULL AND (lock_token IS NULL OR locked_until <= ?)";

  @Override
  public String insertMessageSql(String table) {
    return "INSERT INTO " + table + " (" +
        "message_id, queue_name, body, headers, expires_at, dead_letter_queue, created_at, " +
        "delivery_count, lock_token, locked_until" +
        ") VALUES (?,?,?,?,?,?,?,0,NULL,NULL)";
  }

  @Override
  public boolean insertDeduplicationId(Connection conn, String table, String queue,
      String deduplicationId, Instant now) {
    return JdbcTemplate.tryInsert(conn,
        "INSERT INTO " + table + " (queue_name, dedup_id, created_at) VALUES (?,?,?)",
        queue, deduplicationId, now);
  }

  @Override
  public int releaseExpired(Connection conn, String table, Instant now) {
    int released = JdbcTemplate.update(conn, "UPDATE " + table +
        " SET created_at=expires_at, queue_name=dead_letter_queue, dead_letter_queue=NULL, expires_at=NULL" +
        " WHERE expires_at <= ? AND dead_letter_queue IS NOT NULL", now);
    int dropped = JdbcTemplate.update(conn, "DELETE FROM " + table +
        " WHERE expires_at <= ? AND dead_letter_queue IS NULL", now);
    return released + dropped;
  }

  @Override
  public List<ClaimedRow> claim(Connection conn, String table, String queue, String lockToken,
      Instant now, Instant lockedUntil, int limit) {
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + table +
        " SET lock_token=?, locked_until=?, delivery_count=delivery_count+1" +
        " WHERE message_id IN (" +
        "SELECT message_id FROM " + table + " WHERE " + AVAILABLE +
        " ORDER BY created_at, message_id LIMIT ?)" +
        " AND (lock_token IS NULL OR locked_until <= ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        lockToken, lockedUntil, queue, now, limit, now);
    if (updated == 0) return List.of();
    // Phase 2: SELECT claimed rows
    return selectClaimed(conn, table, lockToken);
  }

  @Override
  public int purgeDeduplicationIds(Connection conn, String table, Instant before, int limit) {
    String sql = "DELETE FROM " + table + " WHERE created_at < ? AND dedup_id IN (" +
        "SELECT dedup_id FROM " + table + " WHERE created_at < ? ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, before, limit);
  }

  protected List<ClaimedRow> selectClaimed(Connection conn, String table, String lockToken) {
    return JdbcTemplate.query(conn,
        "SELECT " + CLAIMED_COLUMNS + " FROM " + table +
            " WHERE lock_token=? ORDER BY created_at, message_id",
        CLAIMED_ROW_MAPPER, lockToken);
  }
}
