package io.jobqueue.jdbc.dialect;

import io.jobqueue.jdbc.JdbcTemplate;
import io.jobqueue.jdbc.spi.ClaimedRow;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED} so concurrent consumers never
 * wait on each other's rows.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertDeduplicationId(Connection conn, String table, String queue,
      String deduplicationId, Instant now) {
    // a failed INSERT would abort the surrounding transaction
    return JdbcTemplate.update(conn,
        "INSERT INTO " + table + " (queue_name, dedup_id, created_at) VALUES (?,?,?)" +
            " ON CONFLICT (queue_name, dedup_id) DO NOTHING",
        queue, deduplicationId, now) > 0;
  }

  @Override
  public List<ClaimedRow> claim(Connection conn, String table, String queue, String lockToken,
      Instant now, Instant lockedUntil, int limit) {
    String sql = "UPDATE " + table +
        " SET lock_token=?, locked_until=?, delivery_count=delivery_count+1" +
        " WHERE message_id IN (" +
        "SELECT message_id FROM " + table + " WHERE " + AVAILABLE +
        " ORDER BY created_at, message_id LIMIT ? FOR UPDATE SKIP LOCKED)" +
        " RETURNING " + CLAIMED_COLUMNS;
    List<ClaimedRow> rows = new ArrayList<>(JdbcTemplate.query(conn, sql, CLAIMED_ROW_MAPPER,
        lockToken, lockedUntil, queue, now, limit));
    rows.sort(Comparator.comparing(ClaimedRow::createdAt).thenComparing(ClaimedRow::messageId));
    return rows;
  }
}
