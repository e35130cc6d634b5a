package io.jobqueue.jdbc.dialect;

import io.jobqueue.jdbc.JdbcTemplate;
import io.jobqueue.jdbc.spi.ClaimedRow;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean insertDeduplicationId(Connection conn, String table, String queue,
      String deduplicationId, Instant now) {
    return JdbcTemplate.update(conn,
        "INSERT IGNORE INTO " + table + " (queue_name, dedup_id, created_at) VALUES (?,?,?)",
        queue, deduplicationId, now) > 0;
  }

  @Override
  public List<ClaimedRow> claim(Connection conn, String table, String queue, String lockToken,
      Instant now, Instant lockedUntil, int limit) {
    // MySQL rejects LIMIT inside IN subqueries, so lock the ids first
    List<String> ids = JdbcTemplate.query(conn,
        "SELECT message_id FROM " + table + " WHERE " + AVAILABLE +
            " ORDER BY created_at, message_id LIMIT ? FOR UPDATE SKIP LOCKED",
        rs -> rs.getString(1), queue, now, limit);
    if (ids.isEmpty()) return List.of();
    List<Object> params = new ArrayList<>();
    params.add(lockToken);
    params.add(lockedUntil);
    params.addAll(ids);
    JdbcTemplate.update(conn, "UPDATE " + table +
        " SET lock_token=?, locked_until=?, delivery_count=delivery_count+1" +
        " WHERE message_id IN (" + String.join(",", Collections.nCopies(ids.size(), "?")) + ")",
        params.toArray());
    return selectClaimed(conn, table, lockToken);
  }

  @Override
  public int purgeDeduplicationIds(Connection conn, String table, Instant before, int limit) {
    // MySQL supports DELETE...ORDER BY...LIMIT (no subquery needed)
    return JdbcTemplate.update(conn,
        "DELETE FROM " + table + " WHERE created_at < ? ORDER BY created_at LIMIT ?",
        before, limit);
  }
}
