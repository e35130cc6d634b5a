package io.jobqueue.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Static JDBC helpers shared by {@link JdbcTransport} and the dialects.
 *
 * <p>Every {@link SQLException} surfaces as a {@link QueueStoreException}, so
 * callers see the transport's unchecked error type. {@link Instant} parameters
 * are bound as timestamps.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface TransactionBody<T> {
    T run(Connection conn) throws SQLException;
  }

  /** Runs a statement without a result set and returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new QueueStoreException("Statement failed: " + verb(sql), e);
    }
  }

  /**
   * Runs an INSERT against a table with a unique key.
   *
   * @return {@code false} if the key was already taken
   */
  public static boolean tryInsert(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      if (isUniqueViolation(e)) {
        return false;
      }
      throw new QueueStoreException("Statement failed: " + verb(sql), e);
    }
  }

  /**
   * Runs a statement producing rows: a SELECT, or an UPDATE ... RETURNING
   * where the database supports it.
   */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
      return rows;
    } catch (SQLException e) {
      throw new QueueStoreException("Query failed: " + verb(sql), e);
    }
  }

  /**
   * Runs {@code body} in one transaction on {@code conn} and restores the
   * connection's auto-commit mode afterwards. Any exception rolls back.
   */
  public static <T> T inTransaction(Connection conn, TransactionBody<T> body) throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      T result = body.run(conn);
      conn.commit();
      return result;
    } catch (RuntimeException | SQLException e) {
      try {
        conn.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  /** SQLState class 23: integrity constraint violation. */
  static boolean isUniqueViolation(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof byte[] bytes) {
      ps.setBytes(index, bytes);
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else {
      ps.setObject(index, param);
    }
  }

  private static String verb(String sql) {
    String trimmed = sql.stripLeading();
    int space = trimmed.indexOf(' ');
    return space < 0 ? trimmed : trimmed.substring(0, space);
  }

  private JdbcTemplate() {}
}
