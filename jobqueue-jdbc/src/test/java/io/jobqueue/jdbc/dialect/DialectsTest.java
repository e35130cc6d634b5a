package io.jobqueue.jdbc.dialect;

import io.jobqueue.jdbc.spi.Dialect;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void registersBuiltInDialects() {
    assertEquals(3, Dialects.all().size());
    assertInstanceOf(H2Dialect.class, Dialects.get("h2"));
    assertInstanceOf(PostgresDialect.class, Dialects.get("PostgreSQL"));
    assertInstanceOf(MySqlDialect.class, Dialects.get("mysql"));
  }

  @Test
  void unknownNameListsAvailableDialects() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> Dialects.get("oracle"));
    assertTrue(error.getMessage().contains("postgresql"));
  }

  @Test
  void detectsFromJdbcUrl() {
    assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://db:5432/jobs").name());
    assertEquals("mysql", Dialects.detect("jdbc:mysql://db/jobs").name());
    assertEquals("mysql", Dialects.detect("jdbc:tidb://db/jobs").name());
  }

  @Test
  void rejectsUnknownOrMissingUrls() {
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect("jdbc:sqlserver://db"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
  }

  @Test
  void connectionFailureDuringDetectionIsReported() {
    IllegalStateException error = assertThrows(IllegalStateException.class, () -> Dialects.detect(() -> {
      throw new SQLException("database down");
    }));
    assertInstanceOf(SQLException.class, error.getCause());
  }

  @Test
  void dialectSqlTargetsConfiguredTable() {
    for (Dialect dialect : Dialects.all()) {
      String sql = dialect.insertMessageSql("custom_jobs");
      assertTrue(sql.startsWith("INSERT INTO custom_jobs "), dialect.name());
      assertEquals(7, sql.chars().filter(c -> c == '?').count(), dialect.name());
    }
  }
}
