package io.jobqueue.jdbc.purge;

import io.jobqueue.jdbc.ConnectionProvider;
import io.jobqueue.jdbc.JdbcTransport;
import io.jobqueue.jdbc.MutableClock;
import io.jobqueue.jdbc.Schemas;
import io.jobqueue.jdbc.dialect.H2Dialect;
import io.jobqueue.spi.MessageHeaders;
import io.jobqueue.spi.TransportMessage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeduplicationPurgeSchedulerTest {
  private static final Instant START = Instant.parse("2030-01-15T12:00:00Z");

  private static JdbcDataSource dataSource;
  private MutableClock clock;
  private JdbcTransport transport;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:jobqueue_purge;DB_CLOSE_DELAY=-1");
    Schemas.apply(dataSource, "/schema/h2.sql");
  }

  @BeforeEach
  void setUp() throws Exception {
    Schemas.clear(dataSource);
    clock = new MutableClock(START);
    transport = JdbcTransport.builder().dataSource(dataSource).dialect(new H2Dialect()).clock(clock).build();
  }

  private DeduplicationPurgeScheduler.Builder scheduler() {
    return DeduplicationPurgeScheduler.builder()
        .connectionProvider(ConnectionProvider.of(dataSource))
        .dialect(new H2Dialect())
        .clock(clock)
        .retention(Duration.ofHours(1));
  }

  @Test
  void deletesOnlyIdsOlderThanRetention() throws Exception {
    for (int i = 0; i < 5; i++) {
      publish("old-" + i);
    }
    clock.advance(Duration.ofMinutes(90));
    publish("fresh");

    DeduplicationPurgeScheduler purge = scheduler().batchSize(2).build();
    assertEquals(5, purge.runOnce());
    assertEquals(1, countDeduplicationIds());
    assertEquals(0, purge.runOnce());
    purge.close();

    assertEquals(6, transport.depth("jobs.regular"));
  }

  @Test
  void closedSchedulerDoesNothing() throws Exception {
    publish("old");
    clock.advance(Duration.ofHours(2));

    DeduplicationPurgeScheduler purge = scheduler().build();
    purge.close();

    assertEquals(0, purge.runOnce());
    assertEquals(1, countDeduplicationIds());
    assertThrows(IllegalStateException.class, purge::start);
  }

  @Test
  void takesSettingsFromTransport() throws Exception {
    JdbcTransport shortLived = JdbcTransport.builder()
        .dataSource(dataSource)
        .dialect(new H2Dialect())
        .clock(clock)
        .deduplicationRetention(Duration.ofMinutes(10))
        .build();
    assertTrue(shortLived.publish("jobs.regular", new TransportMessage(new byte[0],
        Map.of(MessageHeaders.DEDUPLICATION_ID, "short"))));
    clock.advance(Duration.ofMinutes(11));

    DeduplicationPurgeScheduler purge = DeduplicationPurgeScheduler.builder()
        .transport(shortLived)
        .clock(clock)
        .build();
    assertEquals(1, purge.runOnce());
    assertEquals(0, countDeduplicationIds());
    purge.close();
  }

  @Test
  void startIsIdempotent() {
    try (DeduplicationPurgeScheduler purge = scheduler().interval(Duration.ofHours(1)).build()) {
      purge.start();
      purge.start();
    }
  }

  @Test
  void storeFailuresAreLoggedNotThrown() {
    DeduplicationPurgeScheduler purge = scheduler().table("missing_table").build();

    assertEquals(0, purge.runOnce());
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(NullPointerException.class, () -> DeduplicationPurgeScheduler.builder().build());
    assertThrows(IllegalArgumentException.class, () -> scheduler().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> scheduler().interval(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> scheduler().retention(Duration.ofSeconds(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> scheduler().table("bad name").build());
  }

  private void publish(String deduplicationId) {
    assertTrue(transport.publish("jobs.regular", new TransportMessage(new byte[0],
        Map.of(MessageHeaders.DEDUPLICATION_ID, deduplicationId))));
  }

  private static long countDeduplicationIds() throws Exception {
    try (Connection conn = dataSource.getConnection();
         Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM job_dedup")) {
      rs.next();
      return rs.getLong(1);
    }
  }
}
