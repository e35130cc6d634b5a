package io.jobqueue.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.jobqueue.jdbc.dialect.PostgresDialect;
import io.jobqueue.jdbc.spi.Dialect;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@Testcontainers(disabledWithoutDocker = true)
class PostgresJdbcTransportIntegrationTest extends AbstractJdbcTransportTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("jobqueue_test");

  private static HikariDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = ContainerDataSources.withSchema(postgres, "/schema/postgresql.sql");
  }

  @AfterAll
  static void closePool() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @BeforeEach
  void clearTables() throws Exception {
    Schemas.clear(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  Dialect dialect() {
    return new PostgresDialect();
  }
}
