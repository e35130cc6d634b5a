/**
 * Database-backed {@link io.jobqueue.spi.Transport}.
 *
 * <p>{@link io.jobqueue.jdbc.JdbcTransport} stores messages in
 * {@code job_message} and deduplication ids in {@code job_dedup}. Table DDL for
 * H2, PostgreSQL and MySQL ships under {@code schema/} on the classpath.
 *
 * @see io.jobqueue.jdbc.JdbcTransport
 * @see io.jobqueue.jdbc.dialect.Dialects
 */
package io.jobqueue.jdbc;
