/**
 * Built-in {@link io.jobqueue.jdbc.spi.Dialect} implementations.
 *
 * <p>{@link io.jobqueue.jdbc.dialect.AbstractDialect} claims with an
 * {@code UPDATE} over an ordered subquery, which suits H2. PostgreSQL and MySQL
 * claim with {@code FOR UPDATE SKIP LOCKED}.
 */
package io.jobqueue.jdbc.dialect;
