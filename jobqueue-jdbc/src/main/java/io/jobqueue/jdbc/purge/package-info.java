/**
 * Scheduled cleanup of the deduplication table.
 *
 * <p>The delete statement comes from the {@link io.jobqueue.jdbc.spi.Dialect}:
 * a subquery-bounded {@code DELETE} by default and
 * {@code DELETE...ORDER BY...LIMIT} on MySQL.
 */
package io.jobqueue.jdbc.purge;
