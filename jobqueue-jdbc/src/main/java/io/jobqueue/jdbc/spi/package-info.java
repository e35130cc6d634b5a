/**
 * Extension point for additional databases.
 */
package io.jobqueue.jdbc.spi;
