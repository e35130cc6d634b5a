/**
 * Built-in transports. Database-backed transports live in the
 * {@code jobqueue-jdbc} module.
 */
package io.jobqueue.transport;
