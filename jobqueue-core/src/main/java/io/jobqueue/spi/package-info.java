/**
 * Service provider interfaces: the message {@link io.jobqueue.spi.Transport},
 * job creation, envelope serialization and metrics.
 */
package io.jobqueue.spi;
