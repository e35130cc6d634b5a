/**
 * Micrometer bridge for exporting job queue metrics to Prometheus, Datadog and
 * other backends.
 *
 * @see io.jobqueue.micrometer.MicrometerMetricsExporter
 */
package io.jobqueue.micrometer;
