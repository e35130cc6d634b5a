/**
 * Retry policies and their decisions.
 */
package io.jobqueue.retry;
