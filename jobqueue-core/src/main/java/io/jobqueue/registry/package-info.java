/**
 * Job type to handler registry.
 */
package io.jobqueue.registry;
