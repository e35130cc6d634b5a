/**
 * Queue classes, routing rules and physical queue naming.
 *
 * @see io.jobqueue.routing.QueueRouter
 */
package io.jobqueue.routing;
