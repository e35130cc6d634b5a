/**
 * Default envelope serializer.
 */
package io.jobqueue.serial;
