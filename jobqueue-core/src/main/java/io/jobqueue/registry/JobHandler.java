package io.jobqueue.registry;

import io.jobqueue.JobScope;

/**
 * Handles jobs of one type. The scope gives access to resources shared with the
 * other jobs of the same delivery batch.
 */
@FunctionalInterface
public interface JobHandler {

  void handle(byte[] arguments, JobScope scope) throws Exception;
}
