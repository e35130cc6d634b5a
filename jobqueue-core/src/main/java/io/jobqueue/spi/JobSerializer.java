package io.jobqueue.spi;

import io.jobqueue.JobEnvelope;

/**
 * Converts envelopes to and from message bodies. Round-tripping an envelope
 * must yield an equal envelope.
 *
 * <p>Failures are reported as {@link io.jobqueue.JobSerializationException}.
 */
public interface JobSerializer {

  byte[] serialize(JobEnvelope envelope);

  JobEnvelope deserialize(byte[] body);
}
