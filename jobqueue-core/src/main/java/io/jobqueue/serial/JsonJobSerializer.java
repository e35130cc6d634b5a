package io.jobqueue.serial;

import io.jobqueue.JobEnvelope;
import io.jobqueue.JobSerializationException;
import io.jobqueue.schedule.Schedule;
import io.jobqueue.spi.JobSerializer;
import io.jobqueue.util.FlatJson;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes envelopes as a flat UTF-8 JSON object.
 *
 * <pre>{@code
 * {"v":"1","jobId":"01J...","jobType":"send-invoice","arguments":"eyJpZCI6NDJ9",
 *  "timeout":"PT5S","attempt":"0","enqueuedAt":"2024-05-01T10:00:00Z"}
 * }</pre>
 *
 * <p>Arguments are Base64; durations and instants use their ISO-8601 text so
 * nanosecond precision survives the round trip. Absent optional fields are
 * omitted.
 */
public final class JsonJobSerializer implements JobSerializer {
  static final String FORMAT_VERSION = "1";

  @Override
  public byte[] serialize(JobEnvelope envelope) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("v", FORMAT_VERSION);
    fields.put("jobId", envelope.jobId());
    fields.put("jobType", envelope.jobType());
    fields.put("arguments", Base64.getEncoder().encodeToString(envelope.arguments()));
    fields.put("timeout", envelope.timeout().toString());
    fields.put("attempt", Integer.toString(envelope.attempt()));
    fields.put("notBefore", text(envelope.notBefore()));
    if (envelope.isPeriodic()) {
      fields.put("periodicId", envelope.periodicId());
      fields.put("schedule", envelope.schedule().asText());
    }
    fields.put("enqueuedAt", envelope.enqueuedAt().toString());
    fields.put("lastError", envelope.lastError());
    fields.put("failedAt", text(envelope.failedAt()));
    return FlatJson.write(fields).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public JobEnvelope deserialize(byte[] body) {
    if (body == null || body.length == 0) {
      throw new JobSerializationException("Empty job payload");
    }
    try {
      Map<String, String> fields = FlatJson.read(new String(body, StandardCharsets.UTF_8));
      String version = fields.get("v");
      if (!FORMAT_VERSION.equals(version)) {
        throw new JobSerializationException("Unsupported envelope format version: " + version);
      }
      JobEnvelope.Builder builder = JobEnvelope.builder(required(fields, "jobType"))
          .jobId(required(fields, "jobId"))
          .arguments(Base64.getDecoder().decode(required(fields, "arguments")))
          .timeout(Duration.parse(required(fields, "timeout")))
          .attempt(Integer.parseInt(required(fields, "attempt")))
          .notBefore(instant(fields.get("notBefore")))
          .enqueuedAt(Instant.parse(required(fields, "enqueuedAt")))
          .lastError(fields.get("lastError"))
          .failedAt(instant(fields.get("failedAt")));
      String periodicId = fields.get("periodicId");
      String schedule = fields.get("schedule");
      if (periodicId != null || schedule != null) {
        builder.periodic(periodicId, schedule == null ? null : Schedule.parse(schedule));
      }
      return builder.build();
    } catch (JobSerializationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new JobSerializationException("Cannot decode job envelope: " + e.getMessage(), e);
    }
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null) {
      throw new JobSerializationException("Missing field '" + name + "' in job envelope");
    }
    return value;
  }

  private static String text(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static Instant instant(String text) {
    return text == null ? null : Instant.parse(text);
  }
}
