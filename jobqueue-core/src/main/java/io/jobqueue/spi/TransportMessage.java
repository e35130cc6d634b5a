package io.jobqueue.spi;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Body and headers of a message as seen by a {@link Transport}.
 */
public final class TransportMessage {
  private final byte[] body;
  private final Map<String, String> headers;

  public TransportMessage(byte[] body, Map<String, String> headers) {
    Objects.requireNonNull(body, "body");
    this.body = Arrays.copyOf(body, body.length);
    Map<String, String> copy = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
    if (copy.containsKey(null) || copy.containsValue(null)) {
      throw new IllegalArgumentException("headers cannot contain null keys or values");
    }
    this.headers = Collections.unmodifiableMap(copy);
  }

  public byte[] body() {
    return Arrays.copyOf(body, body.length);
  }

  public Map<String, String> headers() {
    return headers;
  }

  public String header(String name) {
    return headers.get(name);
  }

  /**
   * Returns the expiry instant from {@link MessageHeaders#EXPIRES_AT}, or {@code null}.
   *
   * @return the expiry, or {@code null}
   * @throws IllegalArgumentException if the header is not a number
   */
  public Instant expiresAt() {
    String value = headers.get(MessageHeaders.EXPIRES_AT);
    if (value == null) {
      return null;
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + MessageHeaders.EXPIRES_AT + " header: " + value, e);
    }
  }

  public String deadLetterQueue() {
    return headers.get(MessageHeaders.DEAD_LETTER_QUEUE);
  }

  public String deduplicationId() {
    return headers.get(MessageHeaders.DEDUPLICATION_ID);
  }

  /**
   * Returns a copy with the expiry and dead-letter headers removed, as it
   * looks after the transport released it into its dead-letter queue.
   *
   * @return the released message
   */
  public TransportMessage released() {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.remove(MessageHeaders.EXPIRES_AT);
    copy.remove(MessageHeaders.DEAD_LETTER_QUEUE);
    return new TransportMessage(body, copy);
  }

  public TransportMessage withHeader(String name, String value) {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.put(name, value);
    return new TransportMessage(body, copy);
  }

  @Override
  public String toString() {
    return "TransportMessage{body=" + body.length + " bytes, headers=" + headers + '}';
  }
}
