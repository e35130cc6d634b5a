package io.jobqueue.jdbc.spi;

import java.time.Instant;

/**
 * A message row leased by {@link Dialect#claim}.
 *
 * @param messageId row id
 * @param lockToken token written by the claim; settling requires it
 * @param body message body
 * @param headers headers as flat JSON, or {@code null}
 * @param deliveryCount delivery count including this delivery
 * @param createdAt queue position
 */
public record ClaimedRow(
    String messageId,
    String lockToken,
    byte[] body,
    String headers,
    int deliveryCount,
    Instant createdAt) {
}
