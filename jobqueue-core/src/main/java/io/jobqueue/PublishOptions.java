package io.jobqueue;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-publish settings: when the job may run and how long it may take.
 *
 * <pre>{@code
 * publisher.publish("send-invoice", args,
 *     PublishOptions.builder().delay(Duration.ofMinutes(5)).timeout(Duration.ofSeconds(30)).build());
 * }</pre>
 */
public final class PublishOptions {
  public static final PublishOptions DEFAULT = builder().build();

  private final Duration delay;
  private final Instant notBefore;
  private final Duration timeout;

  private PublishOptions(Builder builder) {
    if (builder.delay != null && builder.notBefore != null) {
      throw new IllegalArgumentException("Set either delay or notBefore, not both");
    }
    if (builder.delay != null && builder.delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (builder.timeout != null && (builder.timeout.isZero() || builder.timeout.isNegative())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.delay = builder.delay;
    this.notBefore = builder.notBefore;
    this.timeout = builder.timeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PublishOptions delay(Duration delay) {
    return builder().delay(delay).build();
  }

  public static PublishOptions timeout(Duration timeout) {
    return builder().timeout(timeout).build();
  }

  public Duration delay() {
    return delay;
  }

  public Instant notBefore() {
    return notBefore;
  }

  public Duration timeout() {
    return timeout;
  }

  /** Builder for {@link PublishOptions}. */
  public static final class Builder {
    private Duration delay;
    private Instant notBefore;
    private Duration timeout;

    private Builder() {}

    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    public Builder notBefore(Instant notBefore) {
      this.notBefore = notBefore;
      return this;
    }

    /**
     * Sets the execution budget. Optional; defaults to {@link JobEnvelope#DEFAULT_TIMEOUT}.
     * Jobs with a timeout above ten seconds run on the long-running queue.
     *
     * @param timeout the timeout
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public PublishOptions build() {
      return new PublishOptions(this);
    }
  }
}
