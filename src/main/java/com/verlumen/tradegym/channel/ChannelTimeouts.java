package com.verlumen.tradegym.channel;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Optional;

/**
 * Send and receive limits for a {@link MessageChannel}.
 *
 * <p>The receive timeout may be {@link #UNBOUNDED}; the send timeout is always strictly positive.
 */
public record ChannelTimeouts(Optional<Duration> receiveTimeout, Duration sendTimeout) {
  /** Sentinel for a receive that waits as long as it takes. */
  public static final Optional<Duration> UNBOUNDED = Optional.empty();

  public ChannelTimeouts {
    receiveTimeout.ifPresent(
        timeout ->
            checkArgument(
                !timeout.isNegative() && !timeout.isZero(),
                "Receive timeout must be positive: %s",
                timeout));
    checkArgument(
        !sendTimeout.isNegative() && !sendTimeout.isZero(),
        "Send timeout must be positive: %s",
        sendTimeout);
  }

  public static ChannelTimeouts bounded(Duration receiveTimeout, Duration sendTimeout) {
    return new ChannelTimeouts(Optional.of(receiveTimeout), sendTimeout);
  }

  public static ChannelTimeouts unboundedReceive(Duration sendTimeout) {
    return new ChannelTimeouts(UNBOUNDED, sendTimeout);
  }
}
