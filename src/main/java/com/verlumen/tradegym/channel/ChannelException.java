package com.verlumen.tradegym.channel;

import java.io.IOException;

/** A failed {@code send} or {@code receive} on a {@link MessageChannel}. */
public final class ChannelException extends IOException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The configured send or receive timeout elapsed. */
    TIMED_OUT,
    /** Any other transport fault: refused connection, peer gone, undecodable frame. */
    TRANSPORT_ERROR
  }

  private final Kind kind;

  private ChannelException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static ChannelException timedOut(String message) {
    return new ChannelException(Kind.TIMED_OUT, message, null);
  }

  public static ChannelException transportError(String message) {
    return new ChannelException(Kind.TRANSPORT_ERROR, message, null);
  }

  public static ChannelException transportError(String message, Throwable cause) {
    return new ChannelException(Kind.TRANSPORT_ERROR, message, cause);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTimeout() {
    return kind == Kind.TIMED_OUT;
  }
}
