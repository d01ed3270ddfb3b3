package com.verlumen.tradegym.channel;

/**
 * A broken contract between the server and one of its peers.
 *
 * <p>Protocol errors are never retried: once raised the session cannot safely continue.
 */
public final class ProtocolException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** An in-episode request carried neither {@code ctrl} nor {@code action}. */
    MISSING_ACTION,
    /** An in-episode request carried a {@code ctrl} other than {@code render} or {@code done}. */
    UNKNOWN_CONTROL,
    /** A send or receive was attempted out of request/reply order. */
    OUT_OF_ORDER_EXCHANGE
  }

  private final Kind kind;

  public ProtocolException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
