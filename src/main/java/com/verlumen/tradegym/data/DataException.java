package com.verlumen.tradegym.data;

/** Failure to obtain data from the data provider. Always fatal to the session. */
public final class DataException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The provider could not be reached or answered with something unusable. */
    UNREACHABLE,
    /** The provider kept reporting "not ready" past the wait budget. */
    TIMEOUT
  }

  private final Kind kind;

  private DataException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static DataException unreachable(String message) {
    return new DataException(Kind.UNREACHABLE, message, null);
  }

  public static DataException unreachable(String message, Throwable cause) {
    return new DataException(Kind.UNREACHABLE, message, cause);
  }

  public static DataException timeout(String message) {
    return new DataException(Kind.TIMEOUT, message, null);
  }

  public static DataException timeout(String message, Throwable cause) {
    return new DataException(Kind.TIMEOUT, message, cause);
  }

  public Kind kind() {
    return kind;
  }
}
