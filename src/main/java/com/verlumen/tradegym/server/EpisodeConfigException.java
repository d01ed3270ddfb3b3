package com.verlumen.tradegym.server;

/** A {@code reset} whose configuration cannot produce an episode. */
final class EpisodeConfigException extends Exception {
  EpisodeConfigException(String message) {
    super(message);
  }

  EpisodeConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
