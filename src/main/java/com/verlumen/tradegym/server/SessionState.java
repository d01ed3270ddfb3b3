package com.verlumen.tradegym.server;

/** Modes of a controller session. */
public enum SessionState {
  /** Only control commands are accepted. */
  CONTROL,
  /** The engine is ticking and actions are expected. */
  EPISODE,
  TERMINATED
}
