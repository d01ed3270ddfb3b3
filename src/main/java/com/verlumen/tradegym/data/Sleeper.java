package com.verlumen.tradegym.data;

import java.time.Duration;

/** Pauses the calling thread. */
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
  }
}
