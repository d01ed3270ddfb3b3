package com.verlumen.tradegym.engine;

import com.google.gson.JsonObject;
import java.io.IOException;

/**
 * Callback the engine invokes once per tick, after the tick's accounting is done and before the
 * pending action is executed on the next tick.
 */
public interface StepHook {
  /** Name under which the hook's own analysis appears in {@link EpisodeRun#analyses()}. */
  String NAME = "_env_analyzer";

  void onTick() throws IOException;

  JsonObject analysis();
}
