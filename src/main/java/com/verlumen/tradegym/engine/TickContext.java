package com.verlumen.tradegym.engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/** The engine's view of the current tick, as seen from a {@link StepHook}. */
public interface TickContext {
  /** Zero-based number of the current tick within the episode. */
  int tick();

  boolean isDone();

  /** Info record of the current tick. */
  JsonObject info();

  JsonElement rawState();

  JsonElement state();

  double reward();

  /** Sets the action the engine executes on the next tick. */
  void setAction(String action);

  void setLastAction(String action);

  void closePositions();

  /** Stops the run after the current tick. */
  void halt();
}
