package com.verlumen.tradegym.render;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/** What the controller was told on the last communicated step, kept for rendering. */
@AutoValue
public abstract class StepSnapshot {
  public abstract JsonElement rawState();

  public abstract JsonElement state();

  public abstract double reward();

  public abstract boolean done();

  /** Info records of every tick since the previous communicated step. */
  public abstract ImmutableList<JsonObject> info();

  public static StepSnapshot create(
      JsonElement rawState,
      JsonElement state,
      double reward,
      boolean done,
      ImmutableList<JsonObject> info) {
    return new AutoValue_StepSnapshot(rawState, state, reward, done, info);
  }
}
