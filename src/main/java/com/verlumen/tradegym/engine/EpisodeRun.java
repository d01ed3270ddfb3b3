package com.verlumen.tradegym.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;

/** Outcome of one {@link BacktestEngine#run()}. */
@AutoValue
public abstract class EpisodeRun {
  /** Analyzer results by analyzer name, including the step hook's entry. */
  public abstract ImmutableMap<String, JsonElement> analyses();

  /** Number of ticks the engine went through. */
  public abstract int length();

  public static EpisodeRun create(ImmutableMap<String, JsonElement> analyses, int length) {
    return new AutoValue_EpisodeRun(analyses, length);
  }
}
