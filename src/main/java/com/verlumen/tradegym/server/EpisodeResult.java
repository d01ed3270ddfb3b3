package com.verlumen.tradegym.server;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.time.Duration;
import java.time.Instant;

/** The record {@code getstat} reports for a completed episode. */
@AutoValue
public abstract class EpisodeResult {
  public abstract int episode();

  public abstract Instant startTime();

  public abstract Duration runtime();

  /** Engine ticks in the episode. */
  public abstract int length();

  public abstract boolean done();

  /** Whether the controller ended the episode early with {@code done}. */
  public abstract boolean earlyStop();

  /** Analyzer results by name. */
  public abstract ImmutableMap<String, JsonElement> analyses();

  public static Builder builder() {
    return new AutoValue_EpisodeResult.Builder();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("episode", episode());
    json.addProperty("start_time", startTime().toString());
    json.addProperty("runtime", runtime().toMillis() / 1000.0);
    json.addProperty("length", length());
    json.addProperty("done", done());
    json.addProperty("early_stop", earlyStop());
    analyses().forEach((name, result) -> json.add(name, result.deepCopy()));
    return json;
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEpisode(int episode);

    public abstract Builder setStartTime(Instant startTime);

    public abstract Builder setRuntime(Duration runtime);

    public abstract Builder setLength(int length);

    public abstract Builder setDone(boolean done);

    public abstract Builder setEarlyStop(boolean earlyStop);

    public abstract Builder setAnalyses(ImmutableMap<String, JsonElement> analyses);

    public abstract EpisodeResult build();
  }
}
