package com.verlumen.tradegym.sample;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.Optional;

/**
 * Parameters for drawing a trial from the data provider or an episode from a trial.
 *
 * <p>Keys absent from a request keep their defaults: {@code get_new=true}, {@code sample_type=0},
 * no {@code timestamp}, {@code b_alpha=1.0}, {@code b_beta=1.0}.
 */
@AutoValue
public abstract class SampleConfig {
  static final String GET_NEW = "get_new";
  static final String SAMPLE_TYPE = "sample_type";
  static final String TIMESTAMP = "timestamp";
  static final String B_ALPHA = "b_alpha";
  static final String B_BETA = "b_beta";

  private static final ImmutableList<String> KEYS =
      ImmutableList.of(GET_NEW, SAMPLE_TYPE, TIMESTAMP, B_ALPHA, B_BETA);

  public static final int TRAIN = 0;
  public static final int TEST = 1;

  /** Whether a fresh trial must be fetched even if one is cached. */
  public abstract boolean getNew();

  /** {@link #TRAIN} or {@link #TEST}. */
  public abstract int sampleType();

  /** Epoch seconds to anchor the sample at, instead of drawing a random start. */
  public abstract Optional<Long> timestamp();

  /** Alpha of the Beta distribution the start position is drawn from. */
  public abstract double bAlpha();

  /** Beta of the Beta distribution the start position is drawn from. */
  public abstract double bBeta();

  public static SampleConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_SampleConfig.Builder()
        .setGetNew(true)
        .setSampleType(TRAIN)
        .setBAlpha(1.0)
        .setBBeta(1.0);
  }

  public abstract Builder toBuilder();

  /** Reads a config, filling every missing or null key from the defaults. */
  public static SampleConfig fromJson(JsonObject json) {
    Builder builder = builder();
    present(json, GET_NEW).ifPresent(value -> builder.setGetNew(value.getAsBoolean()));
    present(json, SAMPLE_TYPE).ifPresent(value -> builder.setSampleType(value.getAsInt()));
    present(json, TIMESTAMP).ifPresent(value -> builder.setTimestamp(value.getAsLong()));
    present(json, B_ALPHA).ifPresent(value -> builder.setBAlpha(value.getAsDouble()));
    present(json, B_BETA).ifPresent(value -> builder.setBBeta(value.getAsDouble()));
    return builder.build();
  }

  /** Keys of {@code json} that {@link #fromJson} fills from the defaults. */
  public static ImmutableList<String> missingKeys(JsonObject json) {
    return KEYS.stream().filter(key -> !present(json, key).isPresent()).collect(toImmutableList());
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty(GET_NEW, getNew());
    json.addProperty(SAMPLE_TYPE, sampleType());
    if (timestamp().isPresent()) {
      json.addProperty(TIMESTAMP, timestamp().get());
    } else {
      json.add(TIMESTAMP, JsonNull.INSTANCE);
    }
    json.addProperty(B_ALPHA, bAlpha());
    json.addProperty(B_BETA, bBeta());
    return json;
  }

  private static Optional<JsonElement> present(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? Optional.empty() : Optional.of(value);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setGetNew(boolean getNew);

    public abstract Builder setSampleType(int sampleType);

    public abstract Builder setTimestamp(Long timestamp);

    public abstract Builder setBAlpha(double bAlpha);

    public abstract Builder setBBeta(double bBeta);

    abstract SampleConfig autoBuild();

    public SampleConfig build() {
      SampleConfig config = autoBuild();
      checkArgument(
          config.sampleType() == TRAIN || config.sampleType() == TEST,
          "sample_type must be 0 (train) or 1 (test): %s",
          config.sampleType());
      checkArgument(
          config.bAlpha() > 0 && config.bBeta() > 0,
          "b_alpha and b_beta must be positive: %s, %s",
          config.bAlpha(),
          config.bBeta());
      return config;
    }
  }
}
