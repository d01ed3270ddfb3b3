package com.verlumen.tradegym.server;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.verlumen.tradegym.sample.SampleConfig;

/** The sampling configs a {@code reset} asks for, read over the defaults. */
@AutoValue
abstract class EpisodeRequest {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String TRIAL_CONFIG = "trial_config";
  static final String EPISODE_CONFIG = "episode_config";

  abstract SampleConfig trialConfig();

  abstract SampleConfig episodeConfig();

  static EpisodeRequest create(SampleConfig trialConfig, SampleConfig episodeConfig) {
    return new AutoValue_EpisodeRequest(trialConfig, episodeConfig);
  }

  static EpisodeRequest defaults() {
    return create(SampleConfig.defaults(), SampleConfig.defaults());
  }

  /**
   * Reads {@code trial_config} and {@code episode_config} from the {@code reset} arguments.
   *
   * @throws EpisodeConfigException if a present config holds a value of the wrong type or out of
   *     range
   */
  static EpisodeRequest fromKwargs(JsonObject kwargs) throws EpisodeConfigException {
    return create(readConfig(kwargs, TRIAL_CONFIG), readConfig(kwargs, EPISODE_CONFIG));
  }

  private static SampleConfig readConfig(JsonObject kwargs, String key)
      throws EpisodeConfigException {
    JsonElement config = kwargs.get(key);
    if (config == null || !config.isJsonObject()) {
      logger.atFine().log("No <%s> given, using defaults: %s", key, SampleConfig.defaults());
      return SampleConfig.defaults();
    }
    JsonObject json = config.getAsJsonObject();
    ImmutableList<String> missing = SampleConfig.missingKeys(json);
    if (!missing.isEmpty()) {
      logger.atFine().log("<%s> lacks %s, using defaults for them", key, missing);
    }
    try {
      return SampleConfig.fromJson(json);
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
      throw new EpisodeConfigException(
          String.format("Invalid <%s> %s: %s", key, json, e.getMessage()), e);
    }
  }
}
