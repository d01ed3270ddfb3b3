package com.verlumen.tradegym.sample;

import com.google.gson.JsonObject;

/** Turns the {@code sample} object of a data provider reply into a {@link TrialSample}. */
public interface SampleDecoder {
  /**
   * Decodes a trial.
   *
   * @throws IllegalArgumentException if {@code sample} is not a well-formed trial
   */
  TrialSample decode(JsonObject sample);
}
