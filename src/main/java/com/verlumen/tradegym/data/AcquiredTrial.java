package com.verlumen.tradegym.data;

import com.google.auto.value.AutoValue;
import com.google.gson.JsonObject;
import com.verlumen.tradegym.sample.SampleStats;
import com.verlumen.tradegym.sample.TrialSample;

/** A trial as handed out by the data provider, with its statistics. */
@AutoValue
public abstract class AcquiredTrial {
  public abstract TrialSample sample();

  public abstract SampleStats trialStat();

  /** Statistics of the whole dataset the trial was cut from, passed through verbatim. */
  public abstract JsonObject datasetStat();

  public static AcquiredTrial create(
      TrialSample sample, SampleStats trialStat, JsonObject datasetStat) {
    return new AutoValue_AcquiredTrial(sample, trialStat, datasetStat);
  }
}
