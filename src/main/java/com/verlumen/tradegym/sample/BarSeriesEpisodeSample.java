package com.verlumen.tradegym.sample;

import com.google.gson.JsonObject;
import org.ta4j.core.BarSeries;

/** An {@link EpisodeSample} holding a contiguous window of a trial's bars. */
final class BarSeriesEpisodeSample implements EpisodeSample {
  private final String name;
  private final BarSeries series;
  private final JsonObject metadata;

  BarSeriesEpisodeSample(String name, BarSeries series, JsonObject metadata) {
    this.name = name;
    this.series = series;
    this.metadata = metadata;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public SampleStats describe() {
    return SampleStats.describe(series);
  }

  @Override
  public JsonObject metadata() {
    return metadata.deepCopy();
  }

  @Override
  public BarSeries toFeed() {
    return series;
  }
}
