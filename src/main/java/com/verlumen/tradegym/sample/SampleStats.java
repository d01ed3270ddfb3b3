package com.verlumen.tradegym.sample;

import com.google.auto.value.AutoValue;
import com.google.gson.JsonObject;
import org.ta4j.core.BarSeries;

/** Descriptive statistics of the close prices in a sample. */
@AutoValue
public abstract class SampleStats {
  public abstract int count();

  public abstract double mean();

  public abstract double std();

  public abstract double min();

  public abstract double max();

  public static SampleStats create(int count, double mean, double std, double min, double max) {
    return new AutoValue_SampleStats(count, mean, std, min, max);
  }

  public static SampleStats describe(BarSeries series) {
    int count = series.getBarCount();
    if (count == 0) {
      return create(0, 0.0, 0.0, 0.0, 0.0);
    }

    double sum = 0.0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = series.getBeginIndex(); i <= series.getEndIndex(); i++) {
      double close = series.getBar(i).getClosePrice().doubleValue();
      sum += close;
      min = Math.min(min, close);
      max = Math.max(max, close);
    }
    double mean = sum / count;

    double squares = 0.0;
    for (int i = series.getBeginIndex(); i <= series.getEndIndex(); i++) {
      double deviation = series.getBar(i).getClosePrice().doubleValue() - mean;
      squares += deviation * deviation;
    }
    return create(count, mean, Math.sqrt(squares / count), min, max);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("count", count());
    json.addProperty("mean", mean());
    json.addProperty("std", std());
    json.addProperty("min", min());
    json.addProperty("max", max());
    return json;
  }
}
