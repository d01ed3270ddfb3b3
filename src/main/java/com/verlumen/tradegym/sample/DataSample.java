package com.verlumen.tradegym.sample;

import com.google.gson.JsonObject;
import org.ta4j.core.BarSeries;

/** A slice of market data supplied by the data provider. */
public interface DataSample {
  String name();

  SampleStats describe();

  JsonObject metadata();

  /** Converts the sample into the feed the backtest engine consumes. */
  BarSeries toFeed();
}
