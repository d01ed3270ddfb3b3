package com.verlumen.tradegym.sample;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Random;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Decodes trials of the form:
 *
 * <pre>{@code
 * {
 *   "name": "BTCUSD_2024_01",
 *   "metadata": {...},
 *   "episode_length": 1440,
 *   "train_fraction": 0.8,
 *   "bar_seconds": 60,
 *   "bars": [{"t": 1704067260, "o": 1.0, "h": 1.2, "l": 0.9, "c": 1.1, "v": 10.0}, ...]
 * }
 * }</pre>
 *
 * <p>{@code t} is the bar end time in epoch seconds. Only {@code bars} and {@code episode_length}
 * are required.
 */
final class SampleDecoderImpl implements SampleDecoder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final long DEFAULT_BAR_SECONDS = 60;

  private final Random random;

  @Inject
  SampleDecoderImpl(Random random) {
    this.random = random;
  }

  @Override
  public TrialSample decode(JsonObject sample) {
    checkArgument(sample.has("bars") && sample.get("bars").isJsonArray(), "Trial has no bars");
    checkArgument(sample.has("episode_length"), "Trial has no episode_length");

    String name = sample.has("name") ? sample.get("name").getAsString() : "trial";
    long barSeconds =
        sample.has("bar_seconds") ? sample.get("bar_seconds").getAsLong() : DEFAULT_BAR_SECONDS;
    Duration barPeriod = Duration.ofSeconds(barSeconds);
    JsonObject metadata =
        sample.has("metadata") && sample.get("metadata").isJsonObject()
            ? sample.getAsJsonObject("metadata")
            : new JsonObject();
    double trainFraction =
        sample.has("train_fraction") ? sample.get("train_fraction").getAsDouble() : 1.0;

    BarSeries series = createBarSeries(name, sample.getAsJsonArray("bars"), barPeriod);
    logger.atFine().log("Decoded trial <%s> with %d bars", name, series.getBarCount());
    return new BarSeriesTrialSample(
        name,
        series,
        metadata,
        sample.get("episode_length").getAsInt(),
        trainFraction,
        random);
  }

  private static BarSeries createBarSeries(String name, JsonArray bars, Duration barPeriod) {
    BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
    for (JsonElement element : bars) {
      checkArgument(element.isJsonObject(), "Bar is not an object: %s", element);
      series.addBar(createBar(element.getAsJsonObject(), barPeriod));
    }
    return series;
  }

  private static BaseBar createBar(JsonObject bar, Duration barPeriod) {
    ZonedDateTime endTime =
        ZonedDateTime.ofInstant(Instant.ofEpochSecond(bar.get("t").getAsLong()), UTC);
    double close = bar.get("c").getAsDouble();
    return new BaseBar(
        barPeriod,
        endTime,
        bar.has("o") ? bar.get("o").getAsDouble() : close,
        bar.has("h") ? bar.get("h").getAsDouble() : close,
        bar.has("l") ? bar.get("l").getAsDouble() : close,
        close,
        bar.has("v") ? bar.get("v").getAsDouble() : 0.0);
  }
}
