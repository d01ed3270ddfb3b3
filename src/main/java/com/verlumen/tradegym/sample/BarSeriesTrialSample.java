package com.verlumen.tradegym.sample;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonObject;
import java.util.Random;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.ta4j.core.BarSeries;

/**
 * A {@link TrialSample} backed by a ta4j {@link BarSeries}.
 *
 * <p>The first {@code trainFraction} of the bars form the train part and the rest the test part.
 * Each episode is a window of {@code episodeLength} consecutive bars taken from the part selected
 * by {@link SampleConfig#sampleType()}. The window start is either anchored at the requested
 * timestamp or drawn from a Beta({@code b_alpha}, {@code b_beta}) distribution over all admissible
 * starts, so that {@code b_alpha = b_beta = 1} means uniform.
 */
public final class BarSeriesTrialSample implements TrialSample {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final BarSeries series;
  private final JsonObject metadata;
  private final int episodeLength;
  private final double trainFraction;
  private final RandomGenerator random;
  private int sampleCount;

  public BarSeriesTrialSample(
      String name,
      BarSeries series,
      JsonObject metadata,
      int episodeLength,
      double trainFraction,
      Random random) {
    checkArgument(episodeLength > 0, "Episode length must be positive: %s", episodeLength);
    checkArgument(
        trainFraction > 0.0 && trainFraction <= 1.0,
        "Train fraction must be in (0, 1]: %s",
        trainFraction);
    this.name = name;
    this.series = series;
    this.metadata = metadata;
    this.episodeLength = episodeLength;
    this.trainFraction = trainFraction;
    this.random = RandomGeneratorFactory.createRandomGenerator(random);
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
    JsonObject copy = metadata.deepCopy();
    copy.addProperty("sample_num", sampleCount);
    return copy;
  }

  @Override
  public BarSeries toFeed() {
    return series;
  }

  @Override
  public void reset() {
    sampleCount = 0;
  }

  @Override
  public EpisodeSample sample(SampleConfig config) {
    int trainEnd = (int) Math.round(series.getBarCount() * trainFraction);
    int rangeStart = config.sampleType() == SampleConfig.TRAIN ? 0 : trainEnd;
    int rangeEnd = config.sampleType() == SampleConfig.TRAIN ? trainEnd : series.getBarCount();
    int admissibleStarts = rangeEnd - rangeStart - episodeLength + 1;
    checkArgument(
        admissibleStarts > 0,
        "Trial <%s> has %s bars in its %s part, fewer than the episode length %s",
        name,
        rangeEnd - rangeStart,
        config.sampleType() == SampleConfig.TRAIN ? "train" : "test",
        episodeLength);

    int offset =
        config.timestamp().isPresent()
            ? offsetAt(config.timestamp().get(), rangeStart, admissibleStarts)
            : (int) Math.min(
                admissibleStarts - 1,
                Math.floor(drawBeta(config.bAlpha(), config.bBeta()) * admissibleStarts));
    int start = series.getBeginIndex() + rangeStart + offset;
    BarSeries window = series.getSubSeries(start, start + episodeLength);

    sampleCount++;
    String episodeName = String.format("%s_episode_%d", name, sampleCount);
    JsonObject episodeMetadata = new JsonObject();
    episodeMetadata.addProperty("trial", name);
    episodeMetadata.addProperty("sample_num", sampleCount);
    episodeMetadata.addProperty("type", config.sampleType());
    episodeMetadata.addProperty("first_row", start);
    episodeMetadata.addProperty("length", episodeLength);
    episodeMetadata.addProperty(
        "first_timestamp", window.getFirstBar().getEndTime().toEpochSecond());
    episodeMetadata.addProperty("last_timestamp", window.getLastBar().getEndTime().toEpochSecond());
    logger.atFine().log(
        "Sampled %s: bars [%d, %d) of trial <%s>", episodeName, start, start + episodeLength, name);
    return new BarSeriesEpisodeSample(episodeName, window, episodeMetadata);
  }

  /** Offset of the first bar ending at or after {@code epochSeconds}, kept inside the range. */
  private int offsetAt(long epochSeconds, int rangeStart, int admissibleStarts) {
    int offset = 0;
    while (offset < admissibleStarts - 1
        && series
                .getBar(series.getBeginIndex() + rangeStart + offset)
                .getEndTime()
                .toEpochSecond()
            < epochSeconds) {
      offset++;
    }
    return offset;
  }

  private double drawBeta(double alpha, double beta) {
    if (alpha == 1.0 && beta == 1.0) {
      return random.nextDouble();
    }
    return new BetaDistribution(random, alpha, beta).sample();
  }
}
