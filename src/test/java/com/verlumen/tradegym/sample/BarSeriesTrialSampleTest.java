package com.verlumen.tradegym.sample;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonObject;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.ta4j.core.BarSeries;

@RunWith(JUnit4.class)
public class BarSeriesTrialSampleTest {
  private static final double[] CLOSES = TestSeries.ramp(20, 100.0, 1.0);

  @Test
  public void sample_returnsWindowOfEpisodeLength() {
    // Arrange
    BarSeriesTrialSample trial = createTrial(5, 1.0);

    // Act
    EpisodeSample episode = trial.sample(SampleConfig.defaults());

    // Assert
    assertThat(episode.toFeed().getBarCount()).isEqualTo(5);
    assertThat(episode.metadata().get("length").getAsInt()).isEqualTo(5);
    assertThat(episode.metadata().get("trial").getAsString()).isEqualTo("ramp");
  }

  @Test
  public void sample_anchorsAtTimestamp() {
    // Arrange
    BarSeriesTrialSample trial = createTrial(5, 1.0);
    SampleConfig config =
        SampleConfig.builder().setTimestamp(TestSeries.endEpoch(7)).build();

    // Act
    BarSeries feed = trial.sample(config).toFeed();

    // Assert
    assertThat(feed.getFirstBar().getEndTime().toEpochSecond()).isEqualTo(TestSeries.endEpoch(7));
    assertThat(feed.getFirstBar().getClosePrice().doubleValue()).isEqualTo(107.0);
  }

  @Test
  public void sample_timestampPastTheEndClampsToLastAdmissibleStart() {
    BarSeriesTrialSample trial = createTrial(5, 1.0);
    SampleConfig config = SampleConfig.builder().setTimestamp(TestSeries.endEpoch(100)).build();

    BarSeries feed = trial.sample(config).toFeed();

    assertThat(feed.getLastBar().getClosePrice().doubleValue()).isEqualTo(119.0);
  }

  @Test
  public void sample_testTypeDrawsFromTheTestPart() {
    // Arrange
    BarSeriesTrialSample trial = createTrial(5, 0.5);
    SampleConfig config = SampleConfig.builder().setSampleType(SampleConfig.TEST).build();

    // Act
    for (int i = 0; i < 20; i++) {
      BarSeries feed = trial.sample(config).toFeed();

      // Assert
      assertThat(feed.getFirstBar().getClosePrice().doubleValue()).isAtLeast(110.0);
    }
  }

  @Test
  public void sample_trainTypeStaysInTheTrainPart() {
    BarSeriesTrialSample trial = createTrial(5, 0.5);

    for (int i = 0; i < 20; i++) {
      BarSeries feed = trial.sample(SampleConfig.defaults()).toFeed();

      assertThat(feed.getLastBar().getClosePrice().doubleValue()).isLessThan(110.0);
    }
  }

  @Test
  public void sample_skewedBetaStillYieldsAdmissibleStarts() {
    BarSeriesTrialSample trial = createTrial(5, 1.0);
    SampleConfig config = SampleConfig.builder().setBAlpha(5.0).setBBeta(0.5).build();

    for (int i = 0; i < 50; i++) {
      assertThat(trial.sample(config).toFeed().getBarCount()).isEqualTo(5);
    }
  }

  @Test(timeout = 10_000)
  public void sample_concentratedBetaCentresTheWindow() {
    // Arrange
    BarSeriesTrialSample trial =
        new BarSeriesTrialSample(
            "ramp",
            TestSeries.closes("ramp", TestSeries.ramp(200, 100.0, 1.0)),
            new JsonObject(),
            10,
            1.0,
            new Random(42));
    SampleConfig config = SampleConfig.builder().setBAlpha(30.0).setBBeta(30.0).build();

    // Act
    for (int i = 0; i < 50; i++) {
      BarSeries feed = trial.sample(config).toFeed();

      // Assert
      double firstClose = feed.getFirstBar().getClosePrice().doubleValue();
      assertThat(feed.getBarCount()).isEqualTo(10);
      assertThat(firstClose).isAtLeast(119.0);
      assertThat(firstClose).isAtMost(272.0);
    }
  }

  @Test(timeout = 10_000)
  public void sample_largeAsymmetricBetaTerminates() {
    BarSeriesTrialSample trial = createTrial(5, 1.0);
    SampleConfig config = SampleConfig.builder().setBAlpha(200.0).setBBeta(0.7).build();

    for (int i = 0; i < 20; i++) {
      assertThat(trial.sample(config).toFeed().getBarCount()).isEqualTo(5);
    }
  }

  @Test
  public void sample_failsWhenPartIsShorterThanEpisode() {
    BarSeriesTrialSample trial = createTrial(15, 0.5);

    assertThrows(IllegalArgumentException.class, () -> trial.sample(SampleConfig.defaults()));
  }

  @Test
  public void reset_restartsSampleNumbering() {
    // Arrange
    BarSeriesTrialSample trial = createTrial(5, 1.0);
    trial.sample(SampleConfig.defaults());
    trial.sample(SampleConfig.defaults());

    // Act
    trial.reset();
    EpisodeSample episode = trial.sample(SampleConfig.defaults());

    // Assert
    assertThat(episode.metadata().get("sample_num").getAsInt()).isEqualTo(1);
  }

  @Test
  public void describe_summarizesClosePrices() {
    SampleStats stats = createTrial(5, 1.0).describe();

    assertThat(stats.count()).isEqualTo(20);
    assertThat(stats.mean()).isWithin(1e-9).of(109.5);
    assertThat(stats.min()).isEqualTo(100.0);
    assertThat(stats.max()).isEqualTo(119.0);
  }

  private static BarSeriesTrialSample createTrial(int episodeLength, double trainFraction) {
    return new BarSeriesTrialSample(
        "ramp",
        TestSeries.closes("ramp", CLOSES),
        new JsonObject(),
        episodeLength,
        trainFraction,
        new Random(42));
  }
}
