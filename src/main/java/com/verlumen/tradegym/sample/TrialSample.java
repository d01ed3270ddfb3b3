package com.verlumen.tradegym.sample;

/**
 * A trial: a data slice that is kept across episodes and narrowed into one {@link EpisodeSample}
 * per episode.
 */
public interface TrialSample extends DataSample {
  /** Rewinds the trial's own sampling state, as done when it is first received. */
  void reset();

  /**
   * Draws a fresh episode from this trial.
   *
   * @throws IllegalArgumentException if the trial cannot yield an episode for {@code config}
   */
  EpisodeSample sample(SampleConfig config);
}
