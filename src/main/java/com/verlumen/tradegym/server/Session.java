package com.verlumen.tradegym.server;

import com.verlumen.tradegym.data.AcquiredTrial;
import java.util.Optional;

/** Per-session state that outlives single episodes. */
final class Session {
  private final int task;
  private SessionState state = SessionState.CONTROL;
  private int episodeCount = 0;
  private Optional<AcquiredTrial> trial = Optional.empty();
  private Optional<EpisodeResult> lastResult = Optional.empty();

  Session(int task) {
    this.task = task;
  }

  int task() {
    return task;
  }

  SessionState state() {
    return state;
  }

  void setState(SessionState state) {
    this.state = state;
  }

  /** Number of the next episode; counts completed episodes. */
  int episodeCount() {
    return episodeCount;
  }

  Optional<AcquiredTrial> trial() {
    return trial;
  }

  void setTrial(AcquiredTrial trial) {
    this.trial = Optional.of(trial);
  }

  Optional<EpisodeResult> lastResult() {
    return lastResult;
  }

  void completeEpisode(EpisodeResult result) {
    lastResult = Optional.of(result);
    episodeCount++;
  }
}
