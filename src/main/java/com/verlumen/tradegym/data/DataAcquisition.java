package com.verlumen.tradegym.data;

import com.verlumen.tradegym.sample.SampleConfig;

/** Talks to the data provider process on behalf of the session. */
public interface DataAcquisition {
  /**
   * Checks that the provider answers at all. Called once at session start.
   *
   * @throws DataException of kind {@link DataException.Kind#UNREACHABLE} if it does not
   */
  void ping() throws DataException;

  /**
   * Requests a trial, polling with jittered pauses while the provider reports it is not ready.
   *
   * <p>When the wait budget is exhausted the provider is told to stop and the controller channel
   * is closed before {@link DataException.Kind#TIMEOUT} is thrown: the session is over.
   */
  AcquiredTrial acquire(SampleConfig trialConfig) throws DataException;

  /** Sends a best-effort {@code stop} to the provider, at most once, and closes the channel. */
  void stop();
}
