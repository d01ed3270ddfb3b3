package com.verlumen.tradegym.data;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;

/**
 * Limits of the readiness polling loop.
 *
 * @param waitBudget total pause time after which a not-ready provider is given up on
 * @param maxPause upper bound (exclusive) of each random pause between attempts
 */
public record DataConfig(Duration waitBudget, Duration maxPause) {
  public static final Duration DEFAULT_WAIT_BUDGET = Duration.ofSeconds(300);
  public static final Duration DEFAULT_MAX_PAUSE = Duration.ofSeconds(2);

  public DataConfig {
    checkArgument(!waitBudget.isNegative(), "Wait budget must not be negative: %s", waitBudget);
    checkArgument(
        !maxPause.isNegative() && !maxPause.isZero(), "Max pause must be positive: %s", maxPause);
  }

  public static DataConfig defaults() {
    return new DataConfig(DEFAULT_WAIT_BUDGET, DEFAULT_MAX_PAUSE);
  }
}
