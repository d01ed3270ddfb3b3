package com.verlumen.tradegym.engine;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Broker and episode settings of {@link Ta4jBacktestEngine}.
 *
 * @param startCash cash at the start of every episode
 * @param stake units traded per order
 * @param commission fraction of the traded notional charged per order
 * @param windowSize bars in the state window, also the warm-up length
 * @param drawdownLimit drawdown fraction at which the episode ends
 * @param skipFrame ticks between two communicated steps
 */
public record EngineConfig(
    double startCash,
    double stake,
    double commission,
    int windowSize,
    double drawdownLimit,
    int skipFrame) {
  public EngineConfig {
    checkArgument(startCash > 0, "Start cash must be positive: %s", startCash);
    checkArgument(stake > 0, "Stake must be positive: %s", stake);
    checkArgument(commission >= 0, "Commission must not be negative: %s", commission);
    checkArgument(windowSize > 0, "Window size must be positive: %s", windowSize);
    checkArgument(
        drawdownLimit > 0 && drawdownLimit <= 1,
        "Drawdown limit must be in (0, 1]: %s",
        drawdownLimit);
    checkArgument(skipFrame > 0, "Skip frame must be positive: %s", skipFrame);
  }

  public static EngineConfig defaults() {
    return new EngineConfig(100.0, 1.0, 0.0, 4, 0.5, 1);
  }
}
