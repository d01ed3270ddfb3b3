package com.verlumen.tradegym.engine;

/** Per-tick series an engine can record for episode rendering. */
public enum ObserverKind {
  DRAWDOWN("drawdown"),
  NORM_PNL("norm_pnl"),
  POSITION("position"),
  REWARD("reward");

  private final String label;

  ObserverKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
