package com.verlumen.tradegym.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import java.io.IOException;
import org.ta4j.core.BarSeries;

/**
 * A backtest engine that walks a feed tick by tick and hands control to a {@link StepHook} on
 * every tick.
 *
 * <p>A configured instance acts as a template: each episode runs on a {@link #copy()}.
 */
public interface BacktestEngine {
  /** Returns an independent engine with the same configuration, observers and parameters. */
  BacktestEngine copy();

  ImmutableSet<ObserverKind> observers();

  boolean hasObserver(ObserverKind kind);

  void addObserver(ObserverKind kind);

  TickContext tickContext();

  void setStepHook(StepHook hook);

  void addFeed(BarSeries feed);

  void putStrategyParam(String key, JsonElement value);

  ImmutableMap<String, JsonElement> strategyParams();

  /** Ticks between two communicated steps. */
  int skipFrame();

  /**
   * Runs the engine over the feed to completion, invoking the step hook every tick.
   *
   * @throws IOException if the step hook fails to talk to its peer
   */
  EpisodeRun run() throws IOException;

  /** Recorded observer series of the last run. */
  ImmutableMap<ObserverKind, ImmutableList<Double>> observerLines();
}
