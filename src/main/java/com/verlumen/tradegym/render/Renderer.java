package com.verlumen.tradegym.render;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.verlumen.tradegym.engine.ObserverKind;
import java.util.Optional;

/** Produces render payloads that are sent back to the controller. */
public interface Renderer {
  String EPISODE_MODE = "episode";

  boolean enabled();

  ImmutableSet<String> renderModes();

  /**
   * Renders the requested modes. With a step, step modes are rendered afresh from it; without
   * one, or for the episode mode, the last rendering of each mode is returned.
   */
  JsonElement render(ImmutableList<String> modes, Optional<StepSnapshot> step);

  /** Renders the given modes from {@code step} without returning anything. */
  void renderInPlace(ImmutableList<String> modes, StepSnapshot step);

  /** Renders the finished episode from the engine's recorded observer series. */
  void renderEpisode(ImmutableMap<ObserverKind, ImmutableList<Double>> observerLines);
}
