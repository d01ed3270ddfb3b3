package com.verlumen.tradegym.render;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.verlumen.tradegym.engine.ObserverKind;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders steps and episodes as JSON documents.
 *
 * <p>Modes: {@code human} (last tick's info with reward and done flag), {@code agent} (the state
 * the agent saw) and {@code episode} (recorded observer series of the finished episode).
 */
public final class JsonRenderer implements Renderer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String HUMAN_MODE = "human";
  public static final String AGENT_MODE = "agent";
  static final String DISABLED_MESSAGE = "Rendering disabled, start the server with --render true";

  private static final ImmutableSet<String> MODES =
      ImmutableSet.of(HUMAN_MODE, AGENT_MODE, EPISODE_MODE);

  private final boolean enabled;
  private final Map<String, JsonObject> lastRendering = new HashMap<>();

  public JsonRenderer(boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public boolean enabled() {
    return enabled;
  }

  @Override
  public ImmutableSet<String> renderModes() {
    return MODES;
  }

  @Override
  public JsonElement render(ImmutableList<String> modes, Optional<StepSnapshot> step) {
    if (!enabled) {
      JsonObject disabled = new JsonObject();
      disabled.addProperty("rendering", DISABLED_MESSAGE);
      return disabled;
    }
    ImmutableList<String> requested = modes.isEmpty() ? ImmutableList.of(HUMAN_MODE) : modes;
    if (requested.size() == 1) {
      return renderMode(Iterables.getOnlyElement(requested), step);
    }
    JsonObject payload = new JsonObject();
    for (String mode : requested) {
      payload.add(mode, renderMode(mode, step));
    }
    return payload;
  }

  @Override
  public void renderInPlace(ImmutableList<String> modes, StepSnapshot step) {
    if (!enabled) {
      return;
    }
    for (String mode : modes) {
      if (!EPISODE_MODE.equals(mode) && MODES.contains(mode)) {
        lastRendering.put(mode, renderStep(mode, step));
      }
    }
  }

  @Override
  public void renderEpisode(ImmutableMap<ObserverKind, ImmutableList<Double>> observerLines) {
    if (!enabled) {
      return;
    }
    JsonObject lines = new JsonObject();
    int length = 0;
    for (Map.Entry<ObserverKind, ImmutableList<Double>> entry : observerLines.entrySet()) {
      JsonArray values = new JsonArray();
      entry.getValue().forEach(values::add);
      lines.add(entry.getKey().label(), values);
      length = Math.max(length, entry.getValue().size());
    }
    JsonObject episode = header(EPISODE_MODE);
    episode.addProperty("length", length);
    episode.add("lines", lines);
    lastRendering.put(EPISODE_MODE, episode);
    logger.atFine().log("Rendered episode of %d ticks", length);
  }

  private JsonObject renderMode(String mode, Optional<StepSnapshot> step) {
    if (!MODES.contains(mode)) {
      JsonObject unknown = header(mode);
      unknown.addProperty("error", "unknown render mode, expected one of " + MODES);
      return unknown;
    }
    if (step.isPresent() && !EPISODE_MODE.equals(mode)) {
      JsonObject rendering = renderStep(mode, step.get());
      lastRendering.put(mode, rendering);
      return rendering;
    }
    JsonObject cached = lastRendering.get(mode);
    if (cached != null) {
      return cached;
    }
    JsonObject empty = header(mode);
    empty.addProperty("message", "nothing rendered yet");
    return empty;
  }

  private static JsonObject renderStep(String mode, StepSnapshot step) {
    JsonObject rendering = header(mode);
    rendering.addProperty("reward", step.reward());
    rendering.addProperty("done", step.done());
    if (AGENT_MODE.equals(mode)) {
      rendering.add("state", step.state());
      rendering.add("raw_state", step.rawState());
    } else if (!step.info().isEmpty()) {
      rendering.add("info", Iterables.getLast(step.info()));
    }
    return rendering;
  }

  private static JsonObject header(String mode) {
    JsonObject header = new JsonObject();
    header.addProperty("mode", mode);
    return header;
  }
}
