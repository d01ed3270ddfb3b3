package com.verlumen.tradegym.render;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.verlumen.tradegym.engine.ObserverKind;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class JsonRendererTest {
  private final JsonRenderer renderer = new JsonRenderer(true);

  @Test
  public void render_humanModeShowsLatestInfo() {
    // Act
    JsonObject rendering =
        renderer.render(ImmutableList.of("human"), Optional.of(step(0.25, 3))).getAsJsonObject();

    // Assert
    assertThat(rendering.get("mode").getAsString()).isEqualTo("human");
    assertThat(rendering.get("reward").getAsDouble()).isEqualTo(0.25);
    assertThat(rendering.getAsJsonObject("info").get("step").getAsInt()).isEqualTo(2);
  }

  @Test
  public void render_agentModeShowsState() {
    JsonObject rendering =
        renderer.render(ImmutableList.of("agent"), Optional.of(step(0.0, 1))).getAsJsonObject();

    assertThat(rendering.getAsJsonArray("state").size()).isEqualTo(2);
    assertThat(rendering.has("raw_state")).isTrue();
  }

  @Test
  public void render_severalModesAreKeyedByMode() {
    JsonObject rendering =
        renderer
            .render(ImmutableList.of("human", "agent"), Optional.of(step(0.0, 1)))
            .getAsJsonObject();

    assertThat(rendering.keySet()).containsExactly("human", "agent");
  }

  @Test
  public void render_withoutStepReturnsLastRendering() {
    // Arrange
    JsonElement first = renderer.render(ImmutableList.of("human"), Optional.of(step(0.5, 1)));

    // Act
    JsonElement again = renderer.render(ImmutableList.of("human"), Optional.empty());

    // Assert
    assertThat(again).isEqualTo(first);
  }

  @Test
  public void render_beforeAnythingWasRendered() {
    JsonObject rendering =
        renderer.render(ImmutableList.of("episode"), Optional.empty()).getAsJsonObject();

    assertThat(rendering.get("message").getAsString()).isEqualTo("nothing rendered yet");
  }

  @Test
  public void render_unknownModeReportsError() {
    JsonObject rendering =
        renderer.render(ImmutableList.of("plot"), Optional.of(step(0.0, 1))).getAsJsonObject();

    assertThat(rendering.get("error").getAsString()).contains("unknown render mode");
  }

  @Test
  public void render_disabledRendererReturnsFixedPayload() {
    JsonRenderer disabled = new JsonRenderer(false);

    JsonObject rendering =
        disabled.render(ImmutableList.of("human"), Optional.of(step(0.0, 1))).getAsJsonObject();

    assertThat(rendering.get("rendering").getAsString())
        .isEqualTo(JsonRenderer.DISABLED_MESSAGE);
  }

  @Test
  public void renderInPlace_cachesStepModesOnly() {
    // Act
    renderer.renderInPlace(ImmutableList.of("human", "episode"), step(0.75, 2));

    // Assert
    JsonObject human =
        renderer.render(ImmutableList.of("human"), Optional.empty()).getAsJsonObject();
    JsonObject episode =
        renderer.render(ImmutableList.of("episode"), Optional.empty()).getAsJsonObject();
    assertThat(human.get("reward").getAsDouble()).isEqualTo(0.75);
    assertThat(episode.has("message")).isTrue();
  }

  @Test
  public void renderEpisode_exposesObserverLines() {
    // Arrange
    ImmutableMap<ObserverKind, ImmutableList<Double>> lines =
        ImmutableMap.of(
            ObserverKind.DRAWDOWN, ImmutableList.of(0.0, 0.1, 0.05),
            ObserverKind.REWARD, ImmutableList.of(0.0, -0.1, 0.05));

    // Act
    renderer.renderEpisode(lines);

    // Assert
    JsonObject episode =
        renderer.render(ImmutableList.of("episode"), Optional.empty()).getAsJsonObject();
    assertThat(episode.get("length").getAsInt()).isEqualTo(3);
    assertThat(episode.getAsJsonObject("lines").keySet()).containsExactly("drawdown", "reward");
  }

  private static StepSnapshot step(double reward, int ticks) {
    ImmutableList.Builder<JsonObject> info = ImmutableList.builder();
    for (int i = 0; i < ticks; i++) {
      JsonObject record = new JsonObject();
      record.addProperty("step", i);
      info.add(record);
    }
    JsonArray state = new JsonArray();
    state.add(-0.01);
    state.add(0.0);
    return StepSnapshot.create(state, state.deepCopy(), reward, false, info.build());
  }
}
