package com.verlumen.tradegym.server;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.util.Modules;
import com.verlumen.tradegym.channel.Control;
import com.verlumen.tradegym.channel.ControllerChannel;
import com.verlumen.tradegym.channel.DataChannel;
import com.verlumen.tradegym.channel.Endpoint;
import com.verlumen.tradegym.channel.Message;
import com.verlumen.tradegym.channel.MessageChannel;
import com.verlumen.tradegym.channel.ScriptedMessageChannel;
import com.verlumen.tradegym.data.Sleeper;
import com.verlumen.tradegym.engine.EngineConfig;
import com.verlumen.tradegym.engine.StepHook;
import com.verlumen.tradegym.sample.TestSeries;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Drives a whole session through the production wiring with scripted peers. */
@RunWith(JUnit4.class)
public class SessionScenarioTest {
  private static final ServerConfig CONFIG =
      new ServerConfig(
          Endpoint.parse("tcp://127.0.0.1:5000"),
          Endpoint.parse("tcp://127.0.0.1:4999"),
          Duration.ofSeconds(1),
          0,
          Duration.ofSeconds(30),
          true,
          EngineConfig.defaults());

  private final ScriptedMessageChannel controller = ScriptedMessageChannel.replier();
  private final ScriptedMessageChannel dataProvider =
      ScriptedMessageChannel.requester(this::answerDataRequest);
  private final List<Duration> pauses = new ArrayList<>();
  private int notReadyReplies = 1;

  private ControlLoop controlLoop;

  @Before
  public void setUp() {
    controlLoop =
        Guice.createInjector(
                Modules.override(ServerModule.create(CONFIG))
                    .with(
                        new AbstractModule() {
                          @Override
                          protected void configure() {
                            bind(MessageChannel.class)
                                .annotatedWith(ControllerChannel.class)
                                .toInstance(controller);
                            bind(MessageChannel.class)
                                .annotatedWith(DataChannel.class)
                                .toInstance(dataProvider);
                            bind(Sleeper.class).toInstance(pauses::add);
                            bind(Random.class).toInstance(new Random(11));
                          }
                        }))
            .getInstance(ControlLoop.class);
  }

  @Test
  public void session_playsEpisodesAndReportsThem() throws Exception {
    // Arrange
    JsonObject reuseTrial = new JsonObject();
    JsonObject trialConfig = new JsonObject();
    trialConfig.addProperty("get_new", false);
    reuseTrial.add("trial_config", trialConfig);
    controller
        .enqueue(Message.control(Control.GETSTAT), Message.control(Control.RESET))
        .enqueue(Message.render("human"), Message.action("buy"))
        .enqueue(Message.action("hold"), Message.action("sell"))
        .enqueue(Message.control(Control.GETSTAT))
        .enqueue(Message.control(Control.RESET, reuseTrial), Message.control(Control.DONE))
        .enqueue(Message.control(Control.GETSTAT), Message.control(Control.STOP));

    // Act
    controlLoop.run();

    // Assert
    ImmutableList<JsonElement> replies = controller.sent();
    assertThat(replies).hasSize(11);
    assertThat(replies.get(0)).isEqualTo(new JsonObject());
    assertThat(replies.get(1).getAsString()).startsWith("Preparing new episode");
    assertThat(replies.get(2).getAsJsonObject().get("mode").getAsString()).isEqualTo("human");
    assertStep(replies.get(3), false);
    assertStep(replies.get(4), false);
    assertStep(replies.get(5), true);

    JsonObject firstEpisode = replies.get(6).getAsJsonObject();
    assertThat(firstEpisode.get("episode").getAsInt()).isEqualTo(0);
    assertThat(firstEpisode.get("length").getAsInt()).isEqualTo(3);
    assertThat(firstEpisode.get("done").getAsBoolean()).isTrue();
    assertThat(firstEpisode.get("early_stop").getAsBoolean()).isFalse();
    assertThat(firstEpisode.getAsJsonObject("trades").get("total").getAsInt()).isEqualTo(1);
    assertThat(firstEpisode.has(StepHook.NAME)).isFalse();

    assertThat(replies.get(8)).isEqualTo(new JsonPrimitive(StepExchange.DONE_ACK));
    JsonObject secondEpisode = replies.get(9).getAsJsonObject();
    assertThat(secondEpisode.get("episode").getAsInt()).isEqualTo(1);
    assertThat(secondEpisode.get("length").getAsInt()).isEqualTo(1);
    assertThat(secondEpisode.get("early_stop").getAsBoolean()).isTrue();
    assertThat(replies.get(10)).isEqualTo(new JsonPrimitive(ControlLoop.EXIT_REPLY));
    assertThat(controlLoop.state()).isEqualTo(SessionState.TERMINATED);
  }

  @Test
  public void session_waitsForDataThenReusesTheTrialAndStopsTheProviderOnce() throws Exception {
    // Arrange
    notReadyReplies = 2;
    JsonObject reuseTrial = new JsonObject();
    JsonObject trialConfig = new JsonObject();
    trialConfig.addProperty("get_new", false);
    reuseTrial.add("trial_config", trialConfig);
    controller
        .enqueue(Message.control(Control.RESET), Message.control(Control.DONE))
        .enqueue(Message.control(Control.RESET, reuseTrial), Message.control(Control.DONE))
        .enqueue(Message.control(Control.STOP));

    // Act
    controlLoop.run();

    // Assert
    assertThat(controlsSentToProvider())
        .containsExactly("ping", "get_data", "get_data", "get_data", "stop")
        .inOrder();
    assertThat(pauses).hasSize(2);
    assertThat(dataProvider.isClosed()).isTrue();
    assertThat(controller.closeCount()).isEqualTo(1);
  }

  private static void assertStep(JsonElement reply, boolean done) {
    JsonArray step = reply.getAsJsonArray();
    assertThat(step.size()).isEqualTo(4);
    assertThat(step.get(2).getAsBoolean()).isEqualTo(done);
    assertThat(step.get(3).getAsJsonArray().size()).isEqualTo(1);
  }

  private ImmutableList<String> controlsSentToProvider() {
    return dataProvider.sent().stream()
        .map(request -> request.getAsJsonObject().get("ctrl").getAsString())
        .collect(toImmutableList());
  }

  private JsonElement answerDataRequest(JsonElement request) {
    String ctrl = request.getAsJsonObject().get("ctrl").getAsString();
    switch (ctrl) {
      case "ping":
        return new JsonPrimitive("pong");
      case "stop":
        return new JsonPrimitive("stopped");
      case "get_data":
        JsonObject reply = new JsonObject();
        if (notReadyReplies > 0) {
          notReadyReplies--;
          reply.addProperty("status", "not_ready");
          return reply;
        }
        reply.addProperty("status", "ready");
        reply.add("sample", TestSeries.trialJson("btc", 6, TestSeries.ramp(12, 100.0, 1.0)));
        reply.add("stat", new JsonObject());
        return reply;
      default:
        throw new AssertionError("Unexpected data request: " + request);
    }
  }
}
