package com.verlumen.tradegym.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.verlumen.tradegym.sample.TestSeries;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class Ta4jBacktestEngineTest {
  private static final EngineConfig CONFIG = new EngineConfig(100.0, 1.0, 0.0, 2, 0.5, 1);

  @Test
  public void run_walksEveryBarAfterWarmUp() throws Exception {
    // Arrange
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("flat", 100, 100, 100, 100, 100));

    // Act
    EpisodeRun run = engine.run();

    // Assert
    assertThat(run.length()).isEqualTo(4);
    assertThat(run.analyses().keySet()).containsExactly("trades", "drawdown", "returns");
  }

  @Test
  public void run_callsHookOncePerTickAndFlagsTheLastOne() throws Exception {
    // Arrange
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("flat", 100, 100, 100, 100, 100));
    List<Integer> ticks = new ArrayList<>();
    List<Boolean> doneFlags = new ArrayList<>();
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              ticks.add(context.tick());
              doneFlags.add(context.isDone());
            }));

    // Act
    EpisodeRun run = engine.run();

    // Assert
    assertThat(ticks).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(doneFlags).containsExactly(false, false, false, true).inOrder();
    assertThat(run.analyses()).containsKey(StepHook.NAME);
  }

  @Test
  public void run_fillsOrdersAtTheNextClose() throws Exception {
    // Arrange
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("ramp", 100, 101, 102, 103, 104));
    List<Double> rewards = new ArrayList<>();
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              rewards.add(context.reward());
              if (context.tick() == 0) {
                context.setAction(Ta4jBacktestEngine.BUY);
              }
            }));

    // Act
    EpisodeRun run = engine.run();

    // Assert
    assertThat(rewards.get(1)).isWithin(1e-9).of(0.0);
    assertThat(rewards.get(2)).isWithin(1e-9).of(0.01);
    JsonObject returns = run.analyses().get("returns").getAsJsonObject();
    assertThat(returns.get("total_return").getAsDouble()).isWithin(1e-9).of(0.02);
    JsonObject trades = run.analyses().get("trades").getAsJsonObject();
    assertThat(trades.get("total").getAsInt()).isEqualTo(1);
    assertThat(trades.get("profit_loss").getAsDouble()).isWithin(1e-9).of(2.0);
  }

  @Test
  public void run_sellOpensShortThatProfitsOnFallingPrices() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("fall", 104, 103, 102, 101, 100));
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              if (context.tick() == 0) {
                context.setAction(Ta4jBacktestEngine.SELL);
              }
            }));

    EpisodeRun run = engine.run();

    JsonObject returns = run.analyses().get("returns").getAsJsonObject();
    assertThat(returns.get("total_return").getAsDouble()).isWithin(1e-9).of(0.02);
    JsonObject trades = run.analyses().get("trades").getAsJsonObject();
    assertThat(trades.get("short").getAsInt()).isEqualTo(1);
  }

  @Test
  public void run_endsWhenDrawdownReachesLimit() throws Exception {
    // Arrange
    Ta4jBacktestEngine engine =
        new Ta4jBacktestEngine(new EngineConfig(100.0, 1.0, 0.0, 1, 0.5, 1));
    engine.addFeed(TestSeries.closes("crash", 100, 100, 50, 40, 30, 20));
    List<Boolean> doneFlags = new ArrayList<>();
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              doneFlags.add(context.isDone());
              if (context.tick() == 0) {
                context.setAction(Ta4jBacktestEngine.BUY);
              }
            }));

    // Act
    EpisodeRun run = engine.run();

    // Assert
    assertThat(run.length()).isEqualTo(3);
    assertThat(doneFlags).containsExactly(false, false, true).inOrder();
    JsonObject drawdown = run.analyses().get("drawdown").getAsJsonObject();
    assertThat(drawdown.get("max_drawdown").getAsDouble()).isWithin(1e-9).of(0.5);
  }

  @Test
  public void halt_stopsAfterTheCurrentTick() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("flat", 100, 100, 100, 100, 100));
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              if (context.tick() == 1) {
                context.halt();
              }
            }));

    EpisodeRun run = engine.run();

    assertThat(run.length()).isEqualTo(2);
  }

  @Test
  public void closePositions_flattensImmediately() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("ramp", 100, 101, 102, 103, 104));
    List<Double> positions = new ArrayList<>();
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              if (context.tick() == 0) {
                context.setAction(Ta4jBacktestEngine.BUY);
              }
              if (context.tick() == 2) {
                context.closePositions();
              }
              positions.add(context.info().get("position").getAsDouble());
            }));

    engine.run();

    assertThat(positions).containsExactly(0.0, 1.0, 0.0, 0.0).inOrder();
  }

  @Test
  public void info_reportsUnknownActionsAsHold() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("flat", 100, 100, 100, 100));
    List<String> messages = new ArrayList<>();
    engine.setStepHook(
        hook(
            engine.tickContext(),
            context -> {
              messages.add(context.info().get("broker_message").getAsString());
              context.setAction("jump");
            }));

    engine.run();

    assertThat(messages.get(1)).contains("unknown action <jump>");
  }

  @Test
  public void state_isWindowOfClosesRelativeToCurrentClose() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("pair", 50, 100));
    List<String> states = new ArrayList<>();
    engine.setStepHook(
        hook(engine.tickContext(), context -> states.add(context.state().toString())));

    engine.run();

    assertThat(states).containsExactly("[-0.5,0.0]");
  }

  @Test
  public void copy_keepsObserversAndParamsButNotTheFeed() {
    // Arrange
    Ta4jBacktestEngine template = new Ta4jBacktestEngine(CONFIG);
    template.addObserver(ObserverKind.DRAWDOWN);
    template.putStrategyParam("metadata", new JsonObject());

    // Act
    Ta4jBacktestEngine copy = template.copy();
    copy.addObserver(ObserverKind.REWARD);
    copy.putStrategyParam("episode_stat", new JsonPrimitive(1));

    // Assert
    assertThat(copy.observers()).containsExactly(ObserverKind.DRAWDOWN, ObserverKind.REWARD);
    assertThat(template.observers()).containsExactly(ObserverKind.DRAWDOWN);
    assertThat(template.strategyParams().keySet()).containsExactly("metadata");
    assertThrows(IllegalStateException.class, copy::run);
  }

  @Test
  public void observerLines_recordOneValuePerTick() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addObserver(ObserverKind.DRAWDOWN);
    engine.addObserver(ObserverKind.POSITION);
    engine.addFeed(TestSeries.closes("flat", 100, 100, 100, 100, 100));

    engine.run();

    assertThat(engine.observerLines().keySet())
        .containsExactly(ObserverKind.DRAWDOWN, ObserverKind.POSITION);
    assertThat(engine.observerLines().get(ObserverKind.DRAWDOWN)).hasSize(4);
  }

  @Test
  public void run_isSingleUse() throws Exception {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);
    engine.addFeed(TestSeries.closes("flat", 100, 100));
    engine.run();

    assertThrows(IllegalStateException.class, engine::run);
  }

  @Test
  public void addFeed_rejectsFeedShorterThanWindow() {
    Ta4jBacktestEngine engine = new Ta4jBacktestEngine(CONFIG);

    assertThrows(
        IllegalArgumentException.class, () -> engine.addFeed(TestSeries.closes("short", 100)));
  }

  private static StepHook hook(TickContext context, Consumer<TickContext> onTick) {
    return new StepHook() {
      @Override
      public void onTick() {
        onTick.accept(context);
      }

      @Override
      public JsonObject analysis() {
        return new JsonObject();
      }
    };
  }
}
