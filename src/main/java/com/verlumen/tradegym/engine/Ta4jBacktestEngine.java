package com.verlumen.tradegym.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.ta4j.core.Bar;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseTradingRecord;
import org.ta4j.core.Trade.TradeType;
import org.ta4j.core.TradingRecord;
import org.ta4j.core.criteria.pnl.ProfitLossCriterion;

/**
 * Single-instrument backtest engine over a ta4j {@link BarSeries}.
 *
 * <p>Orders are filled at the close of the tick after the one on which they were requested.
 * Actions are {@code buy}, {@code sell}, {@code close} and {@code hold}; a {@code buy} while
 * short closes the short and vice versa.
 */
public final class Ta4jBacktestEngine implements BacktestEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String HOLD = "hold";
  public static final String BUY = "buy";
  public static final String SELL = "sell";
  public static final String CLOSE = "close";

  private final EngineConfig config;
  private final EnumSet<ObserverKind> observers = EnumSet.noneOf(ObserverKind.class);
  private final Map<String, JsonElement> strategyParams = new LinkedHashMap<>();
  private final Map<ObserverKind, List<Double>> observerLines = new EnumMap<>(ObserverKind.class);
  private final TickContext tickContext = new Context();
  private Optional<StepHook> stepHook = Optional.empty();
  private Optional<BarSeries> feed = Optional.empty();
  private boolean ran = false;

  private BarSeries series;
  private TradingRecord longRecord;
  private TradingRecord shortRecord;
  private int index;
  private int tick;
  private double cash;
  private double units;
  private double value;
  private double reward;
  private double peakValue;
  private double drawdown;
  private double maxDrawdown;
  private double fees;
  private String pendingAction = HOLD;
  private String lastAction = HOLD;
  private String brokerMessage = "";
  private boolean done;
  private boolean halted;

  @Inject
  Ta4jBacktestEngine(EngineConfig config) {
    this.config = config;
  }

  @Override
  public Ta4jBacktestEngine copy() {
    Ta4jBacktestEngine copy = new Ta4jBacktestEngine(config);
    copy.observers.addAll(observers);
    strategyParams.forEach((key, value) -> copy.strategyParams.put(key, value.deepCopy()));
    return copy;
  }

  @Override
  public ImmutableSet<ObserverKind> observers() {
    return ImmutableSet.copyOf(observers);
  }

  @Override
  public boolean hasObserver(ObserverKind kind) {
    return observers.contains(kind);
  }

  @Override
  public void addObserver(ObserverKind kind) {
    observers.add(kind);
  }

  @Override
  public TickContext tickContext() {
    return tickContext;
  }

  @Override
  public void setStepHook(StepHook hook) {
    this.stepHook = Optional.of(hook);
  }

  @Override
  public void addFeed(BarSeries feed) {
    checkArgument(feed.getBarCount() >= config.windowSize(),
        "Feed of %s bars is shorter than the window of %s bars",
        feed.getBarCount(), config.windowSize());
    this.feed = Optional.of(feed);
  }

  @Override
  public void putStrategyParam(String key, JsonElement value) {
    strategyParams.put(key, value);
  }

  @Override
  public ImmutableMap<String, JsonElement> strategyParams() {
    return ImmutableMap.copyOf(strategyParams);
  }

  @Override
  public int skipFrame() {
    return config.skipFrame();
  }

  @Override
  public EpisodeRun run() throws IOException {
    checkState(!ran, "Engine already ran, run a copy instead");
    series = feed.orElseThrow(() -> new IllegalStateException("No feed added"));
    ran = true;
    startRun();

    int first = series.getBeginIndex() + config.windowSize() - 1;
    int last = series.getEndIndex();
    logger.atFine().log(
        "Running <%s> over bars %d..%d with params %s",
        series.getName(), first, last, strategyParams.keySet());
    for (int i = first; i <= last; i++) {
      index = i;
      tick = i - first;
      execute(pendingAction);
      pendingAction = HOLD;
      updateAccount(i == last);
      recordObservers();
      if (stepHook.isPresent()) {
        stepHook.get().onTick();
      }
      if (done || halted) {
        break;
      }
    }
    closeAll();
    return EpisodeRun.create(analyses(), tick + 1);
  }

  @Override
  public ImmutableMap<ObserverKind, ImmutableList<Double>> observerLines() {
    return observerLines.entrySet().stream()
        .collect(toImmutableMap(Map.Entry::getKey, e -> ImmutableList.copyOf(e.getValue())));
  }

  private void startRun() {
    longRecord = new BaseTradingRecord(TradeType.BUY);
    shortRecord = new BaseTradingRecord(TradeType.SELL);
    cash = config.startCash();
    units = 0;
    value = cash;
    peakValue = cash;
    drawdown = 0;
    maxDrawdown = 0;
    fees = 0;
    done = false;
    halted = false;
    observerLines.clear();
    observers.forEach(kind -> observerLines.put(kind, new ArrayList<>()));
  }

  private void execute(String action) {
    lastAction = action;
    switch (action) {
      case HOLD:
        brokerMessage = "";
        break;
      case BUY:
        if (units < 0) {
          closeShort();
        } else if (units == 0) {
          openLong();
        } else {
          brokerMessage = "long position already open";
        }
        break;
      case SELL:
        if (units > 0) {
          closeLong();
        } else if (units == 0) {
          openShort();
        } else {
          brokerMessage = "short position already open";
        }
        break;
      case CLOSE:
        if (units == 0) {
          brokerMessage = "no open position";
        } else {
          closeAll();
        }
        break;
      default:
        brokerMessage = String.format("unknown action <%s>, holding", action);
    }
  }

  private void openLong() {
    double price = closePrice();
    longRecord.enter(index, series.numOf(price), series.numOf(config.stake()));
    cash -= price * config.stake() + fee(price, config.stake());
    units = config.stake();
    brokerMessage = "opened long";
  }

  private void closeLong() {
    double price = closePrice();
    longRecord.exit(index, series.numOf(price), series.numOf(units));
    cash += price * units - fee(price, units);
    units = 0;
    brokerMessage = "closed long";
  }

  private void openShort() {
    double price = closePrice();
    shortRecord.enter(index, series.numOf(price), series.numOf(config.stake()));
    cash += price * config.stake() - fee(price, config.stake());
    units = -config.stake();
    brokerMessage = "opened short";
  }

  private void closeShort() {
    double price = closePrice();
    double amount = -units;
    shortRecord.exit(index, series.numOf(price), series.numOf(amount));
    cash -= price * amount + fee(price, amount);
    units = 0;
    brokerMessage = "closed short";
  }

  private void closeAll() {
    if (units > 0) {
      closeLong();
    } else if (units < 0) {
      closeShort();
    }
    value = cash + units * closePrice();
  }

  private double fee(double price, double amount) {
    double fee = price * amount * config.commission();
    fees += fee;
    return fee;
  }

  private void updateAccount(boolean lastBar) {
    double previousValue = value;
    value = cash + units * closePrice();
    reward = (value - previousValue) / config.startCash();
    peakValue = Math.max(peakValue, value);
    drawdown = peakValue > 0 ? (peakValue - value) / peakValue : 0;
    maxDrawdown = Math.max(maxDrawdown, drawdown);
    done = lastBar || drawdown >= config.drawdownLimit() || halted;
    if (drawdown >= config.drawdownLimit()) {
      logger.atInfo().log(
          "Drawdown %.3f reached limit %.3f at tick %d", drawdown, config.drawdownLimit(), tick);
    }
  }

  private void recordObservers() {
    observerLines.forEach(
        (kind, line) -> {
          switch (kind) {
            case DRAWDOWN:
              line.add(drawdown);
              break;
            case NORM_PNL:
              line.add((value - config.startCash()) / config.startCash());
              break;
            case POSITION:
              line.add(units);
              break;
            case REWARD:
              line.add(reward);
              break;
          }
        });
  }

  private double closePrice() {
    return series.getBar(index).getClosePrice().doubleValue();
  }

  private ImmutableList<Bar> window() {
    int from = index - config.windowSize() + 1;
    ImmutableList.Builder<Bar> bars = ImmutableList.builder();
    for (int i = from; i <= index; i++) {
      bars.add(series.getBar(i));
    }
    return bars.build();
  }

  private ImmutableMap<String, JsonElement> analyses() {
    ProfitLossCriterion profitLoss = new ProfitLossCriterion();
    JsonObject trades = new JsonObject();
    trades.addProperty("total", longRecord.getPositionCount() + shortRecord.getPositionCount());
    trades.addProperty("long", longRecord.getPositionCount());
    trades.addProperty("short", shortRecord.getPositionCount());
    trades.addProperty(
        "profit_loss",
        profitLoss.calculate(series, longRecord).doubleValue()
            + profitLoss.calculate(series, shortRecord).doubleValue());
    trades.addProperty("commission", fees);

    JsonObject drawdowns = new JsonObject();
    drawdowns.addProperty("max_drawdown", maxDrawdown);
    drawdowns.addProperty("final_drawdown", drawdown);

    JsonObject returns = new JsonObject();
    returns.addProperty("total_return", (value - config.startCash()) / config.startCash());
    returns.addProperty("final_value", value);

    ImmutableMap.Builder<String, JsonElement> analyses =
        ImmutableMap.<String, JsonElement>builder()
            .put("trades", trades)
            .put("drawdown", drawdowns)
            .put("returns", returns);
    stepHook.ifPresent(hook -> analyses.put(StepHook.NAME, hook.analysis()));
    return analyses.build();
  }

  private final class Context implements TickContext {
    @Override
    public int tick() {
      return tick;
    }

    @Override
    public boolean isDone() {
      return done;
    }

    @Override
    public JsonObject info() {
      JsonObject info = new JsonObject();
      info.addProperty("step", tick);
      info.addProperty("time", series.getBar(index).getEndTime().toString());
      info.addProperty("action", lastAction);
      info.addProperty("broker_message", brokerMessage);
      info.addProperty("broker_cash", cash);
      info.addProperty("broker_value", value);
      info.addProperty("position", units);
      info.addProperty("drawdown", drawdown);
      return info;
    }

    @Override
    public JsonElement rawState() {
      JsonArray rows = new JsonArray();
      for (Bar bar : window()) {
        JsonArray row = new JsonArray();
        row.add(bar.getOpenPrice().doubleValue());
        row.add(bar.getHighPrice().doubleValue());
        row.add(bar.getLowPrice().doubleValue());
        row.add(bar.getClosePrice().doubleValue());
        rows.add(row);
      }
      return rows;
    }

    @Override
    public JsonElement state() {
      double current = closePrice();
      JsonArray state = new JsonArray();
      ImmutableList<Double> closes =
          window().stream()
              .map(bar -> bar.getClosePrice().doubleValue())
              .collect(toImmutableList());
      for (double close : closes) {
        state.add(current == 0 ? 0.0 : close / current - 1.0);
      }
      return state;
    }

    @Override
    public double reward() {
      return reward;
    }

    @Override
    public void setAction(String action) {
      pendingAction = action;
    }

    @Override
    public void setLastAction(String action) {
      lastAction = action;
    }

    @Override
    public void closePositions() {
      closeAll();
    }

    @Override
    public void halt() {
      halted = true;
    }
  }
}
