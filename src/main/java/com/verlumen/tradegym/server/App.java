package com.verlumen.tradegym.server;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.tradegym.channel.Endpoint;
import com.verlumen.tradegym.engine.EngineConfig;
import java.time.Duration;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ControlLoop controlLoop;
  private final ServerConfig serverConfig;

  @Inject
  App(ControlLoop controlLoop, ServerConfig serverConfig) {
    this.controlLoop = controlLoop;
    this.serverConfig = serverConfig;
  }

  void run() throws Exception {
    logger.atInfo().log(
        "Task %d: serving controller at %s, data provider at %s",
        serverConfig.task(), serverConfig.controllerAddress(), serverConfig.dataAddress());
    controlLoop.run();
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("TradeGym server starting up with %d arguments", args.length);
    try {
      Namespace namespace = createParser().parseArgs(args);
      ServerConfig serverConfig = createServerConfig(namespace);
      App app = Guice.createInjector(ServerModule.create(serverConfig)).getInstance(App.class);
      app.run();
      logger.atInfo().log("Task %d: server exiting", serverConfig.task());
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error, server exiting");
      throw e;
    }
  }

  static ServerConfig createServerConfig(Namespace namespace) {
    EngineConfig engineConfig =
        new EngineConfig(
            namespace.getDouble("start.cash"),
            namespace.getDouble("stake"),
            namespace.getDouble("commission"),
            namespace.getInt("window.size"),
            namespace.getDouble("drawdown.limit"),
            namespace.getInt("skip.frame"));
    return new ServerConfig(
        Endpoint.parse(namespace.getString("network.address")),
        Endpoint.parse(namespace.getString("data.network.address")),
        Duration.ofSeconds(namespace.getInt("connect.timeout.seconds")),
        namespace.getInt("task"),
        Duration.ofSeconds(namespace.getInt("data.wait.budget.seconds")),
        namespace.getBoolean("render"),
        engineConfig);
  }

  static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("TradeGymServer")
      .build()
      .defaultHelp(true)
      .description("Backtest environment server for a single controller session");

    // Channels
    parser.addArgument("--network.address")
      .setDefault("tcp://127.0.0.1:5000")
      .help("Address to bind for the controller");

    parser.addArgument("--data.network.address")
      .setDefault("tcp://127.0.0.1:4999")
      .help("Address of the data provider");

    parser.addArgument("--connect.timeout.seconds")
      .type(Integer.class)
      .setDefault(60)
      .help("Send timeout on both channels, receive timeout on the data channel");

    parser.addArgument("--task")
      .type(Integer.class)
      .setDefault(0)
      .help("Task id, used in log lines");

    parser.addArgument("--data.wait.budget.seconds")
      .type(Integer.class)
      .setDefault(300)
      .help("How long to wait for a data provider that is not ready");

    // Episodes
    parser.addArgument("--render")
      .type(Boolean.class)
      .setDefault(true)
      .help("Whether to render steps and episodes");

    parser.addArgument("--skip.frame")
      .type(Integer.class)
      .setDefault(1)
      .help("Ticks between two steps communicated to the controller");

    // Broker
    parser.addArgument("--start.cash")
      .type(Double.class)
      .setDefault(100.0)
      .help("Cash at the start of every episode");

    parser.addArgument("--stake")
      .type(Double.class)
      .setDefault(1.0)
      .help("Units traded per order");

    parser.addArgument("--commission")
      .type(Double.class)
      .setDefault(0.0)
      .help("Fraction of the traded notional charged per order");

    parser.addArgument("--window.size")
      .type(Integer.class)
      .setDefault(4)
      .help("Bars in the state window");

    parser.addArgument("--drawdown.limit")
      .type(Double.class)
      .setDefault(0.5)
      .help("Drawdown at which an episode ends");

    return parser;
  }
}
