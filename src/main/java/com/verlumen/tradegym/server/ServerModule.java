package com.verlumen.tradegym.server;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.verlumen.tradegym.channel.ChannelException;
import com.verlumen.tradegym.channel.ChannelTimeouts;
import com.verlumen.tradegym.channel.ControllerChannel;
import com.verlumen.tradegym.channel.DataChannel;
import com.verlumen.tradegym.channel.FrameCodec;
import com.verlumen.tradegym.channel.MessageChannel;
import com.verlumen.tradegym.channel.SocketMessageChannel;
import com.verlumen.tradegym.data.DataConfig;
import com.verlumen.tradegym.data.DataModule;
import com.verlumen.tradegym.data.Sleeper;
import com.verlumen.tradegym.engine.EngineConfig;
import com.verlumen.tradegym.engine.EngineModule;
import com.verlumen.tradegym.render.JsonRenderer;
import com.verlumen.tradegym.render.Renderer;
import com.verlumen.tradegym.sample.SampleModule;
import java.util.Random;

@AutoValue
abstract class ServerModule extends AbstractModule {
  static ServerModule create(ServerConfig serverConfig) {
    return new AutoValue_ServerModule(serverConfig);
  }

  abstract ServerConfig serverConfig();

  @Override
  protected void configure() {
    bind(Sleeper.class).toInstance(Sleeper.system());

    install(new FactoryModuleBuilder().build(StepExchange.Factory.class));
    install(DataModule.create());
    install(EngineModule.create());
    install(SampleModule.create());
  }

  @Provides
  ServerConfig provideServerConfig() {
    return serverConfig();
  }

  @Provides
  EngineConfig provideEngineConfig() {
    return serverConfig().engineConfig();
  }

  @Provides
  DataConfig provideDataConfig() {
    return new DataConfig(serverConfig().dataWaitBudget(), DataConfig.DEFAULT_MAX_PAUSE);
  }

  @Provides
  @Singleton
  Random provideRandom() {
    return new Random();
  }

  @Provides
  @Singleton
  Renderer provideRenderer() {
    return new JsonRenderer(serverConfig().render());
  }

  @Provides
  @Singleton
  FrameCodec provideFrameCodec() {
    return FrameCodec.create();
  }

  @Provides
  @Singleton
  @ControllerChannel
  MessageChannel provideControllerChannel(FrameCodec codec) throws ChannelException {
    // The controller sets the pace, so receives never time out.
    return SocketMessageChannel.bind(
        serverConfig().controllerAddress(),
        ChannelTimeouts.unboundedReceive(serverConfig().connectTimeout()),
        codec);
  }

  @Provides
  @Singleton
  @DataChannel
  MessageChannel provideDataChannel(FrameCodec codec) throws ChannelException {
    return SocketMessageChannel.connect(
        serverConfig().dataAddress(),
        ChannelTimeouts.bounded(serverConfig().connectTimeout(), serverConfig().connectTimeout()),
        codec);
  }
}
