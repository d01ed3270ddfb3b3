package com.verlumen.tradegym.engine;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

public class EngineModule extends AbstractModule {
  public static EngineModule create() {
    return new EngineModule();
  }

  @Override
  protected void configure() {
    // The bound engine is the template; episodes run on copies of it.
    bind(BacktestEngine.class).to(Ta4jBacktestEngine.class).in(Singleton.class);
  }

  private EngineModule() {}
}
