package com.verlumen.tradegym.sample;

import com.google.inject.AbstractModule;

public class SampleModule extends AbstractModule {
  public static SampleModule create() {
    return new SampleModule();
  }

  @Override
  protected void configure() {
    bind(SampleDecoder.class).to(SampleDecoderImpl.class);
  }

  private SampleModule() {}
}
