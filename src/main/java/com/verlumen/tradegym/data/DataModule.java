package com.verlumen.tradegym.data;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

public class DataModule extends AbstractModule {
  public static DataModule create() {
    return new DataModule();
  }

  @Override
  protected void configure() {
    bind(DataAcquisition.class).to(DataAcquisitionImpl.class).in(Singleton.class);
  }

  private DataModule() {}
}
