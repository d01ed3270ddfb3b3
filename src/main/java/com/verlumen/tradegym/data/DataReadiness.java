package com.verlumen.tradegym.data;

/** What a {@code get_data} exchange says about the data provider. */
public enum DataReadiness {
  READY,
  NOT_READY,
  UNREACHABLE
}
