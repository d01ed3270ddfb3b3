package com.verlumen.tradegym.channel;

/** Outcome of {@link MessageChannel#exchange}. */
public enum ExchangeStatus {
  OK,
  SEND_FAILED_TIMEOUT,
  SEND_FAILED_OTHER,
  RECEIVE_FAILED_TIMEOUT,
  RECEIVE_FAILED_OTHER;

  static ExchangeStatus sendFailure(ChannelException e) {
    return e.isTimeout() ? SEND_FAILED_TIMEOUT : SEND_FAILED_OTHER;
  }

  static ExchangeStatus receiveFailure(ChannelException e) {
    return e.isTimeout() ? RECEIVE_FAILED_TIMEOUT : RECEIVE_FAILED_OTHER;
  }

  public String wireName() {
    return name().toLowerCase();
  }
}
