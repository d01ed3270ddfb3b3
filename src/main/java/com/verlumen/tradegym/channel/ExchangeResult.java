package com.verlumen.tradegym.channel;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.gson.JsonElement;
import java.time.Duration;
import java.util.Optional;

/** Structured result of a send-then-receive exchange. */
@AutoValue
public abstract class ExchangeResult {
  public abstract ExchangeStatus status();

  /** The reply; present only when {@link #status()} is {@link ExchangeStatus#OK}. */
  public abstract Optional<JsonElement> reply();

  /** Time spent waiting for the reply after the request went out. */
  public abstract Duration roundTrip();

  public static ExchangeResult ok(JsonElement reply, Duration roundTrip) {
    return new AutoValue_ExchangeResult(ExchangeStatus.OK, Optional.of(reply), roundTrip);
  }

  public static ExchangeResult failed(ExchangeStatus status, Duration roundTrip) {
    checkArgument(status != ExchangeStatus.OK, "A failed exchange cannot have status OK");
    return new AutoValue_ExchangeResult(status, Optional.empty(), roundTrip);
  }

  public boolean isOk() {
    return status() == ExchangeStatus.OK;
  }
}
