package com.verlumen.tradegym.data;

import com.google.auto.value.AutoValue;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.verlumen.tradegym.channel.ExchangeResult;
import com.verlumen.tradegym.channel.ExchangeStatus;
import java.util.Optional;

/**
 * A {@code get_data} exchange classified by readiness.
 *
 * <p>The provider marks its reply with {@code "status": "ready"} or {@code "status": "not_ready"}.
 * A reply without a status counts as ready when it carries a {@code sample}.
 */
@AutoValue
public abstract class DataReply {
  static final String STATUS = "status";
  static final String READY = "ready";
  static final String NOT_READY = "not_ready";
  static final String SAMPLE = "sample";
  static final String STAT = "stat";

  public abstract DataReadiness readiness();

  public abstract ExchangeStatus exchangeStatus();

  /** The reply object when {@link #readiness()} is {@link DataReadiness#READY}. */
  public abstract Optional<JsonObject> payload();

  public static DataReply classify(ExchangeResult result) {
    if (!result.isOk()) {
      return new AutoValue_DataReply(
          DataReadiness.UNREACHABLE, result.status(), Optional.empty());
    }
    JsonElement reply = result.reply().get();
    if (!reply.isJsonObject()) {
      return new AutoValue_DataReply(DataReadiness.READY, result.status(), Optional.empty());
    }
    JsonObject json = reply.getAsJsonObject();
    JsonElement status = json.get(STATUS);
    if (status != null
        && status.isJsonPrimitive()
        && NOT_READY.equals(status.getAsString())) {
      return new AutoValue_DataReply(DataReadiness.NOT_READY, result.status(), Optional.empty());
    }
    return new AutoValue_DataReply(DataReadiness.READY, result.status(), Optional.of(json));
  }
}
