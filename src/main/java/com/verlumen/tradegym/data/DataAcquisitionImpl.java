package com.verlumen.tradegym.data;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.tradegym.channel.Control;
import com.verlumen.tradegym.channel.ControllerChannel;
import com.verlumen.tradegym.channel.DataChannel;
import com.verlumen.tradegym.channel.ExchangeResult;
import com.verlumen.tradegym.channel.Message;
import com.verlumen.tradegym.channel.MessageChannel;
import com.verlumen.tradegym.sample.SampleConfig;
import com.verlumen.tradegym.sample.SampleDecoder;
import com.verlumen.tradegym.sample.SampleStats;
import com.verlumen.tradegym.sample.TrialSample;
import java.time.Duration;
import java.util.Random;

final class DataAcquisitionImpl implements DataAcquisition {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final MessageChannel dataChannel;
  private final MessageChannel controllerChannel;
  private final SampleDecoder sampleDecoder;
  private final Sleeper sleeper;
  private final Random random;
  private final DataConfig config;
  private boolean stopped = false;

  @Inject
  DataAcquisitionImpl(
      @DataChannel MessageChannel dataChannel,
      @ControllerChannel MessageChannel controllerChannel,
      SampleDecoder sampleDecoder,
      Sleeper sleeper,
      Random random,
      DataConfig config) {
    this.dataChannel = dataChannel;
    this.controllerChannel = controllerChannel;
    this.sampleDecoder = sampleDecoder;
    this.sleeper = sleeper;
    this.random = random;
    this.config = config;
  }

  @Override
  public void ping() throws DataException {
    ExchangeResult result = dataChannel.exchange(Message.control(Control.PING));
    if (!result.isOk()) {
      throw DataException.unreachable(
          String.format("Data provider did not answer ping: %s", result.status().wireName()));
    }
    logger.atInfo().log(
        "Data provider answered ping in %d ms: %s",
        result.roundTrip().toMillis(), result.reply().get());
  }

  @Override
  public AcquiredTrial acquire(SampleConfig trialConfig) throws DataException {
    Message request = Message.control(Control.GET_DATA, trialConfig.toJson());
    Duration waited = Duration.ZERO;
    int attempt = 0;
    while (true) {
      attempt++;
      DataReply reply = DataReply.classify(dataChannel.exchange(request));
      switch (reply.readiness()) {
        case UNREACHABLE:
          throw DataException.unreachable(
              String.format(
                  "Data provider unreachable on attempt %d: %s",
                  attempt, reply.exchangeStatus().wireName()));
        case READY:
          return decode(reply);
        case NOT_READY:
          if (waited.compareTo(config.waitBudget()) > 0) {
            giveUp(waited);
          }
          Duration pause = nextPause();
          logger.atInfo().log(
              "Data provider not ready, retrying in %.1f s; %d s of %d s budget left",
              pause.toMillis() / 1000.0,
              Math.max(0, config.waitBudget().minus(waited).getSeconds()),
              config.waitBudget().getSeconds());
          pause(pause);
          waited = waited.plus(pause);
          break;
      }
    }
  }

  @Override
  public void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    ExchangeResult result = dataChannel.exchange(Message.control(Control.STOP));
    if (result.isOk()) {
      logger.atInfo().log("Data provider acknowledged stop: %s", result.reply().get());
    } else {
      logger.atWarning().log(
          "Data provider did not acknowledge stop: %s", result.status().wireName());
    }
    dataChannel.close();
  }

  private AcquiredTrial decode(DataReply reply) throws DataException {
    JsonObject payload =
        reply
            .payload()
            .orElseThrow(() -> DataException.unreachable("Data provider reply is not an object"));
    JsonElement sample = payload.get(DataReply.SAMPLE);
    if (sample == null || !sample.isJsonObject()) {
      throw DataException.unreachable("Data provider reply carries no sample");
    }

    TrialSample trial;
    try {
      trial = sampleDecoder.decode(sample.getAsJsonObject());
    } catch (RuntimeException e) {
      throw DataException.unreachable("Data provider sent an undecodable sample", e);
    }
    JsonElement stat = payload.get(DataReply.STAT);
    JsonObject datasetStat =
        stat != null && stat.isJsonObject() ? stat.getAsJsonObject() : new JsonObject();

    SampleStats trialStat = trial.describe();
    trial.reset();
    logger.atInfo().log("Received trial <%s> with %d bars", trial.name(), trialStat.count());
    return AcquiredTrial.create(trial, trialStat, datasetStat);
  }

  private void giveUp(Duration waited) throws DataException {
    String message =
        String.format(
            "Data provider not ready after waiting %d s, budget is %d s",
            waited.getSeconds(), config.waitBudget().getSeconds());
    logger.atSevere().log("%s; shutting down", message);
    stop();
    controllerChannel.close();
    throw DataException.timeout(message);
  }

  private Duration nextPause() {
    return Duration.ofNanos((long) (random.nextDouble() * config.maxPause().toNanos()));
  }

  private void pause(Duration pause) throws DataException {
    try {
      sleeper.sleep(pause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw DataException.timeout("Interrupted while waiting for the data provider", e);
    }
  }
}
