package com.verlumen.tradegym.server;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.inject.Inject;
import com.verlumen.tradegym.data.AcquiredTrial;
import com.verlumen.tradegym.data.DataAcquisition;
import com.verlumen.tradegym.data.DataException;
import com.verlumen.tradegym.engine.BacktestEngine;
import com.verlumen.tradegym.engine.EpisodeRun;
import com.verlumen.tradegym.engine.ObserverKind;
import com.verlumen.tradegym.engine.StepHook;
import com.verlumen.tradegym.render.Renderer;
import com.verlumen.tradegym.sample.EpisodeSample;
import com.verlumen.tradegym.sample.SampleConfig;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Runs one episode on a fresh copy of the engine template. */
final class EpisodeRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final ImmutableList<ObserverKind> RENDER_OBSERVERS =
      ImmutableList.of(ObserverKind.NORM_PNL, ObserverKind.POSITION, ObserverKind.REWARD);

  private final BacktestEngine engineTemplate;
  private final StepExchange.Factory stepExchangeFactory;
  private final DataAcquisition dataAcquisition;
  private final Renderer renderer;

  @Inject
  EpisodeRunner(
      BacktestEngine engineTemplate,
      StepExchange.Factory stepExchangeFactory,
      DataAcquisition dataAcquisition,
      Renderer renderer) {
    this.engineTemplate = engineTemplate;
    this.stepExchangeFactory = stepExchangeFactory;
    this.dataAcquisition = dataAcquisition;
    this.renderer = renderer;
  }

  /**
   * Runs an episode to completion and records it in the session.
   *
   * @throws EpisodeConfigException if the trial cannot yield an episode for the requested
   *     config; nothing has been exchanged with the controller at that point
   */
  EpisodeResult run(Session session, EpisodeRequest request)
      throws DataException, EpisodeConfigException, IOException {
    Instant startTime = Instant.now();
    Stopwatch stopwatch = Stopwatch.createStarted();
    int episode = session.episodeCount();

    BacktestEngine engine = engineTemplate.copy();
    attachObservers(engine);
    StepExchange stepExchange =
        stepExchangeFactory.create(engine.tickContext(), engine.skipFrame());
    engine.setStepHook(stepExchange);

    AcquiredTrial trial = resolveTrial(session, request.trialConfig());
    EpisodeSample sample = sampleEpisode(trial, request.episodeConfig());

    engine.putStrategyParam("trial_stat", trial.trialStat().toJson());
    engine.putStrategyParam("trial_metadata", trial.sample().metadata().deepCopy());
    engine.putStrategyParam("dataset_stat", trial.datasetStat().deepCopy());
    engine.putStrategyParam("episode_stat", sample.describe().toJson());
    engine.putStrategyParam("metadata", sample.metadata().deepCopy());
    engine.addFeed(sample.toFeed());

    logger.atInfo().log(
        "Task %d: starting episode %d on <%s>", session.task(), episode, sample.name());
    EpisodeRun run = engine.run();
    renderer.renderEpisode(engine.observerLines());

    EpisodeResult result =
        EpisodeResult.builder()
            .setEpisode(episode)
            .setStartTime(startTime)
            .setRuntime(stopwatch.elapsed())
            .setLength(run.length())
            .setDone(stepExchange.isDone())
            .setEarlyStop(stepExchange.wasForced())
            .setAnalyses(withoutStepHook(run.analyses()))
            .build();
    session.completeEpisode(result);
    logger.atInfo().log(
        "Task %d: episode %d finished after %d ticks in %s, early stop: %s",
        session.task(), episode, result.length(), formatRuntime(result.runtime()),
        result.earlyStop());

    System.gc();
    return result;
  }

  private void attachObservers(BacktestEngine engine) {
    attach(engine, ObserverKind.DRAWDOWN);
    if (renderer.enabled()) {
      RENDER_OBSERVERS.forEach(kind -> attach(engine, kind));
    }
  }

  private static void attach(BacktestEngine engine, ObserverKind kind) {
    if (engine.hasObserver(kind)) {
      return;
    }
    engine.addObserver(kind);
  }

  private AcquiredTrial resolveTrial(Session session, SampleConfig trialConfig)
      throws DataException {
    if (!trialConfig.getNew() && session.trial().isPresent()) {
      logger.atFine().log("Task %d: reusing cached trial", session.task());
      return session.trial().get();
    }
    AcquiredTrial trial = dataAcquisition.acquire(trialConfig);
    session.setTrial(trial);
    return trial;
  }

  private static EpisodeSample sampleEpisode(AcquiredTrial trial, SampleConfig episodeConfig)
      throws EpisodeConfigException {
    try {
      return trial.sample().sample(episodeConfig);
    } catch (IllegalArgumentException e) {
      throw new EpisodeConfigException(
          String.format(
              "Cannot sample an episode from trial <%s>: %s",
              trial.sample().name(), e.getMessage()),
          e);
    }
  }

  private static ImmutableMap<String, JsonElement> withoutStepHook(
      ImmutableMap<String, JsonElement> analyses) {
    return analyses.entrySet().stream()
        .filter(entry -> !StepHook.NAME.equals(entry.getKey()))
        .collect(toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  private static String formatRuntime(Duration runtime) {
    return String.format("%.3f s", runtime.toMillis() / 1000.0);
  }
}
