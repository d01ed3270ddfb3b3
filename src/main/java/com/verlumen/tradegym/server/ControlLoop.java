package com.verlumen.tradegym.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.inject.Inject;
import com.verlumen.tradegym.channel.ChannelException;
import com.verlumen.tradegym.channel.Control;
import com.verlumen.tradegym.channel.ControllerChannel;
import com.verlumen.tradegym.channel.Message;
import com.verlumen.tradegym.channel.MessageChannel;
import com.verlumen.tradegym.data.DataAcquisition;
import com.verlumen.tradegym.data.DataException;
import com.verlumen.tradegym.render.Renderer;
import java.io.IOException;
import java.util.Optional;

/**
 * The session's outer state machine.
 *
 * <p>In control mode every request gets exactly one reply. Only {@code reset}, which runs an
 * episode, and {@code stop}, which ends the session, leave control mode. Controller channel faults
 * in control mode cost at most one reply; a {@code reset} with an unusable config is answered with
 * a diagnostic and leaves the session in control mode.
 */
public final class ControlLoop {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String EXIT_REPLY = "Exiting.";
  static final String USAGE_HINT = "send control keys: <reset>, <getstat>, <render>, <stop>.";

  private final MessageChannel channel;
  private final DataAcquisition dataAcquisition;
  private final EpisodeRunner episodeRunner;
  private final Renderer renderer;
  private final Session session;
  private Optional<String> episodeFailure = Optional.empty();
  private boolean closed = false;

  @Inject
  ControlLoop(
      @ControllerChannel MessageChannel channel,
      DataAcquisition dataAcquisition,
      EpisodeRunner episodeRunner,
      Renderer renderer,
      ServerConfig config) {
    this.channel = channel;
    this.dataAcquisition = dataAcquisition;
    this.episodeRunner = episodeRunner;
    this.renderer = renderer;
    this.session = new Session(config.task());
  }

  /**
   * Serves the controller until it sends {@code stop}.
   *
   * <p>Data provider failures, protocol violations and engine faults end the session: they are
   * logged with the task id, the provider is told to stop, both channels are closed and the
   * failure is rethrown.
   */
  public void run() throws DataException, IOException {
    logger.atInfo().log("Task %d: session started", session.task());
    try {
      dataAcquisition.ping();
      while (session.state() != SessionState.TERMINATED) {
        Optional<Message> message = receive();
        if (message.isPresent()) {
          handle(message.get());
        }
      }
    } catch (DataException | IOException | RuntimeException e) {
      logger.atSevere().withCause(e).log("Task %d: session failed", session.task());
      shutdown();
      throw e;
    }
    logger.atInfo().log(
        "Task %d: session ended after %d episodes", session.task(), session.episodeCount());
  }

  @VisibleForTesting
  SessionState state() {
    return session.state();
  }

  private Optional<Message> receive() {
    try {
      Message message = Message.fromJson(channel.receive());
      logger.atFine().log("Task %d: control message %s", session.task(), message);
      return Optional.of(message);
    } catch (ChannelException e) {
      logger.atWarning().withCause(e).log(
          "Task %d: failed to receive a control message", session.task());
      if (channel.awaitingReply()) {
        reply(
            new JsonPrimitive(
                "Control mode: failed to receive a valid message: " + e.getMessage()));
      }
      return Optional.empty();
    }
  }

  private void handle(Message message) throws DataException, IOException {
    if (!message.hasCtrl()) {
      reply(new JsonPrimitive(noCtrlHint(message)));
      return;
    }

    Optional<Control> control = message.control();
    if (control.isEmpty()) {
      sendUsageHint();
      return;
    }
    switch (control.get()) {
      case STOP:
        reply(new JsonPrimitive(EXIT_REPLY));
        logger.atInfo().log("Task %d: stop received", session.task());
        shutdown();
        session.setState(SessionState.TERMINATED);
        break;
      case RESET:
        reset(message.kwargs());
        break;
      case GETSTAT:
        reply(lastResult());
        break;
      case RENDER:
        if (message.modes().isEmpty()) {
          sendUsageHint();
        } else {
          reply(renderer.render(message.modes(), Optional.empty()));
        }
        break;
      default:
        sendUsageHint();
    }
  }

  private void reset(JsonObject kwargs) throws DataException, IOException {
    EpisodeRequest request;
    try {
      request = EpisodeRequest.fromKwargs(kwargs);
    } catch (EpisodeConfigException e) {
      logger.atWarning().log("Task %d: rejected reset: %s", session.task(), e.getMessage());
      reply(new JsonPrimitive(e.getMessage() + "\nHint: check the reset() kwargs."));
      return;
    }
    if (!reply(new JsonPrimitive("Preparing new episode with kwargs: " + kwargs))) {
      return;
    }
    session.setState(SessionState.EPISODE);
    try {
      episodeRunner.run(session, request);
    } catch (EpisodeConfigException e) {
      logger.atWarning().withCause(e).log(
          "Task %d: episode %d did not start", session.task(), session.episodeCount());
      episodeFailure = Optional.of(e.getMessage());
    }
    session.setState(SessionState.CONTROL);
  }

  private String noCtrlHint(Message message) {
    if (episodeFailure.isPresent()) {
      String failure = episodeFailure.get();
      episodeFailure = Optional.empty();
      return String.format(
          "No episode is running, the last reset failed: %s\nHint: check the reset() kwargs.",
          failure);
    }
    return String.format("No <ctrl> key received: %s\nHint: forgot to call reset()?", message);
  }

  private JsonElement lastResult() {
    return session.lastResult().map(EpisodeResult::toJson).orElseGet(JsonObject::new);
  }

  private void sendUsageHint() {
    JsonObject hint = new JsonObject();
    hint.addProperty("ctrl", USAGE_HINT);
    reply(hint);
  }

  /**
   * Sends a control-mode reply. A failed send loses only this reply: the channel drops the peer
   * and the loop keeps serving.
   *
   * @return whether the reply went out
   */
  private boolean reply(JsonElement reply) {
    try {
      channel.send(reply);
      return true;
    } catch (ChannelException e) {
      logger.atWarning().withCause(e).log(
          "Task %d: failed to send a control reply", session.task());
      return false;
    }
  }

  private void shutdown() {
    if (closed) {
      return;
    }
    closed = true;
    dataAcquisition.stop();
    channel.close();
  }
}
