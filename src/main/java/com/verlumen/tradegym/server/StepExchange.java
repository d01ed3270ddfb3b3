package com.verlumen.tradegym.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.tradegym.channel.ChannelException;
import com.verlumen.tradegym.channel.Control;
import com.verlumen.tradegym.channel.ControllerChannel;
import com.verlumen.tradegym.channel.Message;
import com.verlumen.tradegym.channel.MessageChannel;
import com.verlumen.tradegym.channel.ProtocolException;
import com.verlumen.tradegym.engine.StepHook;
import com.verlumen.tradegym.engine.TickContext;
import com.verlumen.tradegym.render.Renderer;
import com.verlumen.tradegym.render.StepSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-tick hook that synchronizes engine time with the controller.
 *
 * <p>Every {@code skipFrame}-th tick, and on the terminal tick, it blocks until the controller
 * sends an action, answering any {@code render} requests in between without consuming the turn.
 * The reply to an action is {@code [state, reward, done, [info]]} where {@code info} is the
 * record of the latest tick; all records since the previous reply are kept for rendering.
 */
public final class StepExchange implements StepHook {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String HOLD = "hold";
  static final String DONE_ACK = "_DONE SIGNAL RECEIVED";

  private final MessageChannel channel;
  private final Renderer renderer;
  private final TickContext context;
  private final int skipFrame;
  private final List<JsonObject> batch = new ArrayList<>();
  private Optional<Message> lastMessage = Optional.empty();
  private Optional<StepSnapshot> lastStep = Optional.empty();
  private int ticks = 0;
  private int communicatedSteps = 0;
  private boolean done = false;
  private boolean forced = false;

  @Inject
  StepExchange(
      @ControllerChannel MessageChannel channel,
      Renderer renderer,
      @Assisted TickContext context,
      @Assisted int skipFrame) {
    checkArgument(skipFrame > 0, "Skip frame must be positive: %s", skipFrame);
    this.channel = channel;
    this.renderer = renderer;
    this.context = context;
    this.skipFrame = skipFrame;
  }

  @Override
  public void onTick() throws ChannelException {
    ticks++;
    done = context.isDone();
    batch.add(context.info());
    context.setAction(HOLD);

    if (context.tick() % skipFrame != 0 && !done) {
      return;
    }

    JsonElement rawState = context.rawState();
    JsonElement state = context.state();
    double reward = context.reward();

    Message message = receive();
    while (message.hasCtrl()) {
      if (message.is(Control.RENDER)) {
        channel.send(renderer.render(message.modes(), lastStep));
        message = receive();
      } else if (message.is(Control.DONE)) {
        channel.send(new JsonPrimitive(DONE_ACK));
        logger.atInfo().log("Episode terminated by the controller at tick %d", context.tick());
        done = true;
        forced = true;
        earlyStop();
        return;
      } else {
        String ctrl = message.ctrl().get();
        channel.send(
            new JsonPrimitive(
                String.format(
                    "Unknown control key <%s> during an episode, send <action>, <render> or"
                        + " <done>.",
                    ctrl)));
        throw new ProtocolException(
            ProtocolException.Kind.UNKNOWN_CONTROL,
            "Unknown control key during an episode: " + ctrl);
      }
    }

    if (!message.hasAction()) {
      channel.send(new JsonPrimitive("No <action> key received: " + message));
      throw new ProtocolException(
          ProtocolException.Kind.MISSING_ACTION, "Episode message without action: " + message);
    }

    String action = message.action().get();
    context.setAction(action);
    context.setLastAction(action);

    JsonArray info = new JsonArray();
    info.add(Iterables.getLast(batch));
    JsonArray reply = new JsonArray();
    reply.add(state);
    reply.add(reward);
    reply.add(done);
    reply.add(info);
    channel.send(reply);
    communicatedSteps++;

    lastStep =
        Optional.of(
            StepSnapshot.create(rawState, state, reward, done, ImmutableList.copyOf(batch)));
    batch.clear();

    if (done) {
      earlyStop();
    }
  }

  @Override
  public JsonObject analysis() {
    JsonObject analysis = new JsonObject();
    analysis.addProperty("ticks", ticks);
    analysis.addProperty("communicated_steps", communicatedSteps);
    analysis.addProperty("forced", forced);
    return analysis;
  }

  /** Whether the episode has reached its terminal tick, naturally or by request. */
  public boolean isDone() {
    return done;
  }

  /** Whether the controller ended the episode with {@code done}. */
  public boolean wasForced() {
    return forced;
  }

  @VisibleForTesting
  Optional<Message> lastMessage() {
    return lastMessage;
  }

  @VisibleForTesting
  Optional<StepSnapshot> lastStep() {
    return lastStep;
  }

  private Message receive() throws ChannelException {
    Message message = Message.fromJson(channel.receive());
    logger.atFine().log("Episode message at tick %d: %s", context.tick(), message);
    lastMessage = Optional.of(message);
    return message;
  }

  private void earlyStop() {
    ImmutableList<String> stepModes =
        renderer.renderModes().stream()
            .filter(mode -> !Renderer.EPISODE_MODE.equals(mode))
            .collect(ImmutableList.toImmutableList());
    lastStep.ifPresent(step -> renderer.renderInPlace(stepModes, step));
    context.closePositions();
    context.halt();
  }

  public interface Factory {
    StepExchange create(TickContext context, int skipFrame);
  }
}
