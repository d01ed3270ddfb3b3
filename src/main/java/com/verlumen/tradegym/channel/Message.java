package com.verlumen.tradegym.channel;

import static com.google.common.collect.Streams.stream;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.Optional;

/**
 * A request exchanged over a {@link MessageChannel}.
 *
 * <p>On the wire a message is a JSON object with the optional keys {@code ctrl}, {@code action},
 * {@code mode} and {@code kwargs}. The {@code ctrl} value is kept verbatim so that commands outside
 * the known vocabulary can still be reported back to the sender.
 */
@AutoValue
public abstract class Message {
  private static final String CTRL = "ctrl";
  private static final String ACTION = "action";
  private static final String MODE = "mode";
  private static final String KWARGS = "kwargs";

  public abstract Optional<String> ctrl();

  public abstract Optional<String> action();

  /** Requested render modes; empty when the message carries no {@code mode}. */
  public abstract ImmutableList<String> modes();

  public abstract JsonObject kwargs();

  public static Builder builder() {
    return new AutoValue_Message.Builder()
        .setModes(ImmutableList.of())
        .setKwargs(new JsonObject());
  }

  public static Message control(Control control) {
    return builder().setCtrl(control.wireName()).build();
  }

  public static Message control(Control control, JsonObject kwargs) {
    return builder().setCtrl(control.wireName()).setKwargs(kwargs).build();
  }

  public static Message render(String... modes) {
    return builder()
        .setCtrl(Control.RENDER.wireName())
        .setModes(ImmutableList.copyOf(modes))
        .build();
  }

  public static Message action(String action) {
    return builder().setAction(action).build();
  }

  /** The known control command, if {@code ctrl} is present and part of the vocabulary. */
  public Optional<Control> control() {
    return ctrl().flatMap(Control::fromWireName);
  }

  public boolean hasCtrl() {
    return ctrl().isPresent();
  }

  public boolean hasAction() {
    return action().isPresent();
  }

  public boolean is(Control control) {
    return control().filter(control::equals).isPresent();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    ctrl().ifPresent(ctrl -> json.addProperty(CTRL, ctrl));
    action().ifPresent(action -> json.addProperty(ACTION, action));
    if (modes().size() == 1) {
      json.addProperty(MODE, modes().get(0));
    } else if (!modes().isEmpty()) {
      JsonArray modeArray = new JsonArray();
      modes().forEach(modeArray::add);
      json.add(MODE, modeArray);
    }
    if (kwargs().size() > 0) {
      json.add(KWARGS, kwargs());
    }
    return json;
  }

  /**
   * Reads a message from its JSON form.
   *
   * <p>Anything that is not a JSON object reads as a message with no fields, which the receivers
   * treat as "lacking both {@code ctrl} and {@code action}".
   */
  public static Message fromJson(JsonElement element) {
    Builder builder = builder();
    if (element == null || !element.isJsonObject()) {
      return builder.build();
    }
    JsonObject json = element.getAsJsonObject();
    asString(json.get(CTRL)).ifPresent(builder::setCtrl);
    asString(json.get(ACTION)).ifPresent(builder::setAction);
    builder.setModes(parseModes(json.get(MODE)));
    JsonElement kwargs = json.get(KWARGS);
    if (kwargs != null && kwargs.isJsonObject()) {
      builder.setKwargs(kwargs.getAsJsonObject());
    }
    return builder.build();
  }

  private static ImmutableList<String> parseModes(JsonElement mode) {
    if (mode == null || mode.isJsonNull()) {
      return ImmutableList.of();
    }
    if (mode.isJsonArray()) {
      return stream(mode.getAsJsonArray())
          .map(Message::asString)
          .flatMap(Optional::stream)
          .collect(toImmutableList());
    }
    return asString(mode).map(ImmutableList::of).orElse(ImmutableList.of());
  }

  private static Optional<String> asString(JsonElement element) {
    if (element == null || !element.isJsonPrimitive()) {
      return Optional.empty();
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    return Optional.of(primitive.getAsString());
  }

  @Override
  public final String toString() {
    return toJson().toString();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCtrl(String ctrl);

    public abstract Builder setAction(String action);

    public abstract Builder setModes(ImmutableList<String> modes);

    public abstract Builder setKwargs(JsonObject kwargs);

    public abstract Message build();
  }
}
