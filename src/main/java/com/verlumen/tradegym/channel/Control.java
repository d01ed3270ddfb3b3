package com.verlumen.tradegym.channel;

import java.util.Arrays;
import java.util.Optional;

/** The fixed vocabulary of the {@code ctrl} field. */
public enum Control {
  RESET("reset"),
  STOP("stop"),
  GETSTAT("getstat"),
  RENDER("render"),
  GET_DATA("get_data"),
  DONE("done"),
  PING("ping");

  private final String wireName;

  Control(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Looks up a control by its wire name; unknown names yield an empty result. */
  public static Optional<Control> fromWireName(String name) {
    return Arrays.stream(values())
        .filter(control -> control.wireName.equals(name))
        .findFirst();
  }
}
