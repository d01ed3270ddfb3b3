package com.verlumen.tradegym.channel;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.ByteBuffer;

/**
 * Length-prefixed JSON framing: a 4-byte big-endian payload length followed by the UTF-8 JSON
 * text.
 */
public final class FrameCodec {
  public static final int HEADER_BYTES = Integer.BYTES;
  public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

  private final Gson gson;
  private final int maxFrameBytes;

  public FrameCodec(int maxFrameBytes) {
    checkArgument(maxFrameBytes > 0, "Max frame size must be positive: %s", maxFrameBytes);
    this.gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();
    this.maxFrameBytes = maxFrameBytes;
  }

  public static FrameCodec create() {
    return new FrameCodec(DEFAULT_MAX_FRAME_BYTES);
  }

  /** Encodes one frame, header included, ready to be written. */
  public ByteBuffer encode(JsonElement message) throws ChannelException {
    byte[] payload = gson.toJson(message).getBytes(UTF_8);
    if (payload.length > maxFrameBytes) {
      throw ChannelException.transportError(
          String.format(
              "Frame of %d bytes exceeds the %d byte limit", payload.length, maxFrameBytes));
    }
    ByteBuffer frame = ByteBuffer.allocate(HEADER_BYTES + payload.length);
    frame.putInt(payload.length).put(payload);
    frame.flip();
    return frame;
  }

  /** Validates a payload length read from a frame header. */
  public int checkLength(int length) throws ChannelException {
    if (length < 0 || length > maxFrameBytes) {
      throw ChannelException.transportError(
          String.format("Invalid frame length %d (limit %d)", length, maxFrameBytes));
    }
    return length;
  }

  public JsonElement decode(byte[] payload) throws ChannelException {
    try {
      return JsonParser.parseString(new String(payload, UTF_8));
    } catch (JsonParseException e) {
      throw ChannelException.transportError("Received a frame that is not valid JSON", e);
    }
  }
}
