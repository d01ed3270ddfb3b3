package com.verlumen.tradegym.channel;

import com.google.common.base.Stopwatch;
import com.google.gson.JsonElement;
import java.io.Closeable;
import java.time.Duration;

/**
 * A duplex, message-oriented connection with bounded send and receive times.
 *
 * <p>Every exchange is request/reply paired. A replier must {@link #receive()} before each {@link
 * #send}, a requester must {@link #send} before each {@link #receive()}. Calls made out of that
 * order fail with {@link ProtocolException.Kind#OUT_OF_ORDER_EXCHANGE}.
 */
public interface MessageChannel extends Closeable {
  /**
   * Sends one message.
   *
   * @throws ChannelException with {@link ChannelException.Kind#TIMED_OUT} when the send timeout
   *     elapsed, {@link ChannelException.Kind#TRANSPORT_ERROR} on any other fault
   */
  void send(JsonElement message) throws ChannelException;

  /** Convenience for sending a typed request. */
  default void send(Message message) throws ChannelException {
    send(message.toJson());
  }

  /**
   * Receives one message, waiting at most the configured receive timeout.
   *
   * @throws ChannelException with {@link ChannelException.Kind#TIMED_OUT} when the receive timeout
   *     elapsed, {@link ChannelException.Kind#TRANSPORT_ERROR} on any other fault
   */
  JsonElement receive() throws ChannelException;

  /** True when a request has been received and its reply is still owed to the peer. */
  boolean awaitingReply();

  /**
   * Sends {@code request} and waits for the reply, reporting failures as a status instead of an
   * exception.
   */
  default ExchangeResult exchange(JsonElement request) {
    try {
      send(request);
    } catch (ChannelException e) {
      return ExchangeResult.failed(ExchangeStatus.sendFailure(e), Duration.ZERO);
    }
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      JsonElement reply = receive();
      return ExchangeResult.ok(reply, stopwatch.elapsed());
    } catch (ChannelException e) {
      return ExchangeResult.failed(ExchangeStatus.receiveFailure(e), stopwatch.elapsed());
    }
  }

  default ExchangeResult exchange(Message request) {
    return exchange(request.toJson());
  }

  /** Releases the connection. Closing twice is a no-op. */
  @Override
  void close();
}
