package com.verlumen.tradegym.channel;

import com.google.common.base.Stopwatch;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import java.io.IOException;
import java.net.ConnectException;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link MessageChannel} over a TCP socket with length-prefixed JSON frames.
 *
 * <p>A channel is either a replier, created by {@link #bind}, or a requester, created by {@link
 * #connect}:
 *
 * <ul>
 *   <li>The replier listens on its endpoint and serves one peer at a time. When the peer goes away
 *       the next {@link #receive()} accepts a new one.
 *   <li>The requester connects lazily on {@link #send} and drops its connection after any failed
 *       exchange, so the next request starts on a clean stream.
 * </ul>
 *
 * <p>All waiting is done on selectors so that both directions honour their timeouts. Instances are
 * not thread-safe; a channel belongs to one session thread.
 */
public final class SocketMessageChannel implements MessageChannel {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long CONNECT_RETRY_MILLIS = 50;

  enum Role {
    REPLIER,
    REQUESTER
  }

  private final Role role;
  private final Endpoint endpoint;
  private final ChannelTimeouts timeouts;
  private final FrameCodec codec;
  private final Selector ioSelector;
  private final Optional<ServerSocketChannel> server;
  private final Optional<Selector> acceptSelector;

  private SocketChannel peer;
  private boolean awaitingReply;
  private boolean partialFrame;
  private boolean closed;

  private SocketMessageChannel(
      Role role,
      Endpoint endpoint,
      ChannelTimeouts timeouts,
      FrameCodec codec,
      Selector ioSelector,
      Optional<ServerSocketChannel> server,
      Optional<Selector> acceptSelector) {
    this.role = role;
    this.endpoint = endpoint;
    this.timeouts = timeouts;
    this.codec = codec;
    this.ioSelector = ioSelector;
    this.server = server;
    this.acceptSelector = acceptSelector;
  }

  /** Binds a replier channel to {@code endpoint}. */
  public static SocketMessageChannel bind(
      Endpoint endpoint, ChannelTimeouts timeouts, FrameCodec codec) throws ChannelException {
    try {
      ServerSocketChannel server = ServerSocketChannel.open();
      server.setOption(StandardSocketOptions.SO_REUSEADDR, true);
      server.bind(endpoint.toSocketAddress());
      server.configureBlocking(false);
      Selector acceptSelector = Selector.open();
      server.register(acceptSelector, SelectionKey.OP_ACCEPT);
      logger.atInfo().log("Channel bound at %s", endpoint);
      return new SocketMessageChannel(
          Role.REPLIER,
          endpoint,
          timeouts,
          codec,
          Selector.open(),
          Optional.of(server),
          Optional.of(acceptSelector));
    } catch (IOException e) {
      throw ChannelException.transportError("Unable to bind channel at " + endpoint, e);
    }
  }

  /** Creates a requester channel for {@code endpoint}; the connection is opened on first send. */
  public static SocketMessageChannel connect(
      Endpoint endpoint, ChannelTimeouts timeouts, FrameCodec codec) throws ChannelException {
    try {
      return new SocketMessageChannel(
          Role.REQUESTER,
          endpoint,
          timeouts,
          codec,
          Selector.open(),
          Optional.empty(),
          Optional.empty());
    } catch (IOException e) {
      throw ChannelException.transportError("Unable to open selector for " + endpoint, e);
    }
  }

  /** The port actually bound, useful when binding to port 0. */
  public int localPort() {
    return server
        .map(serverChannel -> serverChannel.socket().getLocalPort())
        .orElseThrow(() -> new IllegalStateException("Only a bound channel has a local port"));
  }

  @Override
  public void send(JsonElement message) throws ChannelException {
    checkOpen();
    if (role == Role.REPLIER && !awaitingReply) {
      throw outOfOrder("send() called on " + endpoint + " with no request to reply to");
    }
    if (role == Role.REQUESTER && awaitingReply) {
      throw outOfOrder("send() called on " + endpoint + " while a reply is still pending");
    }

    ByteBuffer frame = codec.encode(message);
    Deadline deadline = Deadline.after(Optional.of(timeouts.sendTimeout()));
    try {
      if (role == Role.REQUESTER && peer == null) {
        connectPeer(deadline);
      }
      if (peer == null) {
        throw ChannelException.transportError("Peer at " + endpoint + " left before the reply");
      }
      writeFully(frame, deadline);
      awaitingReply = role == Role.REQUESTER;
      logger.atFine().log("Sent %d byte frame on %s", frame.limit(), endpoint);
    } catch (ChannelException e) {
      dropPeer();
      awaitingReply = false;
      throw e;
    }
  }

  @Override
  public JsonElement receive() throws ChannelException {
    checkOpen();
    if (role == Role.REPLIER && awaitingReply) {
      throw outOfOrder("receive() called on " + endpoint + " before replying to the last request");
    }
    if (role == Role.REQUESTER && !awaitingReply) {
      throw outOfOrder("receive() called on " + endpoint + " with no request in flight");
    }

    Deadline deadline = Deadline.after(timeouts.receiveTimeout());
    while (true) {
      if (role == Role.REPLIER && peer == null) {
        acceptPeer(deadline);
      }
      byte[] payload;
      try {
        payload = readPayload(deadline);
      } catch (PeerGoneException e) {
        dropPeer();
        if (role == Role.REPLIER) {
          logger.atInfo().log("Peer on %s disconnected, waiting for a new one", endpoint);
          continue;
        }
        awaitingReply = false;
        throw ChannelException.transportError("Peer at " + endpoint + " closed the connection", e);
      } catch (ChannelException e) {
        if (role == Role.REQUESTER || partialFrame || !e.isTimeout()) {
          dropPeer();
        }
        if (role == Role.REQUESTER) {
          awaitingReply = false;
        }
        throw e;
      }
      // The frame was read completely, so the stream is still aligned even if decoding fails.
      awaitingReply = role == Role.REPLIER;
      logger.atFine().log("Received %d byte frame on %s", payload.length, endpoint);
      return codec.decode(payload);
    }
  }

  @Override
  public boolean awaitingReply() {
    return role == Role.REPLIER && awaitingReply;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    awaitingReply = false;
    dropPeer();
    server.ifPresent(this::closeQuietly);
    acceptSelector.ifPresent(this::closeSelector);
    closeSelector(ioSelector);
    logger.atInfo().log("Channel %s closed", endpoint);
  }

  private void acceptPeer(Deadline deadline) throws ChannelException {
    ServerSocketChannel serverChannel = server.orElseThrow();
    Selector selector = acceptSelector.orElseThrow();
    try {
      while (true) {
        SocketChannel accepted = serverChannel.accept();
        if (accepted != null) {
          accepted.configureBlocking(false);
          accepted.setOption(StandardSocketOptions.TCP_NODELAY, true);
          accepted.register(ioSelector, 0);
          peer = accepted;
          logger.atInfo().log("Accepted peer %s on %s", accepted.getRemoteAddress(), endpoint);
          return;
        }
        select(selector, deadline, "waiting for a peer to connect to " + endpoint);
      }
    } catch (ChannelException e) {
      throw e;
    } catch (IOException e) {
      throw ChannelException.transportError("Failed to accept a peer on " + endpoint, e);
    }
  }

  private void connectPeer(Deadline deadline) throws ChannelException {
    while (true) {
      SocketChannel candidate = null;
      try {
        candidate = SocketChannel.open();
        candidate.configureBlocking(false);
        candidate.setOption(StandardSocketOptions.TCP_NODELAY, true);
        candidate.register(ioSelector, 0);
        if (!candidate.connect(endpoint.toSocketAddress())) {
          while (!candidate.finishConnect()) {
            awaitIo(candidate, SelectionKey.OP_CONNECT, deadline, "connecting to " + endpoint);
          }
        }
        peer = candidate;
        logger.atFine().log("Connected to %s", endpoint);
        return;
      } catch (ConnectException e) {
        closeQuietly(candidate);
        if (deadline.expired()) {
          throw ChannelException.timedOut("Timed out connecting to " + endpoint);
        }
        logger.atFine().log("Connection to %s refused, retrying", endpoint);
        pause(deadline);
      } catch (ChannelException e) {
        closeQuietly(candidate);
        throw e;
      } catch (IOException e) {
        closeQuietly(candidate);
        throw ChannelException.transportError("Failed to connect to " + endpoint, e);
      }
    }
  }

  private void pause(Deadline deadline) throws ChannelException {
    try {
      TimeUnit.MILLISECONDS.sleep(Math.min(CONNECT_RETRY_MILLIS, deadline.remainingMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ChannelException.transportError("Interrupted while connecting to " + endpoint, e);
    }
  }

  private byte[] readPayload(Deadline deadline) throws ChannelException, PeerGoneException {
    partialFrame = false;
    ByteBuffer header = ByteBuffer.allocate(FrameCodec.HEADER_BYTES);
    readFully(header, deadline);
    header.flip();
    int length = codec.checkLength(header.getInt());
    ByteBuffer payload = ByteBuffer.allocate(length);
    readFully(payload, deadline);
    partialFrame = false;
    return payload.array();
  }

  private void readFully(ByteBuffer buffer, Deadline deadline)
      throws ChannelException, PeerGoneException {
    while (buffer.hasRemaining()) {
      int read;
      try {
        read = peer.read(buffer);
      } catch (IOException e) {
        throw new PeerGoneException(e);
      }
      if (read < 0) {
        throw new PeerGoneException(null);
      }
      if (read > 0) {
        partialFrame = true;
      } else {
        awaitIo(peer, SelectionKey.OP_READ, deadline, "receiving on " + endpoint);
      }
    }
  }

  private void writeFully(ByteBuffer frame, Deadline deadline) throws ChannelException {
    try {
      while (frame.hasRemaining()) {
        if (peer.write(frame) == 0) {
          awaitIo(peer, SelectionKey.OP_WRITE, deadline, "sending on " + endpoint);
        }
      }
    } catch (ChannelException e) {
      throw e;
    } catch (IOException e) {
      throw ChannelException.transportError("Failed to write to " + endpoint, e);
    }
  }

  private void awaitIo(SocketChannel channel, int op, Deadline deadline, String activity)
      throws ChannelException {
    SelectionKey key = channel.keyFor(ioSelector);
    if (key == null) {
      throw ChannelException.transportError("Channel not registered while " + activity);
    }
    key.interestOps(op);
    try {
      select(ioSelector, deadline, activity);
    } finally {
      if (key.isValid()) {
        key.interestOps(0);
      }
    }
  }

  private static void select(Selector selector, Deadline deadline, String activity)
      throws ChannelException {
    if (deadline.expired()) {
      throw ChannelException.timedOut("Timed out " + activity);
    }
    try {
      selector.selectedKeys().clear();
      int ready =
          deadline.isBounded()
              ? selector.select(Math.max(1, deadline.remainingMillis()))
              : selector.select();
      selector.selectedKeys().clear();
      if (ready == 0 && deadline.expired()) {
        throw ChannelException.timedOut("Timed out " + activity);
      }
    } catch (ChannelException e) {
      throw e;
    } catch (IOException e) {
      throw ChannelException.transportError("Selector failed while " + activity, e);
    }
  }

  private void dropPeer() {
    if (peer != null) {
      closeQuietly(peer);
      peer = null;
    }
    partialFrame = false;
  }

  private void checkOpen() throws ChannelException {
    if (closed) {
      throw ChannelException.transportError("Channel " + endpoint + " is closed");
    }
  }

  private static ProtocolException outOfOrder(String message) {
    return new ProtocolException(ProtocolException.Kind.OUT_OF_ORDER_EXCHANGE, message);
  }

  private void closeQuietly(SelectableChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Error closing socket on %s", endpoint);
    }
  }

  private void closeSelector(Selector selector) {
    try {
      selector.close();
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Error closing selector on %s", endpoint);
    }
  }

  /** The peer closed or reset the connection. */
  private static final class PeerGoneException extends Exception {
    private static final long serialVersionUID = 1L;

    PeerGoneException(IOException cause) {
      super(cause);
    }
  }

  private static final class Deadline {
    private final Optional<Duration> timeout;
    private final Stopwatch stopwatch;

    private Deadline(Optional<Duration> timeout) {
      this.timeout = timeout;
      this.stopwatch = Stopwatch.createStarted();
    }

    static Deadline after(Optional<Duration> timeout) {
      return new Deadline(timeout);
    }

    boolean isBounded() {
      return timeout.isPresent();
    }

    long remainingMillis() {
      return timeout
          .map(limit -> Math.max(0, limit.minus(stopwatch.elapsed()).toMillis()))
          .orElse(Long.MAX_VALUE);
    }

    boolean expired() {
      return timeout.isPresent() && stopwatch.elapsed().compareTo(timeout.get()) >= 0;
    }
  }
}
