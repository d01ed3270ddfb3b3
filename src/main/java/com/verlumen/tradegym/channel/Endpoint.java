package com.verlumen.tradegym.channel;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.net.InetSocketAddress;

/**
 * A TCP endpoint, consisting of a host and port, written {@code tcp://host:port}.
 */
public record Endpoint(String host, int port) {
  private static final String SCHEME = "tcp://";

  public Endpoint {
    checkArgument(!host.isEmpty(), "Host must not be empty");
    checkArgument(port >= 0 && port <= 0xFFFF, "Port out of range: %s", port);
  }

  /**
   * Parses an address such as {@code tcp://127.0.0.1:5000}. The scheme prefix is optional and
   * {@code *} stands for every local interface.
   */
  public static Endpoint parse(String address) {
    String hostAndPort = address.startsWith(SCHEME) ? address.substring(SCHEME.length()) : address;
    ImmutableList<String> parts = ImmutableList.copyOf(Splitter.on(':').split(hostAndPort));
    checkArgument(parts.size() == 2, "Expected tcp://host:port but got: %s", address);
    try {
      return new Endpoint(parts.get(0), Integer.parseInt(parts.get(1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in address: " + address, e);
    }
  }

  public InetSocketAddress toSocketAddress() {
    return host.equals("*") ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
  }

  @Override
  public String toString() {
    return SCHEME + host + ":" + port;
  }
}
