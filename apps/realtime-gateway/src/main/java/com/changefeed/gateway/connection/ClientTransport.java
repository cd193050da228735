package com.changefeed.gateway.connection;

import java.io.IOException;

/** Duplex text channel to one client. {@link #send} may block on network backpressure. */
public interface ClientTransport {
  String id();

  boolean isOpen();

  void send(String text) throws IOException;

  void close(int statusCode, String reason);
}
