package com.proptrading.engine.gateway;

import java.io.IOException;

/** Transport side of one client connection. */
public interface ClientConnection {
  String id();

  void send(String payload) throws IOException;

  /** Bytes queued for this connection but not yet written to the socket. */
  int bufferedBytes();

  boolean isOpen();

  void close();
}
