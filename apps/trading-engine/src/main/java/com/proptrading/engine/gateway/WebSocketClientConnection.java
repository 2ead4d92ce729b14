package com.proptrading.engine.gateway;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/** Thread-safe sender over a WebSocket session with a bounded outbound buffer. */
public class WebSocketClientConnection implements ClientConnection {
  private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

  private final ConcurrentWebSocketSessionDecorator session;

  public WebSocketClientConnection(
      WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimitBytes) {
    this.session =
        new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimitBytes);
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(String payload) throws IOException {
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  public int bufferedBytes() {
    return session.getBufferSize();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void close() {
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException ex) {
      log.debug("Close failed for connectionId={}: {}", id(), ex.getMessage());
    }
  }
}
