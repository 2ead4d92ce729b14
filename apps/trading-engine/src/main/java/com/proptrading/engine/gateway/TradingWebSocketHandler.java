package com.proptrading.engine.gateway;

import com.proptrading.engine.config.EngineProperties;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class TradingWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(TradingWebSocketHandler.class);

  private final ConnectionManager connectionManager;
  private final MessageDispatcher dispatcher;
  private final EngineProperties.Gateway gateway;

  public TradingWebSocketHandler(
      ConnectionManager connectionManager,
      MessageDispatcher dispatcher,
      EngineProperties properties) {
    this.connectionManager = connectionManager;
    this.dispatcher = dispatcher;
    this.gateway = properties.getGateway();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    ClientConnection connection =
        new WebSocketClientConnection(
            session, gateway.getSendTimeLimitMs(), gateway.getSendBufferLimitBytes());
    connectionManager.add(connection);
    log.info(
        "Connection opened connectionId={} remote={}", session.getId(), session.getRemoteAddress());
    connectionManager.send(
        session.getId(),
        OutboundMessage.builder(OutboundMessageType.CONNECTED)
            .put("connectionId", session.getId())
            .put("message", "Connected to PropFirm Trading Engine. Please authenticate.")
            .build());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    dispatcher.dispatch(session.getId(), message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error connectionId={}: {}", session.getId(), exception.getMessage());
    connectionManager.remove(session.getId());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    connectionManager.remove(session.getId());
    log.info("Connection closed connectionId={} status={}", session.getId(), status);
  }
}
