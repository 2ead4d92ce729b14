package com.proptrading.engine.gateway;

import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.outbound.OutboundMessages;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes one inbound frame to its handler and sends the reply on the same connection. Nothing
 * thrown while handling a frame escapes; the client gets an {@code ERROR} instead.
 */
@Component
public class MessageDispatcher {
  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

  private final ConnectionManager connectionManager;
  private final GatewayMessageCodec codec;
  private final AuthMessageHandler authHandler;
  private final OrderMessageHandler orderHandler;
  private final PositionMessageHandler positionHandler;
  private final SubscriptionMessageHandler subscriptionHandler;
  private final Clock clock;

  public MessageDispatcher(
      ConnectionManager connectionManager,
      GatewayMessageCodec codec,
      AuthMessageHandler authHandler,
      OrderMessageHandler orderHandler,
      PositionMessageHandler positionHandler,
      SubscriptionMessageHandler subscriptionHandler,
      Clock clock) {
    this.connectionManager = connectionManager;
    this.codec = codec;
    this.authHandler = authHandler;
    this.orderHandler = orderHandler;
    this.positionHandler = positionHandler;
    this.subscriptionHandler = subscriptionHandler;
    this.clock = clock;
  }

  public void dispatch(String connectionId, String raw) {
    Optional<ConnectionContext> found = connectionManager.find(connectionId);
    if (found.isEmpty()) {
      return;
    }
    ConnectionContext context = found.get();
    OutboundMessage reply;
    try {
      reply = handle(context, codec.decode(raw));
    } catch (MalformedMessageException ex) {
      log.debug("Malformed frame connectionId={}: {}", connectionId, ex.getMessage());
      reply = OutboundMessages.error("Invalid message format");
    } catch (RuntimeException ex) {
      log.error("Failed to handle frame connectionId={}", connectionId, ex);
      reply = OutboundMessages.error("Internal server error");
    }
    if (reply != null) {
      connectionManager.send(connectionId, reply);
    }
  }

  private OutboundMessage handle(ConnectionContext context, InboundMessage message) {
    Optional<InboundMessageType> parsed = message.type();
    if (parsed.isEmpty()) {
      return OutboundMessage.builder(OutboundMessageType.ERROR)
          .put("message", "Unknown message type")
          .put("messageType", message.rawType())
          .build();
    }
    InboundMessageType type = parsed.get();
    if (type.requiresAuthentication() && !context.isAuthenticated()) {
      return OutboundMessages.error("Not authenticated");
    }
    switch (type) {
      case AUTH:
        return authHandler.authenticate(context, message);
      case PLACE_ORDER:
        return orderHandler.placeOrder(context, message);
      case CANCEL_ORDER:
        return orderHandler.cancelOrder(context, message);
      case GET_PENDING_ORDERS:
        return orderHandler.pendingOrders(context, message);
      case MODIFY_POSITION:
        return positionHandler.modify(context, message);
      case CLOSE_POSITION:
        return positionHandler.close(context, message);
      case GET_POSITIONS:
        return positionHandler.list(context, message);
      case SUBSCRIBE:
        return subscriptionHandler.subscribe(context, message);
      case UNSUBSCRIBE:
        return subscriptionHandler.unsubscribe(context, message);
      case PING:
        return OutboundMessage.builder(OutboundMessageType.PONG)
            .put("timestamp", clock.millis())
            .build();
      case PONG:
        context.markPong(clock.instant());
        return null;
      default:
        throw new IllegalStateException("Unhandled message type " + type);
    }
  }
}
