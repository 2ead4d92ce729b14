package com.proptrading.engine.outbound;

/** Pushes engine-originated messages to connected clients. Delivery is best effort. */
public interface EngineNotifier {
  void sendToUser(String userId, OutboundMessage message);

  void sendToAccount(String accountId, OutboundMessage message);

  void broadcastToSubscribers(String symbol, OutboundMessage message);
}
