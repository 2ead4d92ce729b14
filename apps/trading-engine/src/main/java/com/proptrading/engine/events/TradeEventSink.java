package com.proptrading.engine.events;

/**
 * Receives audit events after the in-memory state change has committed. Implementations must not
 * throw: delivery failures are logged and counted, never propagated to the caller.
 */
public interface TradeEventSink {
  void publish(TradeEvent event);
}
