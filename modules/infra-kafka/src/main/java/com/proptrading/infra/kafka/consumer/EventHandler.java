package com.proptrading.infra.kafka.consumer;

import com.proptrading.infra.kafka.contract.EventEnvelope;

/**
 * Receives decoded envelopes on the listener thread. Runtime exceptions are counted and the record
 * is dropped; they never reach the container.
 */
@FunctionalInterface
public interface EventHandler<T> {
  void handle(EventEnvelope<T> envelope);
}
