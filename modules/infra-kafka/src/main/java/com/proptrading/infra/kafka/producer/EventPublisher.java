package com.proptrading.infra.kafka.producer;

import com.proptrading.infra.kafka.contract.EventEnvelope;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

public interface EventPublisher {
  /** Completes with the broker acknowledgement, or exceptionally with a publish exception. */
  <T> CompletableFuture<RecordMetadata> publish(
      String topic, String key, EventEnvelope<T> envelope);
}
