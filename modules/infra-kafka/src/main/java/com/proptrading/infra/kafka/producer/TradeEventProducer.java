package com.proptrading.infra.kafka.producer;

import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventTypes;
import com.proptrading.infra.kafka.contract.payload.TradeEventV1;
import com.proptrading.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.RecordMetadata;

/** Trade events are keyed by account so one account's history stays ordered on a partition. */
public class TradeEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public TradeEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<RecordMetadata> publishTradeEvent(TradeEventV1 payload) {
    String key = requireKey(payload.accountId(), "payload.accountId");
    String correlationId = payload.orderId() != null ? payload.orderId() : payload.eventId();
    EventEnvelope<TradeEventV1> envelope =
        EventEnvelope.of(
            EventTypes.TRADE_EVENT_RECORDED,
            EVENT_VERSION_V1,
            producerName,
            requireKey(correlationId, "payload.eventId"),
            key,
            payload.occurredAt(),
            payload);
    return eventPublisher.publish(TopicNames.TRADING_EVENTS_V1, key, envelope);
  }

  private static String requireKey(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}
