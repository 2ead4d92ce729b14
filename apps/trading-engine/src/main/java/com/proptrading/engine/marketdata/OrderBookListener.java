package com.proptrading.engine.marketdata;

import com.proptrading.infra.kafka.consumer.EventConsumerAdapter;
import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventTypes;
import com.proptrading.infra.kafka.contract.payload.OrderBookSnapshotV1;
import com.proptrading.infra.kafka.observability.KafkaTelemetry;
import com.proptrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.proptrading.infra.kafka.topics.TopicNames;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class OrderBookListener {
  private final EventConsumerAdapter<OrderBookSnapshotV1> adapter;
  private final OrderBookRelay relay;

  public OrderBookListener(
      EventEnvelopeJsonCodec codec, KafkaTelemetry telemetry, OrderBookRelay relay) {
    this.relay = relay;
    this.adapter =
        new EventConsumerAdapter<>(
            OrderBookSnapshotV1.class,
            EventTypes.ORDER_BOOK_SNAPSHOT,
            1,
            codec,
            this::handleEvent,
            telemetry);
  }

  @KafkaListener(
      topics = TopicNames.MARKET_ORDER_BOOKS_V1,
      groupId = "${infra.kafka.consumer.group-id:trading-engine}",
      containerFactory = "infraKafkaListenerContainerFactory",
      autoStartup = "${engine.events.order-book-consumer-enabled:true}")
  public void onMessage(ConsumerRecord<String, String> record) {
    adapter.process(record);
  }

  private void handleEvent(EventEnvelope<OrderBookSnapshotV1> envelope) {
    relay.onSnapshot(envelope.payload());
  }
}
