package com.proptrading.engine.marketdata;

import com.proptrading.infra.kafka.consumer.EventConsumerAdapter;
import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventTypes;
import com.proptrading.infra.kafka.contract.payload.PriceTickV1;
import com.proptrading.infra.kafka.observability.KafkaTelemetry;
import com.proptrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.proptrading.infra.kafka.topics.TopicNames;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class PriceTickListener {
  private final EventConsumerAdapter<PriceTickV1> adapter;
  private final PriceTickProcessor processor;

  public PriceTickListener(
      EventEnvelopeJsonCodec codec, KafkaTelemetry telemetry, PriceTickProcessor processor) {
    this.processor = processor;
    this.adapter =
        new EventConsumerAdapter<>(
            PriceTickV1.class, EventTypes.PRICE_TICK, 1, codec, this::handleEvent, telemetry);
  }

  @KafkaListener(
      topics = TopicNames.MARKET_PRICES_V1,
      groupId = "${infra.kafka.consumer.group-id:trading-engine}",
      containerFactory = "infraKafkaListenerContainerFactory",
      autoStartup = "${engine.events.price-consumer-enabled:true}")
  public void onMessage(ConsumerRecord<String, String> record) {
    adapter.process(record);
  }

  private void handleEvent(EventEnvelope<PriceTickV1> envelope) {
    processor.onTick(envelope.payload());
  }
}
