package com.proptrading.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventTypes;
import com.proptrading.infra.kafka.contract.payload.PriceTickV1;
import com.proptrading.infra.kafka.contract.payload.TradeEventV1;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventEnvelopeJsonCodecTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldWriteInstantsAsIsoAndOmitAbsentFields() {
    TradeEventV1 payload =
        new TradeEventV1(
            "evt-1", "DAILY_RESET", "acc-1", "user-1", null, null, null, null, null, null, null,
            null, null, null, new BigDecimal("10000"), null, NOW);

    String json =
        codec.encode(
            EventEnvelope.of(
                EventTypes.TRADE_EVENT_RECORDED, 1, "engine", "evt-1", "acc-1", NOW, payload));

    assertTrue(json.contains("\"occurredAt\":\"2026-03-02T10:00:00Z\""));
    assertFalse(json.contains("positionId"));
  }

  @Test
  void shouldDecodeTickWithDecimalPrecisionIntact() {
    String json =
        "{\"eventId\":\"7d0c4c3e-2f43-4a8b-9a3e-0f6f1c3b9a10\",\"eventType\":\"PriceTick\","
            + "\"eventVersion\":1,\"occurredAt\":\"2026-03-02T10:00:00Z\","
            + "\"producer\":\"ingester\","
            + "\"correlationId\":\"c-1\",\"key\":\"ETHUSDT\",\"extra\":true,"
            + "\"payload\":{\"symbol\":\"ETHUSDT\",\"bid\":3000.12345678,\"ask\":3000.5,"
            + "\"fundingRate\":0.0001,\"timestamp\":\"2026-03-02T10:00:00Z\"}}";

    EventEnvelope<PriceTickV1> decoded = codec.decode(json, PriceTickV1.class);

    assertEquals("ETHUSDT", decoded.payload().symbol());
    assertEquals(new BigDecimal("3000.12345678"), decoded.payload().bid());
    assertEquals(NOW, decoded.payload().timestamp());
  }

  @Test
  void shouldFailOnEnvelopeMissingRequiredFields() {
    assertThrows(
        IllegalStateException.class,
        () -> codec.decode("{\"eventType\":\"PriceTick\",\"eventVersion\":1}", PriceTickV1.class));
    assertThrows(IllegalStateException.class, () -> codec.decode("", PriceTickV1.class));
  }
}
