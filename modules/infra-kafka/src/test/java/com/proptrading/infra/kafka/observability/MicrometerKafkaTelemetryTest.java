package com.proptrading.infra.kafka.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerKafkaTelemetryTest {
  @Test
  void shouldRecordPublishAndConsumeOutcomes() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerKafkaTelemetry telemetry = new MicrometerKafkaTelemetry(registry);

    telemetry.onPublishSuccess("trading.events.v1", "TradeEventRecorded", 5_000_000L);
    telemetry.onPublishFailure(
        "trading.events.v1", "TradeEventRecorded", new IllegalStateException("boom"));
    telemetry.onConsumeSuccess("market.prices.v1", "PriceTick", 0, 1_000_000L);
    telemetry.onConsumeDropped("market.prices.v1", null, "malformed");

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.consume.total")
            .tag("event_type", "unknown")
            .tag("outcome", "dropped")
            .counter()
            .count());
    assertEquals(1L, registry.get("infra.kafka.publish.duration").timer().count());
    assertEquals(1L, registry.get("infra.kafka.consume.duration").timer().count());
  }
}
