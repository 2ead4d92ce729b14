package com.proptrading.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {
    publishCounter(topic, eventType, "success", "none").increment();
    Timer.builder("infra.kafka.publish.duration")
        .description("Kafka publish latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {
    publishCounter(topic, eventType, "failure", safeError(error)).increment();
  }

  @Override
  public void onConsumeSuccess(String topic, String eventType, int partition, long durationNanos) {
    consumeCounter(topic, eventType, "success", "none").increment();
    Timer.builder("infra.kafka.consume.duration")
        .description("Kafka consume processing latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onConsumeDropped(String topic, String eventType, String reason) {
    consumeCounter(topic, eventType, "dropped", safeValue(reason)).increment();
  }

  private Counter publishCounter(String topic, String eventType, String outcome, String error) {
    return Counter.builder("infra.kafka.publish.total")
        .description("Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", outcome)
        .tag("error", error)
        .register(meterRegistry);
  }

  private Counter consumeCounter(String topic, String eventType, String outcome, String reason) {
    return Counter.builder("infra.kafka.consume.total")
        .description("Kafka records consumed by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", outcome)
        .tag("reason", reason)
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
