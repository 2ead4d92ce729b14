package com.proptrading.infra.kafka.observability;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, String eventType, long durationNanos);

  void onPublishFailure(String topic, String eventType, Throwable error);

  void onConsumeSuccess(String topic, String eventType, int partition, long durationNanos);

  /** A consumed record that was discarded without being handled, e.g. malformed or rejected. */
  void onConsumeDropped(String topic, String eventType, String reason);
}
