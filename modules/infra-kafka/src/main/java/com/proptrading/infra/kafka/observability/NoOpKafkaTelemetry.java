package com.proptrading.infra.kafka.observability;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {}

  @Override
  public void onConsumeSuccess(String topic, String eventType, int partition, long durationNanos) {}

  @Override
  public void onConsumeDropped(String topic, String eventType, String reason) {}
}
