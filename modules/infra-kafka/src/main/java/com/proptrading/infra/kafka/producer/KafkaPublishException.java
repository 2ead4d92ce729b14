package com.proptrading.infra.kafka.producer;

/** A record that the broker did not acknowledge, either refused or not answered in time. */
public class KafkaPublishException extends RuntimeException {
  private final String topic;
  private final String key;
  private final String eventType;
  private final boolean timedOut;

  public KafkaPublishException(
      String topic,
      String key,
      String eventType,
      boolean timedOut,
      String message,
      Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.key = key;
    this.eventType = eventType;
    this.timedOut = timedOut;
  }

  public String getTopic() {
    return topic;
  }

  public String getKey() {
    return key;
  }

  public String getEventType() {
    return eventType;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
