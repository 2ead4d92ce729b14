package com.proptrading.infra.kafka.producer;

import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventHeaders;
import com.proptrading.infra.kafka.observability.KafkaTelemetry;
import com.proptrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.proptrading.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Publishes JSON envelopes with the event metadata copied into record headers. The returned future
 * fails with {@link KafkaPublishException}; it never throws for broker errors.
 */
public class KafkaEventPublisher implements EventPublisher {
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<RecordMetadata> publish(
      String topic, String key, EventEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }

    long started = System.nanoTime();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, key, codec.encode(envelope));
    header(record, EventHeaders.X_EVENT_ID, envelope.eventId().toString());
    header(record, EventHeaders.X_EVENT_TYPE, envelope.eventType());
    header(record, EventHeaders.X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    header(record, EventHeaders.X_CORRELATION_ID, envelope.correlationId());
    header(record, EventHeaders.X_PRODUCER, envelope.producer());
    header(record, EventHeaders.CONTENT_TYPE, EventHeaders.APPLICATION_JSON);

    CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sendFuture = sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<RecordMetadata> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, envelope.eventType(), System.nanoTime() - started);
            result.complete(sendResult.getRecordMetadata());
            return;
          }
          KafkaPublishException publishException =
              wrap(topic, key, envelope.eventType(), throwable);
          telemetry.onPublishFailure(topic, envelope.eventType(), publishException);
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private static KafkaPublishException wrap(
      String topic, String key, String eventType, Throwable throwable) {
    Throwable cause =
        throwable instanceof CompletionException && throwable.getCause() != null
            ? throwable.getCause()
            : throwable;
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    boolean timedOut = cause instanceof TimeoutException;
    String verb = timedOut ? "Timed out publishing" : "Failed to publish";
    return new KafkaPublishException(
        topic,
        key,
        eventType,
        timedOut,
        verb + " event to Kafka topic=" + topic + " key=" + key + " eventType=" + eventType,
        cause);
  }

  private static void header(ProducerRecord<String, String> record, String name, String value) {
    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}
