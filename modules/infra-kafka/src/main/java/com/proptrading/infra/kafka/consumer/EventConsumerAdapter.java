package com.proptrading.infra.kafka.consumer;

import com.proptrading.infra.kafka.contract.EventEnvelope;
import com.proptrading.infra.kafka.contract.EventHeaders;
import com.proptrading.infra.kafka.errors.InvalidEventMetadataException;
import com.proptrading.infra.kafka.observability.KafkaTelemetry;
import com.proptrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes and validates records of one event type and hands them to an {@link EventHandler}.
 *
 * <p>Records are processed at most once: malformed records and handler failures are logged,
 * counted and dropped. Market data is superseded by the next record, so nothing is retried.
 */
public class EventConsumerAdapter<T> {
  private static final Logger log = LoggerFactory.getLogger(EventConsumerAdapter.class);

  private final Class<T> payloadType;
  private final String expectedEventType;
  private final int expectedEventVersion;
  private final EventEnvelopeJsonCodec codec;
  private final EventHandler<T> handler;
  private final KafkaTelemetry telemetry;

  public EventConsumerAdapter(
      Class<T> payloadType,
      String expectedEventType,
      int expectedEventVersion,
      EventEnvelopeJsonCodec codec,
      EventHandler<T> handler,
      KafkaTelemetry telemetry) {
    this.payloadType = payloadType;
    this.expectedEventType = expectedEventType;
    this.expectedEventVersion = expectedEventVersion;
    this.codec = codec;
    this.handler = handler;
    this.telemetry = telemetry;
  }

  /** Returns {@code true} when the record reached the handler and the handler completed. */
  public boolean process(ConsumerRecord<String, String> record) {
    long started = System.nanoTime();
    String eventTypeFromHeader = headerValue(record.headers(), EventHeaders.X_EVENT_TYPE);

    EventEnvelope<T> envelope;
    try {
      validateMetadataHeaders(record.headers());
      envelope = codec.decode(record.value(), payloadType);
      validateEnvelopeIdentity(envelope);
    } catch (InvalidEventMetadataException | IllegalStateException ex) {
      log.warn(
          "Dropping malformed record topic={} partition={} offset={} reason={}",
          record.topic(),
          record.partition(),
          record.offset(),
          ex.getMessage());
      telemetry.onConsumeDropped(record.topic(), eventTypeFromHeader, "malformed");
      return false;
    }

    try {
      handler.handle(envelope);
    } catch (RuntimeException ex) {
      log.warn(
          "Handler failed for record topic={} key={} eventType={}",
          record.topic(),
          record.key(),
          envelope.eventType(),
          ex);
      telemetry.onConsumeDropped(record.topic(), envelope.eventType(), "handler_failure");
      return false;
    }
    telemetry.onConsumeSuccess(
        record.topic(), envelope.eventType(), record.partition(), System.nanoTime() - started);
    return true;
  }

  private void validateMetadataHeaders(Headers headers) {
    String eventType = headerValue(headers, EventHeaders.X_EVENT_TYPE);
    if (eventType == null || eventType.isBlank()) {
      throw new InvalidEventMetadataException(
          "Missing required header: " + EventHeaders.X_EVENT_TYPE);
    }
    String versionRaw = headerValue(headers, EventHeaders.X_EVENT_VERSION);
    if (versionRaw == null || versionRaw.isBlank()) {
      throw new InvalidEventMetadataException(
          "Missing required header: " + EventHeaders.X_EVENT_VERSION);
    }
    int version;
    try {
      version = Integer.parseInt(versionRaw.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidEventMetadataException("Header x-event-version is not a valid integer");
    }
    if (version < 1) {
      throw new InvalidEventMetadataException("Header x-event-version must be >= 1");
    }
  }

  private void validateEnvelopeIdentity(EventEnvelope<T> envelope) {
    if (!expectedEventType.equals(envelope.eventType())) {
      throw new InvalidEventMetadataException(
          "Unexpected event type: expected=" + expectedEventType + " actual="
              + envelope.eventType());
    }
    if (expectedEventVersion != envelope.eventVersion()) {
      throw new InvalidEventMetadataException(
          "Unexpected event version: expected=" + expectedEventVersion + " actual="
              + envelope.eventVersion());
    }
  }

  private static String headerValue(Headers headers, String name) {
    Header header = headers.lastHeader(name);
    if (header == null || header.value() == null) {
      return null;
    }
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
