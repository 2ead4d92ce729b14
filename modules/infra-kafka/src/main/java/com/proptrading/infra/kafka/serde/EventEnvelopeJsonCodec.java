package com.proptrading.infra.kafka.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proptrading.infra.kafka.contract.EventEnvelope;
import java.util.Objects;

public class EventEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public EventEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode event envelope", ex);
    }
  }

  public <T> EventEnvelope<T> decode(String json, Class<T> payloadType) {
    if (json == null || json.isBlank()) {
      throw new IllegalStateException("Event envelope body is empty");
    }
    try {
      JavaType envelopeType =
          objectMapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
      return objectMapper.readValue(json, envelopeType);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode event envelope", ex);
    }
  }
}
