package com.proptrading.engine.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proptrading.engine.outbound.OutboundMessage;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** JSON text frames of the form {@code {"type": ..., ...fields}}. */
public class GatewayMessageCodec {
  private final ObjectMapper objectMapper;

  public GatewayMessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(OutboundMessage message) {
    Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("type", message.type().name());
    frame.putAll(message.fields());
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode " + message.type(), ex);
    }
  }

  public InboundMessage decode(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedMessageException("Empty message");
    }
    JsonNode body;
    try {
      body = objectMapper.readTree(raw);
    } catch (JsonProcessingException ex) {
      throw new MalformedMessageException("Invalid JSON", ex);
    }
    if (body == null || !body.isObject()) {
      throw new MalformedMessageException("Message must be a JSON object");
    }
    JsonNode type = body.get("type");
    return new InboundMessage(type == null || type.isNull() ? null : type.asText(), body);
  }

  public <T> T read(JsonNode node, Class<T> type) {
    if (node == null || node.isNull() || !node.isObject()) {
      throw new MalformedMessageException("Expected an object for " + type.getSimpleName());
    }
    try {
      return objectMapper.treeToValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new MalformedMessageException("Invalid " + type.getSimpleName(), ex);
    }
  }

  /** Optional decimal field given as a JSON number or numeric string; absent or null is null. */
  public BigDecimal decimal(InboundMessage message, String field) {
    JsonNode node = message.node(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    if (node.isTextual()) {
      try {
        return new BigDecimal(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw new MalformedMessageException("Field " + field + " is not a number", ex);
      }
    }
    throw new MalformedMessageException("Field " + field + " is not a number");
  }
}
