package com.proptrading.engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** A decoded client frame; {@code rawType} is kept for error replies about unknown types. */
public record InboundMessage(String rawType, JsonNode body) {
  public Optional<InboundMessageType> type() {
    return InboundMessageType.parse(rawType);
  }

  public String text(String field) {
    JsonNode node = body.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return node.asText();
  }

  public JsonNode node(String field) {
    return body.get(field);
  }
}
