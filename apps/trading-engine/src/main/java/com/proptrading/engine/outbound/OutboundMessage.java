package com.proptrading.engine.outbound;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One server-to-client frame: a type plus its fields in insertion order. */
public final class OutboundMessage {
  private final OutboundMessageType type;
  private final Map<String, Object> fields;

  private OutboundMessage(OutboundMessageType type, Map<String, Object> fields) {
    this.type = type;
    this.fields = Collections.unmodifiableMap(fields);
  }

  public static Builder builder(OutboundMessageType type) {
    return new Builder(type);
  }

  public static OutboundMessage of(OutboundMessageType type) {
    return new Builder(type).build();
  }

  public OutboundMessageType type() {
    return type;
  }

  public Map<String, Object> fields() {
    return fields;
  }

  public Object field(String name) {
    return fields.get(name);
  }

  @Override
  public String toString() {
    return "OutboundMessage{type=" + type + ", fields=" + fields.keySet() + "}";
  }

  public static final class Builder {
    private final OutboundMessageType type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder(OutboundMessageType type) {
      this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Builder put(String name, Object value) {
      if ("type".equals(name)) {
        throw new IllegalArgumentException("'type' is reserved");
      }
      fields.put(name, value);
      return this;
    }

    public OutboundMessage build() {
      return new OutboundMessage(type, new LinkedHashMap<>(fields));
    }
  }
}
