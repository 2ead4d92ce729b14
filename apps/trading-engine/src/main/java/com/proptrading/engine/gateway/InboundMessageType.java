package com.proptrading.engine.gateway;

import java.util.Optional;

public enum InboundMessageType {
  AUTH(false),
  PLACE_ORDER(true),
  CANCEL_ORDER(true),
  MODIFY_POSITION(true),
  CLOSE_POSITION(true),
  GET_POSITIONS(true),
  GET_PENDING_ORDERS(true),
  SUBSCRIBE(true),
  UNSUBSCRIBE(true),
  PING(false),
  PONG(false);

  private final boolean requiresAuthentication;

  InboundMessageType(boolean requiresAuthentication) {
    this.requiresAuthentication = requiresAuthentication;
  }

  public boolean requiresAuthentication() {
    return requiresAuthentication;
  }

  public static Optional<InboundMessageType> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    for (InboundMessageType type : values()) {
      if (type.name().equals(raw)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
