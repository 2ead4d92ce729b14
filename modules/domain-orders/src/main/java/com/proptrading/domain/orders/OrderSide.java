package com.proptrading.domain.orders;

import java.util.Locale;
import java.util.Optional;

public enum OrderSide {
  LONG,
  SHORT;

  public static Optional<OrderSide> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
