package com.proptrading.domain.orders;

import java.util.Locale;
import java.util.Optional;

public enum OrderType {
  MARKET,
  LIMIT;

  public static Optional<OrderType> parse(String value) {
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
