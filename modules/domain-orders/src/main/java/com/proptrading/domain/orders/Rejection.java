package com.proptrading.domain.orders;

import java.util.Objects;

public record Rejection(RejectionCode code, String message) {
  public Rejection {
    Objects.requireNonNull(code, "code must not be null");
    if (message == null || message.isBlank()) {
      throw new OrderDomainException("message must not be blank");
    }
  }

  public static Rejection of(RejectionCode code, String message) {
    return new Rejection(code, message);
  }

  public boolean isRetryable() {
    return code.isRetryable();
  }
}
