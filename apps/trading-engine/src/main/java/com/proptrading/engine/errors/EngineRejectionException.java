package com.proptrading.engine.errors;

import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import java.util.Objects;

/**
 * Carries a business rejection out of a critical section. Always thrown before the section's first
 * write, so callers can answer with the rejection and nothing needs to be undone.
 */
public class EngineRejectionException extends RuntimeException {
  private final Rejection rejection;

  public EngineRejectionException(Rejection rejection) {
    super(Objects.requireNonNull(rejection, "rejection must not be null").message());
    this.rejection = rejection;
  }

  public EngineRejectionException(RejectionCode code, String message) {
    this(Rejection.of(code, message));
  }

  public Rejection rejection() {
    return rejection;
  }

  public RejectionCode code() {
    return rejection.code();
  }
}
