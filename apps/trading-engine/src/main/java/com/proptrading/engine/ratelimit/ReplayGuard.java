package com.proptrading.engine.ratelimit;

import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Rejects order timestamps that are missing, too old or too far in the future. */
@Component
public class ReplayGuard {
  private final RateLimitProperties properties;
  private final Clock clock;

  public ReplayGuard(RateLimitProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public Optional<Rejection> validateTimestamp(Long clientTimestampMs) {
    if (clientTimestampMs == null) {
      return reject("Order timestamp is required");
    }
    long ageMs = clock.millis() - clientTimestampMs;
    if (ageMs > properties.getReplayMaxAgeMs()) {
      return reject("Order timestamp expired");
    }
    if (-ageMs > properties.getReplayMaxFutureMs()) {
      return reject("Order timestamp is in the future");
    }
    return Optional.empty();
  }

  private static Optional<Rejection> reject(String message) {
    return Optional.of(Rejection.of(RejectionCode.TIMESTAMP_INVALID, message));
  }
}
