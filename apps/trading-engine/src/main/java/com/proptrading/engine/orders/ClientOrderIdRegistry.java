package com.proptrading.engine.orders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Remembers client order ids per account for a sliding window to reject resubmissions. */
public class ClientOrderIdRegistry {
  private final Map<String, Instant> seen = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration window;

  public ClientOrderIdRegistry(Clock clock, Duration window) {
    this.clock = clock;
    this.window = window;
  }

  /** Returns {@code false} when the id was already registered for the account within the window. */
  public boolean register(String accountId, String clientOrderId) {
    Instant now = clock.instant();
    String key = accountId + ":" + clientOrderId;
    boolean[] fresh = {false};
    seen.compute(
        key,
        (ignored, seenAt) -> {
          if (seenAt == null || !now.isBefore(seenAt.plus(window))) {
            fresh[0] = true;
            return now;
          }
          return seenAt;
        });
    return fresh[0];
  }

  /** Forgets an id whose order was rejected without executing, so the client can resubmit it. */
  public void release(String accountId, String clientOrderId) {
    seen.remove(accountId + ":" + clientOrderId);
  }

  public int evictExpired() {
    Instant cutoff = clock.instant().minus(window);
    int before = seen.size();
    seen.values().removeIf(seenAt -> !seenAt.isAfter(cutoff));
    return before - seen.size();
  }
}
