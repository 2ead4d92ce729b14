package com.proptrading.engine.ratelimit;

import java.time.Instant;

public record RateLimitDecision(boolean allowed, int remaining, Instant resetAt) {
  public static RateLimitDecision allow(int remaining, Instant resetAt) {
    return new RateLimitDecision(true, remaining, resetAt);
  }

  public static RateLimitDecision throttled(Instant resetAt) {
    return new RateLimitDecision(false, 0, resetAt);
  }
}
