package com.proptrading.engine.ratelimit;

public enum RateLimitAction {
  PLACE_ORDER(1_000L, 10),
  CANCEL_ORDER(1_000L, 20),
  MODIFY_POSITION(1_000L, 20),
  CLOSE_POSITION(1_000L, 20),
  SUBSCRIBE(1_000L, 5),
  UNSUBSCRIBE(1_000L, 5),
  DEFAULT(1_000L, 100);

  private final long defaultWindowMs;
  private final int defaultMaxRequests;

  RateLimitAction(long defaultWindowMs, int defaultMaxRequests) {
    this.defaultWindowMs = defaultWindowMs;
    this.defaultMaxRequests = defaultMaxRequests;
  }

  public long defaultWindowMs() {
    return defaultWindowMs;
  }

  public int defaultMaxRequests() {
    return defaultMaxRequests;
  }
}
