package com.proptrading.engine.ratelimit;

import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Request throttle with one resilience4j limiter per user and action. Each limiter hands out
 * {@code maxRequests} permits per refresh period and never waits for a permit.
 */
@Component
public class RateLimiter {
  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final RateLimitProperties properties;
  private final Clock clock;
  private final Map<String, TrackedLimiter> limiters = new ConcurrentHashMap<>();

  public RateLimiter(RateLimitProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Takes one permit. {@code resetAt} is the latest instant by which the current period ends; the
   * limiter's own period boundary is not exposed.
   */
  public RateLimitDecision check(String userId, RateLimitAction action) {
    RateLimitProperties.Window window = properties.windowFor(action);
    long nowMs = clock.millis();
    Instant resetAt = Instant.ofEpochMilli(nowMs + window.getWindowMs());
    if (!properties.isEnabled()) {
      return RateLimitDecision.allow(window.getMaxRequests(), resetAt);
    }
    String key = userId + ":" + action.name();
    TrackedLimiter tracked =
        limiters.compute(
            key,
            (name, current) ->
                current == null
                    ? new TrackedLimiter(
                        io.github.resilience4j.ratelimiter.RateLimiter.of(name, configFor(window)),
                        window.getWindowMs(),
                        nowMs)
                    : current.usedAt(nowMs));
    if (!tracked.limiter().acquirePermission()) {
      return RateLimitDecision.throttled(resetAt);
    }
    int remaining = Math.max(0, tracked.limiter().getMetrics().getAvailablePermissions());
    return RateLimitDecision.allow(remaining, resetAt);
  }

  /** Counts one request and returns a {@code RATE_LIMITED} rejection when over the limit. */
  public Optional<Rejection> tryAcquire(String userId, RateLimitAction action) {
    RateLimitDecision decision = check(userId, action);
    if (decision.allowed()) {
      return Optional.empty();
    }
    long retryInMs = Math.max(0L, decision.resetAt().toEpochMilli() - clock.millis());
    return Optional.of(
        Rejection.of(
            RejectionCode.RATE_LIMITED, "Rate limit exceeded. Try again in " + retryInMs + "ms"));
  }

  /** Drops limiters idle for a full period; a fresh one starts with the same full allowance. */
  @Scheduled(fixedDelayString = "${rate-limit.cleanup-interval-ms:60000}")
  public void evictExpired() {
    long nowMs = clock.millis();
    int before = limiters.size();
    limiters.values().removeIf(tracked -> nowMs - tracked.lastUsedMs() >= tracked.periodMs());
    int evicted = before - limiters.size();
    if (evicted > 0) {
      log.debug("Evicted {} idle rate limiters", evicted);
    }
  }

  int trackedWindows() {
    return limiters.size();
  }

  private static RateLimiterConfig configFor(RateLimitProperties.Window window) {
    return RateLimiterConfig.custom()
        .limitForPeriod(window.getMaxRequests())
        .limitRefreshPeriod(Duration.ofMillis(window.getWindowMs()))
        .timeoutDuration(Duration.ZERO)
        .build();
  }

  private record TrackedLimiter(
      io.github.resilience4j.ratelimiter.RateLimiter limiter, long periodMs, long lastUsedMs) {
    TrackedLimiter usedAt(long nowMs) {
      return new TrackedLimiter(limiter, periodMs, nowMs);
    }
  }
}
