package com.proptrading.engine.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RateLimiterTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
  private final RateLimitProperties properties = new RateLimitProperties();
  private final RateLimiter rateLimiter = new RateLimiter(properties, clock);

  @Test
  void shouldAllowUpToLimitWithinWindow() {
    for (int i = 0; i < 10; i++) {
      assertTrue(rateLimiter.tryAcquire("user-1", RateLimitAction.PLACE_ORDER).isEmpty());
    }

    Optional<Rejection> eleventh = rateLimiter.tryAcquire("user-1", RateLimitAction.PLACE_ORDER);

    assertTrue(eleventh.isPresent());
    assertEquals(RejectionCode.RATE_LIMITED, eleventh.get().code());
    assertEquals("Rate limit exceeded. Try again in 1000ms", eleventh.get().message());
  }

  @Test
  void shouldReportRemainingPermitsInPeriod() {
    rateLimiter.check("user-1", RateLimitAction.PLACE_ORDER);
    rateLimiter.check("user-1", RateLimitAction.PLACE_ORDER);

    RateLimitDecision decision = rateLimiter.check("user-1", RateLimitAction.PLACE_ORDER);

    assertTrue(decision.allowed());
    assertEquals(7, decision.remaining());
    assertEquals(clock.instant().plusMillis(1000), decision.resetAt());
  }

  @Test
  void shouldRefillPermitsAfterRefreshPeriod() throws InterruptedException {
    RateLimitProperties.Window window = new RateLimitProperties.Window();
    window.setWindowMs(50);
    window.setMaxRequests(1);
    properties.getLimits().put(RateLimitAction.SUBSCRIBE, window);
    assertTrue(rateLimiter.check("user-1", RateLimitAction.SUBSCRIBE).allowed());
    assertFalse(rateLimiter.check("user-1", RateLimitAction.SUBSCRIBE).allowed());

    Thread.sleep(150);

    assertTrue(rateLimiter.check("user-1", RateLimitAction.SUBSCRIBE).allowed());
  }

  @Test
  void shouldCountUsersAndActionsSeparately() {
    for (int i = 0; i < 10; i++) {
      rateLimiter.tryAcquire("user-1", RateLimitAction.PLACE_ORDER);
    }

    assertTrue(rateLimiter.tryAcquire("user-2", RateLimitAction.PLACE_ORDER).isEmpty());
    assertTrue(rateLimiter.tryAcquire("user-1", RateLimitAction.CANCEL_ORDER).isEmpty());
  }

  @Test
  void shouldUseConfiguredWindow() {
    RateLimitProperties.Window window = new RateLimitProperties.Window();
    window.setWindowMs(60_000);
    window.setMaxRequests(1);
    properties.getLimits().put(RateLimitAction.SUBSCRIBE, window);

    assertTrue(rateLimiter.tryAcquire("user-1", RateLimitAction.SUBSCRIBE).isEmpty());
    assertTrue(rateLimiter.tryAcquire("user-1", RateLimitAction.SUBSCRIBE).isPresent());
  }

  @Test
  void shouldAllowEverythingWhenDisabled() {
    properties.setEnabled(false);

    for (int i = 0; i < 50; i++) {
      assertTrue(rateLimiter.tryAcquire("user-1", RateLimitAction.PLACE_ORDER).isEmpty());
    }
    assertEquals(0, rateLimiter.trackedWindows());
  }

  @Test
  void shouldEvictExpiredWindows() {
    rateLimiter.tryAcquire("user-1", RateLimitAction.PLACE_ORDER);
    rateLimiter.tryAcquire("user-2", RateLimitAction.PLACE_ORDER);
    assertEquals(2, rateLimiter.trackedWindows());

    clock.advance(Duration.ofSeconds(2));
    rateLimiter.evictExpired();

    assertEquals(0, rateLimiter.trackedWindows());
  }
}
