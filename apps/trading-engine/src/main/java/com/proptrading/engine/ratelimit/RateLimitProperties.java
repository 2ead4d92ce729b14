package com.proptrading.engine.ratelimit;

import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {
  private boolean enabled = true;
  private Map<RateLimitAction, Window> limits = new EnumMap<>(RateLimitAction.class);
  private long replayMaxAgeMs = 3_000L;
  private long replayMaxFutureMs = 1_000L;
  private long cleanupIntervalMs = 60_000L;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Map<RateLimitAction, Window> getLimits() {
    return limits;
  }

  public void setLimits(Map<RateLimitAction, Window> limits) {
    this.limits = limits;
  }

  public long getReplayMaxAgeMs() {
    return replayMaxAgeMs;
  }

  public void setReplayMaxAgeMs(long replayMaxAgeMs) {
    this.replayMaxAgeMs = replayMaxAgeMs;
  }

  public long getReplayMaxFutureMs() {
    return replayMaxFutureMs;
  }

  public void setReplayMaxFutureMs(long replayMaxFutureMs) {
    this.replayMaxFutureMs = replayMaxFutureMs;
  }

  public long getCleanupIntervalMs() {
    return cleanupIntervalMs;
  }

  public void setCleanupIntervalMs(long cleanupIntervalMs) {
    this.cleanupIntervalMs = cleanupIntervalMs;
  }

  /** Configured window for {@code action}, falling back to the built-in default. */
  public Window windowFor(RateLimitAction action) {
    Window configured = limits.get(action);
    if (configured != null) {
      return configured;
    }
    Window fallback = new Window();
    fallback.setWindowMs(action.defaultWindowMs());
    fallback.setMaxRequests(action.defaultMaxRequests());
    return fallback;
  }

  public static class Window {
    private long windowMs = 1_000L;
    private int maxRequests = 100;

    public long getWindowMs() {
      return windowMs;
    }

    public void setWindowMs(long windowMs) {
      this.windowMs = windowMs;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }
  }
}
