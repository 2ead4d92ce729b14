package com.proptrading.engine.gateway;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class GatewayHealthIndicator implements HealthIndicator {
  private final ConnectionManager connectionManager;

  public GatewayHealthIndicator(ConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
  }

  @Override
  public Health health() {
    return Health.up()
        .withDetail("connections", connectionManager.connectionCount())
        .withDetail("authenticated", connectionManager.authenticatedCount())
        .build();
  }
}
