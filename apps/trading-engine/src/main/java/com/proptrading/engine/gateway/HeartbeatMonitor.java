package com.proptrading.engine.gateway;

import com.proptrading.engine.config.EngineProperties;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Pings every connection and drops those that have not answered within the timeout. */
@Component
public class HeartbeatMonitor {
  private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

  private final ConnectionManager connectionManager;
  private final Clock clock;
  private final Duration timeout;

  public HeartbeatMonitor(
      ConnectionManager connectionManager, Clock clock, EngineProperties properties) {
    this.connectionManager = connectionManager;
    this.clock = clock;
    this.timeout = Duration.ofMillis(properties.getGateway().getHeartbeatTimeoutMs());
  }

  @Scheduled(fixedDelayString = "${engine.gateway.heartbeat-interval-ms:30000}")
  public int heartbeat() {
    Instant now = clock.instant();
    Instant cutoff = now.minus(timeout);
    int dropped = 0;
    for (ConnectionContext context : connectionManager.connections()) {
      if (context.lastPongAt().isBefore(cutoff)) {
        log.info("Heartbeat timeout connectionId={} userId={}", context.id(), context.userId());
        connectionManager.remove(context.id());
        context.transport().close();
        dropped++;
        continue;
      }
      connectionManager.send(
          context.id(),
          OutboundMessage.builder(OutboundMessageType.PING)
              .put("timestamp", now.toEpochMilli())
              .build());
    }
    return dropped;
  }
}
