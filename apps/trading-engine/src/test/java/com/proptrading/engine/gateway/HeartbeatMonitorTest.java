package com.proptrading.engine.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.engine.config.EngineProperties;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class HeartbeatMonitorTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

  @Test
  void shouldPingLiveConnectionsAndDropSilentOnes() {
    ConnectionManager connections =
        new ConnectionManager(
            new GatewayMessageCodec(Jackson2ObjectMapperBuilder.json().build()),
            new EngineMetrics(new SimpleMeterRegistry()),
            clock,
            50,
            65536);
    EngineProperties properties = new EngineProperties();
    properties.getGateway().setHeartbeatTimeoutMs(60_000);
    HeartbeatMonitor monitor = new HeartbeatMonitor(connections, clock, properties);
    FakeClientConnection silent = new FakeClientConnection("silent");
    FakeClientConnection alive = new FakeClientConnection("alive");
    connections.add(silent);
    ConnectionContext aliveContext = connections.add(alive);

    clock.advance(Duration.ofSeconds(90));
    aliveContext.markPong(clock.instant());
    int dropped = monitor.heartbeat();

    assertEquals(1, dropped);
    assertFalse(silent.isOpen());
    assertTrue(connections.find("silent").isEmpty());
    assertEquals(1, alive.sent().size());
    assertTrue(alive.last().startsWith("{\"type\":\"PING\""));
  }
}
