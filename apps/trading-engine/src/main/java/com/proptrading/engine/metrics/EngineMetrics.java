package com.proptrading.engine.metrics;

import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.CloseReason;
import com.proptrading.engine.events.TradeEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class EngineMetrics {
  private final MeterRegistry meterRegistry;

  public EngineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void orderFilled(boolean fromQueue) {
    orderCounter("filled", "none", fromQueue ? "queue" : "direct").increment();
  }

  public void orderPending() {
    orderCounter("pending", "none", "direct").increment();
  }

  public void orderRejected(RejectionCode code) {
    orderCounter("rejected", code.name(), "direct").increment();
  }

  public void recordExecutionLatency(long durationNanos) {
    Timer.builder("engine.order.execution.duration")
        .description("Time from intake to fill or rejection")
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  public void positionClosed(CloseReason reason) {
    Counter.builder("engine.positions.closed.total")
        .description("Closed or partially closed positions by reason")
        .tag("reason", reason.name())
        .register(meterRegistry)
        .increment();
  }

  public void broadcastDropped(String kind, String cause) {
    Counter.builder("engine.broadcast.dropped.total")
        .description("Outbound messages skipped for a connection")
        .tag("kind", kind)
        .tag("cause", cause)
        .register(meterRegistry)
        .increment();
  }

  public void tradeEventPublishFailed(TradeEventType type) {
    Counter.builder("engine.trade_events.failed.total")
        .description("Trade events that could not be delivered")
        .tag("type", type.name())
        .register(meterRegistry)
        .increment();
  }

  public void accountBreached(String reason) {
    Counter.builder("engine.accounts.breached.total")
        .description("Accounts moved to BREACHED")
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  public void evaluationPassed(String status) {
    Counter.builder("engine.evaluations.passed.total")
        .description("Evaluation accounts that met their pass conditions")
        .tag("status", status)
        .register(meterRegistry)
        .increment();
  }

  private Counter orderCounter(String outcome, String code, String path) {
    return Counter.builder("engine.orders.total")
        .description("Order outcomes")
        .tag("outcome", outcome)
        .tag("code", code)
        .tag("path", path)
        .register(meterRegistry);
  }
}
