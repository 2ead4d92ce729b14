package com.proptrading.engine.events;

import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.infra.kafka.contract.payload.TradeEventV1;
import com.proptrading.infra.kafka.producer.KafkaPublishException;
import com.proptrading.infra.kafka.producer.TradeEventProducer;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fire-and-forget publication to the trading events topic. */
public class KafkaTradeEventSink implements TradeEventSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaTradeEventSink.class);

  private final TradeEventProducer producer;
  private final EngineMetrics metrics;

  public KafkaTradeEventSink(TradeEventProducer producer, EngineMetrics metrics) {
    this.producer = producer;
    this.metrics = metrics;
  }

  @Override
  public void publish(TradeEvent event) {
    try {
      producer
          .publishTradeEvent(toPayload(event))
          .whenComplete(
              (result, error) -> {
                if (error != null) {
                  onFailure(event, error);
                }
              });
    } catch (RuntimeException ex) {
      onFailure(event, ex);
    }
  }

  static TradeEventV1 toPayload(TradeEvent event) {
    return new TradeEventV1(
        event.id(),
        event.type().name(),
        event.accountId(),
        event.userId(),
        event.positionId(),
        event.orderId(),
        event.symbol(),
        event.side() == null ? null : event.side().name(),
        event.quantity(),
        event.price(),
        event.marginUsed(),
        event.fee(),
        event.realizedPnl(),
        event.fundingFee(),
        event.balanceAfter(),
        event.closeReason() == null ? null : event.closeReason().name(),
        event.occurredAt());
  }

  private void onFailure(TradeEvent event, Throwable error) {
    metrics.tradeEventPublishFailed(event.type());
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
    if (cause instanceof KafkaPublishException publishException && publishException.isTimedOut()) {
      log.warn(
          "Trade event publish timed out eventId={} type={} accountId={} topic={}",
          event.id(),
          event.type(),
          event.accountId(),
          publishException.getTopic());
      return;
    }
    log.warn(
        "Trade event publish failed eventId={} type={} accountId={}",
        event.id(),
        event.type(),
        event.accountId(),
        cause);
  }
}
