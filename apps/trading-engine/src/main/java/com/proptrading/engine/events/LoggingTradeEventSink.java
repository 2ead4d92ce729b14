package com.proptrading.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingTradeEventSink implements TradeEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingTradeEventSink.class);

  @Override
  public void publish(TradeEvent event) {
    log.info(
        "Trade event type={} accountId={} positionId={} orderId={} symbol={} qty={} price={}"
            + " realizedPnl={} balanceAfter={}",
        event.type(),
        event.accountId(),
        event.positionId(),
        event.orderId(),
        event.symbol(),
        event.quantity(),
        event.price(),
        event.realizedPnl(),
        event.balanceAfter());
  }
}
