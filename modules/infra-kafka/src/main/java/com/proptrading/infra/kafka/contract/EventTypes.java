package com.proptrading.infra.kafka.contract;

public final class EventTypes {
  public static final String TRADE_EVENT_RECORDED = "TradeEventRecorded";
  public static final String PRICE_TICK = "PriceTick";
  public static final String ORDER_BOOK_SNAPSHOT = "OrderBookSnapshot";

  private EventTypes() {}
}
