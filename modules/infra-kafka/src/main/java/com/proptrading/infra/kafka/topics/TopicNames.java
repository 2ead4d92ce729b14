package com.proptrading.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String TRADING_EVENTS_V1 = "trading.events.v1";
  public static final String MARKET_PRICES_V1 = "market.prices.v1";
  public static final String MARKET_ORDER_BOOKS_V1 = "market.orderbooks.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(TRADING_EVENTS_V1, MARKET_PRICES_V1, MARKET_ORDER_BOOKS_V1);
  }
}
