package com.proptrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Top-of-book depth for one symbol. Bids are best-first descending, asks ascending. */
public record OrderBookSnapshotV1(
    String symbol, List<Level> bids, List<Level> asks, long lastUpdateId, Instant timestamp) {
  public OrderBookSnapshotV1 {
    bids = bids == null ? List.of() : List.copyOf(bids);
    asks = asks == null ? List.of() : List.copyOf(asks);
  }

  public record Level(BigDecimal price, BigDecimal quantity) {}
}
