package com.proptrading.engine.price;

import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.positions.MarginCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Locked bid/ask for one symbol at one instant. */
public record PriceSnapshot(
    String symbol,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal mid,
    BigDecimal spread,
    Instant timestamp,
    BigDecimal fundingRate) {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  public PriceSnapshot {
    Objects.requireNonNull(symbol, "symbol must not be null");
    Objects.requireNonNull(bid, "bid must not be null");
    Objects.requireNonNull(ask, "ask must not be null");
    Objects.requireNonNull(mid, "mid must not be null");
    Objects.requireNonNull(spread, "spread must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if (bid.signum() <= 0 || ask.signum() <= 0) {
      throw new IllegalArgumentException("bid and ask must be > 0");
    }
    if (ask.compareTo(bid) < 0) {
      throw new IllegalArgumentException("ask must not be below bid");
    }
  }

  public static PriceSnapshot of(
      String symbol, BigDecimal bid, BigDecimal ask, BigDecimal fundingRate, Instant timestamp) {
    BigDecimal mid = bid.add(ask).divide(TWO, MarginCalculator.SCALE, RoundingMode.HALF_UP);
    return new PriceSnapshot(symbol, bid, ask, mid, ask.subtract(bid), timestamp, fundingRate);
  }

  /** Price an order opening on {@code side} fills at: LONG buys the ask, SHORT sells the bid. */
  public BigDecimal executionPrice(OrderSide side) {
    return side == OrderSide.LONG ? ask : bid;
  }

  /** Price a position on {@code side} closes at. */
  public BigDecimal exitPrice(OrderSide side) {
    return side == OrderSide.LONG ? bid : ask;
  }

  public boolean isStaleAt(Instant now, Duration maxAge) {
    return Duration.between(timestamp, now).compareTo(maxAge) > 0;
  }
}
