package com.proptrading.domain.orders;

import java.math.BigDecimal;
import java.util.Optional;

/** Order intent exactly as the client sent it. It becomes a position or a pending order. */
public record OrderRequest(
    String clientOrderId,
    String accountId,
    String symbol,
    String side,
    String type,
    BigDecimal quantity,
    BigDecimal leverage,
    BigDecimal limitPrice,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    Long timestamp) {

  public Optional<OrderSide> orderSide() {
    return OrderSide.parse(side);
  }

  public Optional<OrderType> orderType() {
    return OrderType.parse(type);
  }

  public OrderSide requireSide() {
    return orderSide().orElseThrow(() -> new OrderDomainException("Unknown side: " + side));
  }

  public OrderType requireType() {
    return orderType().orElseThrow(() -> new OrderDomainException("Unknown order type: " + type));
  }

  public boolean isLimit() {
    return orderType().filter(t -> t == OrderType.LIMIT).isPresent();
  }

  public OrderRequest normalized() {
    return new OrderRequest(
        clientOrderId == null ? null : clientOrderId.trim(),
        accountId == null ? null : accountId.trim(),
        InstrumentCatalog.normalizeSymbol(symbol),
        side,
        type,
        quantity,
        leverage,
        limitPrice,
        takeProfit,
        stopLoss,
        timestamp);
  }

  public OrderRequest withClientOrderId(String nextClientOrderId) {
    return new OrderRequest(
        nextClientOrderId,
        accountId,
        symbol,
        side,
        type,
        quantity,
        leverage,
        limitPrice,
        takeProfit,
        stopLoss,
        timestamp);
  }
}
