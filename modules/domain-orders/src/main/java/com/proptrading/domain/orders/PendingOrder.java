package com.proptrading.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record PendingOrder(
    String id,
    String clientOrderId,
    String userId,
    String accountId,
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    BigDecimal limitPrice,
    BigDecimal leverage,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    BigDecimal marginReserved,
    PendingOrderStatus status,
    Instant createdAt,
    Instant expiresAt,
    Instant updatedAt) {
  public PendingOrder {
    requireNonBlank(id, "id");
    requireNonBlank(clientOrderId, "clientOrderId");
    requireNonBlank(userId, "userId");
    requireNonBlank(accountId, "accountId");
    requireNonBlank(symbol, "symbol");
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(quantity, "quantity");
    requirePositive(limitPrice, "limitPrice");
    requirePositive(leverage, "leverage");
    requirePositive(marginReserved, "marginReserved");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    if (expiresAt != null && !expiresAt.isAfter(createdAt)) {
      throw new OrderDomainException("expiresAt must be after createdAt");
    }
  }

  public static PendingOrder create(
      String id,
      String clientOrderId,
      String userId,
      String accountId,
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      BigDecimal limitPrice,
      BigDecimal leverage,
      BigDecimal takeProfit,
      BigDecimal stopLoss,
      BigDecimal marginReserved,
      Instant now,
      Instant expiresAt) {
    Objects.requireNonNull(now, "now must not be null");
    return new PendingOrder(
        id,
        clientOrderId,
        userId,
        accountId,
        symbol,
        side,
        quantity,
        limitPrice,
        leverage,
        takeProfit,
        stopLoss,
        marginReserved,
        PendingOrderStatus.PENDING,
        now,
        expiresAt,
        now);
  }

  public PendingOrder transitionTo(PendingOrderStatus toStatus, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    PendingOrderStateMachine.validateTransition(status, toStatus);
    return new PendingOrder(
        id,
        clientOrderId,
        userId,
        accountId,
        symbol,
        side,
        quantity,
        limitPrice,
        leverage,
        takeProfit,
        stopLoss,
        marginReserved,
        toStatus,
        createdAt,
        expiresAt,
        now);
  }

  /** LONG rests until the ask reaches the limit, SHORT until the bid does. */
  public boolean isFillableAt(BigDecimal bid, BigDecimal ask) {
    if (side == OrderSide.LONG) {
      return ask != null && ask.compareTo(limitPrice) <= 0;
    }
    return bid != null && bid.compareTo(limitPrice) >= 0;
  }

  public boolean isPending() {
    return status == PendingOrderStatus.PENDING;
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new OrderDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
