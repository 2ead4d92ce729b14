package com.proptrading.domain.positions;

import com.proptrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

public record Position(
    String id,
    String userId,
    String accountId,
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    BigDecimal leverage,
    BigDecimal marginUsed,
    BigDecimal entryFee,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    BigDecimal liquidationPrice,
    BigDecimal accruedFunding,
    PositionStatus status,
    Instant openedAt,
    Instant updatedAt) {
  public Position {
    requireNonBlank(id, "id");
    requireNonBlank(userId, "userId");
    requireNonBlank(accountId, "accountId");
    requireNonBlank(symbol, "symbol");
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(quantity, "quantity");
    requirePositive(entryPrice, "entryPrice");
    requirePositive(leverage, "leverage");
    requirePositive(marginUsed, "marginUsed");
    Objects.requireNonNull(entryFee, "entryFee must not be null");
    requirePositive(liquidationPrice, "liquidationPrice");
    Objects.requireNonNull(accruedFunding, "accruedFunding must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(openedAt, "openedAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    if (side == OrderSide.LONG && liquidationPrice.compareTo(entryPrice) >= 0) {
      throw new PositionDomainException("LONG liquidationPrice must be below entryPrice");
    }
    if (side == OrderSide.SHORT && liquidationPrice.compareTo(entryPrice) <= 0) {
      throw new PositionDomainException("SHORT liquidationPrice must be above entryPrice");
    }
  }

  public static Position open(
      String id,
      String userId,
      String accountId,
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      MarginQuote quote,
      BigDecimal takeProfit,
      BigDecimal stopLoss,
      Instant now) {
    Objects.requireNonNull(quote, "quote must not be null");
    return new Position(
        id,
        userId,
        accountId,
        symbol,
        side,
        quantity,
        quote.executionPrice(),
        quote.effectiveLeverage(),
        quote.marginRequired(),
        quote.entryFee(),
        takeProfit,
        stopLoss,
        quote.liquidationPrice(),
        BigDecimal.ZERO,
        PositionStatus.OPEN,
        now,
        now);
  }

  public Position withProtectiveLevels(
      BigDecimal nextTakeProfit, BigDecimal nextStopLoss, Instant now) {
    PositionStateMachine.validateTransition(status, PositionStatus.OPEN);
    return new Position(
        id, userId, accountId, symbol, side, quantity, entryPrice, leverage, marginUsed, entryFee,
        nextTakeProfit, nextStopLoss, liquidationPrice, accruedFunding, PositionStatus.OPEN,
        openedAt, now);
  }

  public Position withAccruedFunding(BigDecimal fundingDelta, Instant now) {
    Objects.requireNonNull(fundingDelta, "fundingDelta must not be null");
    PositionStateMachine.validateTransition(status, PositionStatus.OPEN);
    return new Position(
        id, userId, accountId, symbol, side, quantity, entryPrice, leverage, marginUsed, entryFee,
        takeProfit, stopLoss, liquidationPrice, accruedFunding.add(fundingDelta),
        PositionStatus.OPEN, openedAt, now);
  }

  /** Remaining position after {@code closedQuantity} is taken off; amounts shrink pro rata. */
  public Position reduceBy(BigDecimal closedQuantity, Instant now) {
    requirePositive(closedQuantity, "closedQuantity");
    if (closedQuantity.compareTo(quantity) >= 0) {
      throw new PositionDomainException(
          "closedQuantity must be below quantity for a partial close");
    }
    PositionStateMachine.validateTransition(status, PositionStatus.OPEN);
    return new Position(
        id,
        userId,
        accountId,
        symbol,
        side,
        quantity.subtract(closedQuantity),
        entryPrice,
        leverage,
        marginUsed.subtract(shareOf(marginUsed, closedQuantity)),
        entryFee.subtract(shareOf(entryFee, closedQuantity)),
        takeProfit,
        stopLoss,
        liquidationPrice,
        accruedFunding.subtract(shareOf(accruedFunding, closedQuantity)),
        PositionStatus.OPEN,
        openedAt,
        now);
  }

  public Position terminate(PositionStatus terminalStatus, Instant now) {
    if (!terminalStatus.isTerminal()) {
      throw new PositionDomainException(terminalStatus + " is not a terminal status");
    }
    PositionStateMachine.validateTransition(status, terminalStatus);
    return new Position(
        id, userId, accountId, symbol, side, quantity, entryPrice, leverage, marginUsed, entryFee,
        takeProfit, stopLoss, liquidationPrice, accruedFunding, terminalStatus, openedAt, now);
  }

  /** Portion of {@code amount} attributable to {@code closedQuantity} of this position. */
  public BigDecimal shareOf(BigDecimal amount, BigDecimal closedQuantity) {
    if (closedQuantity.compareTo(quantity) >= 0) {
      return amount;
    }
    return amount
        .multiply(closedQuantity)
        .divide(quantity, MarginCalculator.SCALE, RoundingMode.HALF_UP);
  }

  public BigDecimal unrealizedPnl(BigDecimal price) {
    return MarginCalculator.unrealizedPnl(side, entryPrice, price, quantity);
  }

  public BigDecimal roePercent(BigDecimal price) {
    return MarginCalculator.roePercent(unrealizedPnl(price), marginUsed);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new PositionDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new PositionDomainException(fieldName + " must not be blank");
    }
  }
}
