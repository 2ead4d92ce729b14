package com.proptrading.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record AccountSnapshot(
    String accountId,
    String userId,
    AccountStatus status,
    BigDecimal startingBalance,
    BigDecimal currentBalance,
    BigDecimal availableMargin,
    BigDecimal totalMarginUsed,
    BigDecimal reservedMargin,
    BigDecimal dailyPnl,
    BigDecimal dailyStartingBalance,
    BigDecimal peakBalance,
    BigDecimal dailyLossLimit,
    BigDecimal maxDrawdownLimit,
    int majorMaxLeverage,
    int altcoinMaxLeverage,
    long totalTrades,
    long winningTrades,
    long losingTrades,
    BigDecimal totalVolume,
    BigDecimal totalFeesPaid,
    Instant lastTradeAt,
    Instant updatedAt,
    int tradingDays,
    EvaluationRules evaluation) {

  public BigDecimal equity(BigDecimal unrealizedPnl) {
    return currentBalance.add(unrealizedPnl == null ? BigDecimal.ZERO : unrealizedPnl);
  }

  public boolean isConserved() {
    return availableMargin.add(totalMarginUsed).add(reservedMargin).compareTo(currentBalance) == 0;
  }
}
