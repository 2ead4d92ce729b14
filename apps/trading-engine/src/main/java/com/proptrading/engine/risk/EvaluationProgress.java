package com.proptrading.engine.risk;

import java.math.BigDecimal;

/** Where an evaluation account stands against its pass conditions. */
public record EvaluationProgress(
    String accountId,
    int step,
    BigDecimal equity,
    BigDecimal profit,
    BigDecimal profitTarget,
    int tradingDays,
    int minTradingDays,
    long totalTrades) {

  public boolean profitTargetMet() {
    return profit.compareTo(profitTarget) >= 0;
  }

  public boolean minTradingDaysMet() {
    return tradingDays >= minTradingDays;
  }

  public boolean passed() {
    return totalTrades > 0 && profitTargetMet() && minTradingDaysMet();
  }
}
