package com.proptrading.engine.risk;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Equity-based view of an account's limits. {@code dailyLoss} and {@code drawdown} are never
 * negative.
 */
public record RiskAssessment(
    String accountId,
    BigDecimal equity,
    BigDecimal dailyLoss,
    BigDecimal dailyLossLimit,
    BigDecimal drawdown,
    BigDecimal maxDrawdownLimit) {

  public Optional<BreachReason> breach() {
    if (dailyLoss.compareTo(dailyLossLimit) >= 0) {
      return Optional.of(BreachReason.DAILY_LOSS);
    }
    if (drawdown.compareTo(maxDrawdownLimit) >= 0) {
      return Optional.of(BreachReason.MAX_DRAWDOWN);
    }
    return Optional.empty();
  }

  public boolean dailyLossAtLeast(BigDecimal ratio) {
    return dailyLoss.signum() > 0 && dailyLoss.compareTo(dailyLossLimit.multiply(ratio)) >= 0;
  }

  public boolean drawdownAtLeast(BigDecimal ratio) {
    return drawdown.signum() > 0 && drawdown.compareTo(maxDrawdownLimit.multiply(ratio)) >= 0;
  }
}
