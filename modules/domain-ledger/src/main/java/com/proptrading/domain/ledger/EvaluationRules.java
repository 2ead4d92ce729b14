package com.proptrading.domain.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Pass conditions of an evaluation account. Funded accounts carry none. */
public record EvaluationRules(
    int currentStep, int totalSteps, BigDecimal profitTargetPercent, int minTradingDays) {
  private static final BigDecimal HUNDRED = new BigDecimal("100");

  public EvaluationRules {
    if (totalSteps < 1 || totalSteps > 2) {
      throw new LedgerDomainException("totalSteps must be 1 or 2");
    }
    if (currentStep < 1 || currentStep > totalSteps) {
      throw new LedgerDomainException("currentStep must be between 1 and totalSteps");
    }
    if (profitTargetPercent == null || profitTargetPercent.signum() <= 0) {
      throw new LedgerDomainException("profitTargetPercent must be > 0");
    }
    if (minTradingDays < 0) {
      throw new LedgerDomainException("minTradingDays must be >= 0");
    }
  }

  public BigDecimal profitTarget(BigDecimal startingBalance) {
    return startingBalance.multiply(profitTargetPercent).divide(HUNDRED, 8, RoundingMode.HALF_UP);
  }

  /** Step one of a two-step plan hands over to a second evaluation; any other pass is final. */
  public AccountStatus passedStatus() {
    return currentStep < totalSteps ? AccountStatus.STEP1_PASSED : AccountStatus.PASSED;
  }
}
