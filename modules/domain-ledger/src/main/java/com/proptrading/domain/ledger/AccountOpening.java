package com.proptrading.domain.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/** Initial figures an account is loaded with; no margin is in use at that point. */
public record AccountOpening(
    String accountId,
    String userId,
    AccountStatus status,
    BigDecimal startingBalance,
    BigDecimal currentBalance,
    BigDecimal dailyStartingBalance,
    BigDecimal peakBalance,
    BigDecimal dailyLossLimit,
    BigDecimal maxDrawdownLimit,
    int majorMaxLeverage,
    int altcoinMaxLeverage,
    EvaluationRules evaluation,
    int tradingDays) {
  public AccountOpening {
    requireNonBlank(accountId, "accountId");
    requireNonBlank(userId, "userId");
    Objects.requireNonNull(status, "status must not be null");
    requirePositive(startingBalance, "startingBalance");
    requireNonNegative(currentBalance, "currentBalance");
    requireNonNegative(dailyStartingBalance, "dailyStartingBalance");
    requireNonNegative(peakBalance, "peakBalance");
    requirePositive(dailyLossLimit, "dailyLossLimit");
    requirePositive(maxDrawdownLimit, "maxDrawdownLimit");
    if (majorMaxLeverage < 1 || altcoinMaxLeverage < 1) {
      throw new LedgerDomainException("leverage caps must be >= 1");
    }
    if (tradingDays < 0) {
      throw new LedgerDomainException("tradingDays must be >= 0");
    }
  }

  /** Account without evaluation rules and no trading days behind it. */
  public AccountOpening(
      String accountId,
      String userId,
      AccountStatus status,
      BigDecimal startingBalance,
      BigDecimal currentBalance,
      BigDecimal dailyStartingBalance,
      BigDecimal peakBalance,
      BigDecimal dailyLossLimit,
      BigDecimal maxDrawdownLimit,
      int majorMaxLeverage,
      int altcoinMaxLeverage) {
    this(
        accountId,
        userId,
        status,
        startingBalance,
        currentBalance,
        dailyStartingBalance,
        peakBalance,
        dailyLossLimit,
        maxDrawdownLimit,
        majorMaxLeverage,
        altcoinMaxLeverage,
        null,
        0);
  }

  public AccountOpening withEvaluation(EvaluationRules rules) {
    return new AccountOpening(
        accountId,
        userId,
        status,
        startingBalance,
        currentBalance,
        dailyStartingBalance,
        peakBalance,
        dailyLossLimit,
        maxDrawdownLimit,
        majorMaxLeverage,
        altcoinMaxLeverage,
        rules,
        tradingDays);
  }

  public static AccountOpening fresh(
      String accountId,
      String userId,
      BigDecimal startingBalance,
      BigDecimal dailyLossLimit,
      BigDecimal maxDrawdownLimit) {
    return new AccountOpening(
        accountId,
        userId,
        AccountStatus.ACTIVE,
        startingBalance,
        startingBalance,
        startingBalance,
        startingBalance,
        dailyLossLimit,
        maxDrawdownLimit,
        100,
        50);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new LedgerDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new LedgerDomainException(fieldName + " must be >= 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new LedgerDomainException(fieldName + " must not be blank");
    }
  }
}
