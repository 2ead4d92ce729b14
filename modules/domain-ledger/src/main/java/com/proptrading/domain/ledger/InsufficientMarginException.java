package com.proptrading.domain.ledger;

import java.math.BigDecimal;

public class InsufficientMarginException extends LedgerDomainException {
  private final String accountId;
  private final BigDecimal requested;
  private final BigDecimal available;

  public InsufficientMarginException(String accountId, BigDecimal requested, BigDecimal available) {
    super(
        String.format(
            "Insufficient margin for account %s: requested=%s, available=%s",
            accountId, requested.toPlainString(), available.toPlainString()));
    this.accountId = accountId;
    this.requested = requested;
    this.available = available;
  }

  public String accountId() {
    return accountId;
  }

  public BigDecimal requested() {
    return requested;
  }

  public BigDecimal available() {
    return available;
  }
}
