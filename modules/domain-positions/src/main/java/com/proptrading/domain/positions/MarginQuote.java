package com.proptrading.domain.positions;

import java.math.BigDecimal;

public record MarginQuote(
    BigDecimal executionPrice,
    BigDecimal notional,
    BigDecimal effectiveLeverage,
    BigDecimal marginRequired,
    BigDecimal entryFee,
    BigDecimal liquidationPrice) {

  public BigDecimal totalCost() {
    return marginRequired.add(entryFee);
  }
}
