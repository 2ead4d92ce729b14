package com.proptrading.domain.positions;

import java.math.BigDecimal;
import java.util.Objects;

public record MarginPolicy(BigDecimal feeRate, BigDecimal maintenanceMarginRate) {
  public static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.0005");
  public static final BigDecimal DEFAULT_MAINTENANCE_MARGIN_RATE = new BigDecimal("0.005");

  public MarginPolicy {
    Objects.requireNonNull(feeRate, "feeRate must not be null");
    Objects.requireNonNull(maintenanceMarginRate, "maintenanceMarginRate must not be null");
    if (feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0) {
      throw new PositionDomainException("feeRate must be in [0, 1)");
    }
    if (maintenanceMarginRate.signum() < 0
        || maintenanceMarginRate.compareTo(BigDecimal.ONE) >= 0) {
      throw new PositionDomainException("maintenanceMarginRate must be in [0, 1)");
    }
  }

  public static MarginPolicy defaults() {
    return new MarginPolicy(DEFAULT_FEE_RATE, DEFAULT_MAINTENANCE_MARGIN_RATE);
  }
}
