package com.proptrading.domain.orders;

import java.math.BigDecimal;

/** Quantity bands and leverage caps per asset class. */
public enum AssetClass {
  BTC(new BigDecimal("0.0001"), new BigDecimal("100"), 100),
  ETH(new BigDecimal("0.001"), new BigDecimal("1000"), 100),
  ALTCOIN(new BigDecimal("0.01"), new BigDecimal("100000"), 50);

  private final BigDecimal minQuantity;
  private final BigDecimal maxQuantity;
  private final int maxLeverage;

  AssetClass(BigDecimal minQuantity, BigDecimal maxQuantity, int maxLeverage) {
    this.minQuantity = minQuantity;
    this.maxQuantity = maxQuantity;
    this.maxLeverage = maxLeverage;
  }

  public static AssetClass of(String symbol) {
    if (symbol == null) {
      return ALTCOIN;
    }
    if (symbol.startsWith("BTC")) {
      return BTC;
    }
    if (symbol.startsWith("ETH")) {
      return ETH;
    }
    return ALTCOIN;
  }

  public boolean isMajor() {
    return this == BTC || this == ETH;
  }

  public BigDecimal minQuantity() {
    return minQuantity;
  }

  public BigDecimal maxQuantity() {
    return maxQuantity;
  }

  public int maxLeverage() {
    return maxLeverage;
  }
}
