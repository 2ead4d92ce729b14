package com.proptrading.domain.positions;

import com.proptrading.domain.orders.AssetClass;

/** Per-account leverage ceilings. BTC and ETH pairs use the major cap, the rest the altcoin cap. */
public record LeverageCaps(int major, int altcoin) {
  public LeverageCaps {
    if (major < 1 || altcoin < 1) {
      throw new PositionDomainException("leverage caps must be >= 1");
    }
  }

  public int capFor(String symbol) {
    return AssetClass.of(symbol).isMajor() ? major : altcoin;
  }
}
