package com.proptrading.domain.positions;

public enum CloseReason {
  MANUAL,
  TP_TRIGGERED,
  SL_TRIGGERED,
  LIQUIDATION_TRIGGERED,
  BREACH;

  public PositionStatus terminalStatus() {
    return this == LIQUIDATION_TRIGGERED ? PositionStatus.LIQUIDATED : PositionStatus.CLOSED;
  }

  public boolean isAutomatic() {
    return this != MANUAL;
  }
}
