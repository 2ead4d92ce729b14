package com.proptrading.domain.positions;

public enum PositionStatus {
  OPEN,
  CLOSED,
  LIQUIDATED;

  public boolean isTerminal() {
    return this == CLOSED || this == LIQUIDATED;
  }
}
