package com.proptrading.domain.ledger;

public enum ReservationStatus {
  ACTIVE,
  RELEASED;

  public boolean isTerminal() {
    return this == RELEASED;
  }
}
