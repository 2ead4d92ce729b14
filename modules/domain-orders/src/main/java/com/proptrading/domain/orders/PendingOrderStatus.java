package com.proptrading.domain.orders;

public enum PendingOrderStatus {
  PENDING,
  FILLED,
  CANCELLED,
  EXPIRED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
