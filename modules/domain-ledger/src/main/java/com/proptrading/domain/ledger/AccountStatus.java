package com.proptrading.domain.ledger;

public enum AccountStatus {
  ACTIVE,
  STEP1_PASSED,
  PASSED,
  BREACHED,
  SUSPENDED;

  public boolean canTrade() {
    return this == ACTIVE || this == STEP1_PASSED;
  }
}
