package com.proptrading.engine.orders;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.positions.Position;
import java.math.BigDecimal;
import java.util.Objects;

/** Outcome of a synchronous execution: either a filled position or a rejection. */
public record ExecutionResult(
    Position position, AccountSnapshot account, BigDecimal executionPrice, Rejection rejection) {

  public static ExecutionResult filled(
      Position position, AccountSnapshot account, BigDecimal executionPrice) {
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(account, "account must not be null");
    return new ExecutionResult(position, account, executionPrice, null);
  }

  public static ExecutionResult rejected(Rejection rejection) {
    Objects.requireNonNull(rejection, "rejection must not be null");
    return new ExecutionResult(null, null, null, rejection);
  }

  public boolean isFilled() {
    return rejection == null;
  }
}
