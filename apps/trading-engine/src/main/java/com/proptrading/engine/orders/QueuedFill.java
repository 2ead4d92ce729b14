package com.proptrading.engine.orders;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.positions.Position;
import java.math.BigDecimal;

/**
 * What happened to a resting order whose limit was reached: it filled into {@code position}, or it
 * was cancelled at fill time for {@code cancelReason} ({@code position} is {@code null}).
 */
public record QueuedFill(
    PendingOrder order,
    Position position,
    AccountSnapshot account,
    BigDecimal executionPrice,
    String cancelReason) {
  static QueuedFill filled(
      PendingOrder order, Position position, AccountSnapshot account, BigDecimal executionPrice) {
    return new QueuedFill(order, position, account, executionPrice, null);
  }

  static QueuedFill cancelled(PendingOrder order, AccountSnapshot account, String reason) {
    return new QueuedFill(order, null, account, null, reason);
  }

  public boolean isFilled() {
    return position != null;
  }
}
