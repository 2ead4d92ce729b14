package com.proptrading.domain.positions;

import com.proptrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record ClosedTrade(
    String tradeId,
    String positionId,
    String userId,
    String accountId,
    String symbol,
    OrderSide side,
    BigDecimal closedQuantity,
    BigDecimal remainingQuantity,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal leverage,
    BigDecimal grossPnl,
    BigDecimal entryFeeShare,
    BigDecimal exitFee,
    BigDecimal fundingShare,
    BigDecimal realizedPnl,
    BigDecimal marginReleased,
    CloseReason closeReason,
    PositionStatus resultingStatus,
    Instant openedAt,
    Instant closedAt) {
  public ClosedTrade {
    Objects.requireNonNull(tradeId, "tradeId must not be null");
    Objects.requireNonNull(positionId, "positionId must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(closedQuantity, "closedQuantity must not be null");
    Objects.requireNonNull(remainingQuantity, "remainingQuantity must not be null");
    Objects.requireNonNull(grossPnl, "grossPnl must not be null");
    Objects.requireNonNull(realizedPnl, "realizedPnl must not be null");
    Objects.requireNonNull(marginReleased, "marginReleased must not be null");
    Objects.requireNonNull(closeReason, "closeReason must not be null");
    Objects.requireNonNull(resultingStatus, "resultingStatus must not be null");
    Objects.requireNonNull(closedAt, "closedAt must not be null");
  }

  /** Change to the account balance; the entry fee share was already charged at open. */
  public BigDecimal balanceDelta() {
    return grossPnl.subtract(exitFee).subtract(fundingShare);
  }

  public boolean isFullClose() {
    return resultingStatus.isTerminal();
  }
}
