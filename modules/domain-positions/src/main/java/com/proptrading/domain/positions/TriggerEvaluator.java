package com.proptrading.domain.positions;

import com.proptrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Decides whether a position must close on a tick. Every check uses the exit-side price (bid for
 * LONG, ask for SHORT); liquidation is checked before take-profit and stop-loss.
 */
public final class TriggerEvaluator {
  public static final BigDecimal DEFAULT_WARNING_RATIO = new BigDecimal("0.5");

  private TriggerEvaluator() {}

  public static BigDecimal exitPrice(OrderSide side, BigDecimal bid, BigDecimal ask) {
    return side == OrderSide.LONG ? bid : ask;
  }

  public static Optional<CloseReason> evaluate(Position position, BigDecimal bid, BigDecimal ask) {
    if (position.status() != PositionStatus.OPEN) {
      return Optional.empty();
    }
    OrderSide side = position.side();
    BigDecimal price = exitPrice(side, bid, ask);
    if (MarginCalculator.shouldLiquidate(side, price, position.liquidationPrice())) {
      return Optional.of(CloseReason.LIQUIDATION_TRIGGERED);
    }
    BigDecimal takeProfit = position.takeProfit();
    if (takeProfit != null
        && (side == OrderSide.LONG
            ? price.compareTo(takeProfit) >= 0
            : price.compareTo(takeProfit) <= 0)) {
      return Optional.of(CloseReason.TP_TRIGGERED);
    }
    BigDecimal stopLoss = position.stopLoss();
    if (stopLoss != null
        && (side == OrderSide.LONG
            ? price.compareTo(stopLoss) <= 0
            : price.compareTo(stopLoss) >= 0)) {
      return Optional.of(CloseReason.SL_TRIGGERED);
    }
    return Optional.empty();
  }

  /**
   * Remaining distance to the liquidation price as a fraction of the entry-to-liquidation
   * distance: 1 at entry, 0 at liquidation, above 1 when in profit.
   */
  public static BigDecimal liquidationDistanceRatio(Position position, BigDecimal price) {
    BigDecimal full = position.entryPrice().subtract(position.liquidationPrice()).abs();
    BigDecimal remaining =
        position.side() == OrderSide.LONG
            ? price.subtract(position.liquidationPrice())
            : position.liquidationPrice().subtract(price);
    return remaining.divide(full, MarginCalculator.SCALE, RoundingMode.HALF_UP);
  }

  public static boolean isNearLiquidation(
      Position position, BigDecimal bid, BigDecimal ask, BigDecimal warningRatio) {
    BigDecimal ratio =
        liquidationDistanceRatio(position, exitPrice(position.side(), bid, ask));
    return ratio.signum() > 0 && ratio.compareTo(warningRatio) < 0;
  }
}
