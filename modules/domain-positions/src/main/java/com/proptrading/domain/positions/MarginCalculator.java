package com.proptrading.domain.positions;

import com.proptrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/** Margin, fee, liquidation and P&L arithmetic. All amounts are scale 8, HALF_UP. */
public final class MarginCalculator {
  public static final int SCALE = 8;
  private static final int RATIO_SCALE = 16;
  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final MarginPolicy policy;

  public MarginCalculator(MarginPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
  }

  public MarginPolicy policy() {
    return policy;
  }

  public MarginQuote quote(
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      BigDecimal price,
      BigDecimal requestedLeverage,
      LeverageCaps caps) {
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(quantity, "quantity");
    requirePositive(price, "price");
    Objects.requireNonNull(caps, "caps must not be null");
    BigDecimal leverage = effectiveLeverage(requestedLeverage, caps.capFor(symbol));
    BigDecimal notional = scaled(quantity.multiply(price));
    BigDecimal marginRequired = notional.divide(leverage, SCALE, RoundingMode.HALF_UP);
    return new MarginQuote(
        price,
        notional,
        leverage,
        marginRequired,
        fee(quantity, price),
        liquidationPrice(side, price, leverage));
  }

  /** Requested leverage when it lies in {@code [1, cap]}, otherwise the cap. */
  public static BigDecimal effectiveLeverage(BigDecimal requested, int cap) {
    BigDecimal capValue = BigDecimal.valueOf(cap);
    if (requested == null
        || requested.compareTo(BigDecimal.ONE) < 0
        || requested.compareTo(capValue) > 0) {
      return capValue;
    }
    return requested;
  }

  public BigDecimal fee(BigDecimal quantity, BigDecimal price) {
    return scaled(quantity.multiply(price).multiply(policy.feeRate()));
  }

  public BigDecimal liquidationPrice(OrderSide side, BigDecimal entryPrice, BigDecimal leverage) {
    requirePositive(leverage, "leverage");
    BigDecimal inverse = BigDecimal.ONE.divide(leverage, RATIO_SCALE, RoundingMode.HALF_UP);
    BigDecimal factor =
        side == OrderSide.LONG
            ? BigDecimal.ONE.subtract(inverse).add(policy.maintenanceMarginRate())
            : BigDecimal.ONE.add(inverse).subtract(policy.maintenanceMarginRate());
    return scaled(entryPrice.multiply(factor));
  }

  public static BigDecimal unrealizedPnl(
      OrderSide side, BigDecimal entryPrice, BigDecimal price, BigDecimal quantity) {
    BigDecimal move =
        side == OrderSide.LONG ? price.subtract(entryPrice) : entryPrice.subtract(price);
    return scaled(move.multiply(quantity));
  }

  public static BigDecimal roePercent(BigDecimal pnl, BigDecimal marginUsed) {
    if (marginUsed == null || marginUsed.signum() == 0) {
      return BigDecimal.ZERO.setScale(SCALE);
    }
    return pnl.multiply(HUNDRED).divide(marginUsed, SCALE, RoundingMode.HALF_UP);
  }

  public static boolean shouldLiquidate(
      OrderSide side, BigDecimal price, BigDecimal liquidationPrice) {
    return side == OrderSide.LONG
        ? price.compareTo(liquidationPrice) <= 0
        : price.compareTo(liquidationPrice) >= 0;
  }

  /** Signed funding charge for one interval; positive means the position pays. */
  public static BigDecimal fundingCharge(Position position, BigDecimal markPrice, BigDecimal rate) {
    BigDecimal charge = scaled(position.quantity().multiply(markPrice).multiply(rate));
    return position.side() == OrderSide.LONG ? charge : charge.negate();
  }

  /**
   * Settles {@code closeQuantity} of {@code position} at {@code exitPrice}. A quantity at or above
   * the position size closes it in full.
   */
  public ClosedTrade settle(
      Position position,
      BigDecimal closeQuantity,
      BigDecimal exitPrice,
      CloseReason reason,
      String tradeId,
      Instant now) {
    Objects.requireNonNull(position, "position must not be null");
    requirePositive(closeQuantity, "closeQuantity");
    requirePositive(exitPrice, "exitPrice");
    Objects.requireNonNull(reason, "reason must not be null");
    BigDecimal closed = closeQuantity.min(position.quantity());
    if (leavesDust(position, closed)) {
      closed = position.quantity();
    }
    boolean fullClose = closed.compareTo(position.quantity()) == 0;

    BigDecimal gross = unrealizedPnl(position.side(), position.entryPrice(), exitPrice, closed);
    BigDecimal exitFee = fee(closed, exitPrice);
    BigDecimal entryFeeShare = position.shareOf(position.entryFee(), closed);
    BigDecimal fundingShare = position.shareOf(position.accruedFunding(), closed);
    BigDecimal marginReleased = position.shareOf(position.marginUsed(), closed);
    BigDecimal realized = gross.subtract(entryFeeShare).subtract(exitFee).subtract(fundingShare);

    return new ClosedTrade(
        tradeId,
        position.id(),
        position.userId(),
        position.accountId(),
        position.symbol(),
        position.side(),
        closed,
        position.quantity().subtract(closed),
        position.entryPrice(),
        exitPrice,
        position.leverage(),
        gross,
        entryFeeShare,
        exitFee,
        fundingShare,
        realized,
        marginReleased,
        reason,
        fullClose ? reason.terminalStatus() : PositionStatus.OPEN,
        position.openedAt(),
        now);
  }

  /** A remainder that rounds to nothing at ledger scale cannot stand as an open position. */
  private static boolean leavesDust(Position position, BigDecimal closed) {
    BigDecimal remainingQuantity =
        position.quantity().subtract(closed).setScale(SCALE, RoundingMode.HALF_UP);
    if (remainingQuantity.signum() <= 0) {
      return true;
    }
    BigDecimal remainingMargin =
        position.marginUsed().subtract(position.shareOf(position.marginUsed(), closed));
    return remainingMargin.signum() <= 0;
  }

  private static BigDecimal scaled(BigDecimal value) {
    return value.setScale(SCALE, RoundingMode.HALF_UP);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new PositionDomainException(fieldName + " must be > 0");
    }
  }
}
