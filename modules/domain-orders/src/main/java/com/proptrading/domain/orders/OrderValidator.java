package com.proptrading.domain.orders;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateless order checks. The first violated rule wins; nothing is retained between calls.
 *
 * <p>{@link #validate(OrderRequest)} covers everything that can be judged from the request alone.
 * {@link #validateProtectiveLevels(OrderSide, BigDecimal, BigDecimal, BigDecimal)} runs once the
 * execution price has been locked.
 */
public class OrderValidator {
  private final InstrumentCatalog catalog;

  public OrderValidator(InstrumentCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
  }

  public Optional<Rejection> validate(OrderRequest order) {
    if (order == null) {
      return reject(RejectionCode.MISSING_FIELD, "Order data is required");
    }
    if (isBlank(order.accountId())) {
      return reject(RejectionCode.MISSING_FIELD, "Account ID is required");
    }
    if (isBlank(order.symbol())) {
      return reject(RejectionCode.MISSING_FIELD, "Symbol is required");
    }
    if (isBlank(order.side())) {
      return reject(RejectionCode.MISSING_FIELD, "Side is required");
    }
    if (isBlank(order.type())) {
      return reject(RejectionCode.MISSING_FIELD, "Order type is required");
    }
    if (order.quantity() == null) {
      return reject(RejectionCode.MISSING_FIELD, "Quantity is required");
    }

    if (!catalog.isTradeable(order.symbol())) {
      return reject(RejectionCode.INVALID_SYMBOL, "Symbol " + order.symbol() + " is not tradeable");
    }
    if (order.orderSide().isEmpty()) {
      return reject(RejectionCode.INVALID_SIDE, "Side must be LONG or SHORT");
    }
    Optional<OrderType> type = order.orderType();
    if (type.isEmpty()) {
      return reject(RejectionCode.INVALID_ORDER_TYPE, "Order type must be MARKET or LIMIT");
    }

    AssetClass assetClass = AssetClass.of(order.symbol());
    BigDecimal quantity = order.quantity();
    if (quantity.signum() <= 0) {
      return reject(RejectionCode.INVALID_QUANTITY, "Quantity must be a positive number");
    }
    if (quantity.compareTo(assetClass.minQuantity()) < 0) {
      return reject(
          RejectionCode.QUANTITY_OUT_OF_RANGE,
          "Minimum quantity for "
              + order.symbol()
              + " is "
              + assetClass.minQuantity().toPlainString());
    }
    if (quantity.compareTo(assetClass.maxQuantity()) > 0) {
      return reject(
          RejectionCode.QUANTITY_OUT_OF_RANGE,
          "Maximum quantity for "
              + order.symbol()
              + " is "
              + assetClass.maxQuantity().toPlainString());
    }

    BigDecimal leverage = order.leverage();
    if (leverage != null) {
      if (leverage.compareTo(BigDecimal.ONE) < 0) {
        return reject(RejectionCode.INVALID_LEVERAGE, "Leverage must be at least 1");
      }
      if (leverage.compareTo(BigDecimal.valueOf(assetClass.maxLeverage())) > 0) {
        return reject(
            RejectionCode.LEVERAGE_TOO_HIGH,
            "Maximum leverage for " + order.symbol() + " is " + assetClass.maxLeverage() + "x");
      }
    }

    if (type.get() == OrderType.LIMIT) {
      if (order.limitPrice() == null) {
        return reject(
            RejectionCode.INVALID_LIMIT_PRICE, "Limit price is required for LIMIT orders");
      }
      if (order.limitPrice().signum() <= 0) {
        return reject(RejectionCode.INVALID_LIMIT_PRICE, "Limit price must be a positive number");
      }
    }

    if (order.takeProfit() != null && order.takeProfit().signum() <= 0) {
      return reject(RejectionCode.INVALID_TAKE_PROFIT, "Take profit must be a positive number");
    }
    if (order.stopLoss() != null && order.stopLoss().signum() <= 0) {
      return reject(RejectionCode.INVALID_STOP_LOSS, "Stop loss must be a positive number");
    }
    return Optional.empty();
  }

  public Optional<Rejection> validateProtectiveLevels(
      OrderSide side, BigDecimal entryPrice, BigDecimal takeProfit, BigDecimal stopLoss) {
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(entryPrice, "entryPrice must not be null");
    if (side == OrderSide.LONG) {
      if (takeProfit != null && takeProfit.compareTo(entryPrice) <= 0) {
        return reject(
            RejectionCode.INVALID_TAKE_PROFIT,
            "Take profit must be above entry price for LONG positions");
      }
      if (stopLoss != null && stopLoss.compareTo(entryPrice) >= 0) {
        return reject(
            RejectionCode.INVALID_STOP_LOSS,
            "Stop loss must be below entry price for LONG positions");
      }
      return Optional.empty();
    }
    if (takeProfit != null && takeProfit.compareTo(entryPrice) >= 0) {
      return reject(
          RejectionCode.INVALID_TAKE_PROFIT,
          "Take profit must be below entry price for SHORT positions");
    }
    if (stopLoss != null && stopLoss.compareTo(entryPrice) <= 0) {
      return reject(
          RejectionCode.INVALID_STOP_LOSS,
          "Stop loss must be above entry price for SHORT positions");
    }
    return Optional.empty();
  }

  private static Optional<Rejection> reject(RejectionCode code, String message) {
    return Optional.of(Rejection.of(code, message));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
