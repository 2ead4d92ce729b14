package com.proptrading.engine.orders;

import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.orders.OrderValidator;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.LeverageCaps;
import com.proptrading.domain.positions.MarginCalculator;
import com.proptrading.domain.positions.MarginQuote;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.positions.PositionManager;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import java.math.BigDecimal;
import java.util.Optional;

/** Fill-or-reject execution of one order against a locked price. */
public class OrderExecutor {
  private final AccountLedger ledger;
  private final PositionManager positions;
  private final MarginCalculator calculator;
  private final OrderValidator validator;
  private final PriceSnapshotProvider prices;
  private final EntityLockRegistry locks;

  public OrderExecutor(
      AccountLedger ledger,
      PositionManager positions,
      MarginCalculator calculator,
      OrderValidator validator,
      PriceSnapshotProvider prices,
      EntityLockRegistry locks) {
    this.ledger = ledger;
    this.positions = positions;
    this.calculator = calculator;
    this.validator = validator;
    this.prices = prices;
    this.locks = locks;
  }

  /** {@code order} must already have passed {@link OrderValidator#validate}. */
  public ExecutionResult executeSync(String userId, OrderRequest order, PriceSnapshot snapshot) {
    try {
      if (prices.isStale(snapshot)) {
        return ExecutionResult.rejected(
            Rejection.of(RejectionCode.PRICE_STALE, "Price data is stale, please retry"));
      }
      OrderSide side = order.requireSide();
      BigDecimal executionPrice = snapshot.executionPrice(side);
      if (order.isLimit() && !crosses(side, order.limitPrice(), snapshot)) {
        return ExecutionResult.rejected(
            Rejection.of(
                RejectionCode.LIMIT_PRICE_NOT_MET,
                "Limit price " + order.limitPrice().toPlainString() + " not reached"));
      }
      Optional<Rejection> levels =
          validator.validateProtectiveLevels(
              side, executionPrice, order.takeProfit(), order.stopLoss());
      if (levels.isPresent()) {
        return ExecutionResult.rejected(levels.get());
      }
      return locks.withAccountLock(
          order.accountId(),
          () -> {
            LedgerAccount account = ledger.requireTradable(order.accountId(), userId);
            Position position =
                openLocked(
                    account,
                    order.clientOrderId(),
                    order.symbol(),
                    side,
                    order.quantity(),
                    order.leverage(),
                    executionPrice,
                    order.takeProfit(),
                    order.stopLoss());
            return ExecutionResult.filled(position, account.snapshot(), executionPrice);
          });
    } catch (EngineRejectionException ex) {
      return ExecutionResult.rejected(ex.rejection());
    }
  }

  /** LONG crosses when the ask is at or below the limit, SHORT when the bid is at or above it. */
  public static boolean crosses(OrderSide side, BigDecimal limitPrice, PriceSnapshot snapshot) {
    if (side == OrderSide.LONG) {
      return snapshot.ask().compareTo(limitPrice) <= 0;
    }
    return snapshot.bid().compareTo(limitPrice) >= 0;
  }

  /** Opening section shared with queued fills; the caller holds the account lock. */
  Position openLocked(
      LedgerAccount account,
      String orderId,
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      BigDecimal leverage,
      BigDecimal executionPrice,
      BigDecimal takeProfit,
      BigDecimal stopLoss) {
    MarginQuote quote = quote(account, symbol, side, quantity, leverage, executionPrice);
    requireAffordable(account, quote, BigDecimal.ZERO);
    return positions.open(account, orderId, symbol, side, quantity, quote, takeProfit, stopLoss);
  }

  /** TP/SL re-checked against the price a queued order actually fills at. */
  Optional<Rejection> protectiveLevelsAt(
      OrderSide side, BigDecimal executionPrice, BigDecimal takeProfit, BigDecimal stopLoss) {
    return validator.validateProtectiveLevels(side, executionPrice, takeProfit, stopLoss);
  }

  MarginQuote quote(
      LedgerAccount account,
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      BigDecimal leverage,
      BigDecimal price) {
    LeverageCaps caps = new LeverageCaps(account.majorMaxLeverage(), account.altcoinMaxLeverage());
    return calculator.quote(symbol, side, quantity, price, leverage, caps);
  }

  /** {@code credit} is margin that will be returned to the account before the charge. */
  static void requireAffordable(LedgerAccount account, MarginQuote quote, BigDecimal credit) {
    BigDecimal available = account.availableMargin().add(credit);
    if (quote.totalCost().compareTo(available) > 0) {
      throw new EngineRejectionException(
          RejectionCode.INSUFFICIENT_MARGIN,
          "Insufficient margin. Required: "
              + quote.totalCost().toPlainString()
              + ", Available: "
              + available.toPlainString());
    }
  }
}
