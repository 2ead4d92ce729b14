package com.proptrading.engine.positions;

import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.orders.OrderValidator;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.CloseReason;
import com.proptrading.domain.positions.ClosedTrade;
import com.proptrading.domain.positions.MarginCalculator;
import com.proptrading.domain.positions.MarginQuote;
import com.proptrading.domain.positions.Position;
import com.proptrading.domain.positions.PositionStatus;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store and lifecycle of open positions, indexed by account and by symbol.
 *
 * <p>A position is mutated only under its own lock. Closes also touch the ledger and take the
 * position lock first, then the account lock.
 */
public class PositionManager {
  private static final Logger log = LoggerFactory.getLogger(PositionManager.class);
  private static final Comparator<Position> BY_OPENED_AT =
      Comparator.comparing(Position::openedAt).thenComparing(Position::id);

  private final Map<String, Position> positions = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> byAccount = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> bySymbol = new ConcurrentHashMap<>();

  private final EntityLockRegistry locks;
  private final AccountLedger ledger;
  private final MarginCalculator calculator;
  private final OrderValidator validator;
  private final PriceSnapshotProvider prices;
  private final TradeEventSink events;
  private final EngineMetrics metrics;
  private final Clock clock;

  public PositionManager(
      EntityLockRegistry locks,
      AccountLedger ledger,
      MarginCalculator calculator,
      OrderValidator validator,
      PriceSnapshotProvider prices,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock) {
    this.locks = locks;
    this.ledger = ledger;
    this.calculator = calculator;
    this.validator = validator;
    this.prices = prices;
    this.events = events;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Books the opening on {@code account} and stores the new position. The caller holds the
   * account lock and has already checked that {@code quote.totalCost()} is affordable.
   */
  public Position open(
      LedgerAccount account,
      String orderId,
      String symbol,
      OrderSide side,
      BigDecimal quantity,
      MarginQuote quote,
      BigDecimal takeProfit,
      BigDecimal stopLoss) {
    Instant now = clock.instant();
    Position position =
        Position.open(
            UUID.randomUUID().toString(),
            account.userId(),
            account.accountId(),
            symbol,
            side,
            quantity,
            quote,
            takeProfit,
            stopLoss,
            now);
    account.openPosition(quote.marginRequired(), quote.entryFee(), quote.notional(), now);
    store(position);
    log.info(
        "Opened position positionId={} accountId={} symbol={} side={} qty={} entry={} leverage={}",
        position.id(),
        position.accountId(),
        symbol,
        side,
        quantity,
        position.entryPrice(),
        position.leverage());
    events.publish(
        TradeEvent.builder(TradeEventType.POSITION_OPENED, account.accountId(), now)
            .userId(account.userId())
            .positionId(position.id())
            .orderId(orderId)
            .instrument(symbol, side)
            .fill(quantity, position.entryPrice())
            .marginUsed(position.marginUsed())
            .fee(position.entryFee())
            .balanceAfter(account.snapshot().currentBalance())
            .build());
    return position;
  }

  /**
   * Sets or clears take-profit and stop-loss. {@code null} keeps the current level, a value {@code
   * <= 0} removes it, anything else must lie on the correct side of the entry price.
   */
  public Position modifyProtectiveLevels(
      String userId, String positionId, BigDecimal takeProfit, BigDecimal stopLoss) {
    Position known = requireOwned(userId, positionId);
    return locks.withPositionLock(
        known.id(),
        () -> {
          Position current = requireOpen(positionId);
          BigDecimal nextTakeProfit = resolveLevel(current.takeProfit(), takeProfit);
          BigDecimal nextStopLoss = resolveLevel(current.stopLoss(), stopLoss);
          Optional<Rejection> rejection =
              validator.validateProtectiveLevels(
                  current.side(),
                  current.entryPrice(),
                  isSet(takeProfit) ? takeProfit : null,
                  isSet(stopLoss) ? stopLoss : null);
          if (rejection.isPresent()) {
            throw new EngineRejectionException(rejection.get());
          }
          Instant now = clock.instant();
          Position updated = current.withProtectiveLevels(nextTakeProfit, nextStopLoss, now);
          positions.put(updated.id(), updated);
          if (!Objects.equals(current.takeProfit(), nextTakeProfit)) {
            events.publish(levelEvent(TradeEventType.TP_MODIFIED, updated, nextTakeProfit, now));
          }
          if (!Objects.equals(current.stopLoss(), nextStopLoss)) {
            events.publish(levelEvent(TradeEventType.SL_MODIFIED, updated, nextStopLoss, now));
          }
          return updated;
        });
  }

  /**
   * Manual close of {@code quantity} (all of it when {@code null}) at the current exit-side price.
   */
  public CloseOutcome close(
      String userId, String accountId, String positionId, BigDecimal quantity) {
    Position known = requireOwned(userId, positionId);
    if (accountId != null && !accountId.equals(known.accountId())) {
      throw new EngineRejectionException(
          RejectionCode.POSITION_NOT_FOUND, "Position not found: " + positionId);
    }
    if (quantity != null && quantity.signum() <= 0) {
      throw new EngineRejectionException(
          RejectionCode.INVALID_CLOSE_QUANTITY, "Close quantity must be positive");
    }
    PriceSnapshot snapshot =
        prices
            .getPrice(known.symbol())
            .orElseThrow(
                () ->
                    new EngineRejectionException(
                        RejectionCode.PRICE_UNAVAILABLE,
                        "No price available for " + known.symbol()));
    if (prices.isStale(snapshot)) {
      throw new EngineRejectionException(
          RejectionCode.PRICE_STALE, "Price data is stale, please retry");
    }
    return closeLocked(known, quantity, snapshot, CloseReason.MANUAL);
  }

  /** Full close triggered by the engine; empty when the position closed in the meantime. */
  public Optional<CloseOutcome> closeAutomatic(
      String positionId, CloseReason reason, PriceSnapshot snapshot) {
    Position known = positions.get(positionId);
    if (known == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(closeLocked(known, null, snapshot, reason));
    } catch (EngineRejectionException ex) {
      if (ex.code() == RejectionCode.POSITION_NOT_FOUND) {
        return Optional.empty();
      }
      throw ex;
    }
  }

  /** Closes every open position of the account. Symbols without a fresh price are skipped. */
  public List<CloseOutcome> closeAll(String accountId, CloseReason reason) {
    List<CloseOutcome> outcomes = new ArrayList<>();
    for (Position position : positionsForAccount(accountId)) {
      Optional<PriceSnapshot> snapshot = prices.getPrice(position.symbol());
      if (snapshot.isEmpty() || prices.isStale(snapshot.get())) {
        log.warn(
            "Skipping close of positionId={} accountId={} reason={}: no fresh price for {}",
            position.id(),
            accountId,
            reason,
            position.symbol());
        continue;
      }
      try {
        closeAutomatic(position.id(), reason, snapshot.get()).ifPresent(outcomes::add);
      } catch (EngineRejectionException ex) {
        log.warn(
            "Could not close positionId={} accountId={} reason={} code={}",
            position.id(),
            accountId,
            reason,
            ex.code());
      }
    }
    return outcomes;
  }

  /**
   * Charges one funding interval to every open position whose symbol carries a funding rate. The
   * amount accrues on the position and is settled when it closes.
   */
  public int accrueFunding() {
    int charged = 0;
    for (Position position : List.copyOf(positions.values())) {
      Optional<PriceSnapshot> snapshot = prices.getPrice(position.symbol());
      if (snapshot.isEmpty() || snapshot.get().fundingRate() == null) {
        continue;
      }
      BigDecimal rate = snapshot.get().fundingRate();
      BigDecimal markPrice = snapshot.get().mid();
      try {
        boolean applied =
            locks.withPositionLock(
                position.id(),
                () -> {
                  Position current = positions.get(position.id());
                  if (current == null || current.status() != PositionStatus.OPEN) {
                    return false;
                  }
                  BigDecimal charge = MarginCalculator.fundingCharge(current, markPrice, rate);
                  if (charge.signum() == 0) {
                    return false;
                  }
                  Instant now = clock.instant();
                  positions.put(current.id(), current.withAccruedFunding(charge, now));
                  events.publish(
                      TradeEvent.builder(TradeEventType.FUNDING_APPLIED, current.accountId(), now)
                          .userId(current.userId())
                          .positionId(current.id())
                          .instrument(current.symbol(), current.side())
                          .fill(current.quantity(), markPrice)
                          .fundingFee(charge)
                          .build());
                  return true;
                });
        if (applied) {
          charged++;
        }
      } catch (EngineRejectionException ex) {
        log.warn("Funding skipped for positionId={} code={}", position.id(), ex.code());
      }
    }
    return charged;
  }

  public Optional<Position> find(String positionId) {
    return positionId == null ? Optional.empty() : Optional.ofNullable(positions.get(positionId));
  }

  public List<Position> positionsForAccount(String accountId) {
    return collect(byAccount.get(accountId));
  }

  public List<Position> positionsForSymbol(String symbol) {
    return collect(bySymbol.get(symbol));
  }

  public Set<String> accountsWithPositionsOn(String symbol) {
    Set<String> accountIds = new TreeSet<>();
    for (Position position : positionsForSymbol(symbol)) {
      accountIds.add(position.accountId());
    }
    return accountIds;
  }

  /** Sum of unrealized P&L at current exit-side prices; positions without a price count as 0. */
  public BigDecimal unrealizedPnl(String accountId) {
    BigDecimal total = BigDecimal.ZERO;
    for (Position position : positionsForAccount(accountId)) {
      Optional<PriceSnapshot> snapshot = prices.getPrice(position.symbol());
      if (snapshot.isPresent()) {
        total = total.add(position.unrealizedPnl(snapshot.get().exitPrice(position.side())));
      }
    }
    return total;
  }

  public int openPositionCount() {
    return positions.size();
  }

  private CloseOutcome closeLocked(
      Position known, BigDecimal quantity, PriceSnapshot snapshot, CloseReason reason) {
    CloseOutcome outcome =
        locks.withPositionAndAccountLock(
            known.id(),
            known.accountId(),
            () -> {
              Position current = requireOpen(known.id());
              LedgerAccount account = ledger.require(current.accountId());
              Instant now = clock.instant();
              BigDecimal closeQuantity = quantity == null ? current.quantity() : quantity;
              ClosedTrade trade =
                  calculator.settle(
                      current,
                      closeQuantity,
                      snapshot.exitPrice(current.side()),
                      reason,
                      UUID.randomUUID().toString(),
                      now);
              Position next =
                  trade.isFullClose()
                      ? current.terminate(trade.resultingStatus(), now)
                      : current.reduceBy(trade.closedQuantity(), now);
              account.settleClose(
                  trade.marginReleased(),
                  trade.balanceDelta(),
                  trade.realizedPnl(),
                  trade.exitFee(),
                  now);
              Position remaining = null;
              if (trade.isFullClose()) {
                unstore(next);
              } else {
                remaining = next;
                positions.put(remaining.id(), remaining);
              }
              return new CloseOutcome(trade, remaining, account.snapshot());
            });
    ClosedTrade trade = outcome.trade();
    if (trade.isFullClose()) {
      locks.forgetPosition(trade.positionId());
    }
    metrics.positionClosed(reason);
    log.info(
        "Closed positionId={} accountId={} reason={} qty={} exit={} realizedPnl={} remaining={}",
        trade.positionId(),
        trade.accountId(),
        reason,
        trade.closedQuantity(),
        trade.exitPrice(),
        trade.realizedPnl(),
        trade.remainingQuantity());
    publishCloseEvents(outcome);
    return outcome;
  }

  private void publishCloseEvents(CloseOutcome outcome) {
    ClosedTrade trade = outcome.trade();
    if (trade.closeReason() != CloseReason.MANUAL && trade.closeReason() != CloseReason.BREACH) {
      events.publish(closeEvent(triggerEventType(trade.closeReason()), outcome));
    }
    TradeEventType type =
        trade.isFullClose()
            ? TradeEventType.POSITION_CLOSED
            : TradeEventType.POSITION_PARTIALLY_CLOSED;
    events.publish(closeEvent(type, outcome));
  }

  private static TradeEventType triggerEventType(CloseReason reason) {
    return switch (reason) {
      case TP_TRIGGERED -> TradeEventType.TP_TRIGGERED;
      case SL_TRIGGERED -> TradeEventType.SL_TRIGGERED;
      case LIQUIDATION_TRIGGERED -> TradeEventType.LIQUIDATION_TRIGGERED;
      case MANUAL, BREACH -> throw new IllegalArgumentException("Not a trigger: " + reason);
    };
  }

  private static TradeEvent closeEvent(TradeEventType type, CloseOutcome outcome) {
    ClosedTrade trade = outcome.trade();
    return TradeEvent.builder(type, trade.accountId(), trade.closedAt())
        .userId(trade.userId())
        .positionId(trade.positionId())
        .orderId(trade.tradeId())
        .instrument(trade.symbol(), trade.side())
        .fill(trade.closedQuantity(), trade.exitPrice())
        .marginUsed(trade.marginReleased())
        .fee(trade.exitFee())
        .realizedPnl(trade.realizedPnl())
        .fundingFee(trade.fundingShare())
        .balanceAfter(outcome.account().currentBalance())
        .closeReason(trade.closeReason())
        .build();
  }

  private static TradeEvent levelEvent(
      TradeEventType type, Position position, BigDecimal level, Instant now) {
    return TradeEvent.builder(type, position.accountId(), now)
        .userId(position.userId())
        .positionId(position.id())
        .instrument(position.symbol(), position.side())
        .fill(position.quantity(), level)
        .build();
  }

  private Position requireOwned(String userId, String positionId) {
    Position position = positionId == null ? null : positions.get(positionId);
    if (position == null || !position.userId().equals(userId)) {
      throw new EngineRejectionException(
          RejectionCode.POSITION_NOT_FOUND, "Position not found: " + positionId);
    }
    return position;
  }

  private Position requireOpen(String positionId) {
    Position current = positions.get(positionId);
    if (current == null || current.status() != PositionStatus.OPEN) {
      throw new EngineRejectionException(
          RejectionCode.POSITION_NOT_FOUND, "Position not found: " + positionId);
    }
    return current;
  }

  private static BigDecimal resolveLevel(BigDecimal current, BigDecimal requested) {
    if (requested == null) {
      return current;
    }
    return requested.signum() <= 0 ? null : requested;
  }

  private static boolean isSet(BigDecimal level) {
    return level != null && level.signum() > 0;
  }

  private void store(Position position) {
    positions.put(position.id(), position);
    byAccount.computeIfAbsent(position.accountId(), ignored -> ConcurrentHashMap.newKeySet())
        .add(position.id());
    bySymbol.computeIfAbsent(position.symbol(), ignored -> ConcurrentHashMap.newKeySet())
        .add(position.id());
  }

  private void unstore(Position closed) {
    positions.remove(closed.id());
    Set<String> accountIndex = byAccount.get(closed.accountId());
    if (accountIndex != null) {
      accountIndex.remove(closed.id());
    }
    Set<String> symbolIndex = bySymbol.get(closed.symbol());
    if (symbolIndex != null) {
      symbolIndex.remove(closed.id());
    }
  }

  private List<Position> collect(Set<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    List<Position> result = new ArrayList<>(ids.size());
    for (String id : ids) {
      Position position = positions.get(id);
      if (position != null) {
        result.add(position);
      }
    }
    result.sort(BY_OPENED_AT);
    return result;
  }
}
