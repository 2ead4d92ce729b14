package com.proptrading.engine.orders;

import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.PendingOrderStatus;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.MarginQuote;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Resting limit orders. Each holds a margin reservation that is released exactly once: on fill,
 * cancel or expiry, always inside the account lock and only while the order is still PENDING.
 *
 * <p>Terminal orders stay visible until {@link #purgeTerminal()} removes them after the retention
 * period.
 */
public class PendingOrderQueue {
  private static final Logger log = LoggerFactory.getLogger(PendingOrderQueue.class);
  static final String INSUFFICIENT_MARGIN_AT_FILL = "Insufficient margin at fill";

  private final Map<String, PendingOrder> orders = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> pendingBySymbol = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> pendingByAccount = new ConcurrentHashMap<>();

  private final EntityLockRegistry locks;
  private final AccountLedger ledger;
  private final OrderExecutor executor;
  private final PriceSnapshotProvider prices;
  private final TradeEventSink events;
  private final EngineNotifier notifier;
  private final EngineMetrics metrics;
  private final Clock clock;
  private final Duration orderTtl;
  private final Duration retention;

  public PendingOrderQueue(
      EntityLockRegistry locks,
      AccountLedger ledger,
      OrderExecutor executor,
      PriceSnapshotProvider prices,
      TradeEventSink events,
      EngineNotifier notifier,
      EngineMetrics metrics,
      Clock clock,
      Duration orderTtl,
      Duration retention) {
    this.locks = locks;
    this.ledger = ledger;
    this.executor = executor;
    this.prices = prices;
    this.events = events;
    this.notifier = notifier;
    this.metrics = metrics;
    this.clock = clock;
    this.orderTtl = orderTtl;
    this.retention = retention;
  }

  /** Reserves margin and fee at the limit price and parks the order. */
  public PendingOrder admit(String userId, OrderRequest order) {
    OrderSide side = order.requireSide();
    PendingOrder admitted =
        locks.withAccountLock(
            order.accountId(),
            () -> {
              LedgerAccount account = ledger.requireTradable(order.accountId(), userId);
              MarginQuote quote =
                  executor.quote(
                      account,
                      order.symbol(),
                      side,
                      order.quantity(),
                      order.leverage(),
                      order.limitPrice());
              OrderExecutor.requireAffordable(account, quote, BigDecimal.ZERO);
              Instant now = clock.instant();
              PendingOrder pending =
                  PendingOrder.create(
                      UUID.randomUUID().toString(),
                      order.clientOrderId(),
                      userId,
                      account.accountId(),
                      order.symbol(),
                      side,
                      order.quantity(),
                      order.limitPrice(),
                      quote.effectiveLeverage(),
                      order.takeProfit(),
                      order.stopLoss(),
                      quote.totalCost(),
                      now,
                      orderTtl.isZero() ? null : now.plus(orderTtl));
              account.reserve(pending.id(), pending.marginReserved(), now);
              store(pending);
              return pending;
            });
    log.info(
        "Queued limit order orderId={} accountId={} symbol={} side={} qty={} limit={} reserved={}",
        admitted.id(),
        admitted.accountId(),
        admitted.symbol(),
        side,
        admitted.quantity(),
        admitted.limitPrice(),
        admitted.marginReserved());
    events.publish(orderEvent(TradeEventType.ORDER_PENDING, admitted, admitted.createdAt()));
    metrics.orderPending();
    return admitted;
  }

  public PendingOrder cancel(String userId, String orderId) {
    PendingOrder known = orderId == null ? null : orders.get(orderId);
    if (known == null || !known.userId().equals(userId)) {
      throw new EngineRejectionException(
          RejectionCode.ORDER_NOT_FOUND, "Order not found: " + orderId);
    }
    PendingOrder cancelled =
        locks.withAccountLock(
            known.accountId(),
            () -> {
              PendingOrder current = orders.get(orderId);
              if (current == null || !current.isPending()) {
                throw new EngineRejectionException(
                    RejectionCode.ORDER_NOT_CANCELLABLE,
                    "Order cannot be cancelled in status "
                        + (current == null ? "UNKNOWN" : current.status()));
              }
              return finish(current, PendingOrderStatus.CANCELLED);
            });
    log.info("Cancelled limit order orderId={} accountId={}", orderId, cancelled.accountId());
    events.publish(orderEvent(TradeEventType.ORDER_CANCELLED, cancelled, cancelled.updatedAt()));
    return cancelled;
  }

  /** Fills every resting order on the tick's symbol whose limit the tick reaches. */
  public List<QueuedFill> onTick(PriceSnapshot snapshot) {
    Set<String> candidates = pendingBySymbol.get(snapshot.symbol());
    if (candidates == null || candidates.isEmpty() || prices.isStale(snapshot)) {
      return List.of();
    }
    List<QueuedFill> results = new ArrayList<>();
    for (PendingOrder order : sorted(candidates)) {
      if (!order.isPending() || !order.isFillableAt(snapshot.bid(), snapshot.ask())) {
        continue;
      }
      try {
        tryFill(order, snapshot).ifPresent(results::add);
      } catch (EngineRejectionException ex) {
        log.warn(
            "Deferred fill of orderId={} accountId={} code={}",
            order.id(),
            order.accountId(),
            ex.code());
      }
    }
    return results;
  }

  public List<PendingOrder> cancelAllForAccount(String accountId, String reason) {
    List<PendingOrder> cancelled = new ArrayList<>();
    for (PendingOrder order : pendingForAccount(accountId)) {
      try {
        Optional<PendingOrder> done =
            locks.withAccountLock(
                accountId,
                () -> {
                  PendingOrder current = orders.get(order.id());
                  if (current == null || !current.isPending()) {
                    return Optional.<PendingOrder>empty();
                  }
                  return Optional.of(finish(current, PendingOrderStatus.CANCELLED));
                });
        done.ifPresent(
            finished -> {
              cancelled.add(finished);
              events.publish(
                  orderEvent(TradeEventType.ORDER_CANCELLED, finished, finished.updatedAt()));
              notifier.sendToUser(
                  finished.userId(), OutboundMessages.orderCancelled(finished, reason));
            });
      } catch (EngineRejectionException ex) {
        log.warn(
            "Could not cancel orderId={} accountId={} code={}", order.id(), accountId, ex.code());
      }
    }
    return cancelled;
  }

  @Scheduled(fixedDelayString = "${engine.pending-sweep-interval-ms:1000}")
  public void expireDue() {
    Instant now = clock.instant();
    for (PendingOrder order : List.copyOf(orders.values())) {
      if (!order.isPending() || !order.isExpiredAt(now)) {
        continue;
      }
      try {
        Optional<PendingOrder> expired =
            locks.withAccountLock(
                order.accountId(),
                () -> {
                  PendingOrder current = orders.get(order.id());
                  if (current == null || !current.isPending()) {
                    return Optional.<PendingOrder>empty();
                  }
                  return Optional.of(finish(current, PendingOrderStatus.EXPIRED));
                });
        expired.ifPresent(
            done -> {
              log.info("Expired limit order orderId={} accountId={}", done.id(), done.accountId());
              events.publish(orderEvent(TradeEventType.ORDER_EXPIRED, done, done.updatedAt()));
              notifier.sendToUser(
                  done.userId(), OutboundMessages.orderCancelled(done, "Order expired"));
            });
      } catch (EngineRejectionException ex) {
        log.warn("Deferred expiry of orderId={} code={}", order.id(), ex.code());
      }
    }
  }

  @Scheduled(fixedDelayString = "${engine.pending-purge-interval-ms:60000}")
  public void purgeTerminal() {
    Instant cutoff = clock.instant().minus(retention);
    orders.values().removeIf(order -> !order.isPending() && order.updatedAt().isBefore(cutoff));
  }

  public Optional<PendingOrder> find(String orderId) {
    return orderId == null ? Optional.empty() : Optional.ofNullable(orders.get(orderId));
  }

  public List<PendingOrder> pendingForAccount(String accountId) {
    Set<String> ids = pendingByAccount.get(accountId);
    return ids == null ? List.of() : sorted(ids);
  }

  public int pendingCount() {
    return pendingBySymbol.values().stream().mapToInt(Set::size).sum();
  }

  private Optional<QueuedFill> tryFill(PendingOrder order, PriceSnapshot snapshot) {
    Optional<QueuedFill> outcome =
        locks.withAccountLock(
            order.accountId(),
            () -> {
              PendingOrder current = orders.get(order.id());
              if (current == null || !current.isPending()) {
                return Optional.<QueuedFill>empty();
              }
              LedgerAccount account = ledger.require(current.accountId());
              BigDecimal executionPrice = snapshot.executionPrice(current.side());
              MarginQuote quote =
                  executor.quote(
                      account,
                      current.symbol(),
                      current.side(),
                      current.quantity(),
                      current.leverage(),
                      executionPrice);
              BigDecimal reserved = account.reservedFor(current.id()).orElse(BigDecimal.ZERO);
              boolean affordable =
                  account.status().canTrade()
                      && quote.totalCost().compareTo(account.availableMargin().add(reserved)) <= 0;
              if (!affordable) {
                PendingOrder cancelled = finish(current, PendingOrderStatus.CANCELLED);
                return Optional.of(
                    QueuedFill.cancelled(
                        cancelled, account.snapshot(), INSUFFICIENT_MARGIN_AT_FILL));
              }
              Optional<Rejection> levels =
                  executor.protectiveLevelsAt(
                      current.side(), executionPrice, current.takeProfit(), current.stopLoss());
              if (levels.isPresent()) {
                PendingOrder cancelled = finish(current, PendingOrderStatus.CANCELLED);
                return Optional.of(
                    QueuedFill.cancelled(
                        cancelled, account.snapshot(), levels.get().message()));
              }
              Instant now = clock.instant();
              account.release(current.id(), now);
              Position position =
                  executor.openLocked(
                      account,
                      current.clientOrderId(),
                      current.symbol(),
                      current.side(),
                      current.quantity(),
                      current.leverage(),
                      executionPrice,
                      current.takeProfit(),
                      current.stopLoss());
              PendingOrder filled = current.transitionTo(PendingOrderStatus.FILLED, now);
              orders.put(filled.id(), filled);
              unindex(filled);
              return Optional.of(
                  QueuedFill.filled(filled, position, account.snapshot(), executionPrice));
            });
    outcome.ifPresent(this::announce);
    return outcome;
  }

  private void announce(QueuedFill fill) {
    PendingOrder order = fill.order();
    if (fill.isFilled()) {
      log.info(
          "Filled limit order orderId={} positionId={} price={}",
          order.id(),
          fill.position().id(),
          fill.executionPrice());
      metrics.orderFilled(true);
      notifier.sendToUser(
          order.userId(),
          OutboundMessages.orderFilled(
              order.clientOrderId(),
              fill.position(),
              fill.account(),
              fill.executionPrice(),
              order.updatedAt(),
              true));
      return;
    }
    log.warn("Cancelled limit order orderId={} at fill: {}", order.id(), fill.cancelReason());
    events.publish(orderEvent(TradeEventType.ORDER_CANCELLED, order, order.updatedAt()));
    notifier.sendToUser(
        order.userId(), OutboundMessages.orderCancelled(order, fill.cancelReason()));
  }

  /** Releases the reservation and moves the order to {@code status}; account lock held. */
  private PendingOrder finish(PendingOrder current, PendingOrderStatus status) {
    Instant now = clock.instant();
    PendingOrder finished = current.transitionTo(status, now);
    ledger.require(current.accountId()).release(current.id(), now);
    orders.put(finished.id(), finished);
    unindex(finished);
    return finished;
  }

  private void store(PendingOrder order) {
    orders.put(order.id(), order);
    pendingBySymbol
        .computeIfAbsent(order.symbol(), ignored -> ConcurrentHashMap.newKeySet())
        .add(order.id());
    pendingByAccount
        .computeIfAbsent(order.accountId(), ignored -> ConcurrentHashMap.newKeySet())
        .add(order.id());
  }

  private void unindex(PendingOrder order) {
    Set<String> bySymbol = pendingBySymbol.get(order.symbol());
    if (bySymbol != null) {
      bySymbol.remove(order.id());
    }
    Set<String> byAccount = pendingByAccount.get(order.accountId());
    if (byAccount != null) {
      byAccount.remove(order.id());
    }
  }

  private List<PendingOrder> sorted(Set<String> ids) {
    List<PendingOrder> result = new ArrayList<>();
    for (String id : ids) {
      PendingOrder order = orders.get(id);
      if (order != null) {
        result.add(order);
      }
    }
    result.sort(Comparator.comparing(PendingOrder::createdAt).thenComparing(PendingOrder::id));
    return result;
  }

  private static TradeEvent orderEvent(TradeEventType type, PendingOrder order, Instant at) {
    return TradeEvent.builder(type, order.accountId(), at)
        .userId(order.userId())
        .orderId(order.id())
        .instrument(order.symbol(), order.side())
        .fill(order.quantity(), order.limitPrice())
        .marginUsed(order.marginReserved())
        .build();
  }
}
