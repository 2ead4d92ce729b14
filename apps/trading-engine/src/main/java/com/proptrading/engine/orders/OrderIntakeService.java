package com.proptrading.engine.orders;

import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.orders.OrderValidator;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import com.proptrading.engine.ratelimit.RateLimitAction;
import com.proptrading.engine.ratelimit.RateLimiter;
import com.proptrading.engine.ratelimit.ReplayGuard;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Entry point for client orders: throttling, replay and structural checks, duplicate detection,
 * then routing to immediate execution or to the resting queue.
 */
public class OrderIntakeService {
  private static final Logger log = LoggerFactory.getLogger(OrderIntakeService.class);
  static final String INTERNAL_ERROR_MESSAGE = "Internal error processing order";

  private final RateLimiter rateLimiter;
  private final ReplayGuard replayGuard;
  private final OrderValidator validator;
  private final ClientOrderIdRegistry clientOrderIds;
  private final PriceSnapshotProvider prices;
  private final OrderExecutor executor;
  private final PendingOrderQueue queue;
  private final TradeEventSink events;
  private final EngineMetrics metrics;
  private final Clock clock;

  public OrderIntakeService(
      RateLimiter rateLimiter,
      ReplayGuard replayGuard,
      OrderValidator validator,
      ClientOrderIdRegistry clientOrderIds,
      PriceSnapshotProvider prices,
      OrderExecutor executor,
      PendingOrderQueue queue,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock) {
    this.rateLimiter = rateLimiter;
    this.replayGuard = replayGuard;
    this.validator = validator;
    this.clientOrderIds = clientOrderIds;
    this.prices = prices;
    this.executor = executor;
    this.queue = queue;
    this.events = events;
    this.metrics = metrics;
    this.clock = clock;
  }

  public PlaceOrderResult placeOrder(String userId, OrderRequest request) {
    long started = System.nanoTime();
    String clientOrderId = request.clientOrderId();
    PlaceOrderResult result;
    try {
      OrderRequest order = request.normalized();
      if (order.clientOrderId() == null || order.clientOrderId().isBlank()) {
        order = order.withClientOrderId("srv-" + UUID.randomUUID());
      }
      clientOrderId = order.clientOrderId();
      result = route(userId, order);
    } catch (RuntimeException ex) {
      log.error(
          "Unexpected failure placing order userId={} clientOrderId={}", userId, clientOrderId, ex);
      result =
          PlaceOrderResult.rejected(
              clientOrderId, Rejection.of(RejectionCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));
    }
    record(result, System.nanoTime() - started);
    return result;
  }

  /** Cancels a resting order owned by {@code userId}; rejections travel as exceptions. */
  public PendingOrder cancelOrder(String userId, String orderId) {
    Optional<Rejection> throttled = rateLimiter.tryAcquire(userId, RateLimitAction.CANCEL_ORDER);
    if (throttled.isPresent()) {
      throw new EngineRejectionException(throttled.get());
    }
    return queue.cancel(userId, orderId);
  }

  @Scheduled(fixedDelayString = "${engine.duplicate-sweep-interval-ms:60000}")
  public void evictExpiredClientOrderIds() {
    int evicted = clientOrderIds.evictExpired();
    if (evicted > 0) {
      log.debug("Evicted {} client order ids", evicted);
    }
  }

  private PlaceOrderResult route(String userId, OrderRequest order) {
    String clientOrderId = order.clientOrderId();
    Optional<Rejection> rejection = rateLimiter.tryAcquire(userId, RateLimitAction.PLACE_ORDER);
    if (rejection.isEmpty()) {
      rejection = replayGuard.validateTimestamp(order.timestamp());
    }
    if (rejection.isEmpty()) {
      rejection = validator.validate(order);
    }
    if (rejection.isPresent()) {
      return PlaceOrderResult.rejected(clientOrderId, rejection.get());
    }
    if (!clientOrderIds.register(order.accountId(), clientOrderId)) {
      return PlaceOrderResult.rejected(
          clientOrderId,
          Rejection.of(RejectionCode.DUPLICATE_ORDER, "Duplicate clientOrderId: " + clientOrderId));
    }
    PlaceOrderResult result = null;
    try {
      result = routeRegistered(userId, order);
      return result;
    } finally {
      if (result == null || result.outcome() == PlaceOrderResult.Outcome.REJECTED) {
        clientOrderIds.release(order.accountId(), clientOrderId);
      }
    }
  }

  /** Runs once the client order id is held; a rejection from here frees the id for a retry. */
  private PlaceOrderResult routeRegistered(String userId, OrderRequest order) {
    String clientOrderId = order.clientOrderId();
    Optional<PriceSnapshot> snapshot = prices.getPrice(order.symbol());
    if (snapshot.isEmpty()) {
      return PlaceOrderResult.rejected(
          clientOrderId,
          Rejection.of(
              RejectionCode.PRICE_UNAVAILABLE, "No price available for " + order.symbol()));
    }
    if (prices.isStale(snapshot.get())) {
      return PlaceOrderResult.rejected(
          clientOrderId,
          Rejection.of(RejectionCode.PRICE_STALE, "Price data is stale, please retry"));
    }
    OrderSide side = order.requireSide();
    events.publish(
        TradeEvent.builder(TradeEventType.ORDER_PLACED, order.accountId(), clock.instant())
            .userId(userId)
            .orderId(clientOrderId)
            .instrument(order.symbol(), side)
            .fill(order.quantity(), order.isLimit() ? order.limitPrice() : null)
            .build());

    if (order.isLimit() && !OrderExecutor.crosses(side, order.limitPrice(), snapshot.get())) {
      return queue(userId, order, side, snapshot.get());
    }
    ExecutionResult execution = executor.executeSync(userId, order, snapshot.get());
    if (!execution.isFilled()) {
      return PlaceOrderResult.rejected(clientOrderId, execution.rejection());
    }
    log.info(
        "Filled order clientOrderId={} positionId={} accountId={} price={}",
        clientOrderId,
        execution.position().id(),
        order.accountId(),
        execution.executionPrice());
    return PlaceOrderResult.filled(clientOrderId, execution, execution.position().openedAt());
  }

  private PlaceOrderResult queue(
      String userId, OrderRequest order, OrderSide side, PriceSnapshot snapshot) {
    Optional<Rejection> levels =
        validator.validateProtectiveLevels(
            side, order.limitPrice(), order.takeProfit(), order.stopLoss());
    if (levels.isPresent()) {
      return PlaceOrderResult.rejected(order.clientOrderId(), levels.get());
    }
    try {
      PendingOrder pending = queue.admit(userId, order);
      return PlaceOrderResult.pending(pending, snapshot.executionPrice(side));
    } catch (EngineRejectionException ex) {
      return PlaceOrderResult.rejected(order.clientOrderId(), ex.rejection());
    }
  }

  private void record(PlaceOrderResult result, long durationNanos) {
    metrics.recordExecutionLatency(durationNanos);
    switch (result.outcome()) {
      case FILLED -> metrics.orderFilled(false);
      case PENDING -> {
        // counted by the queue on admission
      }
      case REJECTED -> {
        metrics.orderRejected(result.rejection().code());
        log.info(
            "Rejected order clientOrderId={} code={} reason={}",
            result.clientOrderId(),
            result.rejection().code(),
            result.rejection().message());
      }
    }
  }
}
