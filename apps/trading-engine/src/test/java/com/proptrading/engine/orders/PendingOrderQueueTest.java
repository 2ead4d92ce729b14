package com.proptrading.engine.orders;

import static com.proptrading.engine.support.DecimalAssertions.assertDecimalEquals;
import static com.proptrading.engine.support.EngineFixture.ACCOUNT;
import static com.proptrading.engine.support.EngineFixture.BTC;
import static com.proptrading.engine.support.EngineFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.ledger.AccountOpening;
import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.PendingOrderStatus;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.support.EngineFixture;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PendingOrderQueueTest {
  private EngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new EngineFixture();
    engine.tick(BTC, "50000", "50010");
  }

  @Test
  void shouldFillRestingOrderExactlyOnceAtBetterPrice() {
    PendingOrder pending = admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));

    PriceSnapshot dip = engine.tick(BTC, "48980", "48990");
    List<QueuedFill> fills = engine.queue.onTick(dip);
    List<QueuedFill> again = engine.queue.onTick(dip);

    assertEquals(1, fills.size());
    assertTrue(fills.get(0).isFilled());
    assertDecimalEquals("48990", fills.get(0).executionPrice());
    assertTrue(again.isEmpty());
    assertEquals(PendingOrderStatus.FILLED, engine.queue.find(pending.id()).orElseThrow().status());
    assertEquals(0, engine.queue.pendingCount());
    assertEquals(1, engine.positions.positionsForAccount(ACCOUNT).size());

    AccountSnapshot account = engine.ledger.snapshot(ACCOUNT).orElseThrow();
    assertDecimalEquals("0", account.reservedMargin());
    assertDecimalEquals("48.99", account.totalMarginUsed());
    assertTrue(account.isConserved());

    List<OutboundMessage> filled = engine.notifier.ofType(OutboundMessageType.ORDER_FILLED);
    assertEquals(1, filled.size());
    assertEquals(true, filled.get(0).field("filledFromQueue"));
    assertEquals(
        1.0,
        engine
            .meterRegistry
            .get("engine.orders.total")
            .tag("outcome", "filled")
            .tag("path", "queue")
            .counter()
            .count());
  }

  @Test
  void shouldIgnoreTicksThatDoNotReachLimit() {
    admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));

    assertTrue(engine.queue.onTick(engine.tick(BTC, "49005", "49015")).isEmpty());
    assertEquals(1, engine.queue.pendingCount());
  }

  @Test
  void shouldCancelAndReleaseReservationOnce() {
    PendingOrder pending = admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));

    PendingOrder cancelled = engine.queue.cancel(USER, pending.id());

    assertEquals(PendingOrderStatus.CANCELLED, cancelled.status());
    AccountSnapshot account = engine.ledger.snapshot(ACCOUNT).orElseThrow();
    assertDecimalEquals("10000", account.availableMargin());
    assertDecimalEquals("0", account.reservedMargin());
    assertEquals(1, engine.events.ofType(TradeEventType.ORDER_CANCELLED).size());

    EngineRejectionException second =
        assertThrows(
            EngineRejectionException.class, () -> engine.queue.cancel(USER, pending.id()));
    assertEquals("Order cannot be cancelled in status CANCELLED", second.getMessage());
    assertDecimalEquals("10000", engine.ledger.snapshot(ACCOUNT).orElseThrow().availableMargin());
  }

  @Test
  void shouldHideOrdersOfOtherUsers() {
    PendingOrder pending = admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));

    EngineRejectionException rejection =
        assertThrows(
            EngineRejectionException.class, () -> engine.queue.cancel("user-2", pending.id()));
    assertEquals(RejectionCode.ORDER_NOT_FOUND, rejection.code());
  }

  @Test
  void shouldCancelWhenFillCostExceedsAvailableMargin() {
    engine.ledger.register(
        AccountOpening.fresh(
            "acc-small", USER, new BigDecimal("100"), new BigDecimal("50"), new BigDecimal("80")));
    PendingOrder pending = admit(order("acc-small", "c-s", "SHORT", "LIMIT", "0.01", "51000"));
    engine.intake.placeOrder(USER, order("acc-small", "c-m", "LONG", "MARKET", "0.008", null));

    List<QueuedFill> results = engine.queue.onTick(engine.tick(BTC, "60000", "60010"));

    assertEquals(1, results.size());
    assertFalse(results.get(0).isFilled());
    assertEquals(
        PendingOrderStatus.CANCELLED, engine.queue.find(pending.id()).orElseThrow().status());
    AccountSnapshot account = engine.ledger.snapshot("acc-small").orElseThrow();
    assertDecimalEquals("0", account.reservedMargin());
    assertTrue(account.isConserved());
    List<OutboundMessage> cancelled = engine.notifier.ofType(OutboundMessageType.ORDER_CANCELLED);
    assertEquals(1, cancelled.size());
    assertEquals("Insufficient margin at fill", cancelled.get(0).field("reason"));
  }

  @Test
  void shouldCancelGapFillThatWouldOpenWithStopLossAboveEntry() {
    OrderRequest withStop =
        new OrderRequest(
            "c-1",
            ACCOUNT,
            BTC,
            "LONG",
            "LIMIT",
            new BigDecimal("0.01"),
            new BigDecimal("10"),
            new BigDecimal("49000"),
            null,
            new BigDecimal("48500"),
            engine.clock.millis());
    PendingOrder pending = admit(withStop);

    List<QueuedFill> results = engine.queue.onTick(engine.tick(BTC, "47990", "48000"));

    assertEquals(1, results.size());
    assertFalse(results.get(0).isFilled());
    assertEquals(
        PendingOrderStatus.CANCELLED, engine.queue.find(pending.id()).orElseThrow().status());
    assertTrue(engine.positions.positionsForAccount(ACCOUNT).isEmpty());
    AccountSnapshot account = engine.ledger.snapshot(ACCOUNT).orElseThrow();
    assertDecimalEquals("0", account.reservedMargin());
    assertDecimalEquals("10000", account.availableMargin());
    assertTrue(account.isConserved());
    List<OutboundMessage> cancelled = engine.notifier.ofType(OutboundMessageType.ORDER_CANCELLED);
    assertEquals(1, cancelled.size());
    assertEquals(
        "Stop loss must be below entry price for LONG positions",
        cancelled.get(0).field("reason"));
  }

  @Test
  void shouldExpireOrdersPastTimeToLive() {
    PendingOrderQueue expiring =
        new PendingOrderQueue(
            engine.locks,
            engine.ledger,
            engine.executor,
            engine.prices,
            engine.events,
            engine.notifier,
            engine.metrics,
            engine.clock,
            Duration.ofSeconds(30),
            Duration.ofMinutes(5));
    PendingOrder pending =
        expiring.admit(USER, engine.limit("c-1", "LONG", "0.01", "10", "49000").normalized());

    engine.clock.advance(Duration.ofSeconds(31));
    expiring.expireDue();

    assertEquals(PendingOrderStatus.EXPIRED, expiring.find(pending.id()).orElseThrow().status());
    assertEquals(1, engine.events.ofType(TradeEventType.ORDER_EXPIRED).size());
    assertDecimalEquals("0", engine.ledger.snapshot(ACCOUNT).orElseThrow().reservedMargin());
  }

  @Test
  void shouldPurgeTerminalOrdersAfterRetention() {
    PendingOrder pending = admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));
    engine.queue.cancel(USER, pending.id());

    engine.clock.advance(Duration.ofMinutes(5).plusMillis(1));
    engine.queue.purgeTerminal();

    assertTrue(engine.queue.find(pending.id()).isEmpty());
  }

  @Test
  void shouldCancelEveryPendingOrderOfAccount() {
    admit(engine.limit("c-1", "LONG", "0.01", "10", "49000"));
    admit(engine.limit("c-2", "SHORT", "0.01", "10", "52000"));

    List<PendingOrder> cancelled = engine.queue.cancelAllForAccount(ACCOUNT, "Account breached");

    assertEquals(2, cancelled.size());
    assertTrue(engine.queue.pendingForAccount(ACCOUNT).isEmpty());
    assertDecimalEquals("0", engine.ledger.snapshot(ACCOUNT).orElseThrow().reservedMargin());
  }

  private PendingOrder admit(OrderRequest order) {
    PlaceOrderResult result = engine.intake.placeOrder(USER, order);
    assertEquals(PlaceOrderResult.Outcome.PENDING, result.outcome());
    return result.pendingOrder();
  }

  private OrderRequest order(
      String accountId,
      String clientOrderId,
      String side,
      String type,
      String quantity,
      String limitPrice) {
    return new OrderRequest(
        clientOrderId,
        accountId,
        BTC,
        side,
        type,
        new BigDecimal(quantity),
        new BigDecimal("10"),
        limitPrice == null ? null : new BigDecimal(limitPrice),
        null,
        null,
        engine.clock.millis());
  }
}
