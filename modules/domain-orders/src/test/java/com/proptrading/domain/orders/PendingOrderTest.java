package com.proptrading.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PendingOrderTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  @Test
  void shouldFillLongWhenAskReachesLimit() {
    PendingOrder order = order(OrderSide.LONG, "49000", null);

    assertFalse(order.isFillableAt(new BigDecimal("48990"), new BigDecimal("49010")));
    assertTrue(order.isFillableAt(new BigDecimal("48980"), new BigDecimal("49000")));
    assertTrue(order.isFillableAt(new BigDecimal("48900"), new BigDecimal("48950")));
  }

  @Test
  void shouldFillShortWhenBidReachesLimit() {
    PendingOrder order = order(OrderSide.SHORT, "51000", null);

    assertFalse(order.isFillableAt(new BigDecimal("50990"), new BigDecimal("51010")));
    assertTrue(order.isFillableAt(new BigDecimal("51000"), new BigDecimal("51020")));
  }

  @Test
  void shouldTransitionOnceToTerminalState() {
    PendingOrder order = order(OrderSide.LONG, "49000", null);

    PendingOrder cancelled = order.transitionTo(PendingOrderStatus.CANCELLED, NOW.plusSeconds(5));

    assertEquals(PendingOrderStatus.CANCELLED, cancelled.status());
    assertEquals(NOW.plusSeconds(5), cancelled.updatedAt());
    assertEquals(NOW, cancelled.createdAt());
    assertThrows(
        OrderDomainException.class,
        () -> cancelled.transitionTo(PendingOrderStatus.FILLED, NOW.plusSeconds(6)));
  }

  @Test
  void shouldReportExpiry() {
    PendingOrder order = order(OrderSide.LONG, "49000", NOW.plusSeconds(60));

    assertFalse(order.isExpiredAt(NOW.plusSeconds(59)));
    assertTrue(order.isExpiredAt(NOW.plusSeconds(60)));
    assertFalse(order(OrderSide.LONG, "49000", null).isExpiredAt(NOW.plusSeconds(86400)));
  }

  @Test
  void shouldRejectNonPositiveReservation() {
    assertThrows(
        OrderDomainException.class,
        () ->
            PendingOrder.create(
                "po-1",
                "c-1",
                "user-1",
                "acc-1",
                "BTCUSDT",
                OrderSide.LONG,
                new BigDecimal("0.01"),
                new BigDecimal("49000"),
                BigDecimal.TEN,
                null,
                null,
                BigDecimal.ZERO,
                NOW,
                null));
  }

  private static PendingOrder order(OrderSide side, String limit, Instant expiresAt) {
    return PendingOrder.create(
        "po-1",
        "c-1",
        "user-1",
        "acc-1",
        "BTCUSDT",
        side,
        new BigDecimal("0.01"),
        new BigDecimal(limit),
        BigDecimal.TEN,
        null,
        null,
        new BigDecimal("49.245"),
        NOW,
        expiresAt);
  }
}
