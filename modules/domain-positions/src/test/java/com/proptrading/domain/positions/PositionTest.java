package com.proptrading.domain.positions;

import static com.proptrading.domain.positions.MarginCalculatorTest.assertAmount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.proptrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PositionTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final MarginCalculator calculator = new MarginCalculator(MarginPolicy.defaults());

  @Test
  void shouldReducePartiallyAndKeepAmountsProRata() {
    Position position = open(OrderSide.LONG, "1");

    Position reduced = position.reduceBy(new BigDecimal("0.25"), NOW.plusSeconds(1));

    assertAmount("0.75", reduced.quantity());
    assertAmount("3750", reduced.marginUsed());
    assertAmount("18.75", reduced.entryFee());
    assertEquals(PositionStatus.OPEN, reduced.status());
    assertEquals(NOW, reduced.openedAt());
  }

  @Test
  void shouldRefuseReduceByFullQuantity() {
    Position position = open(OrderSide.LONG, "1");

    assertThrows(
        PositionDomainException.class, () -> position.reduceBy(BigDecimal.ONE, NOW));
  }

  @Test
  void shouldRemoveProtectiveLevels() {
    Position position =
        open(OrderSide.SHORT, "1")
            .withProtectiveLevels(new BigDecimal("45000"), new BigDecimal("52000"), NOW);

    Position cleared = position.withProtectiveLevels(null, null, NOW.plusSeconds(1));

    assertNull(cleared.takeProfit());
    assertNull(cleared.stopLoss());
  }

  @Test
  void shouldNotMutateAfterTermination() {
    Position closed = open(OrderSide.LONG, "1").terminate(PositionStatus.CLOSED, NOW);

    assertThrows(
        PositionDomainException.class,
        () -> closed.withProtectiveLevels(BigDecimal.ONE, null, NOW));
    assertThrows(
        PositionDomainException.class, () -> closed.terminate(PositionStatus.LIQUIDATED, NOW));
  }

  @Test
  void shouldRejectLiquidationOnProfitSide() {
    assertThrows(
        PositionDomainException.class,
        () ->
            new Position(
                "p-1", "u-1", "a-1", "BTCUSDT", OrderSide.LONG, BigDecimal.ONE,
                new BigDecimal("50000"), BigDecimal.TEN, new BigDecimal("5000"), BigDecimal.ZERO,
                null, null, new BigDecimal("51000"), BigDecimal.ZERO, PositionStatus.OPEN, NOW,
                NOW));
  }

  @Test
  void shouldReportRoe() {
    Position position = open(OrderSide.LONG, "1");

    assertAmount("20", position.roePercent(new BigDecimal("51000")));
  }

  private Position open(OrderSide side, String quantity) {
    MarginQuote quote =
        calculator.quote(
            "BTCUSDT", side, new BigDecimal(quantity), new BigDecimal("50000"),
            new BigDecimal("10"), new LeverageCaps(100, 50));
    return Position.open("p-1", "u-1", "a-1", "BTCUSDT", side, new BigDecimal(quantity), quote,
        null, null, NOW);
  }
}
