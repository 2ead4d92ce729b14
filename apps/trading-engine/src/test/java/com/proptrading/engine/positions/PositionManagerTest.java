package com.proptrading.engine.positions;

import static com.proptrading.engine.support.DecimalAssertions.assertDecimalEquals;
import static com.proptrading.engine.support.EngineFixture.ACCOUNT;
import static com.proptrading.engine.support.EngineFixture.BTC;
import static com.proptrading.engine.support.EngineFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.CloseReason;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.support.EngineFixture;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class PositionManagerTest {
  private EngineFixture engine;
  private Position position;

  @BeforeEach
  void setUp() {
    engine = new EngineFixture();
    engine.tick(BTC, "50000", "50010");
    position =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10")).position();
    engine.events.clear();
  }

  @Test
  void shouldCloseInFullAtBidAndSettleLedger() {
    engine.tick(BTC, "51000", "51010");

    CloseOutcome outcome = engine.positions.close(USER, ACCOUNT, position.id(), null);

    assertDecimalEquals("51000", outcome.trade().exitPrice());
    assertDecimalEquals("9.9", outcome.trade().grossPnl());
    assertDecimalEquals("0.255", outcome.trade().exitFee());
    assertDecimalEquals("9.39495", outcome.trade().realizedPnl());
    assertTrue(outcome.remainingPosition().isEmpty());
    AccountSnapshot account = outcome.account();
    assertDecimalEquals("10009.39495", account.currentBalance());
    assertDecimalEquals("0", account.totalMarginUsed());
    assertTrue(account.isConserved());
    assertTrue(engine.positions.find(position.id()).isEmpty());
    assertEquals(1, engine.events.ofType(TradeEventType.POSITION_CLOSED).size());
  }

  @Test
  void shouldCloseHalfAndKeepRemainder() {
    engine.tick(BTC, "49000", "49010");

    CloseOutcome outcome =
        engine.positions.close(USER, ACCOUNT, position.id(), new BigDecimal("0.005"));

    assertFalse(outcome.trade().isFullClose());
    Position remaining = outcome.remainingPosition().orElseThrow();
    assertDecimalEquals("0.005", remaining.quantity());
    assertDecimalEquals("25.005", remaining.marginUsed());
    assertDecimalEquals("25.005", outcome.account().totalMarginUsed());
    assertTrue(outcome.account().isConserved());
    assertEquals(1, engine.events.ofType(TradeEventType.POSITION_PARTIALLY_CLOSED).size());
  }

  @Test
  void shouldTreatOversizedCloseAsFullClose() {
    CloseOutcome outcome = engine.positions.close(USER, ACCOUNT, position.id(), BigDecimal.ONE);

    assertDecimalEquals("0.01", outcome.trade().closedQuantity());
    assertTrue(outcome.trade().isFullClose());
  }

  @Test
  void shouldCloseInFullWhenRemainderRoundsToNothing() {
    Position small =
        engine.intake.placeOrder(USER, engine.market("c-2", "LONG", "0.0001", "100")).position();

    CloseOutcome outcome =
        engine.positions.close(USER, ACCOUNT, small.id(), new BigDecimal("0.0000999999999"));

    assertTrue(outcome.trade().isFullClose());
    assertDecimalEquals("0.0001", outcome.trade().closedQuantity());
    assertDecimalEquals("0.05001", outcome.trade().marginReleased());
    assertTrue(engine.positions.find(small.id()).isEmpty());
    assertDecimalEquals("50.01", outcome.account().totalMarginUsed());
    assertTrue(outcome.account().isConserved());
    assertRejected(
        () -> engine.positions.close(USER, ACCOUNT, small.id(), null),
        RejectionCode.POSITION_NOT_FOUND);
  }

  @Test
  void shouldNotLeaveDustPositionBelowLedgerScale() {
    CloseOutcome outcome =
        engine.positions.close(USER, ACCOUNT, position.id(), new BigDecimal("0.00999999999"));

    assertTrue(outcome.trade().isFullClose());
    assertTrue(outcome.remainingPosition().isEmpty());
    assertDecimalEquals("0", outcome.account().totalMarginUsed());
  }

  @Test
  void shouldRejectCloseByOtherUserOrWithBadQuantity() {
    assertRejected(
        () -> engine.positions.close("user-2", null, position.id(), null),
        RejectionCode.POSITION_NOT_FOUND);
    assertRejected(
        () -> engine.positions.close(USER, "acc-other", position.id(), null),
        RejectionCode.POSITION_NOT_FOUND);
    assertRejected(
        () -> engine.positions.close(USER, ACCOUNT, position.id(), BigDecimal.ZERO),
        RejectionCode.INVALID_CLOSE_QUANTITY);
  }

  @Test
  void shouldRejectCloseOnStalePrice() {
    engine.clock.advance(Duration.ofSeconds(6));

    assertRejected(
        () -> engine.positions.close(USER, ACCOUNT, position.id(), null),
        RejectionCode.PRICE_STALE);
    assertTrue(engine.positions.find(position.id()).isPresent());
  }

  @Test
  void shouldRejectSecondCloseOfSamePosition() {
    engine.positions.close(USER, ACCOUNT, position.id(), null);

    assertRejected(
        () -> engine.positions.close(USER, ACCOUNT, position.id(), null),
        RejectionCode.POSITION_NOT_FOUND);
  }

  @Test
  void shouldModifyAndRemoveProtectiveLevels() {
    Position updated =
        engine.positions.modifyProtectiveLevels(
            USER, position.id(), new BigDecimal("55000"), new BigDecimal("48000"));

    assertDecimalEquals("55000", updated.takeProfit());
    assertDecimalEquals("48000", updated.stopLoss());
    assertEquals(1, engine.events.ofType(TradeEventType.TP_MODIFIED).size());
    assertEquals(1, engine.events.ofType(TradeEventType.SL_MODIFIED).size());

    Position cleared =
        engine.positions.modifyProtectiveLevels(USER, position.id(), BigDecimal.ZERO, null);

    assertNull(cleared.takeProfit());
    assertDecimalEquals("48000", cleared.stopLoss());
  }

  @Test
  void shouldRejectStopLossAboveEntryForLong() {
    assertRejected(
        () ->
            engine.positions.modifyProtectiveLevels(
                USER, position.id(), null, new BigDecimal("50500")),
        RejectionCode.INVALID_STOP_LOSS);
  }

  @Test
  void shouldAccrueFundingAndSettleItAtClose() {
    PriceSnapshot withFunding =
        PriceSnapshot.of(
            BTC,
            new BigDecimal("50000"),
            new BigDecimal("50010"),
            new BigDecimal("0.0001"),
            engine.clock.instant());
    engine.prices.update(withFunding);

    int charged = engine.positions.accrueFunding();

    assertEquals(1, charged);
    Position funded = engine.positions.find(position.id()).orElseThrow();
    assertDecimalEquals("0.0500050", funded.accruedFunding());
    List<TradeEvent> fundingEvents = engine.events.ofType(TradeEventType.FUNDING_APPLIED);
    assertEquals(1, fundingEvents.size());
    assertDecimalEquals(
        "9999.74995", engine.ledger.snapshot(ACCOUNT).orElseThrow().currentBalance());

    CloseOutcome outcome = engine.positions.close(USER, ACCOUNT, position.id(), null);
    assertDecimalEquals("0.050005", outcome.trade().fundingShare());
    assertTrue(outcome.account().isConserved());
  }

  @Test
  void shouldCloseAllAndSkipSymbolsWithoutFreshPrice() {
    engine.tick("ETHUSDT", "3000", "3001");
    engine.intake.placeOrder(
        USER,
        new OrderRequest(
            "c-eth",
            ACCOUNT,
            "ETHUSDT",
            "SHORT",
            "MARKET",
            new BigDecimal("0.1"),
            new BigDecimal("10"),
            null,
            null,
            null,
            engine.clock.millis()));
    engine.clock.advance(Duration.ofSeconds(6));
    engine.tick(BTC, "50000", "50010");

    List<CloseOutcome> closed = engine.positions.closeAll(ACCOUNT, CloseReason.BREACH);

    assertEquals(1, closed.size());
    assertEquals(BTC, closed.get(0).trade().symbol());
    assertEquals(1, engine.positions.positionsForAccount(ACCOUNT).size());
  }

  private static void assertRejected(Executable action, RejectionCode code) {
    assertEquals(code, assertThrows(EngineRejectionException.class, action).code());
  }
}
