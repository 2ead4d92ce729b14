package com.proptrading.engine.orders;

import static com.proptrading.engine.support.DecimalAssertions.assertDecimalEquals;
import static com.proptrading.engine.support.EngineFixture.ACCOUNT;
import static com.proptrading.engine.support.EngineFixture.BTC;
import static com.proptrading.engine.support.EngineFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.support.EngineFixture;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrderIntakeServiceTest {
  private EngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new EngineFixture();
    engine.tick(BTC, "50000", "50010");
  }

  @Test
  void shouldFillMarketOrderAtAsk() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));

    assertEquals(PlaceOrderResult.Outcome.FILLED, result.outcome());
    assertDecimalEquals("50010", result.executionPrice());
    Position position = result.position();
    assertDecimalEquals("50.01", position.marginUsed());
    assertDecimalEquals("0.25005", position.entryFee());
    assertDecimalEquals("45259.05", position.liquidationPrice());
    AccountSnapshot account = result.account();
    assertDecimalEquals("9999.74995", account.currentBalance());
    assertDecimalEquals("50.01", account.totalMarginUsed());
    assertDecimalEquals("9949.73995", account.availableMargin());
    assertTrue(account.isConserved());
    assertEquals(1, engine.events.ofType(TradeEventType.ORDER_PLACED).size());
    assertEquals(1, engine.events.ofType(TradeEventType.POSITION_OPENED).size());
    assertEquals(
        1.0,
        engine.meterRegistry.get("engine.orders.total").tag("outcome", "filled").counter().count());

    OutboundMessage message = result.toMessage();
    assertEquals(OutboundMessageType.ORDER_FILLED, message.type());
    assertEquals("c-1", message.field("clientOrderId"));
  }

  @Test
  void shouldUseEffectiveLeverageWhenRequestOmitsIt() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.market("c-1", "SHORT", "0.01", null));

    assertEquals(PlaceOrderResult.Outcome.FILLED, result.outcome());
    assertDecimalEquals("50000", result.executionPrice());
    assertDecimalEquals("100", result.position().leverage());
    assertDecimalEquals("5", result.position().marginUsed());
  }

  @Test
  void shouldGenerateClientOrderIdWhenMissing() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.market(null, "LONG", "0.01", "10"));

    assertEquals(PlaceOrderResult.Outcome.FILLED, result.outcome());
    assertTrue(result.clientOrderId().startsWith("srv-"));
  }

  @Test
  void shouldRejectDuplicateClientOrderIdWithinWindow() {
    engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));

    PlaceOrderResult duplicate =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));

    assertEquals(RejectionCode.DUPLICATE_ORDER, duplicate.rejection().code());
    assertEquals("Duplicate clientOrderId: c-1", duplicate.rejection().message());

    engine.clock.advance(Duration.ofSeconds(61));
    engine.tick(BTC, "50000", "50010");
    PlaceOrderResult later =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));
    assertEquals(PlaceOrderResult.Outcome.FILLED, later.outcome());
  }

  @Test
  void shouldRejectInvalidOrderBeforeTouchingLedger() {
    OrderRequest order =
        new OrderRequest(
            "c-1",
            ACCOUNT,
            "FOOUSDT",
            "LONG",
            "MARKET",
            new BigDecimal("1"),
            null,
            null,
            null,
            null,
            engine.clock.millis());

    PlaceOrderResult result = engine.intake.placeOrder(USER, order);

    assertEquals(RejectionCode.INVALID_SYMBOL, result.rejection().code());
    assertTrue(engine.events.events().isEmpty());
    assertDecimalEquals("10000", engine.ledger.snapshot(ACCOUNT).orElseThrow().availableMargin());
  }

  @Test
  void shouldRejectStaleTimestamp() {
    OrderRequest order = engine.market("c-1", "LONG", "0.01", "10");
    engine.clock.advance(Duration.ofSeconds(4));

    PlaceOrderResult result = engine.intake.placeOrder(USER, order);

    assertEquals(RejectionCode.TIMESTAMP_INVALID, result.rejection().code());
  }

  @Test
  void shouldRejectWhenPriceUnavailableOrStale() {
    OrderRequest eth =
        new OrderRequest(
            "c-eth",
            ACCOUNT,
            "ETHUSDT",
            "LONG",
            "MARKET",
            new BigDecimal("0.1"),
            null,
            null,
            null,
            null,
            engine.clock.millis());
    assertEquals(
        RejectionCode.PRICE_UNAVAILABLE, engine.intake.placeOrder(USER, eth).rejection().code());

    engine.clock.advance(Duration.ofSeconds(6));
    PlaceOrderResult stale =
        engine.intake.placeOrder(USER, engine.market("c-2", "LONG", "0.01", "10"));
    assertEquals(RejectionCode.PRICE_STALE, stale.rejection().code());
    assertTrue(stale.rejection().isRetryable());
  }

  @Test
  void shouldAllowRetryOfClientOrderIdAfterRetryableRejection() {
    engine.clock.advance(Duration.ofSeconds(6));
    PlaceOrderResult stale =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));
    assertEquals(RejectionCode.PRICE_STALE, stale.rejection().code());

    engine.tick(BTC, "50000", "50010");
    PlaceOrderResult retry =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));

    assertEquals(PlaceOrderResult.Outcome.FILLED, retry.outcome());
    PlaceOrderResult again =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "0.01", "10"));
    assertEquals(RejectionCode.DUPLICATE_ORDER, again.rejection().code());
  }

  @Test
  void shouldRejectInsufficientMarginWithFigures() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.market("c-1", "LONG", "1", "1"));

    assertEquals(RejectionCode.INSUFFICIENT_MARGIN, result.rejection().code());
    String message = result.rejection().message();
    assertTrue(
        message.startsWith("Insufficient margin. Required: 50035.00500000, Available: 10000"),
        message);
    assertTrue(engine.positions.positionsForAccount(ACCOUNT).isEmpty());
  }

  @Test
  void shouldRejectForeignAccount() {
    PlaceOrderResult result =
        engine.intake.placeOrder("user-2", engine.market("c-1", "LONG", "0.01", "10"));

    assertEquals(RejectionCode.OWNERSHIP_MISMATCH, result.rejection().code());
  }

  @Test
  void shouldRejectTakeProfitOnWrongSideOfExecutionPrice() {
    OrderRequest order =
        new OrderRequest(
            "c-1",
            ACCOUNT,
            BTC,
            "LONG",
            "MARKET",
            new BigDecimal("0.01"),
            new BigDecimal("10"),
            null,
            new BigDecimal("50005"),
            null,
            engine.clock.millis());

    PlaceOrderResult result = engine.intake.placeOrder(USER, order);

    assertEquals(RejectionCode.INVALID_TAKE_PROFIT, result.rejection().code());
  }

  @Test
  void shouldQueueNonCrossingLimitOrderAndReserveMargin() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.limit("c-1", "LONG", "0.01", "10", "49000"));

    assertEquals(PlaceOrderResult.Outcome.PENDING, result.outcome());
    assertDecimalEquals("49.245", result.pendingOrder().marginReserved());
    assertDecimalEquals("50010", result.currentPrice());
    AccountSnapshot account = engine.ledger.snapshot(ACCOUNT).orElseThrow();
    assertDecimalEquals("49.245", account.reservedMargin());
    assertDecimalEquals("9950.755", account.availableMargin());
    assertTrue(account.isConserved());
    assertEquals(OutboundMessageType.ORDER_PENDING, result.toMessage().type());
  }

  @Test
  void shouldFillCrossingLimitOrderImmediately() {
    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.limit("c-1", "LONG", "0.01", "10", "50100"));

    assertEquals(PlaceOrderResult.Outcome.FILLED, result.outcome());
    assertDecimalEquals("50010", result.executionPrice());
  }

  @Test
  void shouldRateLimitPlacementPerUser() {
    for (int i = 0; i < 10; i++) {
      engine.intake.placeOrder(USER, engine.market("c-" + i, "LONG", "0.001", "10"));
    }

    PlaceOrderResult result =
        engine.intake.placeOrder(USER, engine.market("c-x", "LONG", "0.001", "10"));

    assertEquals(RejectionCode.RATE_LIMITED, result.rejection().code());
  }
}
