package com.proptrading.engine.risk;

import static com.proptrading.engine.support.DecimalAssertions.assertDecimalEquals;
import static com.proptrading.engine.support.EngineFixture.ACCOUNT;
import static com.proptrading.engine.support.EngineFixture.BTC;
import static com.proptrading.engine.support.EngineFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.ledger.AccountOpening;
import com.proptrading.domain.ledger.AccountStatus;
import com.proptrading.domain.ledger.EvaluationRules;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.orders.PlaceOrderResult;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.support.EngineFixture;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EvaluationCheckerTest {
  private static final String EVAL = "acc-eval";

  private EngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new EngineFixture();
    engine.ledger.register(
        new AccountOpening(
            EVAL,
            USER,
            AccountStatus.ACTIVE,
            new BigDecimal("10000"),
            new BigDecimal("10000"),
            new BigDecimal("10000"),
            new BigDecimal("10000"),
            new BigDecimal("500"),
            new BigDecimal("1000"),
            100,
            50,
            new EvaluationRules(1, 2, new BigDecimal("8"), 2),
            1));
    engine.tick(BTC, "50000", "50010");
    PlaceOrderResult result = engine.intake.placeOrder(USER, longOrder("c-1", "0.1"));
    assertEquals(PlaceOrderResult.Outcome.FILLED, result.outcome());
  }

  @Test
  void shouldMeasureProfitOnEquity() {
    engine.tick(BTC, "59000", "59010");

    EvaluationProgress progress = engine.evaluations.progress(EVAL).orElseThrow();

    assertDecimalEquals("10896.4995", progress.equity());
    assertDecimalEquals("896.4995", progress.profit());
    assertDecimalEquals("800", progress.profitTarget());
    assertTrue(progress.profitTargetMet());
    assertEquals(1, progress.tradingDays());
    assertFalse(progress.minTradingDaysMet());
  }

  @Test
  void shouldWaitForMinimumTradingDays() {
    engine.tick(BTC, "59000", "59010");

    assertEquals(Optional.empty(), engine.evaluations.check(EVAL));
    assertEquals(AccountStatus.ACTIVE, engine.ledger.snapshot(EVAL).orElseThrow().status());
    assertTrue(engine.notifier.ofType(OutboundMessageType.EVALUATION_STEP_PASSED).isEmpty());
  }

  @Test
  void shouldPassFirstStepOnceTargetAndTradingDaysAreMet() {
    engine.ledger.require(EVAL).resetDaily(engine.clock.instant());
    engine.tick(BTC, "59000", "59010");

    int passed = engine.evaluations.checkAll();

    assertEquals(1, passed);
    assertEquals(
        AccountStatus.STEP1_PASSED, engine.ledger.snapshot(EVAL).orElseThrow().status());
    assertEquals(1, engine.events.ofType(TradeEventType.STEP1_PASSED).size());
    List<OutboundMessage> notices =
        engine.notifier.ofType(OutboundMessageType.EVALUATION_STEP_PASSED);
    assertEquals(1, notices.size());
    assertEquals(1, notices.get(0).field("step"));
    assertEquals("Congratulations! You passed Step 1.", notices.get(0).field("message"));
    assertEquals(
        1.0,
        engine
            .meterRegistry
            .get("engine.evaluations.passed.total")
            .tag("status", "STEP1_PASSED")
            .counter()
            .count());

    assertEquals(0, engine.evaluations.checkAll());
    assertEquals(1, engine.events.ofType(TradeEventType.STEP1_PASSED).size());
  }

  @Test
  void shouldNotPassBelowProfitTarget() {
    engine.ledger.require(EVAL).resetDaily(engine.clock.instant());
    engine.tick(BTC, "50500", "50510");

    assertEquals(Optional.empty(), engine.evaluations.check(EVAL));
    assertEquals(AccountStatus.ACTIVE, engine.ledger.snapshot(EVAL).orElseThrow().status());
  }

  @Test
  void shouldIgnoreAccountsWithoutEvaluation() {
    assertTrue(engine.evaluations.progress(ACCOUNT).isEmpty());
    assertEquals(Optional.empty(), engine.evaluations.check(ACCOUNT));
  }

  private OrderRequest longOrder(String clientOrderId, String quantity) {
    return new OrderRequest(
        clientOrderId,
        EVAL,
        BTC,
        "LONG",
        "MARKET",
        new BigDecimal(quantity),
        new BigDecimal("10"),
        null,
        null,
        null,
        engine.clock.millis());
  }
}
