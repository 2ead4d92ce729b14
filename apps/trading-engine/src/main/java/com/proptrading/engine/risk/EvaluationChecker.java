package com.proptrading.engine.risk;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.ledger.AccountStatus;
import com.proptrading.domain.ledger.EvaluationRules;
import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.positions.PositionManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Passes ACTIVE evaluation accounts whose equity profit reached the step's target after the
 * minimum number of trading days. Passing step one of a two-step plan leaves the account in
 * STEP1_PASSED; any other pass moves it to PASSED and ends trading on it.
 */
@Component
public class EvaluationChecker {
  private static final Logger log = LoggerFactory.getLogger(EvaluationChecker.class);

  private final AccountLedger ledger;
  private final PositionManager positions;
  private final EntityLockRegistry locks;
  private final EngineNotifier notifier;
  private final TradeEventSink events;
  private final EngineMetrics metrics;
  private final Clock clock;

  public EvaluationChecker(
      AccountLedger ledger,
      PositionManager positions,
      EntityLockRegistry locks,
      EngineNotifier notifier,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock) {
    this.ledger = ledger;
    this.positions = positions;
    this.locks = locks;
    this.notifier = notifier;
    this.events = events;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${engine.evaluation-check-interval-ms:5000}")
  public int checkAll() {
    int passed = 0;
    for (AccountSnapshot account : ledger.snapshots()) {
      try {
        if (check(account.accountId()).isPresent()) {
          passed++;
        }
      } catch (EngineRejectionException ex) {
        log.warn(
            "Evaluation check deferred accountId={} code={}", account.accountId(), ex.code());
      }
    }
    return passed;
  }

  public Optional<EvaluationProgress> progress(String accountId) {
    return ledger.snapshot(accountId).filter(this::isCandidate).map(this::progress);
  }

  /** Returns the status the account moved to when it passed. */
  public Optional<AccountStatus> check(String accountId) {
    Optional<EvaluationProgress> progress = progress(accountId);
    if (progress.isEmpty() || !progress.get().passed()) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    Optional<AccountStatus> next =
        locks.withAccountLock(
            accountId,
            () -> {
              LedgerAccount current = ledger.require(accountId);
              if (current.status() != AccountStatus.ACTIVE) {
                return Optional.<AccountStatus>empty();
              }
              return Optional.of(current.markEvaluationPassed(now));
            });
    next.ifPresent(status -> announce(progress.get(), status, now));
    return next;
  }

  private boolean isCandidate(AccountSnapshot account) {
    return account.status() == AccountStatus.ACTIVE && account.evaluation() != null;
  }

  private EvaluationProgress progress(AccountSnapshot account) {
    EvaluationRules rules = account.evaluation();
    BigDecimal equity = account.equity(positions.unrealizedPnl(account.accountId()));
    return new EvaluationProgress(
        account.accountId(),
        rules.currentStep(),
        equity,
        equity.subtract(account.startingBalance()),
        rules.profitTarget(account.startingBalance()),
        account.tradingDays(),
        rules.minTradingDays(),
        account.totalTrades());
  }

  private void announce(EvaluationProgress progress, AccountStatus status, Instant now) {
    String accountId = progress.accountId();
    AccountSnapshot after = ledger.snapshot(accountId).orElseThrow();
    boolean stepOnly = status == AccountStatus.STEP1_PASSED;
    log.info(
        "Evaluation passed accountId={} step={} status={} profit={} target={} tradingDays={}",
        accountId,
        progress.step(),
        status,
        progress.profit(),
        progress.profitTarget(),
        progress.tradingDays());
    events.publish(
        TradeEvent.builder(
                stepOnly ? TradeEventType.STEP1_PASSED : TradeEventType.EVALUATION_PASSED,
                accountId,
                now)
            .userId(after.userId())
            .realizedPnl(progress.profit())
            .balanceAfter(after.currentBalance())
            .build());
    metrics.evaluationPassed(status.name());
    notifier.sendToAccount(
        accountId,
        OutboundMessage.builder(
                stepOnly
                    ? OutboundMessageType.EVALUATION_STEP_PASSED
                    : OutboundMessageType.EVALUATION_PASSED)
            .put("accountId", accountId)
            .put("step", progress.step())
            .put("status", status.name())
            .put("equity", progress.equity())
            .put("profit", progress.profit())
            .put("profitTarget", progress.profitTarget())
            .put("tradingDays", progress.tradingDays())
            .put(
                "message",
                stepOnly
                    ? "Congratulations! You passed Step " + progress.step() + "."
                    : "Congratulations! You passed the evaluation.")
            .build());
  }
}
