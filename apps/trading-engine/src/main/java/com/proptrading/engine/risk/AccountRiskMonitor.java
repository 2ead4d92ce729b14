package com.proptrading.engine.risk;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.positions.CloseReason;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.orders.PendingOrderQueue;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.positions.CloseOutcome;
import com.proptrading.engine.positions.PositionManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks daily-loss and drawdown limits against equity (balance plus unrealized P&L). A breach
 * stops trading on the account, closes its positions and cancels its resting orders. Each limit
 * warns once when the configured share of it is used.
 */
public class AccountRiskMonitor {
  private static final Logger log = LoggerFactory.getLogger(AccountRiskMonitor.class);
  static final String DAILY_LOSS_WARNING = "DAILY_LOSS_WARNING";
  static final String DRAWDOWN_WARNING = "DRAWDOWN_WARNING";

  private final AccountLedger ledger;
  private final PositionManager positions;
  private final PendingOrderQueue queue;
  private final EntityLockRegistry locks;
  private final EngineNotifier notifier;
  private final TradeEventSink events;
  private final EngineMetrics metrics;
  private final Clock clock;
  private final BigDecimal warningRatio;
  private final Set<String> warned = ConcurrentHashMap.newKeySet();

  public AccountRiskMonitor(
      AccountLedger ledger,
      PositionManager positions,
      PendingOrderQueue queue,
      EntityLockRegistry locks,
      EngineNotifier notifier,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock,
      BigDecimal warningRatio) {
    this.ledger = ledger;
    this.positions = positions;
    this.queue = queue;
    this.locks = locks;
    this.notifier = notifier;
    this.events = events;
    this.metrics = metrics;
    this.clock = clock;
    this.warningRatio = warningRatio;
  }

  /** Re-evaluates every account holding a position on {@code symbol}. */
  public void onTick(String symbol) {
    for (String accountId : positions.accountsWithPositionsOn(symbol)) {
      try {
        evaluate(accountId);
      } catch (EngineRejectionException ex) {
        log.warn("Risk check deferred accountId={} code={}", accountId, ex.code());
      }
    }
  }

  public Optional<RiskAssessment> assess(String accountId) {
    return ledger.snapshot(accountId).map(this::assess);
  }

  /** Returns the breach that was applied, if any. */
  public Optional<BreachReason> evaluate(String accountId) {
    Optional<AccountSnapshot> snapshot = ledger.snapshot(accountId);
    if (snapshot.isEmpty() || !snapshot.get().status().canTrade()) {
      return Optional.empty();
    }
    RiskAssessment assessment = assess(snapshot.get());
    Optional<BreachReason> breach = assessment.breach();
    if (breach.isPresent()) {
      return breach(snapshot.get(), breach.get(), assessment) ? breach : Optional.empty();
    }
    if (assessment.dailyLossAtLeast(warningRatio)) {
      warnOnce(
          snapshot.get(),
          DAILY_LOSS_WARNING,
          assessment.dailyLoss(),
          assessment.dailyLossLimit(),
          "Daily loss has reached " + warningPercent() + " of the limit");
    }
    if (assessment.drawdownAtLeast(warningRatio)) {
      warnOnce(
          snapshot.get(),
          DRAWDOWN_WARNING,
          assessment.drawdown(),
          assessment.maxDrawdownLimit(),
          "Drawdown has reached " + warningPercent() + " of the limit");
    }
    return Optional.empty();
  }

  /** Daily-loss warnings may fire again after the daily reset. */
  public void clearDailyWarnings() {
    warned.removeIf(key -> key.endsWith(":" + DAILY_LOSS_WARNING));
  }

  private String warningPercent() {
    return warningRatio.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
  }

  private RiskAssessment assess(AccountSnapshot account) {
    BigDecimal equity = account.equity(positions.unrealizedPnl(account.accountId()));
    BigDecimal dailyLoss = account.dailyStartingBalance().subtract(equity).max(BigDecimal.ZERO);
    BigDecimal drawdown = account.startingBalance().subtract(equity).max(BigDecimal.ZERO);
    return new RiskAssessment(
        account.accountId(),
        equity,
        dailyLoss,
        account.dailyLossLimit(),
        drawdown,
        account.maxDrawdownLimit());
  }

  private boolean breach(AccountSnapshot account, BreachReason reason, RiskAssessment assessment) {
    String accountId = account.accountId();
    boolean marked =
        locks.withAccountLock(
            accountId,
            () -> {
              LedgerAccount current = ledger.require(accountId);
              if (!current.status().canTrade()) {
                return false;
              }
              current.markBreached(clock.instant());
              return true;
            });
    if (!marked) {
      return false;
    }
    log.warn(
        "Account breached accountId={} reason={} equity={} dailyLoss={} drawdown={}",
        accountId,
        reason,
        assessment.equity(),
        assessment.dailyLoss(),
        assessment.drawdown());
    List<CloseOutcome> closed = positions.closeAll(accountId, CloseReason.BREACH);
    List<PendingOrder> cancelled = queue.cancelAllForAccount(accountId, "Account breached");
    AccountSnapshot after = ledger.snapshot(accountId).orElse(account);
    Instant now = clock.instant();
    events.publish(
        TradeEvent.builder(TradeEventType.ACCOUNT_BREACHED, accountId, now)
            .userId(account.userId())
            .balanceAfter(after.currentBalance())
            .realizedPnl(after.dailyPnl())
            .build());
    metrics.accountBreached(reason.name());
    notifier.sendToAccount(
        accountId,
        OutboundMessage.builder(OutboundMessageType.ACCOUNT_BREACHED)
            .put("accountId", accountId)
            .put("reason", reason.name())
            .put("equity", assessment.equity())
            .put("dailyLoss", assessment.dailyLoss())
            .put("drawdown", assessment.drawdown())
            .put("closedPositions", closed.size())
            .put("cancelledOrders", cancelled.size())
            .put("message", "Account breached: trading disabled")
            .build());
    return true;
  }

  private void warnOnce(
      AccountSnapshot account,
      String warningType,
      BigDecimal current,
      BigDecimal limit,
      String message) {
    if (!warned.add(account.accountId() + ":" + warningType)) {
      return;
    }
    log.info(
        "Risk warning accountId={} type={} current={} limit={}",
        account.accountId(),
        warningType,
        current,
        limit);
    notifier.sendToAccount(
        account.accountId(),
        OutboundMessage.builder(OutboundMessageType.RISK_WARNING)
            .put("accountId", account.accountId())
            .put("warningType", warningType)
            .put("current", current)
            .put("limit", limit)
            .put("message", message)
            .build());
  }
}
