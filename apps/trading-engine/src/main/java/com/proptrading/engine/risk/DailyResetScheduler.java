package com.proptrading.engine.risk;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.events.TradeEvent;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.events.TradeEventType;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.locking.EntityLockRegistry;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Starts a new trading day for every account at midnight UTC. */
@Component
public class DailyResetScheduler {
  private static final Logger log = LoggerFactory.getLogger(DailyResetScheduler.class);
  private static final int MAX_ATTEMPTS = 3;

  private final AccountLedger ledger;
  private final EntityLockRegistry locks;
  private final AccountRiskMonitor riskMonitor;
  private final TradeEventSink events;
  private final Clock clock;

  public DailyResetScheduler(
      AccountLedger ledger,
      EntityLockRegistry locks,
      AccountRiskMonitor riskMonitor,
      TradeEventSink events,
      Clock clock) {
    this.ledger = ledger;
    this.locks = locks;
    this.riskMonitor = riskMonitor;
    this.events = events;
    this.clock = clock;
  }

  @Scheduled(cron = "${engine.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
  public int resetAll() {
    int reset = 0;
    for (AccountSnapshot account : ledger.snapshots()) {
      if (resetWithRetry(account.accountId())) {
        reset++;
      }
    }
    riskMonitor.clearDailyWarnings();
    log.info("Daily reset completed for {} accounts", reset);
    return reset;
  }

  private boolean resetWithRetry(String accountId) {
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      try {
        Instant now = clock.instant();
        AccountSnapshot closingDay =
            locks.withAccountLock(accountId, () -> ledger.require(accountId).resetDaily(now));
        events.publish(
            TradeEvent.builder(TradeEventType.DAILY_RESET, accountId, now)
                .userId(closingDay.userId())
                .realizedPnl(closingDay.dailyPnl())
                .balanceAfter(closingDay.currentBalance())
                .build());
        return true;
      } catch (EngineRejectionException ex) {
        log.warn(
            "Daily reset attempt {} failed accountId={} code={}", attempt, accountId, ex.code());
      }
    }
    log.error("Daily reset skipped accountId={} after {} attempts", accountId, MAX_ATTEMPTS);
    return false;
  }
}
