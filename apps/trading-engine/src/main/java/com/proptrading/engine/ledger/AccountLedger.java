package com.proptrading.engine.ledger;

import com.proptrading.domain.ledger.AccountOpening;
import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.ledger.LedgerAccount;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of in-memory accounts. Lookups are lock-free; any mutation of a returned {@link
 * LedgerAccount} must run inside that account's lock.
 */
public class AccountLedger {
  private static final Logger log = LoggerFactory.getLogger(AccountLedger.class);

  private final Map<String, LedgerAccount> accounts = new ConcurrentHashMap<>();
  private final Clock clock;

  public AccountLedger(Clock clock) {
    this.clock = clock;
  }

  public LedgerAccount register(AccountOpening opening) {
    LedgerAccount account = LedgerAccount.open(opening, clock.instant());
    LedgerAccount existing = accounts.putIfAbsent(opening.accountId(), account);
    if (existing != null) {
      throw new IllegalStateException("Account already registered: " + opening.accountId());
    }
    log.info(
        "Registered account accountId={} userId={} status={} balance={}",
        opening.accountId(),
        opening.userId(),
        opening.status(),
        opening.currentBalance());
    return account;
  }

  public Optional<LedgerAccount> find(String accountId) {
    return accountId == null ? Optional.empty() : Optional.ofNullable(accounts.get(accountId));
  }

  public LedgerAccount require(String accountId) {
    return find(accountId)
        .orElseThrow(
            () ->
                new EngineRejectionException(
                    RejectionCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId));
  }

  /** Account checks of the order path: it exists, it may trade, and {@code userId} owns it. */
  public LedgerAccount requireTradable(String accountId, String userId) {
    LedgerAccount account = require(accountId);
    if (!account.status().canTrade()) {
      throw new EngineRejectionException(
          RejectionCode.ACCOUNT_NOT_ACTIVE, "Account is not active: " + account.status());
    }
    if (!account.userId().equals(userId)) {
      throw new EngineRejectionException(
          RejectionCode.OWNERSHIP_MISMATCH, "Account does not belong to user");
    }
    return account;
  }

  public Optional<AccountSnapshot> snapshot(String accountId) {
    return find(accountId).map(LedgerAccount::snapshot);
  }

  public boolean isOwnedBy(String accountId, String userId) {
    return find(accountId).map(account -> account.userId().equals(userId)).orElse(false);
  }

  public List<AccountSnapshot> snapshots() {
    return accounts.values().stream()
        .map(LedgerAccount::snapshot)
        .sorted(Comparator.comparing(AccountSnapshot::accountId))
        .toList();
  }
}
