package com.proptrading.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable balance and margin state of one trading account.
 *
 * <p>Not thread-safe: every mutating call must happen while the caller holds the account's lock.
 * Each mutation checks its preconditions before the first write, so a thrown exception leaves the
 * account untouched. {@link #snapshot()} may be read from any thread.
 *
 * <p>Conservation: {@code availableMargin + totalMarginUsed + reservedMargin == currentBalance}.
 */
public final class LedgerAccount {
  private final String accountId;
  private final String userId;
  private final BigDecimal startingBalance;
  private final BigDecimal dailyLossLimit;
  private final BigDecimal maxDrawdownLimit;
  private final int majorMaxLeverage;
  private final int altcoinMaxLeverage;
  private final EvaluationRules evaluation;
  private final Map<String, MarginReservation> reservations = new HashMap<>();

  private AccountStatus status;
  private BigDecimal currentBalance;
  private BigDecimal availableMargin;
  private BigDecimal totalMarginUsed = BigDecimal.ZERO;
  private BigDecimal reservedMargin = BigDecimal.ZERO;
  private BigDecimal dailyPnl = BigDecimal.ZERO;
  private BigDecimal dailyStartingBalance;
  private BigDecimal peakBalance;
  private BigDecimal totalVolume = BigDecimal.ZERO;
  private BigDecimal totalFeesPaid = BigDecimal.ZERO;
  private long totalTrades;
  private long winningTrades;
  private long losingTrades;
  private Instant lastTradeAt;
  private Instant dayStartedAt;
  private int tradingDays;
  private Instant updatedAt;

  private volatile AccountSnapshot snapshot;

  private LedgerAccount(AccountOpening opening, Instant now) {
    this.accountId = opening.accountId();
    this.userId = opening.userId();
    this.status = opening.status();
    this.startingBalance = opening.startingBalance();
    this.currentBalance = opening.currentBalance();
    this.availableMargin = opening.currentBalance();
    this.dailyStartingBalance = opening.dailyStartingBalance();
    this.peakBalance = opening.peakBalance().max(opening.currentBalance());
    this.dailyLossLimit = opening.dailyLossLimit();
    this.maxDrawdownLimit = opening.maxDrawdownLimit();
    this.majorMaxLeverage = opening.majorMaxLeverage();
    this.altcoinMaxLeverage = opening.altcoinMaxLeverage();
    this.evaluation = opening.evaluation();
    this.tradingDays = opening.tradingDays();
    this.dayStartedAt = now;
    this.updatedAt = now;
    refreshSnapshot();
  }

  public static LedgerAccount open(AccountOpening opening, Instant now) {
    Objects.requireNonNull(opening, "opening must not be null");
    Objects.requireNonNull(now, "now must not be null");
    return new LedgerAccount(opening, now);
  }

  public MarginReservation reserve(String orderId, BigDecimal amount, Instant now) {
    Objects.requireNonNull(orderId, "orderId must not be null");
    requirePositive(amount, "amount");
    if (reservations.containsKey(orderId)) {
      throw new LedgerDomainException("Order " + orderId + " already holds a reservation");
    }
    if (amount.compareTo(availableMargin) > 0) {
      throw new InsufficientMarginException(accountId, amount, availableMargin);
    }
    MarginReservation reservation = MarginReservation.active(orderId, accountId, amount, now);
    availableMargin = availableMargin.subtract(amount);
    reservedMargin = reservedMargin.add(amount);
    reservations.put(orderId, reservation);
    touch(now);
    return reservation;
  }

  /** Returns the reservation to available margin. A second call for the same order is a no-op. */
  public Optional<MarginReservation> release(String orderId, Instant now) {
    MarginReservation active = reservations.remove(orderId);
    if (active == null) {
      return Optional.empty();
    }
    availableMargin = availableMargin.add(active.amount());
    reservedMargin = reservedMargin.subtract(active.amount());
    touch(now);
    return Optional.of(active.released(now));
  }

  public Optional<BigDecimal> reservedFor(String orderId) {
    MarginReservation reservation = reservations.get(orderId);
    return reservation == null ? Optional.empty() : Optional.of(reservation.amount());
  }

  public void openPosition(
      BigDecimal marginRequired, BigDecimal entryFee, BigDecimal notional, Instant now) {
    requirePositive(marginRequired, "marginRequired");
    requireNonNegative(entryFee, "entryFee");
    requireNonNegative(notional, "notional");
    BigDecimal total = marginRequired.add(entryFee);
    if (total.compareTo(availableMargin) > 0) {
      throw new InsufficientMarginException(accountId, total, availableMargin);
    }
    availableMargin = availableMargin.subtract(total);
    totalMarginUsed = totalMarginUsed.add(marginRequired);
    currentBalance = currentBalance.subtract(entryFee);
    totalFeesPaid = totalFeesPaid.add(entryFee);
    totalTrades++;
    totalVolume = totalVolume.add(notional);
    lastTradeAt = now;
    touch(now);
  }

  /**
   * Books a (partial) close.
   *
   * @param marginReleased margin returned from the closed part of the position
   * @param balanceDelta gross P&L minus exit fee and funding; the entry fee was charged at open
   * @param realizedPnl net P&L of the closed part including its share of the entry fee
   * @param exitFee fee charged on the close
   */
  public void settleClose(
      BigDecimal marginReleased,
      BigDecimal balanceDelta,
      BigDecimal realizedPnl,
      BigDecimal exitFee,
      Instant now) {
    requireNonNegative(marginReleased, "marginReleased");
    Objects.requireNonNull(balanceDelta, "balanceDelta must not be null");
    Objects.requireNonNull(realizedPnl, "realizedPnl must not be null");
    requireNonNegative(exitFee, "exitFee");
    BigDecimal released = marginReleased.min(totalMarginUsed);
    currentBalance = currentBalance.add(balanceDelta);
    availableMargin = availableMargin.add(released).add(balanceDelta);
    totalMarginUsed = totalMarginUsed.subtract(released);
    totalFeesPaid = totalFeesPaid.add(exitFee);
    dailyPnl = dailyPnl.add(realizedPnl);
    peakBalance = peakBalance.max(currentBalance);
    if (realizedPnl.signum() > 0) {
      winningTrades++;
    } else if (realizedPnl.signum() < 0) {
      losingTrades++;
    }
    lastTradeAt = now;
    touch(now);
  }

  public void markBreached(Instant now) {
    status = AccountStatus.BREACHED;
    touch(now);
  }

  /**
   * Starts a new trading day and returns the state the previous day ended with. The day just
   * finished counts as a trading day when it realized P&L or saw a trade.
   */
  public AccountSnapshot resetDaily(Instant now) {
    AccountSnapshot closingDay = snapshot;
    boolean traded =
        dailyPnl.signum() != 0 || (lastTradeAt != null && !lastTradeAt.isBefore(dayStartedAt));
    if (traded) {
      tradingDays++;
    }
    dailyStartingBalance = currentBalance;
    dailyPnl = BigDecimal.ZERO;
    dayStartedAt = now;
    touch(now);
    return closingDay;
  }

  /** Moves an ACTIVE evaluation account to the status its passed step leads to. */
  public AccountStatus markEvaluationPassed(Instant now) {
    if (evaluation == null) {
      throw new LedgerDomainException("Account " + accountId + " is not in evaluation");
    }
    if (status != AccountStatus.ACTIVE) {
      throw new LedgerDomainException(
          "Account " + accountId + " cannot pass its evaluation in status " + status);
    }
    status = evaluation.passedStatus();
    touch(now);
    return status;
  }

  public AccountSnapshot snapshot() {
    return snapshot;
  }

  public String accountId() {
    return accountId;
  }

  public String userId() {
    return userId;
  }

  public AccountStatus status() {
    return status;
  }

  public BigDecimal availableMargin() {
    return availableMargin;
  }

  public int majorMaxLeverage() {
    return majorMaxLeverage;
  }

  public int altcoinMaxLeverage() {
    return altcoinMaxLeverage;
  }

  private void touch(Instant now) {
    updatedAt = Objects.requireNonNull(now, "now must not be null");
    refreshSnapshot();
  }

  private void refreshSnapshot() {
    snapshot =
        new AccountSnapshot(
            accountId,
            userId,
            status,
            startingBalance,
            currentBalance,
            availableMargin,
            totalMarginUsed,
            reservedMargin,
            dailyPnl,
            dailyStartingBalance,
            peakBalance,
            dailyLossLimit,
            maxDrawdownLimit,
            majorMaxLeverage,
            altcoinMaxLeverage,
            totalTrades,
            winningTrades,
            losingTrades,
            totalVolume,
            totalFeesPaid,
            lastTradeAt,
            updatedAt,
            tradingDays,
            evaluation);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new LedgerDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new LedgerDomainException(fieldName + " must be >= 0");
    }
  }
}
