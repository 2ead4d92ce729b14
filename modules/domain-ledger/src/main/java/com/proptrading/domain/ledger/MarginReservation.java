package com.proptrading.domain.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record MarginReservation(
    String orderId,
    String accountId,
    BigDecimal amount,
    ReservationStatus status,
    Instant createdAt,
    Instant releasedAt) {

  public MarginReservation {
    Objects.requireNonNull(orderId, "orderId must not be null");
    Objects.requireNonNull(accountId, "accountId must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    if (amount.signum() <= 0) {
      throw new LedgerDomainException("amount must be > 0");
    }
    if (status == ReservationStatus.RELEASED && releasedAt == null) {
      throw new LedgerDomainException("releasedAt is required once released");
    }
  }

  public static MarginReservation active(
      String orderId, String accountId, BigDecimal amount, Instant now) {
    return new MarginReservation(orderId, accountId, amount, ReservationStatus.ACTIVE, now, null);
  }

  public MarginReservation released(Instant now) {
    if (status.isTerminal()) {
      throw new LedgerDomainException("Reservation for order " + orderId + " already released");
    }
    return new MarginReservation(
        orderId, accountId, amount, ReservationStatus.RELEASED, createdAt, now);
  }
}
