package com.proptrading.engine.positions;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.positions.ClosedTrade;
import com.proptrading.domain.positions.Position;
import java.util.Optional;

/** Result of a (partial) close: the settled trade, what is left open and the account after. */
public record CloseOutcome(ClosedTrade trade, Position remaining, AccountSnapshot account) {
  public Optional<Position> remainingPosition() {
    return Optional.ofNullable(remaining);
  }
}
