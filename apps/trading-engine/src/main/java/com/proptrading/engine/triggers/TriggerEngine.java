package com.proptrading.engine.triggers;

import com.proptrading.domain.positions.CloseReason;
import com.proptrading.domain.positions.Position;
import com.proptrading.domain.positions.TriggerEvaluator;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.engine.positions.CloseOutcome;
import com.proptrading.engine.positions.PositionManager;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans the open positions of a symbol on every tick and closes those whose liquidation,
 * take-profit or stop-loss level the exit-side price has reached. A close that fails (for example
 * on a lock timeout) is attempted again on the next tick.
 */
public class TriggerEngine {
  private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

  private final PositionManager positions;
  private final PriceSnapshotProvider prices;
  private final EngineNotifier notifier;
  private final BigDecimal warningRatio;
  private final Set<String> warnedPositions = ConcurrentHashMap.newKeySet();

  public TriggerEngine(
      PositionManager positions,
      PriceSnapshotProvider prices,
      EngineNotifier notifier,
      BigDecimal warningRatio) {
    this.positions = positions;
    this.prices = prices;
    this.notifier = notifier;
    this.warningRatio = warningRatio;
  }

  public List<CloseOutcome> onTick(PriceSnapshot snapshot) {
    if (prices.isStale(snapshot)) {
      log.debug("Skipping trigger scan for {}: stale tick", snapshot.symbol());
      return List.of();
    }
    List<CloseOutcome> closed = new ArrayList<>();
    for (Position position : positions.positionsForSymbol(snapshot.symbol())) {
      Optional<CloseReason> reason =
          TriggerEvaluator.evaluate(position, snapshot.bid(), snapshot.ask());
      if (reason.isEmpty()) {
        warnIfNearLiquidation(position, snapshot);
        continue;
      }
      try {
        positions
            .closeAutomatic(position.id(), reason.get(), snapshot)
            .ifPresent(
                outcome -> {
                  closed.add(outcome);
                  warnedPositions.remove(position.id());
                  log.info(
                      "Triggered close positionId={} reason={} price={}",
                      position.id(),
                      reason.get(),
                      outcome.trade().exitPrice());
                  notifier.sendToUser(
                      position.userId(), OutboundMessages.positionClosed(outcome));
                });
      } catch (EngineRejectionException ex) {
        log.warn(
            "Triggered close of positionId={} deferred reason={} code={}",
            position.id(),
            reason.get(),
            ex.code());
      }
    }
    warnedPositions.removeIf(id -> positions.find(id).isEmpty());
    return closed;
  }

  private void warnIfNearLiquidation(Position position, PriceSnapshot snapshot) {
    if (!TriggerEvaluator.isNearLiquidation(
        position, snapshot.bid(), snapshot.ask(), warningRatio)) {
      return;
    }
    if (!warnedPositions.add(position.id())) {
      return;
    }
    BigDecimal price = snapshot.exitPrice(position.side());
    log.info("Liquidation warning positionId={} price={}", position.id(), price);
    notifier.sendToUser(
        position.userId(),
        OutboundMessages.liquidationWarning(
            position, price, TriggerEvaluator.liquidationDistanceRatio(position, price)));
  }
}
