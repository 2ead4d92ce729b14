package com.proptrading.engine.marketdata;

import com.proptrading.domain.orders.InstrumentCatalog;
import com.proptrading.engine.orders.PendingOrderQueue;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.engine.price.InMemoryPriceSnapshotProvider;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.risk.AccountRiskMonitor;
import com.proptrading.engine.triggers.TriggerEngine;
import com.proptrading.infra.kafka.contract.payload.PriceTickV1;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each tick as the symbol's latest snapshot and fans it out: triggers first, then resting
 * orders, then account risk, then the price broadcast.
 */
public class PriceTickProcessor {
  private static final Logger log = LoggerFactory.getLogger(PriceTickProcessor.class);

  private final InMemoryPriceSnapshotProvider prices;
  private final TriggerEngine triggerEngine;
  private final PendingOrderQueue pendingOrders;
  private final AccountRiskMonitor riskMonitor;
  private final EngineNotifier notifier;
  private final Clock clock;

  public PriceTickProcessor(
      InMemoryPriceSnapshotProvider prices,
      TriggerEngine triggerEngine,
      PendingOrderQueue pendingOrders,
      AccountRiskMonitor riskMonitor,
      EngineNotifier notifier,
      Clock clock) {
    this.prices = prices;
    this.triggerEngine = triggerEngine;
    this.pendingOrders = pendingOrders;
    this.riskMonitor = riskMonitor;
    this.notifier = notifier;
    this.clock = clock;
  }

  /** Returns {@code false} when the tick was older than the snapshot already held. */
  public boolean onTick(PriceTickV1 tick) {
    if (tick.symbol() == null || tick.bid() == null || tick.ask() == null) {
      throw new IllegalArgumentException("Price tick requires symbol, bid and ask");
    }
    Instant timestamp = tick.timestamp() != null ? tick.timestamp() : clock.instant();
    PriceSnapshot snapshot =
        PriceSnapshot.of(
            InstrumentCatalog.normalizeSymbol(tick.symbol()),
            tick.bid(),
            tick.ask(),
            tick.fundingRate(),
            timestamp);
    if (!prices.update(snapshot)) {
      log.debug("Ignoring out-of-order tick symbol={} at={}", snapshot.symbol(), timestamp);
      return false;
    }
    process(snapshot);
    return true;
  }

  public void process(PriceSnapshot snapshot) {
    String symbol = snapshot.symbol();
    try {
      triggerEngine.onTick(snapshot);
    } catch (RuntimeException ex) {
      log.error("Trigger scan failed symbol={}", symbol, ex);
    }
    try {
      pendingOrders.onTick(snapshot);
    } catch (RuntimeException ex) {
      log.error("Pending order matching failed symbol={}", symbol, ex);
    }
    try {
      riskMonitor.onTick(symbol);
    } catch (RuntimeException ex) {
      log.error("Risk evaluation failed symbol={}", symbol, ex);
    }
    notifier.broadcastToSubscribers(symbol, OutboundMessages.priceUpdate(snapshot));
  }
}
