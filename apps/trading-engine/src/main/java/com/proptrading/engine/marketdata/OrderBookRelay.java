package com.proptrading.engine.marketdata;

import com.proptrading.domain.orders.InstrumentCatalog;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.infra.kafka.contract.payload.OrderBookSnapshotV1;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards depth snapshots to symbol subscribers. The engine never matches against the book; it
 * only relays it, trimmed to a fixed number of levels per side.
 */
public class OrderBookRelay {
  private static final Logger log = LoggerFactory.getLogger(OrderBookRelay.class);

  private final InstrumentCatalog catalog;
  private final EngineNotifier notifier;
  private final Clock clock;
  private final int maxDepth;
  private final Map<String, Long> lastUpdateIds = new ConcurrentHashMap<>();

  public OrderBookRelay(
      InstrumentCatalog catalog, EngineNotifier notifier, Clock clock, int maxDepth) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1");
    }
    this.catalog = catalog;
    this.notifier = notifier;
    this.clock = clock;
    this.maxDepth = maxDepth;
  }

  /** Returns {@code false} for snapshots of unknown symbols or older than the last one relayed. */
  public boolean onSnapshot(OrderBookSnapshotV1 snapshot) {
    if (snapshot.symbol() == null || snapshot.symbol().isBlank()) {
      throw new IllegalArgumentException("Order book snapshot requires a symbol");
    }
    String symbol = InstrumentCatalog.normalizeSymbol(snapshot.symbol());
    if (!catalog.isSubscribable(symbol)) {
      log.debug("Ignoring order book for unknown symbol={}", symbol);
      return false;
    }
    long updateId = snapshot.lastUpdateId();
    AtomicBoolean newer = new AtomicBoolean();
    lastUpdateIds.compute(
        symbol,
        (key, current) -> {
          if (current != null && updateId <= current) {
            return current;
          }
          newer.set(true);
          return updateId;
        });
    if (!newer.get()) {
      log.debug("Ignoring stale order book symbol={} updateId={}", symbol, updateId);
      return false;
    }
    Instant timestamp = snapshot.timestamp() != null ? snapshot.timestamp() : clock.instant();
    notifier.broadcastToSubscribers(
        symbol,
        OutboundMessages.orderBookUpdate(
            symbol, top(snapshot.bids()), top(snapshot.asks()), updateId, timestamp));
    return true;
  }

  private List<List<BigDecimal>> top(List<OrderBookSnapshotV1.Level> levels) {
    return levels.stream()
        .filter(level -> level.price() != null && level.quantity() != null)
        .limit(maxDepth)
        .map(level -> List.of(level.price(), level.quantity()))
        .toList();
  }
}
