package com.proptrading.engine.price;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Latest snapshot per symbol as fed by the tick consumer. Older ticks never replace newer ones. */
public class InMemoryPriceSnapshotProvider implements PriceSnapshotProvider {
  private final Map<String, PriceSnapshot> latest = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration staleAfter;

  public InMemoryPriceSnapshotProvider(Clock clock, Duration staleAfter) {
    this.clock = clock;
    this.staleAfter = staleAfter;
  }

  /** Returns {@code false} when the snapshot was older than the one already held. */
  public boolean update(PriceSnapshot snapshot) {
    PriceSnapshot stored =
        latest.merge(
            snapshot.symbol(),
            snapshot,
            (current, next) -> next.timestamp().isBefore(current.timestamp()) ? current : next);
    return stored == snapshot;
  }

  @Override
  public Optional<PriceSnapshot> getPrice(String symbol) {
    return Optional.ofNullable(latest.get(symbol));
  }

  @Override
  public boolean isPriceStale(String symbol) {
    PriceSnapshot snapshot = latest.get(symbol);
    return snapshot == null || isStale(snapshot);
  }

  @Override
  public boolean isStale(PriceSnapshot snapshot) {
    return snapshot.isStaleAt(clock.instant(), staleAfter);
  }

  public Duration staleAfter() {
    return staleAfter;
  }
}
