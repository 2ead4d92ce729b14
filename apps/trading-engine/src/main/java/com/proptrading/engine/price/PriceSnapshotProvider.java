package com.proptrading.engine.price;

import java.util.Optional;

public interface PriceSnapshotProvider {
  Optional<PriceSnapshot> getPrice(String symbol);

  /** {@code true} when no snapshot exists or the latest one is older than the staleness bound. */
  boolean isPriceStale(String symbol);

  boolean isStale(PriceSnapshot snapshot);
}
