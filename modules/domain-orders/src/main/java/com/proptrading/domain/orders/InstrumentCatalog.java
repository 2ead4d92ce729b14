package com.proptrading.domain.orders;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public final class InstrumentCatalog {
  public static final List<String> DEFAULT_TRADEABLE =
      List.of(
          "BTCUSDT",
          "ETHUSDT",
          "SOLUSDT",
          "BNBUSDT",
          "XRPUSDT",
          "DOGEUSDT",
          "ADAUSDT",
          "AVAXUSDT",
          "DOTUSDT",
          "LINKUSDT");

  public static final List<String> DEFAULT_QUOTE_ONLY =
      List.of("MATICUSDT", "LTCUSDT", "UNIUSDT", "ATOMUSDT", "XLMUSDT");

  private final Set<String> tradeable;
  private final Set<String> subscribable;

  public InstrumentCatalog(Collection<String> tradeable, Collection<String> quoteOnly) {
    Objects.requireNonNull(tradeable, "tradeable must not be null");
    Objects.requireNonNull(quoteOnly, "quoteOnly must not be null");
    this.tradeable = normalize(tradeable);
    Set<String> all = new LinkedHashSet<>(this.tradeable);
    all.addAll(normalize(quoteOnly));
    this.subscribable = Set.copyOf(all);
  }

  public static InstrumentCatalog defaults() {
    return new InstrumentCatalog(DEFAULT_TRADEABLE, DEFAULT_QUOTE_ONLY);
  }

  public boolean isTradeable(String symbol) {
    return symbol != null && tradeable.contains(symbol);
  }

  public boolean isSubscribable(String symbol) {
    return symbol != null && subscribable.contains(normalizeSymbol(symbol));
  }

  public Set<String> tradeableSymbols() {
    return tradeable;
  }

  public Set<String> subscribableSymbols() {
    return subscribable;
  }

  public static String normalizeSymbol(String symbol) {
    return symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
  }

  private static Set<String> normalize(Collection<String> symbols) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String symbol : symbols) {
      if (symbol != null && !symbol.isBlank()) {
        normalized.add(normalizeSymbol(symbol));
      }
    }
    return Set.copyOf(normalized);
  }
}
