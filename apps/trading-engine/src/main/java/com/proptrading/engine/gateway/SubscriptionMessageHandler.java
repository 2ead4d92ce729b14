package com.proptrading.engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.proptrading.domain.orders.InstrumentCatalog;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.engine.price.PriceSnapshotProvider;
import com.proptrading.engine.ratelimit.RateLimitAction;
import com.proptrading.engine.ratelimit.RateLimiter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionMessageHandler {
  private final InstrumentCatalog catalog;
  private final RateLimiter rateLimiter;
  private final ConnectionManager connectionManager;
  private final PriceSnapshotProvider prices;

  public SubscriptionMessageHandler(
      InstrumentCatalog catalog,
      RateLimiter rateLimiter,
      ConnectionManager connectionManager,
      PriceSnapshotProvider prices) {
    this.catalog = catalog;
    this.rateLimiter = rateLimiter;
    this.connectionManager = connectionManager;
    this.prices = prices;
  }

  public OutboundMessage subscribe(ConnectionContext context, InboundMessage message) {
    Optional<Rejection> throttled =
        rateLimiter.tryAcquire(context.userId(), RateLimitAction.SUBSCRIBE);
    if (throttled.isPresent()) {
      return throttledError(throttled.get());
    }
    Set<String> valid = new LinkedHashSet<>();
    List<String> invalid = new ArrayList<>();
    split(message.node("symbols"), valid, invalid);
    connectionManager.subscribe(context.id(), valid);
    for (String symbol : valid) {
      prices
          .getPrice(symbol)
          .ifPresent(p -> connectionManager.send(context.id(), OutboundMessages.priceUpdate(p)));
    }
    return OutboundMessage.builder(OutboundMessageType.SUBSCRIBED)
        .put("symbols", List.copyOf(valid))
        .put("invalid", invalid)
        .build();
  }

  public OutboundMessage unsubscribe(ConnectionContext context, InboundMessage message) {
    Optional<Rejection> throttled =
        rateLimiter.tryAcquire(context.userId(), RateLimitAction.UNSUBSCRIBE);
    if (throttled.isPresent()) {
      return throttledError(throttled.get());
    }
    Set<String> valid = new LinkedHashSet<>();
    List<String> invalid = new ArrayList<>();
    split(message.node("symbols"), valid, invalid);
    connectionManager.unsubscribe(context.id(), valid);
    return OutboundMessage.builder(OutboundMessageType.UNSUBSCRIBED)
        .put("symbols", List.copyOf(valid))
        .put("invalid", invalid)
        .build();
  }

  private void split(JsonNode symbols, Set<String> valid, List<String> invalid) {
    if (symbols == null || !symbols.isArray()) {
      return;
    }
    for (JsonNode node : symbols) {
      String symbol = InstrumentCatalog.normalizeSymbol(node.asText());
      if (catalog.isSubscribable(symbol)) {
        valid.add(symbol);
      } else {
        invalid.add(node.asText());
      }
    }
  }

  private static OutboundMessage throttledError(Rejection rejection) {
    return OutboundMessage.builder(OutboundMessageType.ERROR)
        .put("message", rejection.message())
        .put("code", rejection.code().name())
        .build();
  }
}
