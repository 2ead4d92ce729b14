package com.proptrading.engine.gateway;

import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.outbound.EngineNotifier;
import com.proptrading.engine.outbound.OutboundMessage;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Registry of live connections with user, account and symbol indices, and the delivery path for
 * everything the engine sends.
 *
 * <p>High-frequency market data is throttled per symbol and kind: within a throttle window only
 * the latest message is kept and it goes out at the next window boundary. Such messages are also
 * skipped for a connection whose outbound buffer is over the limit. A failed send removes the
 * connection; delivery errors never reach the caller.
 */
public class ConnectionManager implements EngineNotifier {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final Map<String, ConnectionContext> connections = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> accountConnections = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> symbolSubscribers = new ConcurrentHashMap<>();
  private final Map<String, Long> lastBroadcastMs = new ConcurrentHashMap<>();
  private final Map<String, PendingBroadcast> pendingBroadcasts = new ConcurrentHashMap<>();

  private final GatewayMessageCodec codec;
  private final EngineMetrics metrics;
  private final Clock clock;
  private final long throttleMs;
  private final int maxBufferedBytes;

  public ConnectionManager(
      GatewayMessageCodec codec,
      EngineMetrics metrics,
      Clock clock,
      long throttleMs,
      int maxBufferedBytes) {
    this.codec = codec;
    this.metrics = metrics;
    this.clock = clock;
    this.throttleMs = throttleMs;
    this.maxBufferedBytes = maxBufferedBytes;
  }

  public ConnectionContext add(ClientConnection transport) {
    ConnectionContext context = new ConnectionContext(transport, clock.instant());
    connections.put(transport.id(), context);
    log.debug("Connection added connectionId={}", transport.id());
    return context;
  }

  public void remove(String connectionId) {
    ConnectionContext context = connections.remove(connectionId);
    if (context == null) {
      return;
    }
    unindex(userConnections, context.userId(), connectionId);
    unindex(accountConnections, context.accountId(), connectionId);
    for (String symbol : context.subscriptions()) {
      unindex(symbolSubscribers, symbol, connectionId);
    }
    log.debug("Connection removed connectionId={} userId={}", connectionId, context.userId());
  }

  public Optional<ConnectionContext> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  public void setUser(String connectionId, String userId) {
    ConnectionContext context = connections.get(connectionId);
    if (context == null) {
      return;
    }
    unindex(userConnections, context.userId(), connectionId);
    context.userId(userId);
    index(userConnections, userId, connectionId);
  }

  public void setAccount(String connectionId, String accountId) {
    ConnectionContext context = connections.get(connectionId);
    if (context == null || accountId == null || accountId.equals(context.accountId())) {
      return;
    }
    unindex(accountConnections, context.accountId(), connectionId);
    context.accountId(accountId);
    index(accountConnections, accountId, connectionId);
  }

  public void subscribe(String connectionId, Collection<String> symbols) {
    ConnectionContext context = connections.get(connectionId);
    if (context == null) {
      return;
    }
    for (String symbol : symbols) {
      context.mutableSubscriptions().add(symbol);
      index(symbolSubscribers, symbol, connectionId);
    }
  }

  public void unsubscribe(String connectionId, Collection<String> symbols) {
    ConnectionContext context = connections.get(connectionId);
    if (context == null) {
      return;
    }
    for (String symbol : symbols) {
      context.mutableSubscriptions().remove(symbol);
      unindex(symbolSubscribers, symbol, connectionId);
    }
  }

  public boolean send(String connectionId, OutboundMessage message) {
    ConnectionContext context = connections.get(connectionId);
    if (context == null) {
      return false;
    }
    return deliver(context, codec.encode(message), message);
  }

  @Override
  public void sendToUser(String userId, OutboundMessage message) {
    deliverToAll(userConnections.get(userId), message);
  }

  @Override
  public void sendToAccount(String accountId, OutboundMessage message) {
    deliverToAll(accountConnections.get(accountId), message);
  }

  @Override
  public void broadcastToSubscribers(String symbol, OutboundMessage message) {
    if (!message.type().isHighFrequency()) {
      deliverToAll(symbolSubscribers.get(symbol), message);
      return;
    }
    String key = symbol + ":" + message.type().name();
    if (!claimWindow(key)) {
      pendingBroadcasts.put(key, new PendingBroadcast(symbol, message));
      return;
    }
    pendingBroadcasts.remove(key);
    deliverToAll(symbolSubscribers.get(symbol), message);
  }

  public void broadcastAll(OutboundMessage message) {
    deliverToAll(connections.keySet(), message);
  }

  /** Sends throttled messages whose window has elapsed. */
  @Scheduled(fixedDelayString = "${engine.gateway.throttle-ms:50}")
  public void flushPendingBroadcasts() {
    for (Map.Entry<String, PendingBroadcast> entry : pendingBroadcasts.entrySet()) {
      String key = entry.getKey();
      PendingBroadcast pending = entry.getValue();
      if (claimWindow(key) && pendingBroadcasts.remove(key, pending)) {
        deliverToAll(symbolSubscribers.get(pending.symbol()), pending.message());
      }
    }
  }

  public Collection<ConnectionContext> connections() {
    return List.copyOf(connections.values());
  }

  public int connectionCount() {
    return connections.size();
  }

  public int authenticatedCount() {
    return (int) connections.values().stream().filter(ConnectionContext::isAuthenticated).count();
  }

  public int subscriberCount(String symbol) {
    Set<String> subscribers = symbolSubscribers.get(symbol);
    return subscribers == null ? 0 : subscribers.size();
  }

  int pendingBroadcastCount() {
    return pendingBroadcasts.size();
  }

  private boolean claimWindow(String key) {
    long nowMs = clock.millis();
    boolean[] claimed = {false};
    lastBroadcastMs.compute(
        key,
        (ignored, last) -> {
          if (last == null || nowMs - last >= throttleMs) {
            claimed[0] = true;
            return nowMs;
          }
          return last;
        });
    return claimed[0];
  }

  private void deliverToAll(Set<String> connectionIds, OutboundMessage message) {
    if (connectionIds == null || connectionIds.isEmpty()) {
      return;
    }
    String payload = codec.encode(message);
    for (String connectionId : new ArrayList<>(connectionIds)) {
      ConnectionContext context = connections.get(connectionId);
      if (context != null) {
        deliver(context, payload, message);
      }
    }
  }

  private boolean deliver(ConnectionContext context, String payload, OutboundMessage message) {
    ClientConnection transport = context.transport();
    if (message.type().isHighFrequency() && transport.bufferedBytes() > maxBufferedBytes) {
      metrics.broadcastDropped(message.type().name(), "backpressure");
      return false;
    }
    try {
      transport.send(payload);
      return true;
    } catch (IOException | RuntimeException ex) {
      log.warn(
          "Send failed, dropping connectionId={} type={}: {}",
          context.id(),
          message.type(),
          ex.getMessage());
      metrics.broadcastDropped(message.type().name(), "send_failure");
      remove(context.id());
      transport.close();
      return false;
    }
  }

  private static void index(Map<String, Set<String>> index, String key, String connectionId) {
    if (key == null) {
      return;
    }
    index.compute(
        key,
        (ignored, ids) -> {
          Set<String> target = ids == null ? ConcurrentHashMap.newKeySet() : ids;
          target.add(connectionId);
          return target;
        });
  }

  private static void unindex(Map<String, Set<String>> index, String key, String connectionId) {
    if (key == null) {
      return;
    }
    index.computeIfPresent(
        key,
        (ignored, ids) -> {
          ids.remove(connectionId);
          return ids.isEmpty() ? null : ids;
        });
  }

  private record PendingBroadcast(String symbol, OutboundMessage message) {}
}
