package com.proptrading.engine.gateway;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Per-connection session state held by the {@link ConnectionManager}. */
public final class ConnectionContext {
  private final ClientConnection transport;
  private final Instant connectedAt;
  private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
  private volatile String userId;
  private volatile String accountId;
  private volatile Instant lastPongAt;

  ConnectionContext(ClientConnection transport, Instant connectedAt) {
    this.transport = transport;
    this.connectedAt = connectedAt;
    this.lastPongAt = connectedAt;
  }

  public String id() {
    return transport.id();
  }

  public ClientConnection transport() {
    return transport;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public boolean isAuthenticated() {
    return userId != null;
  }

  public String userId() {
    return userId;
  }

  public String accountId() {
    return accountId;
  }

  public Instant lastPongAt() {
    return lastPongAt;
  }

  public Set<String> subscriptions() {
    return Set.copyOf(subscriptions);
  }

  public void markPong(Instant at) {
    lastPongAt = at;
  }

  void userId(String userId) {
    this.userId = userId;
  }

  void accountId(String accountId) {
    this.accountId = accountId;
  }

  Set<String> mutableSubscriptions() {
    return subscriptions;
  }
}
