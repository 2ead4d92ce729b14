package com.proptrading.engine.gateway;

import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.outbound.OutboundMessages;
import com.proptrading.engine.positions.CloseOutcome;
import com.proptrading.engine.positions.PositionManager;
import com.proptrading.engine.price.PriceSnapshot;
import com.proptrading.engine.price.PriceSnapshotProvider;
import com.proptrading.engine.ratelimit.RateLimitAction;
import com.proptrading.engine.ratelimit.RateLimiter;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class PositionMessageHandler {
  private final PositionManager positions;
  private final PriceSnapshotProvider prices;
  private final AccountLedger ledger;
  private final RateLimiter rateLimiter;
  private final ConnectionManager connectionManager;
  private final GatewayMessageCodec codec;

  public PositionMessageHandler(
      PositionManager positions,
      PriceSnapshotProvider prices,
      AccountLedger ledger,
      RateLimiter rateLimiter,
      ConnectionManager connectionManager,
      GatewayMessageCodec codec) {
    this.positions = positions;
    this.prices = prices;
    this.ledger = ledger;
    this.rateLimiter = rateLimiter;
    this.connectionManager = connectionManager;
    this.codec = codec;
  }

  public OutboundMessage modify(ConnectionContext context, InboundMessage message) {
    String positionId = message.text("positionId");
    try {
      requireAllowed(context, RateLimitAction.MODIFY_POSITION);
      BigDecimal takeProfit = codec.decimal(message, "takeProfit");
      BigDecimal stopLoss = codec.decimal(message, "stopLoss");
      Position updated =
          positions.modifyProtectiveLevels(context.userId(), positionId, takeProfit, stopLoss);
      return OutboundMessages.positionModified(updated);
    } catch (EngineRejectionException ex) {
      return OutboundMessages.rejected(
          OutboundMessageType.MODIFY_REJECTED, "positionId", positionId, ex.rejection());
    }
  }

  public OutboundMessage close(ConnectionContext context, InboundMessage message) {
    String positionId = message.text("positionId");
    String accountId = message.text("accountId");
    try {
      requireAllowed(context, RateLimitAction.CLOSE_POSITION);
      BigDecimal quantity = codec.decimal(message, "quantity");
      CloseOutcome outcome = positions.close(context.userId(), accountId, positionId, quantity);
      if (accountId != null) {
        connectionManager.setAccount(context.id(), accountId);
      }
      return OutboundMessages.positionClosed(outcome);
    } catch (EngineRejectionException ex) {
      return OutboundMessages.rejected(
          OutboundMessageType.CLOSE_REJECTED, "positionId", positionId, ex.rejection());
    }
  }

  public OutboundMessage list(ConnectionContext context, InboundMessage message) {
    String accountId = message.text("accountId");
    if (!ledger.isOwnedBy(accountId, context.userId())) {
      return OutboundMessages.error("Account not found");
    }
    connectionManager.setAccount(context.id(), accountId);
    List<Position> open = positions.positionsForAccount(accountId);
    Map<String, PriceSnapshot> latest = new HashMap<>();
    for (Position position : open) {
      prices.getPrice(position.symbol()).ifPresent(p -> latest.put(p.symbol(), p));
    }
    return OutboundMessages.positions(accountId, open, latest);
  }

  private void requireAllowed(ConnectionContext context, RateLimitAction action) {
    Optional<Rejection> throttled = rateLimiter.tryAcquire(context.userId(), action);
    if (throttled.isPresent()) {
      throw new EngineRejectionException(throttled.get());
    }
  }
}
