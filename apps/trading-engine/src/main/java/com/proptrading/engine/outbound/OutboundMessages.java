package com.proptrading.engine.outbound;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.positions.ClosedTrade;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.positions.CloseOutcome;
import com.proptrading.engine.price.PriceSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds the client-facing frames and the views of domain objects they embed. */
public final class OutboundMessages {
  private OutboundMessages() {}

  public static OutboundMessage orderFilled(
      String clientOrderId,
      Position position,
      AccountSnapshot account,
      BigDecimal executionPrice,
      Instant executionTime,
      boolean filledFromQueue) {
    OutboundMessage.Builder builder =
        OutboundMessage.builder(OutboundMessageType.ORDER_FILLED)
            .put("clientOrderId", clientOrderId)
            .put("orderId", position.id())
            .put("position", positionView(position, null))
            .put("account", accountView(account))
            .put("executionPrice", executionPrice)
            .put("executionTime", executionTime);
    if (filledFromQueue) {
      builder.put("filledFromQueue", true);
    }
    return builder.build();
  }

  public static OutboundMessage orderRejected(String clientOrderId, Rejection rejection) {
    return OutboundMessage.builder(OutboundMessageType.ORDER_REJECTED)
        .put("clientOrderId", clientOrderId)
        .put("reason", rejection.message())
        .put("code", rejection.code().name())
        .build();
  }

  public static OutboundMessage orderPending(PendingOrder order, BigDecimal currentPrice) {
    return OutboundMessage.builder(OutboundMessageType.ORDER_PENDING)
        .put("clientOrderId", order.clientOrderId())
        .put("orderId", order.id())
        .put("symbol", order.symbol())
        .put("side", order.side().name())
        .put("quantity", order.quantity())
        .put("limitPrice", order.limitPrice())
        .put("marginReserved", order.marginReserved())
        .put("currentPrice", currentPrice)
        .build();
  }

  public static OutboundMessage orderCancelled(PendingOrder order, String reason) {
    return OutboundMessage.builder(OutboundMessageType.ORDER_CANCELLED)
        .put("orderId", order.id())
        .put("clientOrderId", order.clientOrderId())
        .put("status", order.status().name())
        .put("marginReleased", order.marginReserved())
        .put("reason", reason)
        .build();
  }

  public static OutboundMessage rejected(
      OutboundMessageType type, String idField, String id, Rejection rejection) {
    return OutboundMessage.builder(type)
        .put(idField, id)
        .put("reason", rejection.message())
        .put("code", rejection.code().name())
        .build();
  }

  public static OutboundMessage positionModified(Position position) {
    return OutboundMessage.builder(OutboundMessageType.POSITION_MODIFIED)
        .put("positionId", position.id())
        .put("takeProfit", position.takeProfit())
        .put("stopLoss", position.stopLoss())
        .put("message", "Position updated")
        .build();
  }

  public static OutboundMessage positionClosed(CloseOutcome outcome) {
    ClosedTrade trade = outcome.trade();
    return OutboundMessage.builder(OutboundMessageType.POSITION_CLOSED)
        .put("positionId", trade.positionId())
        .put("tradeId", trade.tradeId())
        .put("symbol", trade.symbol())
        .put("reason", trade.closeReason().name())
        .put("closedQuantity", trade.closedQuantity())
        .put("remainingQuantity", trade.remainingQuantity())
        .put("exitPrice", trade.exitPrice())
        .put("grossPnl", trade.grossPnl())
        .put("netPnl", trade.realizedPnl())
        .put("fees", trade.entryFeeShare().add(trade.exitFee()))
        .put("funding", trade.fundingShare())
        .put("account", accountView(outcome.account()))
        .build();
  }

  public static OutboundMessage positions(
      String accountId, List<Position> positions, Map<String, PriceSnapshot> prices) {
    List<Map<String, Object>> views =
        positions.stream().map(p -> positionView(p, prices.get(p.symbol()))).toList();
    return OutboundMessage.builder(OutboundMessageType.POSITIONS)
        .put("accountId", accountId)
        .put("positions", views)
        .put("count", views.size())
        .build();
  }

  public static OutboundMessage pendingOrders(String accountId, List<PendingOrder> orders) {
    List<Map<String, Object>> views = orders.stream().map(OutboundMessages::pendingView).toList();
    return OutboundMessage.builder(OutboundMessageType.PENDING_ORDERS)
        .put("accountId", accountId)
        .put("orders", views)
        .put("count", views.size())
        .build();
  }

  public static OutboundMessage priceUpdate(PriceSnapshot snapshot) {
    return OutboundMessage.builder(OutboundMessageType.PRICE_UPDATE)
        .put("symbol", snapshot.symbol())
        .put("bid", snapshot.bid())
        .put("ask", snapshot.ask())
        .put("spread", snapshot.spread())
        .put("midPrice", snapshot.mid())
        .put("timestamp", snapshot.timestamp().toEpochMilli())
        .build();
  }

  /** Each level is a {@code [price, quantity]} pair. */
  public static OutboundMessage orderBookUpdate(
      String symbol,
      List<List<BigDecimal>> bids,
      List<List<BigDecimal>> asks,
      long lastUpdateId,
      Instant timestamp) {
    return OutboundMessage.builder(OutboundMessageType.ORDER_BOOK_UPDATE)
        .put("symbol", symbol)
        .put("bids", bids)
        .put("asks", asks)
        .put("lastUpdateId", lastUpdateId)
        .put("timestamp", timestamp.toEpochMilli())
        .build();
  }

  public static OutboundMessage liquidationWarning(
      Position position, BigDecimal price, BigDecimal distanceRatio) {
    return OutboundMessage.builder(OutboundMessageType.LIQUIDATION_WARNING)
        .put("positionId", position.id())
        .put("symbol", position.symbol())
        .put("currentPrice", price)
        .put("liquidationPrice", position.liquidationPrice())
        .put("distanceRatio", distanceRatio)
        .put("message", "Position is approaching its liquidation price")
        .build();
  }

  public static OutboundMessage error(String message) {
    return OutboundMessage.builder(OutboundMessageType.ERROR).put("message", message).build();
  }

  public static Map<String, Object> accountView(AccountSnapshot account) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("id", account.accountId());
    view.put("status", account.status().name());
    view.put("currentBalance", account.currentBalance());
    view.put("availableMargin", account.availableMargin());
    view.put("totalMarginUsed", account.totalMarginUsed());
    view.put("reservedMargin", account.reservedMargin());
    view.put("dailyPnl", account.dailyPnl());
    return view;
  }

  /** Adds live P&L figures when a price is supplied. */
  public static Map<String, Object> positionView(Position position, PriceSnapshot price) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("id", position.id());
    view.put("accountId", position.accountId());
    view.put("symbol", position.symbol());
    view.put("side", position.side().name());
    view.put("quantity", position.quantity());
    view.put("entryPrice", position.entryPrice());
    view.put("leverage", position.leverage());
    view.put("marginUsed", position.marginUsed());
    view.put("takeProfit", position.takeProfit());
    view.put("stopLoss", position.stopLoss());
    view.put("liquidationPrice", position.liquidationPrice());
    view.put("accruedFunding", position.accruedFunding());
    view.put("status", position.status().name());
    view.put("openedAt", position.openedAt());
    if (price != null) {
      BigDecimal exit = price.exitPrice(position.side());
      view.put("currentPrice", exit);
      view.put("unrealizedPnl", position.unrealizedPnl(exit));
      view.put("roe", position.roePercent(exit));
    }
    return view;
  }

  public static Map<String, Object> pendingView(PendingOrder order) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("orderId", order.id());
    view.put("clientOrderId", order.clientOrderId());
    view.put("accountId", order.accountId());
    view.put("symbol", order.symbol());
    view.put("side", order.side().name());
    view.put("quantity", order.quantity());
    view.put("limitPrice", order.limitPrice());
    view.put("leverage", order.leverage());
    view.put("takeProfit", order.takeProfit());
    view.put("stopLoss", order.stopLoss());
    view.put("marginReserved", order.marginReserved());
    view.put("status", order.status().name());
    view.put("createdAt", order.createdAt());
    view.put("expiresAt", order.expiresAt());
    return view;
  }
}
