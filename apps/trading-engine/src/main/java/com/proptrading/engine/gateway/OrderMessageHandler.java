package com.proptrading.engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.proptrading.domain.orders.OrderRequest;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.orders.OrderIntakeService;
import com.proptrading.engine.orders.PendingOrderQueue;
import com.proptrading.engine.orders.PlaceOrderResult;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.outbound.OutboundMessages;
import org.springframework.stereotype.Component;

@Component
public class OrderMessageHandler {
  private final OrderIntakeService intake;
  private final PendingOrderQueue queue;
  private final AccountLedger ledger;
  private final ConnectionManager connectionManager;
  private final GatewayMessageCodec codec;

  public OrderMessageHandler(
      OrderIntakeService intake,
      PendingOrderQueue queue,
      AccountLedger ledger,
      ConnectionManager connectionManager,
      GatewayMessageCodec codec) {
    this.intake = intake;
    this.queue = queue;
    this.ledger = ledger;
    this.connectionManager = connectionManager;
    this.codec = codec;
  }

  public OutboundMessage placeOrder(ConnectionContext context, InboundMessage message) {
    JsonNode data = message.node("data");
    OrderRequest request;
    try {
      request = codec.read(data, OrderRequest.class);
    } catch (MalformedMessageException ex) {
      String clientOrderId =
          data != null && data.hasNonNull("clientOrderId")
              ? data.get("clientOrderId").asText()
              : null;
      return OutboundMessages.orderRejected(
          clientOrderId, Rejection.of(RejectionCode.MALFORMED_MESSAGE, "Invalid order format"));
    }
    bindAccount(context, request.accountId());
    PlaceOrderResult result = intake.placeOrder(context.userId(), request);
    return result.toMessage();
  }

  public OutboundMessage cancelOrder(ConnectionContext context, InboundMessage message) {
    String orderId = message.text("orderId");
    try {
      PendingOrder cancelled = intake.cancelOrder(context.userId(), orderId);
      return OutboundMessages.orderCancelled(cancelled, "Cancelled by user");
    } catch (EngineRejectionException ex) {
      return OutboundMessages.rejected(
          OutboundMessageType.CANCEL_REJECTED, "orderId", orderId, ex.rejection());
    }
  }

  public OutboundMessage pendingOrders(ConnectionContext context, InboundMessage message) {
    String accountId = message.text("accountId");
    if (!ledger.isOwnedBy(accountId, context.userId())) {
      return OutboundMessages.error("Account not found");
    }
    bindAccount(context, accountId);
    return OutboundMessages.pendingOrders(accountId, queue.pendingForAccount(accountId));
  }

  /** Account-scoped pushes follow the connection once it acts on an account it owns. */
  private void bindAccount(ConnectionContext context, String accountId) {
    if (accountId != null && ledger.isOwnedBy(accountId, context.userId())) {
      connectionManager.setAccount(context.id(), accountId);
    }
  }
}
