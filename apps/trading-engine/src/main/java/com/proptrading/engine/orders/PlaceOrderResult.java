package com.proptrading.engine.orders;

import com.proptrading.domain.ledger.AccountSnapshot;
import com.proptrading.domain.orders.PendingOrder;
import com.proptrading.domain.orders.Rejection;
import com.proptrading.domain.positions.Position;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessages;
import java.math.BigDecimal;
import java.time.Instant;

public record PlaceOrderResult(
    Outcome outcome,
    String clientOrderId,
    Position position,
    AccountSnapshot account,
    BigDecimal executionPrice,
    Instant executedAt,
    PendingOrder pendingOrder,
    BigDecimal currentPrice,
    Rejection rejection) {

  public enum Outcome {
    FILLED,
    PENDING,
    REJECTED
  }

  static PlaceOrderResult filled(
      String clientOrderId, ExecutionResult execution, Instant executedAt) {
    return new PlaceOrderResult(
        Outcome.FILLED,
        clientOrderId,
        execution.position(),
        execution.account(),
        execution.executionPrice(),
        executedAt,
        null,
        null,
        null);
  }

  static PlaceOrderResult pending(PendingOrder order, BigDecimal currentPrice) {
    return new PlaceOrderResult(
        Outcome.PENDING,
        order.clientOrderId(),
        null,
        null,
        null,
        null,
        order,
        currentPrice,
        null);
  }

  static PlaceOrderResult rejected(String clientOrderId, Rejection rejection) {
    return new PlaceOrderResult(
        Outcome.REJECTED, clientOrderId, null, null, null, null, null, null, rejection);
  }

  public OutboundMessage toMessage() {
    return switch (outcome) {
      case FILLED -> OutboundMessages.orderFilled(
          clientOrderId, position, account, executionPrice, executedAt, false);
      case PENDING -> OutboundMessages.orderPending(pendingOrder, currentPrice);
      case REJECTED -> OutboundMessages.orderRejected(clientOrderId, rejection);
    };
  }
}
