package com.proptrading.engine.outbound;

public enum OutboundMessageType {
  CONNECTED,
  AUTHENTICATED,
  AUTH_ERROR,
  ORDER_FILLED,
  ORDER_REJECTED,
  ORDER_PENDING,
  ORDER_CANCELLED,
  CANCEL_REJECTED,
  POSITION_MODIFIED,
  MODIFY_REJECTED,
  POSITION_CLOSED,
  CLOSE_REJECTED,
  POSITIONS,
  PENDING_ORDERS,
  PRICE_UPDATE,
  ORDER_BOOK_UPDATE,
  SUBSCRIBED,
  UNSUBSCRIBED,
  LIQUIDATION_WARNING,
  RISK_WARNING,
  ACCOUNT_BREACHED,
  EVALUATION_STEP_PASSED,
  EVALUATION_PASSED,
  PING,
  PONG,
  ERROR;

  /** Market data kinds that are throttled per symbol and skipped for backed-up connections. */
  public boolean isHighFrequency() {
    return this == PRICE_UPDATE || this == ORDER_BOOK_UPDATE;
  }
}
