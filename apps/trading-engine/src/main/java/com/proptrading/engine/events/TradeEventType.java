package com.proptrading.engine.events;

public enum TradeEventType {
  ORDER_PLACED,
  ORDER_PENDING,
  ORDER_CANCELLED,
  ORDER_EXPIRED,
  POSITION_OPENED,
  POSITION_PARTIALLY_CLOSED,
  POSITION_CLOSED,
  TP_MODIFIED,
  SL_MODIFIED,
  TP_TRIGGERED,
  SL_TRIGGERED,
  LIQUIDATION_TRIGGERED,
  FUNDING_APPLIED,
  ACCOUNT_BREACHED,
  STEP1_PASSED,
  EVALUATION_PASSED,
  DAILY_RESET
}
