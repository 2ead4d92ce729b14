package com.proptrading.engine.risk;

public enum BreachReason {
  DAILY_LOSS,
  MAX_DRAWDOWN
}
