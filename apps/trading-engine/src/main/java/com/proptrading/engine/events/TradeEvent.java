package com.proptrading.engine.events;

import com.proptrading.domain.orders.OrderSide;
import com.proptrading.domain.positions.CloseReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Immutable audit record of one engine state change. */
public record TradeEvent(
    String id,
    TradeEventType type,
    String accountId,
    String userId,
    String positionId,
    String orderId,
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal marginUsed,
    BigDecimal fee,
    BigDecimal realizedPnl,
    BigDecimal fundingFee,
    BigDecimal balanceAfter,
    CloseReason closeReason,
    Instant occurredAt) {
  public TradeEvent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(accountId, "accountId must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
  }

  public static Builder builder(TradeEventType type, String accountId, Instant occurredAt) {
    return new Builder(type, accountId, occurredAt);
  }

  public static final class Builder {
    private final TradeEventType type;
    private final String accountId;
    private final Instant occurredAt;
    private String userId;
    private String positionId;
    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal marginUsed;
    private BigDecimal fee;
    private BigDecimal realizedPnl;
    private BigDecimal fundingFee;
    private BigDecimal balanceAfter;
    private CloseReason closeReason;

    private Builder(TradeEventType type, String accountId, Instant occurredAt) {
      this.type = type;
      this.accountId = accountId;
      this.occurredAt = occurredAt;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder positionId(String positionId) {
      this.positionId = positionId;
      return this;
    }

    public Builder orderId(String orderId) {
      this.orderId = orderId;
      return this;
    }

    public Builder instrument(String symbol, OrderSide side) {
      this.symbol = symbol;
      this.side = side;
      return this;
    }

    public Builder fill(BigDecimal quantity, BigDecimal price) {
      this.quantity = quantity;
      this.price = price;
      return this;
    }

    public Builder marginUsed(BigDecimal marginUsed) {
      this.marginUsed = marginUsed;
      return this;
    }

    public Builder fee(BigDecimal fee) {
      this.fee = fee;
      return this;
    }

    public Builder realizedPnl(BigDecimal realizedPnl) {
      this.realizedPnl = realizedPnl;
      return this;
    }

    public Builder fundingFee(BigDecimal fundingFee) {
      this.fundingFee = fundingFee;
      return this;
    }

    public Builder balanceAfter(BigDecimal balanceAfter) {
      this.balanceAfter = balanceAfter;
      return this;
    }

    public Builder closeReason(CloseReason closeReason) {
      this.closeReason = closeReason;
      return this;
    }

    public TradeEvent build() {
      return new TradeEvent(
          UUID.randomUUID().toString(),
          type,
          accountId,
          userId,
          positionId,
          orderId,
          symbol,
          side,
          quantity,
          price,
          marginUsed,
          fee,
          realizedPnl,
          fundingFee,
          balanceAfter,
          closeReason,
          occurredAt);
    }
  }
}
