package com.proptrading.infra.kafka.contract.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

/** Audit record of one engine state change. Optional fields are omitted when absent. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradeEventV1(
    String eventId,
    String type,
    String accountId,
    String userId,
    String positionId,
    String orderId,
    String symbol,
    String side,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal marginUsed,
    BigDecimal fee,
    BigDecimal realizedPnl,
    BigDecimal fundingFee,
    BigDecimal balanceAfter,
    String closeReason,
    Instant occurredAt) {}
