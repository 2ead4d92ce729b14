package com.proptrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceTickV1(
    String symbol, BigDecimal bid, BigDecimal ask, BigDecimal fundingRate, Instant timestamp) {}
