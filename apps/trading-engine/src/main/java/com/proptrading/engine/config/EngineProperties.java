package com.proptrading.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
  @NotNull
  @DecimalMin("0")
  private BigDecimal feeRate = new BigDecimal("0.0005");

  @NotNull
  @DecimalMin("0")
  @DecimalMax("1")
  private BigDecimal maintenanceMarginRate = new BigDecimal("0.005");

  @Positive private long priceStaleMs = 5_000L;
  @Positive private long lockWaitMs = 50L;
  @PositiveOrZero private long duplicateWindowMs = 60_000L;
  @PositiveOrZero private long pendingRetentionMs = 300_000L;
  @PositiveOrZero private long pendingOrderTtlMs = 0L;

  @NotNull
  @DecimalMin("0")
  @DecimalMax("1")
  private BigDecimal liquidationWarningRatio = new BigDecimal("0.5");

  @NotNull
  @DecimalMin("0")
  @DecimalMax("1")
  private BigDecimal riskWarningRatio = new BigDecimal("0.8");

  @Positive private int orderBookDepth = 20;
  @NotBlank private String producerName = "trading-engine";
  @Valid private final Gateway gateway = new Gateway();
  @Valid private final Auth auth = new Auth();
  @Valid private final Events events = new Events();
  @Valid private List<SeedAccount> accounts = new ArrayList<>();

  public BigDecimal getFeeRate() {
    return feeRate;
  }

  public void setFeeRate(BigDecimal feeRate) {
    this.feeRate = feeRate;
  }

  public BigDecimal getMaintenanceMarginRate() {
    return maintenanceMarginRate;
  }

  public void setMaintenanceMarginRate(BigDecimal maintenanceMarginRate) {
    this.maintenanceMarginRate = maintenanceMarginRate;
  }

  public long getPriceStaleMs() {
    return priceStaleMs;
  }

  public void setPriceStaleMs(long priceStaleMs) {
    this.priceStaleMs = priceStaleMs;
  }

  public long getLockWaitMs() {
    return lockWaitMs;
  }

  public void setLockWaitMs(long lockWaitMs) {
    this.lockWaitMs = lockWaitMs;
  }

  public long getDuplicateWindowMs() {
    return duplicateWindowMs;
  }

  public void setDuplicateWindowMs(long duplicateWindowMs) {
    this.duplicateWindowMs = duplicateWindowMs;
  }

  public long getPendingRetentionMs() {
    return pendingRetentionMs;
  }

  public void setPendingRetentionMs(long pendingRetentionMs) {
    this.pendingRetentionMs = pendingRetentionMs;
  }

  /** Lifetime of a resting limit order; {@code 0} keeps it until filled or cancelled. */
  public long getPendingOrderTtlMs() {
    return pendingOrderTtlMs;
  }

  public void setPendingOrderTtlMs(long pendingOrderTtlMs) {
    this.pendingOrderTtlMs = pendingOrderTtlMs;
  }

  public BigDecimal getLiquidationWarningRatio() {
    return liquidationWarningRatio;
  }

  public void setLiquidationWarningRatio(BigDecimal liquidationWarningRatio) {
    this.liquidationWarningRatio = liquidationWarningRatio;
  }

  public BigDecimal getRiskWarningRatio() {
    return riskWarningRatio;
  }

  public void setRiskWarningRatio(BigDecimal riskWarningRatio) {
    this.riskWarningRatio = riskWarningRatio;
  }

  public int getOrderBookDepth() {
    return orderBookDepth;
  }

  public void setOrderBookDepth(int orderBookDepth) {
    this.orderBookDepth = orderBookDepth;
  }

  public String getProducerName() {
    return producerName;
  }

  public void setProducerName(String producerName) {
    this.producerName = producerName;
  }

  public Gateway getGateway() {
    return gateway;
  }

  public Auth getAuth() {
    return auth;
  }

  public Events getEvents() {
    return events;
  }

  public List<SeedAccount> getAccounts() {
    return accounts;
  }

  public void setAccounts(List<SeedAccount> accounts) {
    this.accounts = accounts;
  }

  public static class Gateway {
    @NotBlank private String path = "/ws";
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    @PositiveOrZero private long throttleMs = 50L;
    @Positive private int maxBufferedBytes = 65_536;
    @Positive private int sendBufferLimitBytes = 1_048_576;
    @Positive private int sendTimeLimitMs = 10_000;
    @Positive private long heartbeatIntervalMs = 30_000L;
    @Positive private long heartbeatTimeoutMs = 90_000L;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }

    public long getThrottleMs() {
      return throttleMs;
    }

    public void setThrottleMs(long throttleMs) {
      this.throttleMs = throttleMs;
    }

    public int getMaxBufferedBytes() {
      return maxBufferedBytes;
    }

    public void setMaxBufferedBytes(int maxBufferedBytes) {
      this.maxBufferedBytes = maxBufferedBytes;
    }

    public int getSendBufferLimitBytes() {
      return sendBufferLimitBytes;
    }

    public void setSendBufferLimitBytes(int sendBufferLimitBytes) {
      this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public long getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getHeartbeatTimeoutMs() {
      return heartbeatTimeoutMs;
    }

    public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) {
      this.heartbeatTimeoutMs = heartbeatTimeoutMs;
    }
  }

  /** Either {@code jwkSetUri} or an HMAC {@code secret} of at least 32 bytes must be set. */
  public static class Auth {
    private String jwkSetUri;
    private String secret;
    @NotBlank private String userIdClaim = "userId";

    public String getJwkSetUri() {
      return jwkSetUri;
    }

    public void setJwkSetUri(String jwkSetUri) {
      this.jwkSetUri = jwkSetUri;
    }

    public String getSecret() {
      return secret;
    }

    public void setSecret(String secret) {
      this.secret = secret;
    }

    public String getUserIdClaim() {
      return userIdClaim;
    }

    public void setUserIdClaim(String userIdClaim) {
      this.userIdClaim = userIdClaim;
    }
  }

  public static class Events {
    @NotBlank private String sink = "kafka";
    private boolean priceConsumerEnabled = true;
    private boolean orderBookConsumerEnabled = true;

    public String getSink() {
      return sink;
    }

    public void setSink(String sink) {
      this.sink = sink;
    }

    public boolean isPriceConsumerEnabled() {
      return priceConsumerEnabled;
    }

    public void setPriceConsumerEnabled(boolean priceConsumerEnabled) {
      this.priceConsumerEnabled = priceConsumerEnabled;
    }

    public boolean isOrderBookConsumerEnabled() {
      return orderBookConsumerEnabled;
    }

    public void setOrderBookConsumerEnabled(boolean orderBookConsumerEnabled) {
      this.orderBookConsumerEnabled = orderBookConsumerEnabled;
    }
  }

  public static class SeedAccount {
    @NotBlank private String id;
    @NotBlank private String userId;
    private String status = "ACTIVE";
    @NotNull @Positive private BigDecimal startingBalance;
    private BigDecimal currentBalance;
    private BigDecimal dailyLossLimit;
    private BigDecimal maxDrawdownLimit;
    private int majorMaxLeverage = 100;
    private int altcoinMaxLeverage = 50;
    /** Unset for funded accounts, which have no profit target. */
    private BigDecimal profitTargetPercent;
    @Positive private int evaluationStep = 1;
    @Positive private int evaluationSteps = 1;
    @PositiveOrZero private int minTradingDays = 0;
    @PositiveOrZero private int tradingDays = 0;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public String getUserId() {
      return userId;
    }

    public void setUserId(String userId) {
      this.userId = userId;
    }

    public String getStatus() {
      return status;
    }

    public void setStatus(String status) {
      this.status = status;
    }

    public BigDecimal getStartingBalance() {
      return startingBalance;
    }

    public void setStartingBalance(BigDecimal startingBalance) {
      this.startingBalance = startingBalance;
    }

    public BigDecimal getCurrentBalance() {
      return currentBalance;
    }

    public void setCurrentBalance(BigDecimal currentBalance) {
      this.currentBalance = currentBalance;
    }

    public BigDecimal getDailyLossLimit() {
      return dailyLossLimit;
    }

    public void setDailyLossLimit(BigDecimal dailyLossLimit) {
      this.dailyLossLimit = dailyLossLimit;
    }

    public BigDecimal getMaxDrawdownLimit() {
      return maxDrawdownLimit;
    }

    public void setMaxDrawdownLimit(BigDecimal maxDrawdownLimit) {
      this.maxDrawdownLimit = maxDrawdownLimit;
    }

    public int getMajorMaxLeverage() {
      return majorMaxLeverage;
    }

    public void setMajorMaxLeverage(int majorMaxLeverage) {
      this.majorMaxLeverage = majorMaxLeverage;
    }

    public int getAltcoinMaxLeverage() {
      return altcoinMaxLeverage;
    }

    public void setAltcoinMaxLeverage(int altcoinMaxLeverage) {
      this.altcoinMaxLeverage = altcoinMaxLeverage;
    }

    public BigDecimal getProfitTargetPercent() {
      return profitTargetPercent;
    }

    public void setProfitTargetPercent(BigDecimal profitTargetPercent) {
      this.profitTargetPercent = profitTargetPercent;
    }

    public int getEvaluationStep() {
      return evaluationStep;
    }

    public void setEvaluationStep(int evaluationStep) {
      this.evaluationStep = evaluationStep;
    }

    public int getEvaluationSteps() {
      return evaluationSteps;
    }

    public void setEvaluationSteps(int evaluationSteps) {
      this.evaluationSteps = evaluationSteps;
    }

    public int getMinTradingDays() {
      return minTradingDays;
    }

    public void setMinTradingDays(int minTradingDays) {
      this.minTradingDays = minTradingDays;
    }

    public int getTradingDays() {
      return tradingDays;
    }

    public void setTradingDays(int tradingDays) {
      this.tradingDays = tradingDays;
    }
  }
}
