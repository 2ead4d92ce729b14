package com.proptrading.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proptrading.domain.ledger.AccountOpening;
import com.proptrading.domain.orders.InstrumentCatalog;
import com.proptrading.domain.orders.OrderValidator;
import com.proptrading.domain.positions.MarginCalculator;
import com.proptrading.domain.positions.MarginPolicy;
import com.proptrading.engine.events.KafkaTradeEventSink;
import com.proptrading.engine.events.LoggingTradeEventSink;
import com.proptrading.engine.events.TradeEventSink;
import com.proptrading.engine.gateway.ConnectionManager;
import com.proptrading.engine.gateway.GatewayMessageCodec;
import com.proptrading.engine.ledger.AccountLedger;
import com.proptrading.engine.ledger.AccountSource;
import com.proptrading.engine.ledger.ConfiguredAccountSource;
import com.proptrading.engine.locking.EntityLockRegistry;
import com.proptrading.engine.marketdata.OrderBookRelay;
import com.proptrading.engine.marketdata.PriceTickProcessor;
import com.proptrading.engine.metrics.EngineMetrics;
import com.proptrading.engine.orders.ClientOrderIdRegistry;
import com.proptrading.engine.orders.OrderExecutor;
import com.proptrading.engine.orders.OrderIntakeService;
import com.proptrading.engine.orders.PendingOrderQueue;
import com.proptrading.engine.positions.PositionManager;
import com.proptrading.engine.price.InMemoryPriceSnapshotProvider;
import com.proptrading.engine.ratelimit.RateLimiter;
import com.proptrading.engine.ratelimit.ReplayGuard;
import com.proptrading.engine.risk.AccountRiskMonitor;
import com.proptrading.engine.triggers.TriggerEngine;
import com.proptrading.infra.kafka.producer.EventPublisher;
import com.proptrading.infra.kafka.producer.TradeEventProducer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/** Wires the engine core. Components with no Spring dependencies are built here, not scanned. */
@Configuration
public class EngineConfiguration {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // The kafka module contributes its own mapper; the web layer and the gateway use this one.
  @Bean
  @Primary
  public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
    return builder.createXmlMapper(false).build();
  }

  @Bean
  public InstrumentCatalog instrumentCatalog() {
    return InstrumentCatalog.defaults();
  }

  @Bean
  public OrderValidator orderValidator(InstrumentCatalog catalog) {
    return new OrderValidator(catalog);
  }

  @Bean
  public MarginCalculator marginCalculator(EngineProperties properties) {
    return new MarginCalculator(
        new MarginPolicy(properties.getFeeRate(), properties.getMaintenanceMarginRate()));
  }

  @Bean
  public EngineMetrics engineMetrics(MeterRegistry meterRegistry) {
    return new EngineMetrics(meterRegistry);
  }

  @Bean
  public EntityLockRegistry entityLockRegistry(EngineProperties properties) {
    return new EntityLockRegistry(Duration.ofMillis(properties.getLockWaitMs()));
  }

  @Bean
  public InMemoryPriceSnapshotProvider priceSnapshotProvider(
      Clock clock, EngineProperties properties) {
    return new InMemoryPriceSnapshotProvider(
        clock, Duration.ofMillis(properties.getPriceStaleMs()));
  }

  @Bean
  public AccountSource accountSource(EngineProperties properties) {
    return new ConfiguredAccountSource(properties.getAccounts());
  }

  @Bean
  public AccountLedger accountLedger(Clock clock, AccountSource accountSource) {
    AccountLedger ledger = new AccountLedger(clock);
    for (AccountOpening opening : accountSource.loadAccounts()) {
      ledger.register(opening);
    }
    return ledger;
  }

  @Bean
  public TradeEventProducer tradeEventProducer(
      EventPublisher eventPublisher, EngineProperties properties) {
    return new TradeEventProducer(eventPublisher, properties.getProducerName());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "engine.events",
      name = "sink",
      havingValue = "kafka",
      matchIfMissing = true)
  public TradeEventSink kafkaTradeEventSink(TradeEventProducer producer, EngineMetrics metrics) {
    return new KafkaTradeEventSink(producer, metrics);
  }

  @Bean
  @ConditionalOnProperty(prefix = "engine.events", name = "sink", havingValue = "logging")
  public TradeEventSink loggingTradeEventSink() {
    return new LoggingTradeEventSink();
  }

  @Bean
  public GatewayMessageCodec gatewayMessageCodec(ObjectMapper objectMapper) {
    return new GatewayMessageCodec(objectMapper);
  }

  @Bean
  public ConnectionManager connectionManager(
      GatewayMessageCodec codec, EngineMetrics metrics, Clock clock, EngineProperties properties) {
    EngineProperties.Gateway gateway = properties.getGateway();
    return new ConnectionManager(
        codec, metrics, clock, gateway.getThrottleMs(), gateway.getMaxBufferedBytes());
  }

  @Bean
  public PositionManager positionManager(
      EntityLockRegistry locks,
      AccountLedger ledger,
      MarginCalculator calculator,
      OrderValidator validator,
      InMemoryPriceSnapshotProvider prices,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock) {
    return new PositionManager(
        locks, ledger, calculator, validator, prices, events, metrics, clock);
  }

  @Bean
  public OrderExecutor orderExecutor(
      AccountLedger ledger,
      PositionManager positions,
      MarginCalculator calculator,
      OrderValidator validator,
      InMemoryPriceSnapshotProvider prices,
      EntityLockRegistry locks) {
    return new OrderExecutor(ledger, positions, calculator, validator, prices, locks);
  }

  @Bean
  public PendingOrderQueue pendingOrderQueue(
      EntityLockRegistry locks,
      AccountLedger ledger,
      OrderExecutor executor,
      InMemoryPriceSnapshotProvider prices,
      TradeEventSink events,
      ConnectionManager notifier,
      EngineMetrics metrics,
      Clock clock,
      EngineProperties properties) {
    return new PendingOrderQueue(
        locks,
        ledger,
        executor,
        prices,
        events,
        notifier,
        metrics,
        clock,
        Duration.ofMillis(properties.getPendingOrderTtlMs()),
        Duration.ofMillis(properties.getPendingRetentionMs()));
  }

  @Bean
  public ClientOrderIdRegistry clientOrderIdRegistry(Clock clock, EngineProperties properties) {
    return new ClientOrderIdRegistry(clock, Duration.ofMillis(properties.getDuplicateWindowMs()));
  }

  @Bean
  public OrderIntakeService orderIntakeService(
      RateLimiter rateLimiter,
      ReplayGuard replayGuard,
      OrderValidator validator,
      ClientOrderIdRegistry clientOrderIds,
      InMemoryPriceSnapshotProvider prices,
      OrderExecutor executor,
      PendingOrderQueue queue,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock) {
    return new OrderIntakeService(
        rateLimiter,
        replayGuard,
        validator,
        clientOrderIds,
        prices,
        executor,
        queue,
        events,
        metrics,
        clock);
  }

  @Bean
  public TriggerEngine triggerEngine(
      PositionManager positions,
      InMemoryPriceSnapshotProvider prices,
      ConnectionManager notifier,
      EngineProperties properties) {
    return new TriggerEngine(positions, prices, notifier, properties.getLiquidationWarningRatio());
  }

  @Bean
  public AccountRiskMonitor accountRiskMonitor(
      AccountLedger ledger,
      PositionManager positions,
      PendingOrderQueue queue,
      EntityLockRegistry locks,
      ConnectionManager notifier,
      TradeEventSink events,
      EngineMetrics metrics,
      Clock clock,
      EngineProperties properties) {
    return new AccountRiskMonitor(
        ledger,
        positions,
        queue,
        locks,
        notifier,
        events,
        metrics,
        clock,
        properties.getRiskWarningRatio());
  }

  @Bean
  public PriceTickProcessor priceTickProcessor(
      InMemoryPriceSnapshotProvider prices,
      TriggerEngine triggerEngine,
      PendingOrderQueue queue,
      AccountRiskMonitor riskMonitor,
      ConnectionManager notifier,
      Clock clock) {
    return new PriceTickProcessor(prices, triggerEngine, queue, riskMonitor, notifier, clock);
  }

  @Bean
  public OrderBookRelay orderBookRelay(
      InstrumentCatalog catalog,
      ConnectionManager notifier,
      Clock clock,
      EngineProperties properties) {
    return new OrderBookRelay(catalog, notifier, clock, properties.getOrderBookDepth());
  }
}
