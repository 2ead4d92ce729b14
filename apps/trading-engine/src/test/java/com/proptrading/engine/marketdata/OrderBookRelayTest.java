package com.proptrading.engine.marketdata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.orders.InstrumentCatalog;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import com.proptrading.engine.support.MutableClock;
import com.proptrading.engine.support.RecordingNotifier;
import com.proptrading.infra.kafka.contract.payload.OrderBookSnapshotV1;
import com.proptrading.infra.kafka.contract.payload.OrderBookSnapshotV1.Level;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrderBookRelayTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final RecordingNotifier notifier = new RecordingNotifier();
  private final OrderBookRelay relay =
      new OrderBookRelay(InstrumentCatalog.defaults(), notifier, new MutableClock(NOW), 2);

  @Test
  void shouldRelayTrimmedBookToSymbolSubscribers() {
    boolean relayed =
        relay.onSnapshot(
            snapshot(
                "btcusdt",
                List.of(level("50000", "1.5"), level("49999", "2"), level("49998", "3")),
                List.of(level("50010", "0.7")),
                10L));

    assertTrue(relayed);
    List<RecordingNotifier.Sent> sent = notifier.sent();
    assertEquals(1, sent.size());
    assertEquals("BTCUSDT", sent.get(0).target());
    OutboundMessage message = sent.get(0).message();
    assertEquals(OutboundMessageType.ORDER_BOOK_UPDATE, message.type());
    assertEquals(2, ((List<?>) message.field("bids")).size());
    assertEquals(1, ((List<?>) message.field("asks")).size());
    assertEquals(10L, message.field("lastUpdateId"));
    assertEquals(NOW.toEpochMilli(), message.field("timestamp"));
  }

  @Test
  void shouldDropStaleAndRepeatedUpdates() {
    relay.onSnapshot(snapshot("ETHUSDT", List.of(level("3000", "1")), List.of(), 20L));
    notifier.clear();

    assertFalse(relay.onSnapshot(snapshot("ETHUSDT", List.of(), List.of(), 19L)));
    assertFalse(relay.onSnapshot(snapshot("ETHUSDT", List.of(), List.of(), 20L)));
    assertTrue(notifier.sent().isEmpty());
    assertTrue(relay.onSnapshot(snapshot("ETHUSDT", List.of(), List.of(), 21L)));
  }

  @Test
  void shouldIgnoreUnknownSymbolAndRejectMissingSymbol() {
    assertFalse(relay.onSnapshot(snapshot("FOOUSDT", List.of(), List.of(), 1L)));
    assertTrue(notifier.sent().isEmpty());
    assertThrows(
        IllegalArgumentException.class,
        () -> relay.onSnapshot(snapshot(" ", List.of(), List.of(), 1L)));
  }

  @Test
  void shouldSkipIncompleteLevels() {
    relay.onSnapshot(
        snapshot(
            "SOLUSDT",
            List.of(new Level(null, new BigDecimal("1")), level("150", "4")),
            List.of(),
            5L));

    List<?> bids = (List<?>) notifier.sent().get(0).message().field("bids");
    assertEquals(List.of(List.of(new BigDecimal("150"), new BigDecimal("4"))), bids);
  }

  private static OrderBookSnapshotV1 snapshot(
      String symbol, List<Level> bids, List<Level> asks, long updateId) {
    return new OrderBookSnapshotV1(symbol, bids, asks, updateId, null);
  }

  private static Level level(String price, String quantity) {
    return new Level(new BigDecimal(price), new BigDecimal(quantity));
  }
}
