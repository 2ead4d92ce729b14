package com.proptrading.engine.gateway;

import static com.proptrading.engine.support.DecimalAssertions.assertDecimalEquals;
import static com.proptrading.engine.support.EngineFixture.ACCOUNT;
import static com.proptrading.engine.support.EngineFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proptrading.engine.config.EngineProperties;
import com.proptrading.engine.support.EngineFixture;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

@ExtendWith(MockitoExtension.class)
class MessageDispatcherTest {
  private static final String CONNECTION = "conn-1";

  @Mock private JwtDecoder jwtDecoder;

  private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
  private EngineFixture engine;
  private ConnectionManager connections;
  private MessageDispatcher dispatcher;
  private FakeClientConnection client;

  @BeforeEach
  void setUp() {
    engine = new EngineFixture();
    GatewayMessageCodec codec = new GatewayMessageCodec(objectMapper);
    connections = new ConnectionManager(codec, engine.metrics, engine.clock, 50, 65536);
    dispatcher =
        new MessageDispatcher(
            connections,
            codec,
            new AuthMessageHandler(jwtDecoder, connections, new EngineProperties()),
            new OrderMessageHandler(
                engine.intake, engine.queue, engine.ledger, connections, codec),
            new PositionMessageHandler(
                engine.positions,
                engine.prices,
                engine.ledger,
                engine.rateLimiter,
                connections,
                codec),
            new SubscriptionMessageHandler(
                engine.catalog, engine.rateLimiter, connections, engine.prices),
            engine.clock);
    client = new FakeClientConnection(CONNECTION);
    connections.add(client);
  }

  @Test
  void shouldAnswerInvalidJsonWithError() throws Exception {
    dispatcher.dispatch(CONNECTION, "{not json");

    JsonNode reply = lastReply();
    assertEquals("ERROR", reply.get("type").asText());
    assertEquals("Invalid message format", reply.get("message").asText());
  }

  @Test
  void shouldEchoUnknownMessageType() throws Exception {
    dispatcher.dispatch(CONNECTION, "{\"type\":\"TELEPORT\"}");

    JsonNode reply = lastReply();
    assertEquals("Unknown message type", reply.get("message").asText());
    assertEquals("TELEPORT", reply.get("messageType").asText());
  }

  @Test
  void shouldRequireAuthenticationForTrading() throws Exception {
    dispatcher.dispatch(CONNECTION, placeOrderFrame("c-1"));

    JsonNode reply = lastReply();
    assertEquals("ERROR", reply.get("type").asText());
    assertEquals("Not authenticated", reply.get("message").asText());
    assertTrue(engine.positions.positionsForAccount(ACCOUNT).isEmpty());
  }

  @Test
  void shouldAnswerPingWithoutAuthentication() throws Exception {
    dispatcher.dispatch(CONNECTION, "{\"type\":\"PING\"}");

    JsonNode reply = lastReply();
    assertEquals("PONG", reply.get("type").asText());
    assertEquals(engine.clock.millis(), reply.get("timestamp").asLong());
  }

  @Test
  void shouldAuthenticateWithUserIdClaim() throws Exception {
    when(jwtDecoder.decode("good-token")).thenReturn(jwt(USER));

    dispatcher.dispatch(CONNECTION, "{\"type\":\"AUTH\",\"token\":\"good-token\"}");

    JsonNode reply = lastReply();
    assertEquals("AUTHENTICATED", reply.get("type").asText());
    assertEquals(USER, reply.get("userId").asText());
    assertEquals(USER, connections.find(CONNECTION).orElseThrow().userId());
  }

  @Test
  void shouldRejectInvalidToken() throws Exception {
    when(jwtDecoder.decode(anyString())).thenThrow(new BadJwtException("signature mismatch"));

    dispatcher.dispatch(CONNECTION, "{\"type\":\"AUTH\",\"token\":\"forged\"}");

    JsonNode reply = lastReply();
    assertEquals("AUTH_ERROR", reply.get("type").asText());
    assertEquals("Invalid token", reply.get("message").asText());
    assertFalse(connections.find(CONNECTION).orElseThrow().isAuthenticated());
  }

  @Test
  void shouldRequireToken() throws Exception {
    dispatcher.dispatch(CONNECTION, "{\"type\":\"AUTH\"}");

    assertEquals("Token required", lastReply().get("message").asText());
  }

  @Test
  void shouldFillMarketOrderAndBindAccount() throws Exception {
    authenticate();
    engine.tick("BTCUSDT", "50000", "50010");

    dispatcher.dispatch(CONNECTION, placeOrderFrame("c-1"));

    JsonNode reply = lastReply();
    assertEquals("ORDER_FILLED", reply.get("type").asText());
    assertEquals("c-1", reply.get("clientOrderId").asText());
    assertDecimalEquals("50010", reply.get("executionPrice").decimalValue());
    assertDecimalEquals("9949.73995", reply.at("/account/availableMargin").decimalValue());
    assertEquals(ACCOUNT, connections.find(CONNECTION).orElseThrow().accountId());
  }

  @Test
  void shouldRejectOrderWithoutData() throws Exception {
    authenticate();

    dispatcher.dispatch(CONNECTION, "{\"type\":\"PLACE_ORDER\"}");

    JsonNode reply = lastReply();
    assertEquals("ORDER_REJECTED", reply.get("type").asText());
    assertEquals("MALFORMED_MESSAGE", reply.get("code").asText());
  }

  @Test
  void shouldCloseFilledPosition() throws Exception {
    authenticate();
    engine.tick("BTCUSDT", "50000", "50010");
    dispatcher.dispatch(CONNECTION, placeOrderFrame("c-1"));
    String positionId = engine.positions.positionsForAccount(ACCOUNT).get(0).id();
    engine.tick("BTCUSDT", "51000", "51010");

    dispatcher.dispatch(
        CONNECTION,
        "{\"type\":\"CLOSE_POSITION\",\"accountId\":\""
            + ACCOUNT
            + "\",\"positionId\":\""
            + positionId
            + "\"}");

    JsonNode reply = lastReply();
    assertEquals("POSITION_CLOSED", reply.get("type").asText());
    assertDecimalEquals("9.39495", reply.get("netPnl").decimalValue());
    assertDecimalEquals("10009.39495", reply.at("/account/currentBalance").decimalValue());
  }

  @Test
  void shouldRejectCancelOfUnknownOrder() throws Exception {
    authenticate();

    dispatcher.dispatch(CONNECTION, "{\"type\":\"CANCEL_ORDER\",\"orderId\":\"nope\"}");

    JsonNode reply = lastReply();
    assertEquals("CANCEL_REJECTED", reply.get("type").asText());
    assertEquals("ORDER_NOT_FOUND", reply.get("code").asText());
  }

  @Test
  void shouldHideAccountsOfOtherUsers() throws Exception {
    authenticate();

    dispatcher.dispatch(CONNECTION, "{\"type\":\"GET_POSITIONS\",\"accountId\":\"acc-other\"}");

    assertEquals("Account not found", lastReply().get("message").asText());
  }

  @Test
  void shouldSubscribeValidSymbolsAndPushSnapshot() throws Exception {
    authenticate();
    engine.tick("BTCUSDT", "50000", "50010");

    dispatcher.dispatch(CONNECTION, "{\"type\":\"SUBSCRIBE\",\"symbols\":[\"btcusdt\",\"NOPE\"]}");

    assertEquals(3, client.sent().size());
    JsonNode snapshot = objectMapper.readTree(client.sent().get(1));
    assertEquals("PRICE_UPDATE", snapshot.get("type").asText());
    assertDecimalEquals("50000", snapshot.get("bid").decimalValue());
    JsonNode reply = lastReply();
    assertEquals("SUBSCRIBED", reply.get("type").asText());
    assertEquals("BTCUSDT", reply.get("symbols").get(0).asText());
    assertEquals("NOPE", reply.get("invalid").get(0).asText());
    assertEquals(1, connections.subscriberCount("BTCUSDT"));
  }

  private void authenticate() {
    when(jwtDecoder.decode("good-token")).thenReturn(jwt(USER));
    dispatcher.dispatch(CONNECTION, "{\"type\":\"AUTH\",\"token\":\"good-token\"}");
    client.clear();
  }

  private String placeOrderFrame(String clientOrderId) {
    return "{\"type\":\"PLACE_ORDER\",\"data\":{\"clientOrderId\":\""
        + clientOrderId
        + "\",\"accountId\":\""
        + ACCOUNT
        + "\",\"symbol\":\"BTCUSDT\",\"side\":\"LONG\",\"type\":\"MARKET\","
        + "\"quantity\":0.01,\"leverage\":10,\"timestamp\":"
        + engine.clock.millis()
        + "}}";
  }

  private JsonNode lastReply() throws Exception {
    return objectMapper.readTree(client.last());
  }

  private static Jwt jwt(String userId) {
    Instant issuedAt = Instant.parse("2026-03-02T09:59:00Z");
    return Jwt.withTokenValue("good-token")
        .header("alg", "HS256")
        .subject("subject-" + userId)
        .claim("userId", userId)
        .issuedAt(issuedAt)
        .expiresAt(issuedAt.plusSeconds(3600))
        .build();
  }
}
