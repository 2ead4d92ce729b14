package com.proptrading.engine.gateway;

import com.proptrading.engine.config.EngineProperties;
import com.proptrading.engine.outbound.OutboundMessage;
import com.proptrading.engine.outbound.OutboundMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/** Verifies the bearer token of an {@code AUTH} frame and binds the connection to its user. */
@Component
public class AuthMessageHandler {
  private static final Logger log = LoggerFactory.getLogger(AuthMessageHandler.class);

  private final JwtDecoder jwtDecoder;
  private final ConnectionManager connectionManager;
  private final String userIdClaim;

  public AuthMessageHandler(
      JwtDecoder jwtDecoder, ConnectionManager connectionManager, EngineProperties properties) {
    this.jwtDecoder = jwtDecoder;
    this.connectionManager = connectionManager;
    this.userIdClaim = properties.getAuth().getUserIdClaim();
  }

  public OutboundMessage authenticate(ConnectionContext context, InboundMessage message) {
    String token = message.text("token");
    if (token == null || token.isBlank()) {
      return authError("Token required");
    }
    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtException ex) {
      log.info("Rejected token connectionId={}: {}", context.id(), ex.getMessage());
      return authError("Invalid token");
    }
    String userId = userIdOf(jwt);
    if (userId == null || userId.isBlank()) {
      return authError("Token has no user");
    }
    connectionManager.setUser(context.id(), userId);
    log.info("Authenticated connectionId={} userId={}", context.id(), userId);
    return OutboundMessage.builder(OutboundMessageType.AUTHENTICATED)
        .put("userId", userId)
        .put("message", "Authentication successful")
        .build();
  }

  private String userIdOf(Jwt jwt) {
    String claim = userIdClaim == null ? null : jwt.getClaimAsString(userIdClaim);
    return claim != null && !claim.isBlank() ? claim : jwt.getSubject();
  }

  private static OutboundMessage authError(String reason) {
    return OutboundMessage.builder(OutboundMessageType.AUTH_ERROR).put("message", reason).build();
  }
}
