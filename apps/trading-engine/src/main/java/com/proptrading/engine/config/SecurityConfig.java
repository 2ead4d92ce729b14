package com.proptrading.engine.config;

import java.nio.charset.StandardCharsets;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.web.SecurityFilterChain;

/**
 * The WebSocket upgrade is open; clients authenticate over the socket with an {@code AUTH} frame
 * that is checked by the same {@link JwtDecoder} guarding the HTTP endpoints.
 */
@Configuration
public class SecurityConfig {
  private static final int MIN_SECRET_BYTES = 32;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, EngineProperties properties)
      throws Exception {
    String wsPath = properties.getGateway().getPath();
    return http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        wsPath, "/actuator/health", "/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> {}))
        .build();
  }

  /** JWK set when configured, otherwise a shared HMAC secret. */
  @Bean
  public JwtDecoder jwtDecoder(EngineProperties properties) {
    EngineProperties.Auth auth = properties.getAuth();
    if (auth.getJwkSetUri() != null && !auth.getJwkSetUri().isBlank()) {
      return NimbusJwtDecoder.withJwkSetUri(auth.getJwkSetUri()).build();
    }
    String secret = auth.getSecret();
    if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "engine.auth.secret must be at least "
              + MIN_SECRET_BYTES
              + " bytes when engine.auth.jwk-set-uri is not set");
    }
    SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }
}
