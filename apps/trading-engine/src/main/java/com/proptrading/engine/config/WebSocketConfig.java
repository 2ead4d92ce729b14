package com.proptrading.engine.config;

import com.proptrading.engine.gateway.TradingWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final TradingWebSocketHandler handler;
  private final EngineProperties properties;

  public WebSocketConfig(TradingWebSocketHandler handler, EngineProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    EngineProperties.Gateway gateway = properties.getGateway();
    registry
        .addHandler(handler, gateway.getPath())
        .setAllowedOriginPatterns(gateway.getAllowedOrigins().toArray(String[]::new));
  }
}
