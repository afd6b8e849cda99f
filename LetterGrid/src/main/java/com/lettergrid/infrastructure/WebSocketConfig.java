package com.lettergrid.infrastructure;

import com.lettergrid.interfaces.ws.RealtimeSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final RealtimeSocketHandler handler;

  @Value("${lettergrid.allowed-origins:*}")
  private String allowedOrigins;

  public WebSocketConfig(RealtimeSocketHandler handler) {
    this.handler = handler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry r) {
    String[] origins = allowedOrigins.split("\\s*,\\s*");
    r.addHandler(handler, "/ws").setAllowedOriginPatterns(origins);
  }
}
