package io.livclinic.clinic.realtime;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  public static final String UPDATES_PATH = "/ws/updates";

  private final RealtimeWebSocketHandler realtimeWebSocketHandler;
  private final RealtimeProperties properties;

  public WebSocketConfig(
      RealtimeWebSocketHandler realtimeWebSocketHandler, RealtimeProperties properties) {
    this.realtimeWebSocketHandler = realtimeWebSocketHandler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(realtimeWebSocketHandler, UPDATES_PATH)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
