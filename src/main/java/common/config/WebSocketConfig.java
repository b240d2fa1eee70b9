package common.config;

import controller.TelemetryRelayHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 注册 Moonraker 代理端点
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TelemetryRelayHandler telemetryRelayHandler;

    public WebSocketConfig(TelemetryRelayHandler telemetryRelayHandler) {
        this.telemetryRelayHandler = telemetryRelayHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(telemetryRelayHandler, "/websocket").setAllowedOrigins("*");
    }
}
