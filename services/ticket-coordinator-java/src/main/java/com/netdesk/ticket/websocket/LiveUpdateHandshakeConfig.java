package com.netdesk.ticket.websocket;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.socket.server.WebSocketService;

@Configuration
@EnableConfigurationProperties(LiveUpdateProperties.class)
public class LiveUpdateHandshakeConfig implements WebFluxConfigurer {

    private final LiveUpdateProperties properties;

    public LiveUpdateHandshakeConfig(LiveUpdateProperties properties) {
        this.properties = properties;
    }

    @Override
    public WebSocketService getWebSocketService() {
        return new OriginCheckingWebSocketService(properties.getAllowedOrigins());
    }
}
