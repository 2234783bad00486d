package com.netdesk.ticket.websocket;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

/**
 * Maps the live update socket. Authentication happens in the security filter chain
 * before the handshake; {@link LiveUpdateHandshakeConfig} checks the browser origin.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping liveUpdateHandlerMapping(LiveUpdateWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws/live", handler), -1);
    }
}
