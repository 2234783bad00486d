package com.netdesk.ticket.websocket;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

/**
 * Handshake service that refuses upgrades from browser origins outside the configured
 * list with 403. Scheme and a trailing slash are ignored when comparing.
 */
public class OriginCheckingWebSocketService extends HandshakeWebSocketService {

    private static final Logger log = LoggerFactory.getLogger(OriginCheckingWebSocketService.class);

    private final List<String> allowedOrigins;

    public OriginCheckingWebSocketService(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins.stream().map(OriginCheckingWebSocketService::normalize).toList();
    }

    @Override
    public Mono<Void> handleRequest(ServerWebExchange exchange, WebSocketHandler handler) {
        String origin = exchange.getRequest().getHeaders().getOrigin();
        if (origin != null && !isAllowed(origin)) {
            log.warn("Refused live update socket from untrusted origin {}", origin);
            exchange.getResponse().setStatusCode(HttpStatus.FORBIDDEN);
            return exchange.getResponse().setComplete();
        }
        return super.handleRequest(exchange, handler);
    }

    boolean isAllowed(String origin) {
        return allowedOrigins.contains(normalize(origin));
    }

    private static String normalize(String origin) {
        String value = origin.trim().toLowerCase(Locale.ROOT);
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        int scheme = value.indexOf("://");
        return scheme < 0 ? value : value.substring(scheme + 3);
    }
}
