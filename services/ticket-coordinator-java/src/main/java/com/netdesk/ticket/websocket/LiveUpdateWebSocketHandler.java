package com.netdesk.ticket.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netdesk.ticket.notification.LiveUpdateBroadcaster;
import com.netdesk.ticket.notification.TicketEvent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Streams ticket events to a browser session as JSON text frames and answers the
 * client's {@code ping} keep-alive with {@code pong}.
 */
@Component
public class LiveUpdateWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveUpdateWebSocketHandler.class);

    private final LiveUpdateBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    public LiveUpdateWebSocketHandler(LiveUpdateBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Flux<WebSocketMessage> pongs = session.receive()
            .map(WebSocketMessage::getPayloadAsText)
            .filter(text -> "ping".equalsIgnoreCase(text.trim()))
            .map(text -> session.textMessage("pong"));

        Flux<WebSocketMessage> events = broadcaster.events()
            .concatMap(this::encode)
            .map(session::textMessage);

        log.debug("Live session {} opened", session.getId());
        return session.send(Flux.merge(events, pongs))
            .doFinally(signal -> log.debug("Live session {} closed ({})", session.getId(), signal));
    }

    private Mono<String> encode(TicketEvent event) {
        try {
            return Mono.just(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not encode {} for ticket {}: {}", event.type(), event.ticketId(), e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
