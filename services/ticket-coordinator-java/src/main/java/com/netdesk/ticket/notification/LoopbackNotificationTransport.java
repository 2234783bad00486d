package com.netdesk.ticket.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Degraded transport: posts the event to the monitor endpoint of the web process on
 * this host. Only sessions connected to that process see the event.
 */
@Component(LoopbackNotificationTransport.NAME)
public class LoopbackNotificationTransport implements NotificationTransport {

    public static final String NAME = "loopbackNotificationTransport";

    private static final Logger log = LoggerFactory.getLogger(LoopbackNotificationTransport.class);

    private final WebClient webClient;
    private final String fallbackUrl;

    public LoopbackNotificationTransport(WebClient.Builder builder, IntegrationProperties properties) {
        this.fallbackUrl = properties.getNotifications().getFallbackUrl();
        this.webClient = builder.build();
    }

    @Override
    public String name() {
        return "loopback";
    }

    @Override
    public Mono<Void> send(TicketEvent event) {
        return webClient.post()
            .uri(fallbackUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .doOnNext(response -> log.debug("Monitor endpoint answered {} for ticket {}",
                response.getStatusCode(), event.ticketId()))
            .then();
    }
}
