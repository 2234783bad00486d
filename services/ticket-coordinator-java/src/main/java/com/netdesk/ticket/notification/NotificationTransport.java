package com.netdesk.ticket.notification;

import reactor.core.publisher.Mono;

/**
 * One way of getting a {@link TicketEvent} to the other processes of the deployment.
 */
public interface NotificationTransport {

    String name();

    /**
     * Completes once the event was handed over, errors when the transport is unavailable.
     */
    Mono<Void> send(TicketEvent event);
}
