package com.netdesk.ticket.service;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a ticket id does not exist. Spring WebFlux maps it to a
 * 404 response via {@link org.springframework.web.bind.annotation.ResponseStatus}.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TicketNotFoundException extends RuntimeException {

    public TicketNotFoundException(UUID id) {
        super("Ticket with id %s not found".formatted(id));
    }

    public TicketNotFoundException(String reference) {
        super("Ticket %s not found".formatted(reference));
    }
}
