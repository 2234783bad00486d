package com.netdesk.ticket.service;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a technician acts on a ticket another technician holds. Mapped to 403
 * so clients can tell it apart from a missing ticket.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class OwnershipConflictException extends RuntimeException {

    private final UUID ticketId;

    public OwnershipConflictException(UUID ticketId, UUID techId) {
        super("Ticket %s is assigned to another technician than %s".formatted(ticketId, techId));
        this.ticketId = ticketId;
    }

    public UUID getTicketId() {
        return ticketId;
    }
}
