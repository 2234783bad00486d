package com.netdesk.ticket.repository;

import java.util.UUID;

import com.netdesk.ticket.domain.TicketStatus;

/**
 * Optional listing filters; {@code null} members are ignored.
 *
 * @param status   only tickets in this status
 * @param clientId only tickets owned by this client
 * @param search   case-insensitive match on subject or description
 */
public record TicketFilter(TicketStatus status, UUID clientId, String search) {

    public static TicketFilter none() {
        return new TicketFilter(null, null, null);
    }

    public static TicketFilter forClient(UUID clientId) {
        return new TicketFilter(null, clientId, null);
    }

    public static TicketFilter forStatus(TicketStatus status) {
        return new TicketFilter(status, null, null);
    }
}
