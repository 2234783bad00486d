package com.netdesk.ticket.service;

import java.util.UUID;

/**
 * Input of {@link TicketService#createTicket(NewTicket)}, shared by the HTTP API and
 * the client chat feed.
 */
public record NewTicket(UUID clientId, String subject, String description, String priority) {
}
