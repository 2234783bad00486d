package com.netdesk.ticket.service;

import java.util.List;

import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketMessage;

/**
 * A ticket together with its conversation in chronological order.
 */
public record TicketDetail(Ticket ticket, List<TicketMessage> messages) {
}
