package com.netdesk.ticket.service;

import java.util.List;

import com.netdesk.ticket.domain.Ticket;

public record TicketPage(List<Ticket> items, long total, int page, int size) {
}
