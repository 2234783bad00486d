package com.netdesk.ticket.repository;

import org.springframework.data.domain.Sort;

/**
 * Who is looking at a ticket list. Technicians see the most recently touched
 * tickets first, clients see their newest tickets first.
 */
public enum TicketView {
    TECHNICIAN(Sort.by(Sort.Direction.DESC, "updatedAt")),
    CLIENT(Sort.by(Sort.Direction.DESC, "createdAt"));

    private final Sort sort;

    TicketView(Sort sort) {
        this.sort = sort;
    }

    public Sort sort() {
        return sort;
    }
}
