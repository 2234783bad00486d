package com.netdesk.ticket.web.dto;

import com.netdesk.ticket.domain.TicketStatus;

import jakarta.validation.constraints.NotNull;

/**
 * Payload for moving a ticket to another status.
 */
public class TicketStatusRequest {

    @NotNull
    private TicketStatus status;

    public TicketStatusRequest() {
    }

    public TicketStatusRequest(TicketStatus status) {
        this.status = status;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public void setStatus(TicketStatus status) {
        this.status = status;
    }
}
