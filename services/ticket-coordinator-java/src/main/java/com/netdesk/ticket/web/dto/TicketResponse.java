package com.netdesk.ticket.web.dto;

import java.time.Instant;
import java.util.UUID;

import com.netdesk.ticket.domain.TicketStatus;

/**
 * API response returned for ticket queries and mutations.
 */
public class TicketResponse {

    private final UUID id;
    private final String reference;
    private final UUID clientId;
    private final TicketStatus status;
    private final String priority;
    private final String subject;
    private final String description;
    private final UUID assignedTechId;
    private final Instant createdAt;
    private final Instant updatedAt;

    public TicketResponse(
        UUID id,
        String reference,
        UUID clientId,
        TicketStatus status,
        String priority,
        String subject,
        String description,
        UUID assignedTechId,
        Instant createdAt,
        Instant updatedAt
    ) {
        this.id = id;
        this.reference = reference;
        this.clientId = clientId;
        this.status = status;
        this.priority = priority;
        this.subject = subject;
        this.description = description;
        this.assignedTechId = assignedTechId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() {
        return id;
    }

    public String getReference() {
        return reference;
    }

    public UUID getClientId() {
        return clientId;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public String getPriority() {
        return priority;
    }

    public String getSubject() {
        return subject;
    }

    public String getDescription() {
        return description;
    }

    public UUID getAssignedTechId() {
        return assignedTechId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
