package com.netdesk.ticket.web.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Payload received from the back office when a ticket is opened on behalf of a client.
 */
public class TicketRequest {

    @NotNull
    private UUID clientId;

    @NotBlank
    @Size(max = 255)
    private String subject;

    @NotBlank
    private String description;

    @Size(max = 32)
    private String priority;

    public TicketRequest() {
    }

    public TicketRequest(UUID clientId, String subject, String description, String priority) {
        this.clientId = clientId;
        this.subject = subject;
        this.description = description;
        this.priority = priority;
    }

    public UUID getClientId() {
        return clientId;
    }

    public void setClientId(UUID clientId) {
        this.clientId = clientId;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }
}
