package com.netdesk.ticket.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Persistent representation of a support ticket.
 *
 * <p>The id is generated by the store. {@code ticketNumber} is a cosmetic sequence
 * shown to humans and is never written by the service.</p>
 *
 * <p>Assignment rule: a ticket in {@link TicketStatus#OPEN} never has an assigned
 * technician. Moving a ticket to any other status keeps (or claims) the assignment,
 * moving it back to open releases it.</p>
 */
@Table("tickets")
public class Ticket {

    @Id
    private UUID id;

    @ReadOnlyProperty
    @Column("ticket_number")
    private Long ticketNumber;

    @Column("client_id")
    private UUID clientId;

    private TicketStatus status;

    private String priority;

    private String subject;

    private String description;

    @Column("assigned_tech_id")
    private UUID assignedTechId;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    public Ticket() {
        // default constructor required by Spring Data
    }

    public Ticket(
        UUID id,
        Long ticketNumber,
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
        this.ticketNumber = ticketNumber;
        this.clientId = clientId;
        this.status = status;
        this.priority = priority;
        this.subject = subject;
        this.description = description;
        this.assignedTechId = assignedTechId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Ticket newTicket(UUID clientId, String subject, String description, String priority, Instant now) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(description, "description must not be null");
        return new Ticket(
            null,
            null,
            clientId,
            TicketStatus.OPEN,
            priority == null || priority.isBlank() ? "normal" : priority,
            subject,
            description,
            null,
            now,
            now
        );
    }

    public boolean isAssigned() {
        return assignedTechId != null;
    }

    /**
     * True when another technician holds the ticket; such a technician may not
     * reply to it or change its status.
     */
    public boolean isAssignedToOther(UUID techId) {
        return assignedTechId != null && !assignedTechId.equals(techId);
    }

    /**
     * Assigns the ticket. An open ticket cannot be held, so claiming it moves it to pending.
     */
    public void claimBy(UUID techId, Instant now) {
        this.assignedTechId = Objects.requireNonNull(techId, "techId must not be null");
        if (status == TicketStatus.OPEN) {
            status = TicketStatus.PENDING;
        }
        this.updatedAt = now;
    }

    /**
     * Applies a status change. Reopening clears the assignment unconditionally.
     */
    public void changeStatus(TicketStatus newStatus, Instant now) {
        this.status = Objects.requireNonNull(newStatus, "status must not be null");
        if (newStatus == TicketStatus.OPEN) {
            this.assignedTechId = null;
        }
        this.updatedAt = now;
    }

    /**
     * A technician reply moves a fresh ticket to pending; other statuses stay as they are.
     */
    public void recordTechnicianReply(Instant now) {
        if (status == TicketStatus.OPEN) {
            status = TicketStatus.PENDING;
        }
        this.updatedAt = now;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    /**
     * Human-facing reference: the sequence number when the store assigned one,
     * otherwise the last six characters of the id.
     */
    public String shortReference() {
        if (ticketNumber != null && ticketNumber > 0) {
            return "#" + ticketNumber;
        }
        if (id == null) {
            return "#new";
        }
        String raw = id.toString();
        return "#" + raw.substring(raw.length() - 6);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Long getTicketNumber() {
        return ticketNumber;
    }

    public void setTicketNumber(Long ticketNumber) {
        this.ticketNumber = ticketNumber;
    }

    public UUID getClientId() {
        return clientId;
    }

    public void setClientId(UUID clientId) {
        this.clientId = clientId;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public void setStatus(TicketStatus status) {
        this.status = status;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
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

    public UUID getAssignedTechId() {
        return assignedTechId;
    }

    public void setAssignedTechId(UUID assignedTechId) {
        this.assignedTechId = assignedTechId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
