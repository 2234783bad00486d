package com.netdesk.ticket.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One entry of a ticket's conversation. Messages are append-only and are read back
 * in {@code created_at} order.
 */
@Table("ticket_messages")
public class TicketMessage {

    @Id
    private UUID id;

    @Column("ticket_id")
    private UUID ticketId;

    @Column("sender_type")
    private SenderType senderType;

    @Column("sender_id")
    private String senderId;

    private String content;

    @Column("media_url")
    private String mediaUrl;

    @Column("created_at")
    private Instant createdAt;

    public TicketMessage() {
        // default constructor required by Spring Data
    }

    public TicketMessage(
        UUID id,
        UUID ticketId,
        SenderType senderType,
        String senderId,
        String content,
        String mediaUrl,
        Instant createdAt
    ) {
        this.id = id;
        this.ticketId = ticketId;
        this.senderType = senderType;
        this.senderId = senderId;
        this.content = content;
        this.mediaUrl = mediaUrl;
        this.createdAt = createdAt;
    }

    public static TicketMessage fromTechnician(UUID ticketId, UUID techId, String content, String mediaUrl, Instant now) {
        Objects.requireNonNull(techId, "techId must not be null");
        return newMessage(ticketId, SenderType.TECH, techId.toString(), content, mediaUrl, now);
    }

    public static TicketMessage fromClient(UUID ticketId, String clientContact, String content, String mediaUrl, Instant now) {
        return newMessage(ticketId, SenderType.CLIENT, clientContact, content, mediaUrl, now);
    }

    private static TicketMessage newMessage(
        UUID ticketId,
        SenderType senderType,
        String senderId,
        String content,
        String mediaUrl,
        Instant now
    ) {
        Objects.requireNonNull(ticketId, "ticketId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        return new TicketMessage(null, ticketId, senderType, senderId, content, mediaUrl, now);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getTicketId() {
        return ticketId;
    }

    public void setTicketId(UUID ticketId) {
        this.ticketId = ticketId;
    }

    public SenderType getSenderType() {
        return senderType;
    }

    public void setSenderType(SenderType senderType) {
        this.senderType = senderType;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public void setMediaUrl(String mediaUrl) {
        this.mediaUrl = mediaUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
