package com.netdesk.ticket.web.dto;

import java.time.Instant;
import java.util.UUID;

import com.netdesk.ticket.domain.SenderType;

public record TicketMessageResponse(
    UUID id,
    SenderType senderType,
    String senderId,
    String content,
    String mediaUrl,
    Instant createdAt
) {
}
