package com.netdesk.ticket.web;

import org.springframework.stereotype.Component;

import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketMessage;
import com.netdesk.ticket.service.TicketDetail;
import com.netdesk.ticket.service.TicketPage;
import com.netdesk.ticket.web.dto.TicketDetailResponse;
import com.netdesk.ticket.web.dto.TicketMessageResponse;
import com.netdesk.ticket.web.dto.TicketPageResponse;
import com.netdesk.ticket.web.dto.TicketResponse;

/**
 * Centralises conversion between persistence objects and API DTOs so the shape of
 * responses stays consistent across controllers.
 */
@Component
public class TicketMapper {

    public TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
            ticket.getId(),
            ticket.shortReference(),
            ticket.getClientId(),
            ticket.getStatus(),
            ticket.getPriority(),
            ticket.getSubject(),
            ticket.getDescription(),
            ticket.getAssignedTechId(),
            ticket.getCreatedAt(),
            ticket.getUpdatedAt()
        );
    }

    public TicketMessageResponse toResponse(TicketMessage message) {
        return new TicketMessageResponse(
            message.getId(),
            message.getSenderType(),
            message.getSenderId(),
            message.getContent(),
            message.getMediaUrl(),
            message.getCreatedAt()
        );
    }

    public TicketDetailResponse toResponse(TicketDetail detail) {
        return new TicketDetailResponse(
            toResponse(detail.ticket()),
            detail.messages().stream().map(this::toResponse).toList()
        );
    }

    public TicketPageResponse toResponse(TicketPage page) {
        return new TicketPageResponse(
            page.items().stream().map(this::toResponse).toList(),
            page.total(),
            page.page(),
            page.size()
        );
    }
}
