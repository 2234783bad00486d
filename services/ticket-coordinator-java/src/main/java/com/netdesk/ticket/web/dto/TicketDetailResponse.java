package com.netdesk.ticket.web.dto;

import java.util.List;

public record TicketDetailResponse(TicketResponse ticket, List<TicketMessageResponse> messages) {
}
