package com.netdesk.ticket.web.dto;

import java.util.List;

public record TicketPageResponse(List<TicketResponse> items, long total, int page, int size) {
}
