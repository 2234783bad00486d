package com.netdesk.ticket.web;

import java.net.URI;
import java.util.Locale;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketView;
import com.netdesk.ticket.service.NewTicket;
import com.netdesk.ticket.service.TicketService;
import com.netdesk.ticket.web.dto.TicketDetailResponse;
import com.netdesk.ticket.web.dto.TicketPageResponse;
import com.netdesk.ticket.web.dto.TicketReplyRequest;
import com.netdesk.ticket.web.dto.TicketRequest;
import com.netdesk.ticket.web.dto.TicketResponse;
import com.netdesk.ticket.web.dto.TicketStatusRequest;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * HTTP API used by technicians in the back office. The acting technician is the
 * {@code sub} claim of the access token.
 */
@RestController
@RequestMapping(path = "/api/tickets", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketController {

    private static final int MAX_PAGE_SIZE = 100;

    private final TicketService ticketService;
    private final TicketMapper ticketMapper;

    public TicketController(TicketService ticketService, TicketMapper ticketMapper) {
        this.ticketService = ticketService;
        this.ticketMapper = ticketMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TicketResponse>> createTicket(@Valid @RequestBody TicketRequest request) {
        NewTicket newTicket = new NewTicket(
            request.getClientId(),
            request.getSubject(),
            request.getDescription(),
            request.getPriority()
        );
        return ticketService.createTicket(newTicket)
            .map(ticketMapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/tickets/" + response.getId()))
                .body(response));
    }

    @GetMapping
    public Mono<TicketPageResponse> listTickets(
        @RequestParam(required = false) String status,
        @RequestParam(required = false) UUID clientId,
        @RequestParam(required = false) String search,
        @RequestParam(defaultValue = "technician") String view,
        @RequestParam(defaultValue = "0") int page,
        @RequestParam(defaultValue = "20") int size
    ) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE));
        }
        TicketFilter filter = new TicketFilter(parseStatus(status), clientId, search);
        return ticketService.list(filter, parseView(view), page, size)
            .map(ticketMapper::toResponse);
    }

    @GetMapping("/{id}")
    public Mono<TicketDetailResponse> getTicket(@PathVariable UUID id) {
        return ticketService.getTicketDetail(id)
            .map(ticketMapper::toResponse);
    }

    @PostMapping(path = "/{id}/reply", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> reply(
        @PathVariable UUID id,
        @Valid @RequestBody TicketReplyRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        return ticketService.reply(id, technicianId(jwt), request.getContent(), request.getMediaUrl())
            .map(ticketMapper::toResponse);
    }

    @PutMapping(path = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> updateStatus(
        @PathVariable UUID id,
        @Valid @RequestBody TicketStatusRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        return ticketService.setStatus(id, technicianId(jwt), request.getStatus())
            .map(ticketMapper::toResponse);
    }

    @PostMapping("/{id}/claim")
    public Mono<TicketResponse> claim(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        return ticketService.claim(id, technicianId(jwt))
            .map(ticketMapper::toResponse);
    }

    private static UUID technicianId(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED);
        }
        try {
            return UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Token subject is not a technician id", e);
        }
    }

    private static TicketStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TicketStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static TicketView parseView(String view) {
        try {
            return TicketView.valueOf(view.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown view '%s'".formatted(view), e);
        }
    }
}
