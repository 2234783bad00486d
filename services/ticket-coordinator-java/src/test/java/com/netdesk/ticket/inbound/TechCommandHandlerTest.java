package com.netdesk.ticket.inbound;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.netdesk.ticket.domain.Technician;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.repository.TechnicianRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketView;
import com.netdesk.ticket.service.OwnershipConflictException;
import com.netdesk.ticket.service.TicketNotFoundException;
import com.netdesk.ticket.service.TicketPage;
import com.netdesk.ticket.service.TicketService;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("Technician command handler")
class TechCommandHandlerTest {

    private static final UUID TECH_ID = UUID.fromString("00000000-0000-0000-0000-00000000e00a");
    private static final UUID TICKET_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private TechnicianRepository technicianRepository;
    @Mock
    private TicketService ticketService;
    @Mock
    private ChatResponder responder;

    private TechCommandHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(technicianRepository.findByTelegramChatId("9001"))
            .thenReturn(Mono.just(new Technician(TECH_ID, "tom", "9001")));
        lenient().when(technicianRepository.findByTelegramChatId("6666")).thenReturn(Mono.empty());
        lenient().when(responder.reply(any(), anyString())).thenReturn(Mono.empty());
        handler = new TechCommandHandler(technicianRepository, ticketService, responder);
    }

    private static InboundEvent command(String sender, String text) {
        return new InboundEvent(Feed.TECH, 1, sender, "Tom", text, null);
    }

    private static Ticket ticket(TicketStatus status, UUID assignedTechId) {
        return new Ticket(TICKET_ID, 42L, UUID.randomUUID(), status, "normal", "No internet", "details",
            assignedTechId, NOW, NOW);
    }

    @Test
    @DisplayName("rejects chats that do not belong to a technician")
    void unknownChat() {
        InboundEvent event = command("6666", "/tickets");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, TechCommandHandler.NOT_REGISTERED);
    }

    @Test
    @DisplayName("/reply answers the client as the technician")
    void replies() {
        when(ticketService.resolveReference("42")).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));
        when(ticketService.reply(TICKET_ID, TECH_ID, "Please restart the router", null))
            .thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_ID)));
        InboundEvent event = command("9001", "/reply 42 Please restart the router");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "Reply sent on #42.");
    }

    @Test
    @DisplayName("/reply on another technician's ticket explains the conflict")
    void replyConflict() {
        when(ticketService.resolveReference("#42")).thenReturn(Mono.just(ticket(TicketStatus.PENDING, UUID.randomUUID())));
        when(ticketService.reply(TICKET_ID, TECH_ID, "hi", null))
            .thenReturn(Mono.error(new OwnershipConflictException(TICKET_ID, TECH_ID)));
        InboundEvent event = command("9001", "/reply #42 hi");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "That ticket is handled by another technician.");
    }

    @Test
    @DisplayName("reports an unknown ticket reference")
    void unknownTicket() {
        when(ticketService.resolveReference("99")).thenReturn(Mono.error(new TicketNotFoundException("99")));
        InboundEvent event = command("9001", "/claim 99");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "Ticket 99 not found");
    }

    @Test
    @DisplayName("/status rejects an unknown status without touching the ticket")
    void unknownStatus() {
        InboundEvent event = command("9001", "/status 42 bogus");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(ticketService, never()).resolveReference(anyString());
        verify(responder).reply(event, "Unknown ticket status 'bogus'");
    }

    @Test
    @DisplayName("/status changes the status")
    void changesStatus() {
        when(ticketService.resolveReference("42")).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_ID)));
        when(ticketService.setStatus(TICKET_ID, TECH_ID, TicketStatus.RESOLVED))
            .thenReturn(Mono.just(ticket(TicketStatus.RESOLVED, TECH_ID)));
        InboundEvent event = command("9001", "/status 42 resolved");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "#42 is now resolved.");
    }

    @Test
    @DisplayName("/claim takes the ticket over")
    void claims() {
        when(ticketService.resolveReference("42")).thenReturn(Mono.just(ticket(TicketStatus.PENDING, UUID.randomUUID())));
        when(ticketService.claim(TICKET_ID, TECH_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_ID)));
        InboundEvent event = command("9001", "/claim@NetDeskBot 42");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "You now handle #42.");
    }

    @Test
    @DisplayName("/tickets filters by status")
    void listsByStatus() {
        when(ticketService.list(TicketFilter.forStatus(TicketStatus.OPEN), TicketView.TECHNICIAN, 0, 10))
            .thenReturn(Mono.just(new TicketPage(List.of(ticket(TicketStatus.OPEN, null)), 4, 0, 10)));
        InboundEvent event = command("9001", "/tickets open");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "Tickets (1 of 4):\n#42 [open] No internet");
    }

    @Test
    @DisplayName("plain text shows the help")
    void plainTextShowsHelp() {
        InboundEvent event = command("9001", "hello?");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, TechCommandHandler.HELP);
    }

    @Test
    @DisplayName("formats an empty list")
    void formatEmptyList() {
        assertThat(TechCommandHandler.formatList(List.of(), 0)).isEqualTo("No tickets found.");
    }
}
