package com.netdesk.ticket.inbound;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.domain.Client;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.repository.ClientRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketView;
import com.netdesk.ticket.service.NewTicket;
import com.netdesk.ticket.service.QuotaExceededException;
import com.netdesk.ticket.service.TicketPage;
import com.netdesk.ticket.service.TicketService;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("Client command handler")
class ClientCommandHandlerTest {

    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000c001");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private ClientRepository clientRepository;
    @Mock
    private TicketService ticketService;
    @Mock
    private ChatResponder responder;

    private ClientCommandHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(clientRepository.findByTelegramContact("5001"))
            .thenReturn(Mono.just(new Client(CLIENT_ID, "Ana", "5001")));
        lenient().when(clientRepository.findByTelegramContact("6666")).thenReturn(Mono.empty());
        lenient().when(responder.reply(any(), anyString())).thenReturn(Mono.empty());
        handler = new ClientCommandHandler(clientRepository, ticketService, responder, new TicketProperties());
    }

    private static InboundEvent message(String sender, String text) {
        return new InboundEvent(Feed.CLIENT, 1, sender, "Ana", text, null);
    }

    private static Ticket ticket(long number, String subject, TicketStatus status) {
        return new Ticket(UUID.randomUUID(), number, CLIENT_ID, status, "normal", subject, "details", null, NOW, NOW);
    }

    @Test
    @DisplayName("asks unknown chats to register")
    void unknownChat() {
        InboundEvent event = message("6666", "/new help");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, ClientCommandHandler.NOT_REGISTERED);
        verify(ticketService, never()).createTicket(any());
    }

    @Nested
    @DisplayName("/new")
    class NewCommand {

        @Test
        @DisplayName("opens a general support ticket with the given description")
        void opensTicket() {
            when(ticketService.createTicket(any())).thenReturn(Mono.just(ticket(12, "General support", TicketStatus.OPEN)));
            InboundEvent event = message("5001", "/new no internet since this morning");

            StepVerifier.create(handler.handle(event)).verifyComplete();

            ArgumentCaptor<NewTicket> request = ArgumentCaptor.forClass(NewTicket.class);
            verify(ticketService).createTicket(request.capture());
            assertThat(request.getValue()).isEqualTo(
                new NewTicket(CLIENT_ID, "General support", "no internet since this morning", "normal"));
            verify(responder).reply(eq(event), contains("Ticket #12 created"));
        }

        @Test
        @DisplayName("explains the quota when the client reached it")
        void quotaReached() {
            when(ticketService.createTicket(any()))
                .thenReturn(Mono.error(new QuotaExceededException(CLIENT_ID, 3, Duration.ofHours(24))));
            InboundEvent event = message("5001", "/new still no internet");

            StepVerifier.create(handler.handle(event)).verifyComplete();

            verify(responder).reply(eq(event), contains("limit of 3 tickets per day"));
        }

        @Test
        @DisplayName("asks for a description when none was given")
        void missingDescription() {
            InboundEvent event = message("5001", "/new");

            StepVerifier.create(handler.handle(event)).verifyComplete();

            verify(ticketService, never()).createTicket(any());
            verify(responder).reply(eq(event), contains("describe the problem"));
        }
    }

    @Nested
    @DisplayName("/agent")
    class AgentCommand {

        @Test
        @DisplayName("opens a high priority live session")
        void opensLiveSession() {
            when(ticketService.findLiveSession(CLIENT_ID)).thenReturn(Mono.empty());
            when(ticketService.createTicket(any()))
                .thenReturn(Mono.just(ticket(13, "Live support request", TicketStatus.OPEN)));

            StepVerifier.create(handler.handle(message("5001", "/agent"))).verifyComplete();

            ArgumentCaptor<NewTicket> request = ArgumentCaptor.forClass(NewTicket.class);
            verify(ticketService).createTicket(request.capture());
            assertThat(request.getValue().subject()).isEqualTo("Live support request");
            assertThat(request.getValue().priority()).isEqualTo("high");
        }

        @Test
        @DisplayName("does not open a second session")
        void sessionAlreadyOpen() {
            when(ticketService.findLiveSession(CLIENT_ID))
                .thenReturn(Mono.just(ticket(13, "Live support request", TicketStatus.PENDING)));
            InboundEvent event = message("5001", "agent");

            StepVerifier.create(handler.handle(event)).verifyComplete();

            verify(ticketService, never()).createTicket(any());
            verify(responder).reply(eq(event), contains("already talking to support"));
        }
    }

    @Test
    @DisplayName("/status lists the latest tickets of the client")
    void status() {
        when(ticketService.list(TicketFilter.forClient(CLIENT_ID), TicketView.CLIENT, 0, 5))
            .thenReturn(Mono.just(new TicketPage(List.of(ticket(12, "General support", TicketStatus.PENDING)), 1, 0, 5)));
        InboundEvent event = message("5001", "/status");

        StepVerifier.create(handler.handle(event)).verifyComplete();

        verify(responder).reply(event, "Your latest tickets:\n#12 General support - pending");
    }

    @Nested
    @DisplayName("free text")
    class FreeText {

        @Test
        @DisplayName("goes to the open live session")
        void appendsToSession() {
            when(ticketService.appendToLiveSession(CLIENT_ID, "5001", "the light is red now", null))
                .thenReturn(Mono.just(ticket(13, "Live support request", TicketStatus.PENDING)));

            StepVerifier.create(handler.handle(message("5001", "the light is red now"))).verifyComplete();

            verify(responder, never()).reply(any(), anyString());
        }

        @Test
        @DisplayName("shows the menu when there is no session")
        void showsMenu() {
            when(ticketService.appendToLiveSession(CLIENT_ID, "5001", "hello", null)).thenReturn(Mono.empty());
            InboundEvent event = message("5001", "hello");

            StepVerifier.create(handler.handle(event)).verifyComplete();

            verify(responder).reply(event, ClientCommandHandler.MENU);
        }
    }

    @Test
    @DisplayName("formats an empty status list")
    void formatEmptyStatus() {
        assertThat(ClientCommandHandler.formatStatus(List.of())).isEqualTo("You have no recent tickets.");
    }
}
