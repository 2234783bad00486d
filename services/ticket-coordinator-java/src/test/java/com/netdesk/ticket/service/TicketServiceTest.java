package com.netdesk.ticket.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.domain.Client;
import com.netdesk.ticket.domain.SenderType;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketMessage;
import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.integration.ClientReplyRelay;
import com.netdesk.ticket.notification.NotificationBus;
import com.netdesk.ticket.notification.TicketEvent;
import com.netdesk.ticket.notification.TicketEventType;
import com.netdesk.ticket.repository.ClientRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketMessageRepository;
import com.netdesk.ticket.repository.TicketQueryRepository;
import com.netdesk.ticket.repository.TicketRepository;
import com.netdesk.ticket.repository.TicketView;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("Ticket service")
class TicketServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000c001");
    private static final UUID TICKET_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID TECH_A = UUID.fromString("00000000-0000-0000-0000-00000000e00a");
    private static final UUID TECH_B = UUID.fromString("00000000-0000-0000-0000-00000000e00b");

    @Mock
    private TicketRepository ticketRepository;
    @Mock
    private TicketMessageRepository messageRepository;
    @Mock
    private TicketQueryRepository queryRepository;
    @Mock
    private ClientRepository clientRepository;
    @Mock
    private NotificationBus notificationBus;
    @Mock
    private ClientReplyRelay clientReplyRelay;
    @Mock
    private TransactionalOperator transactionalOperator;

    private TicketService service;

    @BeforeEach
    void setUp() {
        lenient().when(transactionalOperator.transactional(ArgumentMatchers.<Mono<Ticket>>any()))
            .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(ticketRepository.save(any(Ticket.class)))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(messageRepository.save(any(TicketMessage.class)))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        service = new TicketService(
            ticketRepository,
            messageRepository,
            queryRepository,
            clientRepository,
            notificationBus,
            clientReplyRelay,
            transactionalOperator,
            new TicketProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static Ticket ticket(TicketStatus status, UUID assignedTechId) {
        return new Ticket(TICKET_ID, 42L, CLIENT_ID, status, "normal", "No internet", "Router blinks red",
            assignedTechId, NOW.minusSeconds(3600), NOW.minusSeconds(3600));
    }

    private TicketEvent publishedEvent() {
        ArgumentCaptor<TicketEvent> captor = ArgumentCaptor.forClass(TicketEvent.class);
        verify(notificationBus).publish(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("createTicket")
    class CreateTicket {

        private final NewTicket request = new NewTicket(CLIENT_ID, "General support", "No internet", null);

        @BeforeEach
        void knownClient() {
            lenient().when(clientRepository.findById(CLIENT_ID))
                .thenReturn(Mono.just(new Client(CLIENT_ID, "Ana", "5001")));
        }

        @Test
        @DisplayName("opens the ticket and announces it while the client is under the quota")
        void createsBelowQuota() {
            when(ticketRepository.countByClientIdAndCreatedAtGreaterThanEqual(CLIENT_ID, NOW.minus(Duration.ofHours(24))))
                .thenReturn(Mono.just(2L));
            when(ticketRepository.save(any(Ticket.class))).thenAnswer(invocation -> {
                Ticket toSave = invocation.getArgument(0);
                toSave.setId(TICKET_ID);
                toSave.setTicketNumber(7L);
                return Mono.just(toSave);
            });

            StepVerifier.create(service.createTicket(request))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertThat(ticket.getAssignedTechId()).isNull();
                    assertThat(ticket.getPriority()).isEqualTo("normal");
                    assertThat(ticket.getCreatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

            TicketEvent event = publishedEvent();
            assertThat(event.type()).isEqualTo(TicketEventType.TICKET_CREATED);
            assertThat(event.ticketId()).isEqualTo(TICKET_ID.toString());
            assertThat(event.notification()).isEqualTo("New ticket #7: General support");
        }

        @Test
        @DisplayName("rejects the ticket that would exceed the quota without writing anything")
        void rejectsAtQuota() {
            when(ticketRepository.countByClientIdAndCreatedAtGreaterThanEqual(eq(CLIENT_ID), any(Instant.class)))
                .thenReturn(Mono.just(3L));

            StepVerifier.create(service.createTicket(request))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(QuotaExceededException.class);
                    assertThat(((QuotaExceededException) error).getLimit()).isEqualTo(3);
                })
                .verify();

            verify(ticketRepository, never()).save(any(Ticket.class));
            verify(notificationBus, never()).publish(any());
        }

        @Test
        @DisplayName("fails for an unknown client")
        void unknownClient() {
            when(clientRepository.findById(CLIENT_ID)).thenReturn(Mono.empty());

            StepVerifier.create(service.createTicket(request))
                .expectError(ClientNotFoundException.class)
                .verify();

            verify(ticketRepository, never()).save(any(Ticket.class));
        }
    }

    @Nested
    @DisplayName("reply")
    class Reply {

        @BeforeEach
        void relaySucceeds() {
            lenient().when(clientReplyRelay.relayReply(any(), any(), any())).thenReturn(Mono.empty());
        }

        @Test
        @DisplayName("claims an unassigned ticket for the replying technician")
        void autoClaimsUnassignedTicket() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));
            when(ticketRepository.claimIfUnassigned(TICKET_ID, TECH_A, NOW)).thenReturn(Mono.just(1));

            StepVerifier.create(service.reply(TICKET_ID, TECH_A, "We are on it", null))
                .assertNext(ticket -> {
                    assertThat(ticket.getAssignedTechId()).isEqualTo(TECH_A);
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PENDING);
                    assertThat(ticket.getUpdatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

            ArgumentCaptor<TicketMessage> message = ArgumentCaptor.forClass(TicketMessage.class);
            verify(messageRepository).save(message.capture());
            assertThat(message.getValue().getSenderType()).isEqualTo(SenderType.TECH);
            assertThat(message.getValue().getSenderId()).isEqualTo(TECH_A.toString());
            assertThat(message.getValue().getContent()).isEqualTo("We are on it");

            TicketEvent event = publishedEvent();
            assertThat(event.type()).isEqualTo(TicketEventType.TICKET_UPDATED);
            assertThat(event.notification()).isNull();
            verify(clientReplyRelay).relayReply(any(Ticket.class), eq("We are on it"), isNull());
        }

        @Test
        @DisplayName("does not touch the claim when the technician already holds the ticket")
        void ownTicket() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));

            StepVerifier.create(service.reply(TICKET_ID, TECH_A, "Any news?", null))
                .assertNext(ticket -> assertThat(ticket.getAssignedTechId()).isEqualTo(TECH_A))
                .verifyComplete();

            verify(ticketRepository, never()).claimIfUnassigned(any(), any(), any());
        }

        @Test
        @DisplayName("refuses a technician who does not hold the ticket and writes nothing")
        void rejectsOtherTechnician() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));

            StepVerifier.create(service.reply(TICKET_ID, TECH_B, "Hello", null))
                .expectError(OwnershipConflictException.class)
                .verify();

            verify(messageRepository, never()).save(any(TicketMessage.class));
            verify(ticketRepository, never()).save(any(Ticket.class));
            verify(notificationBus, never()).publish(any());
            verify(clientReplyRelay, never()).relayReply(any(), any(), any());
        }

        @Test
        @DisplayName("reports a conflict when another technician claimed the ticket first")
        void lostClaimRace() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));
            when(ticketRepository.claimIfUnassigned(TICKET_ID, TECH_B, NOW)).thenReturn(Mono.just(0));

            StepVerifier.create(service.reply(TICKET_ID, TECH_B, "Hello", null))
                .expectError(OwnershipConflictException.class)
                .verify();

            verify(messageRepository, never()).save(any(TicketMessage.class));
            verify(notificationBus, never()).publish(any());
        }

        @Test
        @DisplayName("fails for an unknown ticket")
        void unknownTicket() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.empty());

            StepVerifier.create(service.reply(TICKET_ID, TECH_A, "Hello", null))
                .expectError(TicketNotFoundException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("setStatus")
    class SetStatus {

        @Test
        @DisplayName("reopening releases the ticket")
        void reopenReleases() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));

            StepVerifier.create(service.setStatus(TICKET_ID, TECH_A, TicketStatus.OPEN))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertThat(ticket.getAssignedTechId()).isNull();
                })
                .verifyComplete();

            assertThat(publishedEvent().type()).isEqualTo(TicketEventType.TICKET_UPDATED);
        }

        @Test
        @DisplayName("resolving an unassigned ticket claims it")
        void resolveClaims() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));
            when(ticketRepository.claimIfUnassigned(TICKET_ID, TECH_A, NOW)).thenReturn(Mono.just(1));

            StepVerifier.create(service.setStatus(TICKET_ID, TECH_A, TicketStatus.RESOLVED))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.RESOLVED);
                    assertThat(ticket.getAssignedTechId()).isEqualTo(TECH_A);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("refuses a technician who does not hold the ticket")
        void rejectsOtherTechnician() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));

            StepVerifier.create(service.setStatus(TICKET_ID, TECH_B, TicketStatus.CLOSED))
                .expectError(OwnershipConflictException.class)
                .verify();

            verify(ticketRepository, never()).save(any(Ticket.class));
        }
    }

    @Nested
    @DisplayName("claim")
    class Claim {

        @Test
        @DisplayName("takes a ticket over from another technician")
        void takesOver() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));

            StepVerifier.create(service.claim(TICKET_ID, TECH_B))
                .assertNext(ticket -> assertThat(ticket.getAssignedTechId()).isEqualTo(TECH_B))
                .verifyComplete();

            verify(ticketRepository, never()).claimIfUnassigned(any(), any(), any());
            assertThat(publishedEvent().type()).isEqualTo(TicketEventType.TICKET_UPDATED);
        }

        @Test
        @DisplayName("claiming an open ticket moves it to pending")
        void claimOpen() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));

            StepVerifier.create(service.claim(TICKET_ID, TECH_A))
                .assertNext(ticket -> {
                    assertThat(ticket.getAssignedTechId()).isEqualTo(TECH_A);
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PENDING);
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("appendToLiveSession")
    class AppendToLiveSession {

        @Test
        @DisplayName("stores the client message and announces a preview")
        void appendsAndAnnounces() {
            when(ticketRepository.findActiveSession(CLIENT_ID, "Live support request"))
                .thenReturn(Mono.just(ticket(TicketStatus.PENDING, TECH_A)));
            String longText = "x".repeat(150);

            StepVerifier.create(service.appendToLiveSession(CLIENT_ID, "5001", longText, null))
                .expectNextCount(1)
                .verifyComplete();

            ArgumentCaptor<TicketMessage> message = ArgumentCaptor.forClass(TicketMessage.class);
            verify(messageRepository).save(message.capture());
            assertThat(message.getValue().getSenderType()).isEqualTo(SenderType.CLIENT);
            assertThat(message.getValue().getSenderId()).isEqualTo("5001");

            TicketEvent event = publishedEvent();
            assertThat(event.level()).isEqualTo("info");
            assertThat(event.notification()).isEqualTo("New message on #42: " + "x".repeat(100) + "...");
        }

        @Test
        @DisplayName("completes empty when the client has no live session")
        void noSession() {
            when(ticketRepository.findActiveSession(CLIENT_ID, "Live support request")).thenReturn(Mono.empty());

            StepVerifier.create(service.appendToLiveSession(CLIENT_ID, "5001", "hello", null))
                .verifyComplete();

            verify(messageRepository, never()).save(any(TicketMessage.class));
            verify(notificationBus, never()).publish(any());
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("resolves a ticket number with a leading hash")
        void resolvesNumber() {
            when(ticketRepository.findByTicketNumber(42L)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));

            StepVerifier.create(service.resolveReference("#42"))
                .assertNext(ticket -> assertThat(ticket.getId()).isEqualTo(TICKET_ID))
                .verifyComplete();
        }

        @Test
        @DisplayName("resolves a full ticket id")
        void resolvesId() {
            when(ticketRepository.findById(TICKET_ID)).thenReturn(Mono.just(ticket(TicketStatus.OPEN, null)));

            StepVerifier.create(service.resolveReference(TICKET_ID.toString()))
                .expectNextCount(1)
                .verifyComplete();

            verify(ticketRepository, never()).findByTicketNumber(anyLong());
        }

        @Test
        @DisplayName("rejects references that are neither id nor number")
        void rejectsGarbage() {
            StepVerifier.create(service.resolveReference("abc"))
                .expectError(TicketNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("combines the page with the total count")
        void listsPage() {
            TicketFilter filter = TicketFilter.forStatus(TicketStatus.OPEN);
            when(queryRepository.findPage(filter, TicketView.TECHNICIAN, 1, 2))
                .thenReturn(Flux.just(ticket(TicketStatus.OPEN, null), ticket(TicketStatus.OPEN, null)));
            when(queryRepository.count(filter)).thenReturn(Mono.just(7L));

            StepVerifier.create(service.list(filter, TicketView.TECHNICIAN, 1, 2))
                .assertNext(page -> {
                    assertThat(page.items()).hasSize(2);
                    assertThat(page.total()).isEqualTo(7L);
                    assertThat(page.page()).isEqualTo(1);
                    assertThat(page.size()).isEqualTo(2);
                })
                .verifyComplete();
        }
    }
}
