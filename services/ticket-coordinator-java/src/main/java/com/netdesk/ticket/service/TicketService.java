package com.netdesk.ticket.service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketMessage;
import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.integration.ClientReplyRelay;
import com.netdesk.ticket.notification.NotificationBus;
import com.netdesk.ticket.notification.TicketEvent;
import com.netdesk.ticket.repository.ClientRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketMessageRepository;
import com.netdesk.ticket.repository.TicketQueryRepository;
import com.netdesk.ticket.repository.TicketRepository;
import com.netdesk.ticket.repository.TicketView;

import reactor.core.publisher.Mono;

/**
 * Application service owning the ticket lifecycle.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Enforce the per-client creation quota and the technician ownership rules</li>
 *   <li>Persist tickets and their conversation through the reactive repositories</li>
 *   <li>Announce every committed change on the {@link NotificationBus}</li>
 *   <li>Relay technician replies to the client's chat</li>
 * </ul>
 * Each mutation runs in one transaction; the change event is published only after
 * the transaction committed and never delays or fails the caller.</p>
 */
@Service
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private static final int PREVIEW_LENGTH = 100;

    private final TicketRepository ticketRepository;
    private final TicketMessageRepository messageRepository;
    private final TicketQueryRepository queryRepository;
    private final ClientRepository clientRepository;
    private final NotificationBus notificationBus;
    private final ClientReplyRelay clientReplyRelay;
    private final TransactionalOperator transactionalOperator;
    private final TicketProperties properties;
    private final Clock clock;

    public TicketService(
        TicketRepository ticketRepository,
        TicketMessageRepository messageRepository,
        TicketQueryRepository queryRepository,
        ClientRepository clientRepository,
        NotificationBus notificationBus,
        ClientReplyRelay clientReplyRelay,
        TransactionalOperator transactionalOperator,
        TicketProperties properties,
        Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.messageRepository = messageRepository;
        this.queryRepository = queryRepository;
        this.clientRepository = clientRepository;
        this.notificationBus = notificationBus;
        this.clientReplyRelay = clientReplyRelay;
        this.transactionalOperator = transactionalOperator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Opens a ticket for a known client. The quota is counted from the store before
     * anything is written; concurrent creations for the same client are not
     * serialised, so the limit is a soft one.
     */
    public Mono<Ticket> createTicket(NewTicket request) {
        TicketProperties.QuotaProperties quota = properties.getQuota();
        Instant now = clock.instant();

        Mono<Ticket> insert = clientRepository.findById(request.clientId())
            .switchIfEmpty(Mono.error(new ClientNotFoundException(request.clientId())))
            .flatMap(client -> ticketRepository.countByClientIdAndCreatedAtGreaterThanEqual(
                client.getId(), now.minus(quota.getWindow())))
            .flatMap(count -> {
                if (count >= quota.getLimit()) {
                    log.warn("Client {} already opened {} tickets within {}; rejecting", request.clientId(), count, quota.getWindow());
                    return Mono.error(new QuotaExceededException(request.clientId(), quota.getLimit(), quota.getWindow()));
                }
                Ticket ticket = Ticket.newTicket(
                    request.clientId(),
                    request.subject(),
                    request.description(),
                    request.priority(),
                    now
                );
                return ticketRepository.save(ticket);
            });

        return transactionalOperator.transactional(insert)
            .doOnNext(saved -> {
                log.info("Ticket {} created for client {}", saved.getId(), saved.getClientId());
                notificationBus.publish(TicketEvent.created(
                    saved.getId(),
                    "New ticket %s: %s".formatted(saved.shortReference(), saved.getSubject())
                ));
            });
    }

    /**
     * Appends a technician reply. An unassigned ticket is claimed by the replying
     * technician and a fresh ticket moves to pending. The reply text is then
     * forwarded to the client's chat on a best-effort basis.
     */
    public Mono<Ticket> reply(UUID ticketId, UUID techId, String content, String mediaUrl) {
        Mono<Ticket> mutation = claimForTechnician(ticketId, techId)
            .flatMap(ticket -> {
                Instant now = clock.instant();
                TicketMessage message = TicketMessage.fromTechnician(ticket.getId(), techId, content, mediaUrl, now);
                ticket.recordTechnicianReply(now);
                return messageRepository.save(message)
                    .then(ticketRepository.save(ticket));
            });

        return transactionalOperator.transactional(mutation)
            .doOnNext(saved -> notificationBus.publish(TicketEvent.updated(saved.getId())))
            .flatMap(saved -> clientReplyRelay.relayReply(saved, content, mediaUrl).thenReturn(saved));
    }

    /**
     * Sets a status chosen by a technician. Reopening releases the ticket, any other
     * status claims it when nobody holds it yet.
     */
    public Mono<Ticket> setStatus(UUID ticketId, UUID techId, TicketStatus status) {
        Mono<Ticket> owned = status == TicketStatus.OPEN
            ? findTicket(ticketId).flatMap(ticket -> checkOwnership(ticket, techId))
            : claimForTechnician(ticketId, techId);

        Mono<Ticket> mutation = owned.flatMap(ticket -> {
            boolean releasing = status == TicketStatus.OPEN && ticket.isAssigned();
            ticket.changeStatus(status, clock.instant());
            if (releasing) {
                log.info("Ticket {} released by technician {}", ticket.getId(), techId);
            }
            return ticketRepository.save(ticket);
        });

        return transactionalOperator.transactional(mutation)
            .doOnNext(saved -> notificationBus.publish(TicketEvent.updated(saved.getId())));
    }

    /**
     * Explicit "take this ticket" action. Unlike {@link #reply} it does not look at the
     * current holder: the last technician to claim wins.
     */
    public Mono<Ticket> claim(UUID ticketId, UUID techId) {
        Mono<Ticket> mutation = findTicket(ticketId)
            .flatMap(ticket -> {
                if (ticket.isAssignedToOther(techId)) {
                    log.info("Ticket {} taken over by technician {} from {}", ticket.getId(), techId, ticket.getAssignedTechId());
                } else {
                    log.info("Ticket {} claimed by technician {}", ticket.getId(), techId);
                }
                ticket.claimBy(techId, clock.instant());
                return ticketRepository.save(ticket);
            });

        return transactionalOperator.transactional(mutation)
            .doOnNext(saved -> notificationBus.publish(TicketEvent.updated(saved.getId())));
    }

    /**
     * Appends a client chat message to the client's live support session, if one is
     * open or pending. Completes empty when the client has no such session.
     */
    public Mono<Ticket> appendToLiveSession(UUID clientId, String clientContact, String content, String mediaUrl) {
        Mono<Ticket> mutation = findLiveSession(clientId)
            .flatMap(ticket -> {
                Instant now = clock.instant();
                TicketMessage message = TicketMessage.fromClient(ticket.getId(), clientContact, content, mediaUrl, now);
                ticket.touch(now);
                return messageRepository.save(message)
                    .then(ticketRepository.save(ticket));
            });

        return transactionalOperator.transactional(mutation)
            .doOnNext(saved -> notificationBus.publish(TicketEvent.updated(
                saved.getId(),
                "New message on %s: %s".formatted(saved.shortReference(), preview(content)),
                "info"
            )));
    }

    public Mono<Ticket> findLiveSession(UUID clientId) {
        return ticketRepository.findActiveSession(clientId, properties.getLiveSupportSubject());
    }

    public Mono<Ticket> getTicket(UUID id) {
        return findTicket(id);
    }

    public Mono<TicketDetail> getTicketDetail(UUID id) {
        return findTicket(id)
            .flatMap(ticket -> messageRepository.findConversation(ticket.getId())
                .collectList()
                .map(messages -> new TicketDetail(ticket, messages)));
    }

    /**
     * Accepts either a full id or the human-facing number, with or without a leading '#'.
     */
    public Mono<Ticket> resolveReference(String reference) {
        String raw = reference == null ? "" : reference.trim();
        if (raw.startsWith("#")) {
            raw = raw.substring(1);
        }
        try {
            return findTicket(UUID.fromString(raw));
        } catch (IllegalArgumentException notUuid) {
            log.trace("'{}' is not a ticket id, trying ticket number", raw);
        }
        try {
            long number = Long.parseLong(raw);
            return ticketRepository.findByTicketNumber(number)
                .switchIfEmpty(Mono.error(new TicketNotFoundException(reference)));
        } catch (NumberFormatException notNumber) {
            return Mono.error(new TicketNotFoundException(reference));
        }
    }

    public Mono<TicketPage> list(TicketFilter filter, TicketView view, int page, int size) {
        return Mono.zip(
                queryRepository.findPage(filter, view, page, size).collectList(),
                queryRepository.count(filter)
            )
            .map(tuple -> new TicketPage(tuple.getT1(), tuple.getT2(), page, size));
    }

    private Mono<Ticket> findTicket(UUID id) {
        return ticketRepository.findById(id)
            .switchIfEmpty(Mono.error(new TicketNotFoundException(id)));
    }

    private Mono<Ticket> checkOwnership(Ticket ticket, UUID techId) {
        if (ticket.isAssignedToOther(techId)) {
            return Mono.error(new OwnershipConflictException(ticket.getId(), techId));
        }
        return Mono.just(ticket);
    }

    /**
     * Loads the ticket and makes sure {@code techId} holds it afterwards. The claim of an
     * unassigned ticket is a conditional update, so of two technicians racing for the
     * same ticket exactly one wins and the other gets an ownership conflict.
     */
    private Mono<Ticket> claimForTechnician(UUID ticketId, UUID techId) {
        return findTicket(ticketId)
            .flatMap(ticket -> checkOwnership(ticket, techId))
            .flatMap(ticket -> {
                if (ticket.isAssigned()) {
                    return Mono.just(ticket);
                }
                Instant now = clock.instant();
                return ticketRepository.claimIfUnassigned(ticket.getId(), techId, now)
                    .flatMap(updated -> {
                        if (updated == 0) {
                            log.warn("Technician {} lost the claim race on ticket {}", techId, ticket.getId());
                            return Mono.error(new OwnershipConflictException(ticket.getId(), techId));
                        }
                        log.info("Ticket {} auto-claimed by technician {}", ticket.getId(), techId);
                        ticket.claimBy(techId, now);
                        return Mono.just(ticket);
                    });
            });
    }

    private static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= PREVIEW_LENGTH
            ? content
            : content.substring(0, PREVIEW_LENGTH) + "...";
    }
}
