package com.netdesk.ticket.repository;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.netdesk.ticket.domain.Ticket;

import reactor.core.publisher.Mono;

/**
 * Reactive persistence gateway for tickets. Spring Data generates implementations
 * at runtime; dynamic listing lives in {@link TicketQueryRepository}.
 */
@Repository
public interface TicketRepository extends ReactiveCrudRepository<Ticket, UUID> {

    Mono<Long> countByClientIdAndCreatedAtGreaterThanEqual(UUID clientId, Instant since);

    Mono<Ticket> findByTicketNumber(Long ticketNumber);

    /**
     * Most recently updated open or pending ticket of the client carrying the given
     * subject. This is the live chat session free text is appended to.
     */
    @Query("SELECT * FROM tickets WHERE client_id = :clientId AND subject = :subject "
        + "AND status IN ('open', 'pending') ORDER BY updated_at DESC LIMIT 1")
    Mono<Ticket> findActiveSession(@Param("clientId") UUID clientId, @Param("subject") String subject);

    /**
     * Assigns the ticket only while nobody holds it, moving an open ticket to pending
     * like {@link Ticket#claimBy}. Returns the number of updated rows, so {@code 0}
     * means another technician won the race.
     */
    @Modifying
    @Query("UPDATE tickets SET assigned_tech_id = :techId, updated_at = :now, "
        + "status = CASE WHEN status = 'open' THEN 'pending' ELSE status END "
        + "WHERE id = :id AND assigned_tech_id IS NULL")
    Mono<Integer> claimIfUnassigned(@Param("id") UUID id, @Param("techId") UUID techId, @Param("now") Instant now);
}
