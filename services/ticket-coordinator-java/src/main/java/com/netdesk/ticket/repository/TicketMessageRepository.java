package com.netdesk.ticket.repository;

import java.util.UUID;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.netdesk.ticket.domain.TicketMessage;

import reactor.core.publisher.Flux;

@Repository
public interface TicketMessageRepository extends ReactiveCrudRepository<TicketMessage, UUID> {

    // seq is the store-assigned insertion order, used when two messages share a timestamp
    @Query("SELECT * FROM ticket_messages WHERE ticket_id = :ticketId ORDER BY created_at ASC, seq ASC")
    Flux<TicketMessage> findConversation(@Param("ticketId") UUID ticketId);
}
