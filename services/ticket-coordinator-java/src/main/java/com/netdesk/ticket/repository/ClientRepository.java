package com.netdesk.ticket.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.netdesk.ticket.domain.Client;

import reactor.core.publisher.Mono;

@Repository
public interface ClientRepository extends ReactiveCrudRepository<Client, UUID> {

    Mono<Client> findByTelegramContact(String telegramContact);
}
