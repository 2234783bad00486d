package com.netdesk.ticket.repository;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.netdesk.ticket.domain.Technician;

import reactor.core.publisher.Mono;

@Repository
public interface TechnicianRepository extends ReactiveCrudRepository<Technician, UUID> {

    Mono<Technician> findByTelegramChatId(String telegramChatId);
}
