package com.netdesk.ticket.integration;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.repository.ClientRepository;

import reactor.core.publisher.Mono;

/**
 * Forwards technician replies to the client's chat through the client feed. The
 * reply is already stored, so a failed delivery is logged and otherwise ignored.
 */
@Component
public class ClientReplyRelay {

    private static final Logger log = LoggerFactory.getLogger(ClientReplyRelay.class);

    private final ClientRepository clientRepository;
    private final FeedTransports feedTransports;

    public ClientReplyRelay(ClientRepository clientRepository, FeedTransports feedTransports) {
        this.clientRepository = clientRepository;
        this.feedTransports = feedTransports;
    }

    public Mono<Void> relayReply(Ticket ticket, String content, String mediaUrl) {
        Optional<MessageTransport> transport = feedTransports.get(Feed.CLIENT);
        if (transport.isEmpty()) {
            log.debug("Client feed not configured; reply on ticket {} is not relayed", ticket.getId());
            return Mono.empty();
        }

        String text = """
            New reply from support
            Ticket %s

            %s""".formatted(ticket.shortReference(), content);

        return clientRepository.findById(ticket.getClientId())
            .filter(client -> StringUtils.hasText(client.getTelegramContact()))
            .flatMap(client -> transport.get().send(client.getTelegramContact(), text, mediaUrl))
            .doOnNext(deliveryId -> log.debug("Reply on ticket {} relayed to client as message {}", ticket.getId(), deliveryId))
            .doOnError(error -> log.warn("Failed to relay reply on ticket {} to the client: {}", ticket.getId(), error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .then();
    }
}
