package com.netdesk.ticket.inbound;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.integration.FeedTransports;

import reactor.core.publisher.Mono;

/**
 * Answers the sender of an inbound event on the feed it came from. Answers are
 * courtesy messages, so delivery failures are only logged.
 */
@Component
public class ChatResponder {

    private static final Logger log = LoggerFactory.getLogger(ChatResponder.class);

    private final FeedTransports feedTransports;

    public ChatResponder(FeedTransports feedTransports) {
        this.feedTransports = feedTransports;
    }

    public Mono<Void> reply(InboundEvent event, String text) {
        return feedTransports.get(event.feed())
            .map(transport -> transport.send(event.senderContact(), text, null)
                .doOnError(error -> log.warn("Could not answer {} on the {} feed: {}",
                    event.senderContact(), event.feed().pathSegment(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .then())
            .orElseGet(Mono::empty);
    }
}
