package com.netdesk.ticket.integration;

import java.time.Duration;
import java.util.List;

import com.netdesk.ticket.inbound.InboundEvent;

import reactor.core.publisher.Mono;

/**
 * Client of one external chat feed. Sending is safe from any process; receiving is
 * reserved to the process leading the feed.
 *
 * <p>Failures surface as {@link TransportException}; a feed that reports another
 * consumer polling at the same time raises {@link LeadershipLostException}.</p>
 */
public interface MessageTransport {

    Feed feed();

    /**
     * Delivers a text, or a picture captioned with the text when {@code mediaRef} is set.
     *
     * @return delivery id assigned by the feed
     */
    Mono<String> send(String contactRef, String text, String mediaRef);

    /**
     * Long-polls for the next batch of events, waiting at most {@code timeout} on the
     * feed side. Acknowledges the returned events so the next call does not repeat them.
     */
    Mono<List<InboundEvent>> receive(Duration timeout);

    Mono<Void> registerWebhook(String url);

    Mono<Void> clearWebhook(boolean dropPending);
}
