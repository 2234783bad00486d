package com.netdesk.ticket.integration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Senders for every configured feed. Built once at start-up, so every process can send
 * through a feed whether or not it polls it.
 */
public class FeedTransports {

    private final Map<Feed, MessageTransport> transports;

    public FeedTransports(Map<Feed, MessageTransport> transports) {
        EnumMap<Feed, MessageTransport> copy = new EnumMap<>(Feed.class);
        copy.putAll(transports);
        this.transports = Collections.unmodifiableMap(copy);
    }

    public Optional<MessageTransport> get(Feed feed) {
        return Optional.ofNullable(transports.get(feed));
    }

    public Set<Feed> configured() {
        return transports.keySet();
    }
}
