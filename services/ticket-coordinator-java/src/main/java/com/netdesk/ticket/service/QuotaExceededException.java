package com.netdesk.ticket.service;

import java.time.Duration;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Business-rule rejection: the client already opened the maximum number of tickets
 * inside the trailing window. Nothing was written.
 */
@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class QuotaExceededException extends RuntimeException {

    private final UUID clientId;
    private final int limit;
    private final Duration window;

    public QuotaExceededException(UUID clientId, int limit, Duration window) {
        super("Client %s reached the limit of %d tickets per %s".formatted(clientId, limit, window));
        this.clientId = clientId;
        this.limit = limit;
        this.window = window;
    }

    public UUID getClientId() {
        return clientId;
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
