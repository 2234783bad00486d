package com.netdesk.ticket.integration;

/**
 * Recoverable failure talking to an external feed: network error, timeout or an
 * error answer. Consuming loops log it and try again later.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
