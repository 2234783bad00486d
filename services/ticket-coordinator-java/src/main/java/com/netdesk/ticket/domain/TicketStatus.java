package com.netdesk.ticket.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a support ticket.
 *
 * <p>There is no terminal state: a closed ticket can be reopened by moving it back
 * to {@link #OPEN}, which also releases the technician assignment. The value is
 * stored as plain text; the API and chat commands use the lower-case form.</p>
 */
public enum TicketStatus {
    OPEN,
    PENDING,
    RESOLVED,
    CLOSED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TicketStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Ticket status must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ticket status '%s'".formatted(value), e);
        }
    }
}
