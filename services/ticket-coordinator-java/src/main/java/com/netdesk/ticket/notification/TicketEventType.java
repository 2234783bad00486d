package com.netdesk.ticket.notification;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TicketEventType {
    TICKET_CREATED,
    TICKET_UPDATED,
    /**
     * Generic "reload your data" signal raised through the internal monitor endpoint.
     */
    DB_UPDATED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TicketEventType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
