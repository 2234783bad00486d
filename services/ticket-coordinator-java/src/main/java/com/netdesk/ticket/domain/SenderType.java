package com.netdesk.ticket.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who authored a {@link TicketMessage}.
 */
public enum SenderType {
    CLIENT,
    TECH,
    SYSTEM;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SenderType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
