package com.netdesk.ticket.integration;

import java.util.Locale;

/**
 * The two external chat feeds: one where clients talk to support, one where
 * technicians work their queue.
 */
public enum Feed {
    CLIENT("client"),
    TECH("tech");

    private final String pathSegment;

    Feed(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Segment used in webhook URLs, {@code /api/webhooks/{segment}/{token}}.
     */
    public String pathSegment() {
        return pathSegment;
    }

    public static Feed fromPathSegment(String segment) {
        String normalized = segment == null ? "" : segment.trim().toLowerCase(Locale.ROOT);
        for (Feed feed : values()) {
            if (feed.pathSegment.equals(normalized)) {
                return feed;
            }
        }
        throw new IllegalArgumentException("Unknown feed '%s'".formatted(segment));
    }
}
