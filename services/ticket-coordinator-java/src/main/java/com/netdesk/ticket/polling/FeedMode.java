package com.netdesk.ticket.polling;

/**
 * How this process takes part in a feed.
 */
public enum FeedMode {
    /**
     * Not configured: neither sends nor receives.
     */
    DISABLED,
    /**
     * Events arrive as webhook calls to whichever process the router picks.
     */
    WEBHOOK,
    /**
     * This process holds the feed's lease and runs its consuming loop.
     */
    POLLING_LEADER,
    /**
     * Another process polls; this one only sends.
     */
    SEND_ONLY
}
