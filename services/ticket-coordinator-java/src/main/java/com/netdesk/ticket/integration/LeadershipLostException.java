package com.netdesk.ticket.integration;

/**
 * The feed reported that another consumer is polling it. The local consuming loop
 * stops and does not try to win leadership back.
 */
public class LeadershipLostException extends TransportException {

    public LeadershipLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
