package com.netdesk.ticket.websocket;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the browser live update socket.
 */
@ConfigurationProperties(prefix = "live-updates")
public class LiveUpdateProperties {

    /**
     * Browser origins allowed to open the socket. A handshake without an
     * {@code Origin} header (non-browser client) is not checked.
     */
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
