package com.netdesk.ticket.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Technician reply to be stored on the ticket and relayed to the client.
 */
public class TicketReplyRequest {

    @NotBlank
    @Size(max = 4096)
    private String content;

    @Size(max = 2048)
    private String mediaUrl;

    public TicketReplyRequest() {
    }

    public TicketReplyRequest(String content, String mediaUrl) {
        this.content = content;
        this.mediaUrl = mediaUrl;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public void setMediaUrl(String mediaUrl) {
        this.mediaUrl = mediaUrl;
    }
}
