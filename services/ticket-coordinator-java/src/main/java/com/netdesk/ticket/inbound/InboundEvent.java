package com.netdesk.ticket.inbound;

import com.netdesk.ticket.integration.Feed;

/**
 * One message or button press received from a chat feed, by polling or by webhook.
 *
 * @param feed          feed it arrived on
 * @param updateId      feed-assigned sequence number
 * @param senderContact chat id to answer to; also identifies the sender
 * @param senderName    display name, may be {@code null}
 * @param text          message text, caption or button payload; never {@code null}
 * @param mediaRef      feed reference of an attached picture, may be {@code null}
 */
public record InboundEvent(
    Feed feed,
    long updateId,
    String senderContact,
    String senderName,
    String text,
    String mediaRef
) {

    public InboundEvent {
        text = text == null ? "" : text;
    }
}
