package com.netdesk.ticket.inbound;

import java.util.Locale;

/**
 * A slash command split into its name and the rest of the line. Plain text has no name.
 */
record ChatCommand(String name, String arguments) {

    static ChatCommand parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!trimmed.startsWith("/")) {
            return new ChatCommand(null, trimmed);
        }
        int space = trimmed.indexOf(' ');
        String head = space < 0 ? trimmed.substring(1) : trimmed.substring(1, space);
        String rest = space < 0 ? "" : trimmed.substring(space + 1).trim();
        // group chats address commands as /name@bot
        int at = head.indexOf('@');
        if (at >= 0) {
            head = head.substring(0, at);
        }
        return new ChatCommand(head.toLowerCase(Locale.ROOT), rest);
    }

    boolean isCommand() {
        return name != null;
    }

    /**
     * Splits the arguments into the first word and the remainder.
     */
    String[] splitFirst() {
        int space = arguments.indexOf(' ');
        if (space < 0) {
            return new String[] {arguments, ""};
        }
        return new String[] {arguments.substring(0, space), arguments.substring(space + 1).trim()};
    }
}
