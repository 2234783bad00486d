package com.netdesk.ticket.notification;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * "Something changed for ticket X" announcement. Receivers re-fetch the ticket
 * instead of trusting the payload, since delivery is neither guaranteed nor ordered.
 *
 * @param type         kind of change
 * @param ticketId     affected ticket, absent for generic refresh signals
 * @param notification optional human-readable text shown to technicians
 * @param level        severity hint for {@code notification}, e.g. {@code info}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketEvent(
    TicketEventType type,
    @JsonProperty("ticket_id") String ticketId,
    String notification,
    String level
) {

    public static TicketEvent created(UUID ticketId, String notification) {
        return new TicketEvent(TicketEventType.TICKET_CREATED, ticketId.toString(), notification, "info");
    }

    public static TicketEvent updated(UUID ticketId) {
        return new TicketEvent(TicketEventType.TICKET_UPDATED, ticketId.toString(), null, null);
    }

    public static TicketEvent updated(UUID ticketId, String notification, String level) {
        return new TicketEvent(TicketEventType.TICKET_UPDATED, ticketId.toString(), notification, level);
    }

    public static TicketEvent dbUpdated(String ticketId, String notification, String level) {
        return new TicketEvent(TicketEventType.DB_UPDATED, ticketId, notification, level);
    }
}
