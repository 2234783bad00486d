package com.netdesk.ticket.inbound;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.netdesk.ticket.domain.Technician;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.domain.TicketStatus;
import com.netdesk.ticket.repository.TechnicianRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketView;
import com.netdesk.ticket.service.OwnershipConflictException;
import com.netdesk.ticket.service.TicketNotFoundException;
import com.netdesk.ticket.service.TicketService;

import reactor.core.publisher.Mono;

/**
 * Conversation with technicians on the tech feed. Tickets are referenced by number or
 * id; the chat id must belong to a back-office user.
 */
@Component
public class TechCommandHandler {

    static final String HELP = """
        /tickets [status] - latest tickets, optionally only one status
        /reply <ticket> <text> - answer the client
        /status <ticket> <open|pending|resolved|closed> - change status
        /claim <ticket> - take over a ticket""";

    static final String NOT_REGISTERED = "This chat is not linked to a technician account.";

    private static final int LIST_ITEMS = 10;

    private final TechnicianRepository technicianRepository;
    private final TicketService ticketService;
    private final ChatResponder responder;

    public TechCommandHandler(TechnicianRepository technicianRepository, TicketService ticketService, ChatResponder responder) {
        this.technicianRepository = technicianRepository;
        this.ticketService = ticketService;
        this.responder = responder;
    }

    public Mono<Void> handle(InboundEvent event) {
        ChatCommand command = ChatCommand.parse(event.text());
        return technicianRepository.findByTelegramChatId(event.senderContact())
            .flatMap(technician -> route(technician, command, event).thenReturn(true))
            .switchIfEmpty(Mono.defer(() -> responder.reply(event, NOT_REGISTERED).thenReturn(false)))
            .then();
    }

    private Mono<Void> route(Technician technician, ChatCommand command, InboundEvent event) {
        if (!command.isCommand()) {
            return responder.reply(event, HELP);
        }
        Mono<String> answer = Mono.defer(() -> switch (command.name()) {
            case "tickets" -> listTickets(command.arguments());
            case "reply" -> reply(technician, command, event);
            case "status" -> changeStatus(technician, command);
            case "claim" -> claim(technician, command.arguments());
            default -> Mono.just(HELP);
        });
        return answer
            .onErrorResume(TicketNotFoundException.class, error -> Mono.just(error.getMessage()))
            .onErrorResume(OwnershipConflictException.class, error -> Mono.just("That ticket is handled by another technician."))
            .onErrorResume(IllegalArgumentException.class, error -> Mono.just(error.getMessage()))
            .flatMap(text -> responder.reply(event, text));
    }

    private Mono<String> listTickets(String statusArgument) {
        TicketFilter filter = statusArgument.isBlank()
            ? TicketFilter.none()
            : TicketFilter.forStatus(TicketStatus.fromValue(statusArgument));
        return ticketService.list(filter, TicketView.TECHNICIAN, 0, LIST_ITEMS)
            .map(page -> formatList(page.items(), page.total()));
    }

    private Mono<String> reply(Technician technician, ChatCommand command, InboundEvent event) {
        String[] parts = command.splitFirst();
        if (parts[0].isBlank() || (parts[1].isBlank() && event.mediaRef() == null)) {
            return Mono.just("Usage: /reply <ticket> <text>");
        }
        return ticketService.resolveReference(parts[0])
            .flatMap(ticket -> ticketService.reply(ticket.getId(), technician.getId(), parts[1], event.mediaRef()))
            .map(ticket -> "Reply sent on %s.".formatted(ticket.shortReference()));
    }

    private Mono<String> changeStatus(Technician technician, ChatCommand command) {
        String[] parts = command.splitFirst();
        if (parts[0].isBlank() || parts[1].isBlank()) {
            return Mono.just("Usage: /status <ticket> <open|pending|resolved|closed>");
        }
        TicketStatus status = TicketStatus.fromValue(parts[1]);
        return ticketService.resolveReference(parts[0])
            .flatMap(ticket -> ticketService.setStatus(ticket.getId(), technician.getId(), status))
            .map(ticket -> "%s is now %s.".formatted(ticket.shortReference(), ticket.getStatus().wireValue()));
    }

    private Mono<String> claim(Technician technician, String reference) {
        if (reference.isBlank()) {
            return Mono.just("Usage: /claim <ticket>");
        }
        return ticketService.resolveReference(reference)
            .flatMap(ticket -> ticketService.claim(ticket.getId(), technician.getId()))
            .map(ticket -> "You now handle %s.".formatted(ticket.shortReference()));
    }

    static String formatList(List<Ticket> tickets, long total) {
        if (tickets.isEmpty()) {
            return "No tickets found.";
        }
        return tickets.stream()
            .map(ticket -> "%s [%s] %s".formatted(ticket.shortReference(), ticket.getStatus().wireValue(), ticket.getSubject()))
            .collect(Collectors.joining("\n", "Tickets (%d of %d):\n".formatted(tickets.size(), total), ""));
    }
}
