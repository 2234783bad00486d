package com.netdesk.ticket.inbound;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.domain.Client;
import com.netdesk.ticket.domain.Ticket;
import com.netdesk.ticket.repository.ClientRepository;
import com.netdesk.ticket.repository.TicketFilter;
import com.netdesk.ticket.repository.TicketView;
import com.netdesk.ticket.service.NewTicket;
import com.netdesk.ticket.service.QuotaExceededException;
import com.netdesk.ticket.service.TicketService;

import reactor.core.publisher.Mono;

/**
 * Conversation with clients on the client feed.
 *
 * <p>Commands: {@code /new <problem>} opens a general support ticket, {@code /agent}
 * opens a live support session, {@code /status} lists the latest tickets. Any other
 * text goes to the client's live session when one is open, otherwise the menu is
 * shown. Button payloads {@code report}, {@code agent} and {@code status} work like
 * the commands.</p>
 */
@Component
public class ClientCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(ClientCommandHandler.class);

    static final String MENU = """
        NetDesk support
        /new <problem> - report a problem
        /agent - talk to a support agent
        /status - your latest tickets""";

    static final String NOT_REGISTERED =
        "This chat is not linked to a customer account. Please contact the office to register it.";

    private static final int STATUS_ITEMS = 5;

    private final ClientRepository clientRepository;
    private final TicketService ticketService;
    private final ChatResponder responder;
    private final TicketProperties properties;

    public ClientCommandHandler(
        ClientRepository clientRepository,
        TicketService ticketService,
        ChatResponder responder,
        TicketProperties properties
    ) {
        this.clientRepository = clientRepository;
        this.ticketService = ticketService;
        this.responder = responder;
        this.properties = properties;
    }

    public Mono<Void> handle(InboundEvent event) {
        ChatCommand command = ChatCommand.parse(event.text());
        return clientRepository.findByTelegramContact(event.senderContact())
            .flatMap(client -> route(client, command, event).thenReturn(true))
            .switchIfEmpty(Mono.defer(() -> responder.reply(event, NOT_REGISTERED).thenReturn(false)))
            .then();
    }

    private Mono<Void> route(Client client, ChatCommand command, InboundEvent event) {
        if (!command.isCommand()) {
            return switch (command.arguments()) {
                case "report" -> responder.reply(event, "Describe your problem after /new, for example: /new no internet since this morning");
                case "agent" -> requestAgent(client, "", event);
                case "status" -> showStatus(client, event);
                default -> appendToSession(client, event);
            };
        }
        return switch (command.name()) {
            case "new", "report" -> reportProblem(client, command.arguments(), event);
            case "agent" -> requestAgent(client, command.arguments(), event);
            case "status" -> showStatus(client, event);
            default -> responder.reply(event, MENU);
        };
    }

    private Mono<Void> reportProblem(Client client, String description, InboundEvent event) {
        if (description.isBlank()) {
            return responder.reply(event, "Please describe the problem, for example: /new no internet since this morning");
        }
        NewTicket request = new NewTicket(client.getId(), properties.getGeneralSupportSubject(), description, "normal");
        return open(request, event, ticket -> "Ticket %s created. A technician will contact you soon.".formatted(ticket.shortReference()));
    }

    private Mono<Void> requestAgent(Client client, String note, InboundEvent event) {
        return ticketService.findLiveSession(client.getId())
            .flatMap(session -> responder.reply(event,
                "You are already talking to support (ticket %s). Just write your message.".formatted(session.shortReference()))
                .thenReturn(true))
            .switchIfEmpty(Mono.defer(() -> {
                String description = note.isBlank() ? "Client requested a live support agent" : note;
                NewTicket request = new NewTicket(client.getId(), properties.getLiveSupportSubject(), description, "high");
                return open(request, event, ticket ->
                    "An agent will join shortly (ticket %s). Write your messages here.".formatted(ticket.shortReference()))
                    .thenReturn(true);
            }))
            .then();
    }

    private Mono<Void> open(NewTicket request, InboundEvent event, Function<Ticket, String> confirmation) {
        return ticketService.createTicket(request)
            .flatMap(ticket -> responder.reply(event, confirmation.apply(ticket)))
            .onErrorResume(QuotaExceededException.class, error -> responder.reply(event,
                "You have reached the limit of %d tickets per day. Please wait for our team to answer your open tickets."
                    .formatted(error.getLimit())));
    }

    private Mono<Void> showStatus(Client client, InboundEvent event) {
        return ticketService.list(TicketFilter.forClient(client.getId()), TicketView.CLIENT, 0, STATUS_ITEMS)
            .flatMap(page -> responder.reply(event, formatStatus(page.items())));
    }

    private Mono<Void> appendToSession(Client client, InboundEvent event) {
        if (event.text().isBlank() && event.mediaRef() == null) {
            return responder.reply(event, MENU);
        }
        return ticketService.appendToLiveSession(client.getId(), event.senderContact(), event.text(), event.mediaRef())
            .doOnNext(ticket -> log.debug("Client message appended to ticket {}", ticket.getId()))
            .map(ticket -> true)
            .switchIfEmpty(Mono.defer(() -> responder.reply(event, MENU).thenReturn(false)))
            .then();
    }

    static String formatStatus(List<Ticket> tickets) {
        if (tickets.isEmpty()) {
            return "You have no recent tickets.";
        }
        return tickets.stream()
            .map(ticket -> "%s %s - %s".formatted(ticket.shortReference(), ticket.getSubject(), ticket.getStatus().wireValue()))
            .collect(Collectors.joining("\n", "Your latest tickets:\n", ""));
    }
}
