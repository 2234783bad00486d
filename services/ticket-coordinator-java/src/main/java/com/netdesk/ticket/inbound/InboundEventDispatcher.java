package com.netdesk.ticket.inbound;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.ratelimit.SlidingWindowRateLimiter;

import reactor.core.publisher.Mono;

/**
 * Entry point for every inbound chat event, polled or pushed. Throttles each sender
 * and routes the event to the handler of its feed.
 */
@Component
public class InboundEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InboundEventDispatcher.class);

    static final String SLOW_DOWN = "Please wait a few seconds before sending more commands.";

    private final SlidingWindowRateLimiter rateLimiter;
    private final TicketProperties.InteractiveProperties throttle;
    private final ClientCommandHandler clientHandler;
    private final TechCommandHandler techHandler;
    private final ChatResponder responder;

    public InboundEventDispatcher(
        SlidingWindowRateLimiter rateLimiter,
        TicketProperties properties,
        ClientCommandHandler clientHandler,
        TechCommandHandler techHandler,
        ChatResponder responder
    ) {
        this.rateLimiter = rateLimiter;
        this.throttle = properties.getInteractive();
        this.clientHandler = clientHandler;
        this.techHandler = techHandler;
        this.responder = responder;
    }

    public Mono<Void> dispatch(InboundEvent event) {
        if (!StringUtils.hasText(event.senderContact())) {
            log.debug("Ignoring update {} without sender", event.updateId());
            return Mono.empty();
        }
        String actorKey = event.feed().pathSegment() + ":" + event.senderContact();
        if (!rateLimiter.allow(actorKey, throttle.getLimit(), throttle.getWindow())) {
            return responder.reply(event, SLOW_DOWN);
        }
        return switch (event.feed()) {
            case CLIENT -> clientHandler.handle(event);
            case TECH -> techHandler.handle(event);
        };
    }
}
