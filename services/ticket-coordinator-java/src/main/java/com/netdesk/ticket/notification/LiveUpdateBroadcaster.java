package com.netdesk.ticket.notification;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process multicast of events to the browser sessions connected to this process.
 * Sessions that cannot keep up miss events; they reload on the next one.
 */
@Component
public class LiveUpdateBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(LiveUpdateBroadcaster.class);

    private final Sinks.Many<TicketEvent> sink = Sinks.many().multicast().directBestEffort();

    public void broadcast(TicketEvent event) {
        try {
            sink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
            log.debug("Broadcast {} for ticket {} to {} sessions", event.type(), event.ticketId(), sink.currentSubscriberCount());
        } catch (Sinks.EmissionException e) {
            log.warn("Could not broadcast {} for ticket {}: {}", event.type(), event.ticketId(), e.getReason());
        }
    }

    public Flux<TicketEvent> events() {
        return sink.asFlux();
    }

    public int sessionCount() {
        return sink.currentSubscriberCount();
    }
}
