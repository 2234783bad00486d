package com.netdesk.ticket.notification;

import java.net.InetSocketAddress;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.core.publisher.Mono;

/**
 * Local entry point of the notification fallback: processes on this host post events
 * here when the broker is unreachable, and they are pushed to this process's live
 * sessions. Parameters may come from the query string or a JSON body; body values win.
 */
@RestController
@RequestMapping(path = "/api/internal", produces = MediaType.APPLICATION_JSON_VALUE)
public class InternalNotificationController {

    private static final Logger log = LoggerFactory.getLogger(InternalNotificationController.class);

    private final LiveUpdateBroadcaster broadcaster;

    public InternalNotificationController(LiveUpdateBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @PostMapping("/notify-monitor-update")
    public Mono<Map<String, Object>> notifyMonitorUpdate(
        ServerHttpRequest request,
        @RequestParam(required = false) String message,
        @RequestParam(required = false) String level,
        @RequestParam(name = "ticket_id", required = false) String ticketId,
        @RequestBody(required = false) Mono<MonitorUpdate> body
    ) {
        if (!isLoopback(request.getRemoteAddress())) {
            log.warn("Rejected monitor update from non-local address {}", request.getRemoteAddress());
            return Mono.error(new ResponseStatusException(HttpStatus.FORBIDDEN, "Local callers only"));
        }
        MonitorUpdate fromQuery = new MonitorUpdate(null, ticketId, null, message, level);
        return body
            .map(update -> update.orElse(fromQuery))
            .defaultIfEmpty(fromQuery)
            .map(MonitorUpdate::toEvent)
            .doOnNext(broadcaster::broadcast)
            .map(event -> Map.<String, Object>of("status", "broadcast_sent", "payload", event));
    }

    static boolean isLoopback(InetSocketAddress remote) {
        // unresolved in-memory exchanges carry no address
        if (remote == null || remote.getAddress() == null) {
            return true;
        }
        return remote.getAddress().isLoopbackAddress();
    }

    /**
     * Accepts both the event shape sent by the fallback transport ({@code notification})
     * and the shorter {@code message} form used by scripts.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MonitorUpdate(
        TicketEventType type,
        @JsonProperty("ticket_id") String ticketId,
        String notification,
        String message,
        String level
    ) {

        MonitorUpdate orElse(MonitorUpdate other) {
            return new MonitorUpdate(
                type,
                ticketId != null ? ticketId : other.ticketId,
                notification != null ? notification : other.notification,
                message != null ? message : other.message,
                level != null ? level : other.level
            );
        }

        TicketEvent toEvent() {
            return new TicketEvent(
                type != null ? type : TicketEventType.DB_UPDATED,
                ticketId,
                notification != null ? notification : message,
                level
            );
        }
    }
}
