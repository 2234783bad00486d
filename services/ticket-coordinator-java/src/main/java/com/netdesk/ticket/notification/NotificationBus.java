package com.netdesk.ticket.notification;

import java.time.Duration;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Best-effort fan-out of ticket change events.
 *
 * <p>{@link #publish} hands the event to a dedicated scheduler and returns at once.
 * Delivery tries the primary transport, then the fallback, each bounded by the
 * attempt timeout; if both fail the event is logged and dropped. At most
 * {@code max-in-flight} deliveries run at the same time, further events are dropped
 * rather than queued.</p>
 */
@Component
public class NotificationBus {

    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    private final NotificationTransport primary;
    private final NotificationTransport fallback;
    private final Scheduler scheduler;
    private final Duration attemptTimeout;
    private final int maxInFlight;
    private final Semaphore permits;

    public NotificationBus(
        @Qualifier(RedisNotificationTransport.NAME) NotificationTransport primary,
        @Qualifier(LoopbackNotificationTransport.NAME) NotificationTransport fallback,
        @Qualifier("notificationScheduler") Scheduler scheduler,
        IntegrationProperties properties
    ) {
        this.primary = primary;
        this.fallback = fallback;
        this.scheduler = scheduler;
        this.attemptTimeout = properties.getNotifications().getAttemptTimeout();
        this.maxInFlight = properties.getNotifications().getMaxInFlight();
        this.permits = new Semaphore(maxInFlight);
    }

    /**
     * Never blocks on a transport and never throws.
     */
    public void publish(TicketEvent event) {
        if (!permits.tryAcquire()) {
            log.warn("{} notifications already in flight; dropping {} for ticket {}",
                maxInFlight, event.type(), event.ticketId());
            return;
        }
        deliver(event)
            .subscribeOn(scheduler)
            .doFinally(signal -> permits.release())
            .subscribe(
                transport -> log.debug("Delivered {} for ticket {} via {}", event.type(), event.ticketId(), transport),
                error -> log.error("Notification dispatch for ticket {} failed unexpectedly", event.ticketId(), error)
            );
    }

    public int inFlight() {
        return maxInFlight - permits.availablePermits();
    }

    /**
     * Emits the name of the transport that accepted the event, or completes empty
     * when the event was dropped.
     */
    Mono<String> deliver(TicketEvent event) {
        return attempt(primary, event)
            .onErrorResume(primaryError -> {
                log.warn("Notification transport {} failed for ticket {} ({}); trying {}",
                    primary.name(), event.ticketId(), describe(primaryError), fallback.name());
                return attempt(fallback, event);
            })
            .onErrorResume(fallbackError -> {
                log.error("Dropping {} for ticket {}: transport {} failed as well ({})",
                    event.type(), event.ticketId(), fallback.name(), describe(fallbackError));
                return Mono.empty();
            });
    }

    private Mono<String> attempt(NotificationTransport transport, TicketEvent event) {
        return Mono.defer(() -> transport.send(event))
            .timeout(attemptTimeout)
            .thenReturn(transport.name());
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
