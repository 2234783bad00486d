package com.netdesk.ticket.ratelimit;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.config.TicketProperties;

/**
 * Periodically evicts idle actors from the interactive rate limiter to bound memory.
 */
@Component
public class RateLimitSweeper {

    private final SlidingWindowRateLimiter rateLimiter;
    private final TicketProperties.InteractiveProperties properties;

    public RateLimitSweeper(SlidingWindowRateLimiter rateLimiter, TicketProperties ticketProperties) {
        this.rateLimiter = rateLimiter;
        this.properties = ticketProperties.getInteractive();
    }

    @Scheduled(
        fixedDelayString = "${tickets.interactive.sweep-interval:PT5M}",
        initialDelayString = "${tickets.interactive.sweep-interval:PT5M}"
    )
    public void sweep() {
        rateLimiter.sweep(properties.getMaxAge());
    }
}
