package com.netdesk.ticket.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory sliding-window throttle keyed by actor.
 *
 * <p>For every actor the limiter keeps the timestamps of accepted calls. A call is
 * accepted when fewer than {@code limit} accepted calls fall inside the trailing
 * window; rejected calls are not recorded. Timestamps that left the window are
 * purged lazily on each check.</p>
 *
 * <p>All reads and writes of one actor's window happen inside
 * {@link ConcurrentMap#compute}, so a sweep can never drop an entry that a
 * concurrent {@link #allow} is updating. State is local to this process.</p>
 */
@Component
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final ConcurrentMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public boolean allow(String actorKey, int limit, Duration window) {
        if (limit <= 0) {
            return false;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        boolean[] accepted = new boolean[1];

        windows.compute(actorKey, (key, existing) -> {
            Deque<Instant> timestamps = existing == null ? new ArrayDeque<>() : existing;
            while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
                timestamps.pollFirst();
            }
            if (timestamps.size() < limit) {
                timestamps.addLast(now);
                accepted[0] = true;
            }
            return timestamps;
        });

        if (!accepted[0]) {
            log.warn("Rate limit exceeded for actor {} ({} calls per {})", actorKey, limit, window);
        }
        return accepted[0];
    }

    /**
     * Drops actors whose most recent accepted call is older than {@code maxAge}.
     * {@code maxAge} should not be shorter than the longest window used with this
     * limiter, otherwise an idle actor regains its full quota early.
     *
     * @return number of actors removed
     */
    public int sweep(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (String actorKey : windows.keySet()) {
            boolean[] dropped = new boolean[1];
            windows.computeIfPresent(actorKey, (key, timestamps) -> {
                Instant last = timestamps.peekLast();
                if (last == null || last.isBefore(cutoff)) {
                    dropped[0] = true;
                    return null;
                }
                return timestamps;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Rate limit table swept: {} stale actors removed, {} remaining", removed, windows.size());
        }
        return removed;
    }

    public int size() {
        return windows.size();
    }
}
