package com.netdesk.ticket.polling;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which sibling process consumes a feed. Leadership for a feed is simply
 * holding its {@link ExclusiveLease}; it is never taken over or renewed.
 */
@Component
public class PollingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PollingCoordinator.class);

    private final ExclusiveLease lease;
    private final Set<String> leading = ConcurrentHashMap.newKeySet();

    public PollingCoordinator(ExclusiveLease lease) {
        this.lease = lease;
    }

    /**
     * Returns at once; {@code false} means another process leads {@code resourceKey}.
     */
    public boolean tryAcquireLeadership(String resourceKey) {
        boolean acquired = lease.tryAcquire(resourceKey);
        if (acquired) {
            leading.add(resourceKey);
            log.info("Leadership for '{}' acquired by pid {}", resourceKey, ProcessHandle.current().pid());
        } else {
            log.info("Leadership for '{}' is held by another process", resourceKey);
        }
        return acquired;
    }

    public void release(String resourceKey) {
        if (leading.remove(resourceKey)) {
            lease.release(resourceKey);
            log.info("Leadership for '{}' released", resourceKey);
        }
    }

    public void releaseAll() {
        for (String key : List.copyOf(leading)) {
            release(key);
        }
    }

    public boolean isLeader(String resourceKey) {
        return leading.contains(resourceKey) && lease.isHeld(resourceKey);
    }
}
