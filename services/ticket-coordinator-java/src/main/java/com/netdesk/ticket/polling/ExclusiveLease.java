package com.netdesk.ticket.polling;

/**
 * Cross-process mutual exclusion keyed by name. Acquisition never waits, and a lease
 * held by a process that dies is freed without that process's help.
 */
public interface ExclusiveLease {

    /**
     * @return {@code true} when this process holds the lease afterwards
     */
    boolean tryAcquire(String key);

    void release(String key);

    boolean isHeld(String key);
}
