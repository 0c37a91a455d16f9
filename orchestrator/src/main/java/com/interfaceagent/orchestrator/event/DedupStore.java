package com.interfaceagent.orchestrator.event;

import java.time.Duration;

/**
 * Shared store of already-seen keys with a bounded lifetime.
 * Every method throws {@link EventBusException} DEDUP_STORE_UNAVAILABLE when the store cannot be reached.
 */
public interface DedupStore {

    /** Record {@code key} unless present. @return true if this call recorded it */
    boolean markIfAbsent(String key, Duration ttl);

    boolean contains(String key);

    void remove(String key);
}
