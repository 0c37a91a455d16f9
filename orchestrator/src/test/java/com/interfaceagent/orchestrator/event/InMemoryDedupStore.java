package com.interfaceagent.orchestrator.event;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DedupStore for tests. TTLs are ignored; {@link #failing} simulates an
 * unreachable store.
 */
public class InMemoryDedupStore implements DedupStore {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public Set<String> keys() {
        return Set.copyOf(keys);
    }

    @Override
    public boolean markIfAbsent(String key, Duration ttl) {
        check();
        return keys.add(key);
    }

    @Override
    public boolean contains(String key) {
        check();
        return keys.contains(key);
    }

    @Override
    public void remove(String key) {
        check();
        keys.remove(key);
    }

    private void check() {
        if (failing) {
            throw new EventBusException(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE,
                    "in-memory store set to fail", null);
        }
    }
}
