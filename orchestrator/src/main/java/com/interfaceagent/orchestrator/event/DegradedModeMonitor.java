package com.interfaceagent.orchestrator.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which event-bus dependencies are currently failing and since when.
 * Read by {@link EventBusHealthIndicator}; written by the bus on every
 * failure and every subsequent success.
 */
@Component
public class DegradedModeMonitor {

    private static final Logger log = LoggerFactory.getLogger(DegradedModeMonitor.class);

    private final Map<EventBusException.Kind, Instant> degradedSince = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public DegradedModeMonitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void degrade(EventBusException.Kind reason, String detail) {
        meterRegistry.counter("interfaceagent.events.degraded", "reason", reason.name()).increment();
        if (degradedSince.putIfAbsent(reason, Instant.now()) == null) {
            log.warn("Event bus entering degraded mode: {} ({})", reason, detail);
        }
    }

    public void recover(EventBusException.Kind reason) {
        Instant since = degradedSince.remove(reason);
        if (since != null) {
            log.info("Event bus recovered from {} (degraded since {})", reason, since);
        }
    }

    public boolean isDegraded() {
        return !degradedSince.isEmpty();
    }

    public boolean isDegraded(EventBusException.Kind reason) {
        return degradedSince.containsKey(reason);
    }

    /** Copy of the active conditions. */
    public Map<EventBusException.Kind, Instant> snapshot() {
        Map<EventBusException.Kind, Instant> copy = new EnumMap<>(EventBusException.Kind.class);
        copy.putAll(degradedSince);
        return copy;
    }
}
