package com.interfaceagent.orchestrator.event;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Exposes degraded event delivery on /actuator/health as {@code eventBus}.
 * Degraded is not DOWN: executions keep running, only delivery guarantees weaken.
 */
@Component("eventBus")
public class EventBusHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Event delivery guarantees are weakened");

    private final DegradedModeMonitor monitor;

    public EventBusHealthIndicator(DegradedModeMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Map<EventBusException.Kind, Instant> active = monitor.snapshot();
        if (active.isEmpty()) {
            return Health.up().build();
        }
        Health.Builder builder = Health.status(DEGRADED);
        active.forEach((reason, since) -> builder.withDetail(reason.name(), "since " + since));
        return builder.build();
    }
}
