package com.interfaceagent.orchestrator.audit;

import com.interfaceagent.orchestrator.event.DomainEvent;
import com.interfaceagent.orchestrator.event.EventBus;
import com.interfaceagent.orchestrator.event.EventConsumer;
import com.interfaceagent.orchestrator.event.EventTypes;
import com.interfaceagent.orchestrator.model.AuditStatus;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Writes step outcomes and detected anomalies from the bus into the audit trail.
 * Agent state changes and execution outcomes are audited directly by the code
 * that causes them, so those event types are not consumed here.
 */
@Component
public class AuditEventConsumer implements EventConsumer {

    static final String NAME = "audit-logger";

    private static final Set<String> TYPES = Set.of(
            EventTypes.STEP_SUCCEEDED, EventTypes.STEP_FAILED, EventTypes.ANOMALY_DETECTED);

    private final AuditLogger auditLogger;
    private final EventBus    eventBus;

    public AuditEventConsumer(AuditLogger auditLogger, EventBus eventBus) {
        this.auditLogger = auditLogger;
        this.eventBus    = eventBus;
    }

    @PostConstruct
    void subscribe() {
        eventBus.subscribe(this);
    }

    @Override public String name() { return NAME; }

    @Override
    public boolean accepts(String eventType) {
        return TYPES.contains(eventType);
    }

    @Override
    public void handle(DomainEvent event) {
        Map<String, Object> details = new LinkedHashMap<>(event.payload());
        details.put("eventId", event.eventId());

        if (EventTypes.ANOMALY_DETECTED.equals(event.type())) {
            auditLogger.record(AuditLogger.SYSTEM_ACTOR, event.type(), "anomaly",
                    event.payload().get("sourceEventId"), AuditStatus.SUCCESS, details);
            return;
        }
        AuditStatus status = EventTypes.STEP_SUCCEEDED.equals(event.type()) ? AuditStatus.SUCCESS : AuditStatus.FAILURE;
        auditLogger.record(AuditLogger.SYSTEM_ACTOR, event.type(), "pipeline_step",
                event.payload().get("stepId"), status, details);
    }
}
