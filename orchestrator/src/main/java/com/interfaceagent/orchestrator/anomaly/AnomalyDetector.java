package com.interfaceagent.orchestrator.anomaly;

import com.interfaceagent.orchestrator.event.DomainEvent;
import com.interfaceagent.orchestrator.event.EventBus;
import com.interfaceagent.orchestrator.event.EventConsumer;
import com.interfaceagent.orchestrator.event.EventTypes;
import com.interfaceagent.orchestrator.model.AnomalyRecord;
import com.interfaceagent.orchestrator.repository.AnomalyRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scores step and execution outcomes as they arrive on the bus.
 *
 * A payload over the threshold is stored as an {@link AnomalyRecord} and
 * announced with {@code anomaly.detected} (event id {@code anomaly:<source event id>},
 * so a redelivered source yields the same anomaly event). Every payload is then
 * fed back into the model.
 *
 * <p>A scorer failure is logged and the event is skipped. A failure to store or
 * announce an anomaly is rethrown so the bus releases the dedup key and redelivers;
 * on redelivery a stored anomaly whose event never reached the broker is announced
 * again instead of being scored a second time.
 */
@Component
public class AnomalyDetector implements EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    static final String NAME = "anomaly-detector";

    private static final Set<String> TYPES = Set.of(
            EventTypes.STEP_SUCCEEDED, EventTypes.STEP_FAILED, EventTypes.EXECUTION_COMPLETED);

    private final AnomalyScorer     scorer;
    private final AnomalyRepository anomalies;
    private final EventBus          eventBus;
    private final boolean           enabled;

    public AnomalyDetector(AnomalyScorer scorer,
                           AnomalyRepository anomalies,
                           EventBus eventBus,
                           @Value("${interface-agent.anomaly.enabled:true}") boolean enabled) {
        this.scorer    = scorer;
        this.anomalies = anomalies;
        this.eventBus  = eventBus;
        this.enabled   = enabled;
    }

    @PostConstruct
    void subscribe() {
        if (enabled) {
            eventBus.subscribe(this);
        } else {
            log.info("Anomaly detection disabled");
        }
    }

    @Override public String name() { return NAME; }

    @Override
    public boolean accepts(String eventType) {
        return TYPES.contains(eventType);
    }

    @Override
    public void handle(DomainEvent event) {
        Optional<AnomalyRecord> recorded = anomalies.findBySourceEventId(event.eventId());
        if (recorded.isPresent()) {
            if (eventBus.wasPublished(anomalyEventId(event.eventId()))) {
                log.debug("Anomaly for {} already recorded and announced", event.eventId());
            } else {
                log.info("Re-announcing anomaly recorded for {}", event.eventId());
                announce(recorded.get());
            }
            return;
        }

        AnomalyScore score;
        try {
            score = scorer.score(event.payload());
        } catch (RuntimeException e) {
            log.warn("Anomaly scoring of {} ({}) failed: {}", event.eventId(), event.type(), e.getMessage());
            return;
        }

        if (score.anomalous()) {
            AnomalyRecord record = anomalies.save(new AnomalyRecord(event.type(), score.severity(), score.score(),
                    event.eventId(), event.executionId(), event.payload()));
            announce(record);
            log.warn("Anomaly detected in {} ({}): severity={}, score={}",
                    event.eventId(), event.type(), score.severity(), String.format("%.2f", score.score()));
        }

        try {
            scorer.observe(event.payload());
        } catch (RuntimeException e) {
            log.warn("Anomaly model update from {} failed: {}", event.eventId(), e.getMessage());
        }
    }

    // Throws EventBusException while the broker is down; the bus then redelivers the source event.
    private void announce(AnomalyRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sourceEventId", record.getSourceEventId());
        payload.put("detectionType", record.getDetectionType());
        payload.put("severity", record.getSeverity().name());
        payload.put("score", record.getScore());
        eventBus.publish(DomainEvent.of(anomalyEventId(record.getSourceEventId()), EventTypes.ANOMALY_DETECTED,
                payload, record.getExecutionId(), NAME));
    }

    static String anomalyEventId(String sourceEventId) {
        return "anomaly:" + sourceEventId;
    }
}
