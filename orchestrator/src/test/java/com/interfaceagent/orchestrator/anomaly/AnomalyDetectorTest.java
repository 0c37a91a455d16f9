package com.interfaceagent.orchestrator.anomaly;

import com.interfaceagent.orchestrator.event.DegradedModeMonitor;
import com.interfaceagent.orchestrator.event.DomainEvent;
import com.interfaceagent.orchestrator.event.EventBus;
import com.interfaceagent.orchestrator.event.EventBusException;
import com.interfaceagent.orchestrator.event.EventLedger;
import com.interfaceagent.orchestrator.event.EventTypes;
import com.interfaceagent.orchestrator.event.InMemoryDedupStore;
import com.interfaceagent.orchestrator.event.KafkaEventBus;
import com.interfaceagent.orchestrator.model.AnomalyRecord;
import com.interfaceagent.orchestrator.model.AnomalySeverity;
import com.interfaceagent.orchestrator.repository.AnomalyRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    @Mock AnomalyScorer     scorer;
    @Mock AnomalyRepository anomalies;
    @Mock EventBus          eventBus;

    private final UUID        executionId = UUID.randomUUID();
    private final DomainEvent source = DomainEvent.of(
            EventTypes.stepEventId(executionId, 1, EventTypes.STEP_SUCCEEDED), EventTypes.STEP_SUCCEEDED,
            Map.of("durationMs", 90_000), executionId, "orchestrator");

    @Test
    void handle_anomalousPayload_storesRecordAndPublishesDeterministicEvent() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.empty());
        when(scorer.score(source.payload())).thenReturn(new AnomalyScore(true, AnomalySeverity.HIGH, 5.2));
        when(anomalies.save(any(AnomalyRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        detector.handle(source);

        ArgumentCaptor<AnomalyRecord> record = ArgumentCaptor.forClass(AnomalyRecord.class);
        verify(anomalies).save(record.capture());
        assertThat(record.getValue().getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(record.getValue().getSourceEventId()).isEqualTo(source.eventId());

        ArgumentCaptor<DomainEvent> published = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus).publish(published.capture());
        assertThat(published.getValue().eventId()).isEqualTo("anomaly:" + source.eventId());
        assertThat(published.getValue().type()).isEqualTo(EventTypes.ANOMALY_DETECTED);
        assertThat(published.getValue().executionId()).isEqualTo(executionId);
        assertThat(published.getValue().payload()).containsEntry("severity", "HIGH");
        verify(scorer).observe(source.payload());
    }

    @Test
    void handle_brokerDownWhileAnnouncing_throwsSoTheSourceIsRedelivered() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.empty());
        when(scorer.score(source.payload())).thenReturn(new AnomalyScore(true, AnomalySeverity.HIGH, 5.2));
        when(anomalies.save(any(AnomalyRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        doThrow(new EventBusException(EventBusException.Kind.BROKER_UNAVAILABLE, "down", null))
                .when(eventBus).publish(any());

        assertThatThrownBy(() -> detector.handle(source)).isInstanceOf(EventBusException.class);
        verify(scorer, never()).observe(any());
    }

    @Test
    void handle_recordedButNeverAnnounced_republishesWithoutScoring() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        AnomalyRecord stored = new AnomalyRecord(source.type(), AnomalySeverity.CRITICAL, 7.5,
                source.eventId(), executionId, source.payload());
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.of(stored));
        when(eventBus.wasPublished("anomaly:" + source.eventId())).thenReturn(false);

        detector.handle(source);

        ArgumentCaptor<DomainEvent> published = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus).publish(published.capture());
        assertThat(published.getValue().eventId()).isEqualTo("anomaly:" + source.eventId());
        assertThat(published.getValue().payload()).containsEntry("severity", "CRITICAL");
        verify(anomalies, never()).save(any());
        verifyNoInteractions(scorer);
    }

    @Test
    void handle_recordedAndAnnounced_doesNothing() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        AnomalyRecord stored = new AnomalyRecord(source.type(), AnomalySeverity.HIGH, 5.2,
                source.eventId(), executionId, source.payload());
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.of(stored));
        when(eventBus.wasPublished("anomaly:" + source.eventId())).thenReturn(true);

        detector.handle(source);

        verify(anomalies, never()).save(any());
        verify(eventBus, never()).publish(any());
        verifyNoInteractions(scorer);
    }

    @Test
    void handle_normalPayload_onlyFeedsModel() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.empty());
        when(scorer.score(source.payload())).thenReturn(AnomalyScore.normal(0.4));

        detector.handle(source);

        verify(scorer).observe(source.payload());
        verify(anomalies, never()).save(any());
        verifyNoInteractions(eventBus);
    }

    @Test
    void handle_scorerFails_errorIsContained() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, true);
        when(anomalies.findBySourceEventId(source.eventId())).thenReturn(Optional.empty());
        when(scorer.score(source.payload())).thenThrow(new IllegalStateException("model corrupt"));

        assertThatCode(() -> detector.handle(source)).doesNotThrowAnyException();
        verify(anomalies, never()).save(any());
        verifyNoInteractions(eventBus);
    }

    @Test
    void subscribe_disabled_staysOffTheBus() {
        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, eventBus, false);

        detector.subscribe();

        verifyNoInteractions(eventBus);
        assertThat(detector.accepts(EventTypes.EXECUTION_COMPLETED)).isTrue();
        assertThat(detector.accepts(EventTypes.ANOMALY_DETECTED)).isFalse();
    }

    /**
     * Wired to a real KafkaEventBus: the broker refuses the anomaly event on the
     * first delivery, the container redelivers the source record once the broker
     * is back, and exactly one anomaly event ends up acknowledged.
     */
    @Test
    @SuppressWarnings("unchecked")
    void redeliveryAfterBrokerOutage_announcesTheAnomalyExactlyOnce() {
        KafkaTemplate<String, DomainEvent> kafka = mock(KafkaTemplate.class);
        InMemoryDedupStore dedupStore = new InMemoryDedupStore();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        KafkaEventBus bus = new KafkaEventBus(kafka, dedupStore, new DegradedModeMonitor(meterRegistry),
                mock(EventLedger.class), meterRegistry, "interface-agent.events", Duration.ofSeconds(1), Duration.ofHours(24));

        List<AnomalyRecord> stored = new ArrayList<>();
        when(anomalies.findBySourceEventId(source.eventId())).thenAnswer(inv -> stored.stream().findFirst());
        when(anomalies.save(any(AnomalyRecord.class))).thenAnswer(inv -> {
            stored.add(inv.getArgument(0));
            return inv.getArgument(0);
        });
        when(scorer.score(source.payload())).thenReturn(new AnomalyScore(true, AnomalySeverity.HIGH, 5.2));

        CompletableFuture<SendResult<String, DomainEvent>> ack = CompletableFuture.completedFuture(null);
        when(kafka.send(anyString(), anyString(), any()))
                .thenThrow(new KafkaException("Send failed"))
                .thenReturn(ack);

        AnomalyDetector detector = new AnomalyDetector(scorer, anomalies, bus, true);
        detector.subscribe();

        assertThatThrownBy(() -> bus.deliver(source)).isInstanceOf(EventBusException.class);
        assertThat(dedupStore.keys()).isEmpty();

        bus.deliver(source);
        bus.deliver(source);

        ArgumentCaptor<DomainEvent> sent = ArgumentCaptor.forClass(DomainEvent.class);
        verify(kafka, times(2)).send(anyString(), anyString(), sent.capture());
        assertThat(sent.getAllValues()).extracting(DomainEvent::eventId)
                .containsOnly("anomaly:" + source.eventId());
        assertThat(stored).hasSize(1);
        assertThat(bus.wasPublished("anomaly:" + source.eventId())).isTrue();
    }
}
