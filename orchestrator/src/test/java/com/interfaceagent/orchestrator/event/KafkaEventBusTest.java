package com.interfaceagent.orchestrator.event;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for KafkaEventBus.
 *
 * The broker is a mocked KafkaTemplate and the dedup store lives in memory.
 * Consumption is driven through {@link KafkaEventBus#deliver}, which is what the
 * listener container calls for every record, redeliveries included.
 */
@ExtendWith(MockitoExtension.class)
class KafkaEventBusTest {

    static final String TOPIC = "interface-agent.events";

    @Mock KafkaTemplate<String, DomainEvent> kafka;
    @Mock EventLedger                        ledger;

    InMemoryDedupStore  dedupStore;
    SimpleMeterRegistry meterRegistry;
    DegradedModeMonitor monitor;
    KafkaEventBus       bus;

    @BeforeEach
    void setUp() {
        dedupStore    = new InMemoryDedupStore();
        meterRegistry = new SimpleMeterRegistry();
        monitor       = new DegradedModeMonitor(meterRegistry);
        bus = new KafkaEventBus(kafka, dedupStore, monitor, ledger, meterRegistry, TOPIC,
                Duration.ofSeconds(1), Duration.ofHours(24));
    }

    // ------------------------------------------------------------------
    // Consume: duplicate suppression
    // ------------------------------------------------------------------

    @Test
    void deliver_thousandEventsWithTenPercentDuplicates_handlesNineHundred() {
        AtomicInteger handled = new AtomicInteger();
        bus.subscribe(consumer("counter", e -> handled.incrementAndGet()));

        List<DomainEvent> stream = new ArrayList<>();
        for (int i = 0; i < 900; i++) {
            stream.add(event("evt-" + i, EventTypes.STEP_SUCCEEDED));
        }
        for (int i = 0; i < 100; i++) {
            stream.add(event("evt-" + (i * 7), EventTypes.STEP_SUCCEEDED));
        }
        stream.forEach(bus::deliver);

        assertThat(handled).hasValue(900);
        assertThat(delivered("counter", "handled")).isEqualTo(900.0);
        assertThat(delivered("counter", "duplicate")).isEqualTo(100.0);
    }

    @Test
    void deliver_dedupIsScopedPerConsumer() {
        AtomicInteger audit   = new AtomicInteger();
        AtomicInteger anomaly = new AtomicInteger();
        bus.subscribe(consumer("audit", e -> audit.incrementAndGet()));
        bus.subscribe(consumer("anomaly", e -> anomaly.incrementAndGet()));

        DomainEvent e = event("evt-1", EventTypes.STEP_FAILED);
        bus.deliver(e);
        bus.deliver(e);

        assertThat(audit).hasValue(1);
        assertThat(anomaly).hasValue(1);
        assertThat(dedupStore.keys()).containsExactlyInAnyOrder("processed:audit:evt-1", "processed:anomaly:evt-1");
    }

    @Test
    void deliver_onlyToConsumersAcceptingTheType() {
        List<String> seen = new ArrayList<>();
        bus.subscribe(new EventConsumer() {
            @Override public String name() { return "failures-only"; }
            @Override public boolean accepts(String type) { return EventTypes.STEP_FAILED.equals(type); }
            @Override public void handle(DomainEvent event) { seen.add(event.eventId()); }
        });

        bus.deliver(event("a", EventTypes.STEP_SUCCEEDED));
        bus.deliver(event("b", EventTypes.STEP_FAILED));

        assertThat(seen).containsExactly("b");
        assertThat(dedupStore.keys()).containsExactly("processed:failures-only:b");
    }

    // ------------------------------------------------------------------
    // Consume: failures
    // ------------------------------------------------------------------

    @Test
    void deliver_handlerThrows_keyReleasedSoRedeliveryRetries() {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(consumer("flaky", e -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("db hiccup");
        }));
        DomainEvent e = event("evt-1", EventTypes.STEP_SUCCEEDED);

        assertThatThrownBy(() -> bus.deliver(e)).isInstanceOf(IllegalStateException.class);
        assertThat(dedupStore.keys()).isEmpty();

        bus.deliver(e);

        assertThat(attempts).hasValue(2);
        assertThat(dedupStore.keys()).containsExactly("processed:flaky:evt-1");
        assertThat(delivered("flaky", "failed")).isEqualTo(1.0);
        assertThat(delivered("flaky", "handled")).isEqualTo(1.0);
    }

    @Test
    void deliver_oneConsumerFails_othersStillHandledAndSkippedOnRetry() {
        AtomicInteger good = new AtomicInteger();
        AtomicInteger bad  = new AtomicInteger();
        bus.subscribe(consumer("bad", e -> {
            bad.incrementAndGet();
            throw new IllegalStateException("always");
        }));
        bus.subscribe(consumer("good", e -> good.incrementAndGet()));
        DomainEvent e = event("evt-1", EventTypes.STEP_SUCCEEDED);

        assertThatThrownBy(() -> bus.deliver(e)).hasMessage("always");
        assertThatThrownBy(() -> bus.deliver(e)).hasMessage("always");

        assertThat(bad).hasValue(2);
        assertThat(good).hasValue(1);
    }

    @Test
    void deliver_dedupStoreDown_stillDeliversAndReportsDegraded() {
        AtomicInteger handled = new AtomicInteger();
        bus.subscribe(consumer("audit", e -> handled.incrementAndGet()));
        dedupStore.setFailing(true);

        bus.deliver(event("evt-1", EventTypes.STEP_SUCCEEDED));
        bus.deliver(event("evt-1", EventTypes.STEP_SUCCEEDED));

        assertThat(handled).hasValue(2);   // duplicate let through rather than dropped
        assertThat(monitor.isDegraded(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE)).isTrue();
        assertThat(new EventBusHealthIndicator(monitor).health().getStatus())
                .isEqualTo(EventBusHealthIndicator.DEGRADED);

        dedupStore.setFailing(false);
        bus.deliver(event("evt-2", EventTypes.STEP_SUCCEEDED));

        assertThat(monitor.isDegraded()).isFalse();
        assertThat(new EventBusHealthIndicator(monitor).health().getStatus()).isEqualTo(Status.UP);
    }

    // ------------------------------------------------------------------
    // Consume: event log
    // ------------------------------------------------------------------

    @Test
    void deliver_allConsumersSucceed_eventLoggedProcessingThenCompleted() {
        bus.subscribe(consumer("audit", e -> { }));
        DomainEvent e = event("evt-1", EventTypes.STEP_SUCCEEDED);

        bus.deliver(e);

        InOrder order = inOrder(ledger);
        order.verify(ledger).markProcessing(e);
        order.verify(ledger).markCompleted(e);
        verify(ledger, never()).markFailed(any(), any());
    }

    @Test
    void deliver_consumerFailsThenRecovers_eventLoggedFailedThenCompleted() {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(consumer("flaky", e -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("db hiccup");
        }));
        DomainEvent e = event("evt-1", EventTypes.STEP_SUCCEEDED);

        assertThatThrownBy(() -> bus.deliver(e)).isInstanceOf(IllegalStateException.class);
        bus.deliver(e);

        InOrder order = inOrder(ledger);
        order.verify(ledger).markProcessing(e);
        order.verify(ledger).markFailed(e, "db hiccup");
        order.verify(ledger).markProcessing(e);
        order.verify(ledger).markCompleted(e);
    }

    @Test
    void subscribe_duplicateName_rejected() {
        bus.subscribe(consumer("audit", e -> { }));

        assertThatThrownBy(() -> bus.subscribe(consumer("audit", e -> { })))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    @Test
    void publish_acknowledged_keyedByExecutionAndRecordedInLedger() {
        when(kafka.send(anyString(), anyString(), any())).thenReturn(acknowledged());
        UUID executionId = UUID.randomUUID();
        DomainEvent e = DomainEvent.of("evt-1", EventTypes.STEP_STARTED, Map.of(), executionId, "orchestrator");

        bus.publish(e);

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(kafka).send(eq(TOPIC), key.capture(), eq(e));
        assertThat(key.getValue()).isEqualTo(executionId.toString());
        assertThat(bus.wasPublished("evt-1")).isTrue();
        assertThat(bus.wasPublished("evt-2")).isFalse();
        assertThat(published(EventTypes.STEP_STARTED, "ok")).isEqualTo(1.0);
        verify(ledger).recordPublished(e);
    }

    @Test
    void publish_brokerRejects_throwsBrokerUnavailable() {
        when(kafka.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no leader for partition")));
        DomainEvent e = event("evt-1", EventTypes.STEP_FAILED);

        assertThatThrownBy(() -> bus.publish(e))
                .isInstanceOf(EventBusException.class)
                .satisfies(ex -> assertThat(((EventBusException) ex).getKind())
                        .isEqualTo(EventBusException.Kind.BROKER_UNAVAILABLE));

        assertThat(bus.wasPublished("evt-1")).isFalse();
        assertThat(monitor.isDegraded(EventBusException.Kind.BROKER_UNAVAILABLE)).isTrue();
        assertThat(published(EventTypes.STEP_FAILED, "failed")).isEqualTo(1.0);
        verifyNoInteractions(ledger);
    }

    @Test
    void publish_sendThrows_throwsBrokerUnavailable() {
        when(kafka.send(anyString(), anyString(), any())).thenThrow(new KafkaException("Send failed"));

        assertThatThrownBy(() -> bus.publish(event("evt-1", EventTypes.STEP_FAILED)))
                .isInstanceOf(EventBusException.class)
                .hasMessageContaining("BROKER_UNAVAILABLE");
    }

    @Test
    void publish_recoversAfterBrokerComesBack() {
        when(kafka.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")))
                .thenReturn(acknowledged());

        assertThatThrownBy(() -> bus.publish(event("evt-1", EventTypes.STEP_FAILED)))
                .isInstanceOf(EventBusException.class);
        bus.publish(event("evt-2", EventTypes.STEP_FAILED));

        assertThat(monitor.isDegraded()).isFalse();
    }

    @Test
    void publish_publishedMarkerWriteFails_publishStillSucceeds() {
        when(kafka.send(anyString(), anyString(), any())).thenReturn(acknowledged());
        dedupStore.setFailing(true);

        bus.publish(event("evt-1", EventTypes.EXECUTION_COMPLETED));

        assertThat(monitor.isDegraded(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE)).isTrue();
        assertThat(published(EventTypes.EXECUTION_COMPLETED, "ok")).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DomainEvent event(String id, String type) {
        return DomainEvent.of(id, type, Map.of("n", id), null, "test");
    }

    private static EventConsumer consumer(String name, Consumer<DomainEvent> handler) {
        return new EventConsumer() {
            @Override public String name() { return name; }
            @Override public void handle(DomainEvent event) { handler.accept(event); }
        };
    }

    private static CompletableFuture<SendResult<String, DomainEvent>> acknowledged() {
        return CompletableFuture.completedFuture(null);
    }

    private double delivered(String consumer, String outcome) {
        return meterRegistry.counter("interfaceagent.events.delivered", "consumer", consumer, "outcome", outcome).count();
    }

    private double published(String type, String status) {
        return meterRegistry.counter("interfaceagent.events.published", "type", type, "status", status).count();
    }
}
