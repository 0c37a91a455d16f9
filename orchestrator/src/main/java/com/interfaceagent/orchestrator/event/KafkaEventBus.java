package com.interfaceagent.orchestrator.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event bus backed by a Kafka topic (durability, per-key ordering) and a
 * {@link DedupStore} (duplicate suppression).
 *
 * <h3>Publish</h3>
 * The record is keyed by execution id and the call blocks until the broker
 * acknowledges it ({@code acks=all}, idempotent producer). Only then is
 * {@code published:<eventId>} written to the dedup store. A failed marker write
 * is logged and does not fail the publish. The acknowledged event is also
 * written to the {@link EventLedger} as PENDING.
 *
 * <h3>Consume</h3>
 * Each delivered record goes to every subscribed consumer that accepts its type.
 * Per consumer, {@code processed:<consumer>:<eventId>} is set-if-absent before
 * the handler runs:
 * <ul>
 *   <li>key already present: duplicate, handler skipped;</li>
 *   <li>handler throws: key removed, so the container's retry reaches the handler again;</li>
 *   <li>dedup store down: handler runs anyway (possible duplicate, never a drop)
 *       and the bus reports DEDUP_STORE_UNAVAILABLE.</li>
 * </ul>
 * If any consumer failed, the first failure is rethrown after all consumers were
 * tried; consumers that succeeded are skipped on the retry by their own keys.
 * The ledger row moves to PROCESSING on receipt, then to COMPLETED, or to FAILED
 * with its retry count raised.
 */
@Component
public class KafkaEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventBus.class);

    static final String PUBLISHED_PREFIX = "published:";
    static final String PROCESSED_PREFIX = "processed:";

    private final KafkaTemplate<String, DomainEvent> kafka;
    private final DedupStore                         dedupStore;
    private final DegradedModeMonitor                monitor;
    private final EventLedger                        ledger;
    private final MeterRegistry                      meterRegistry;
    private final String                             topic;
    private final Duration                           publishTimeout;
    private final Duration                           dedupTtl;

    private final List<EventConsumer> consumers = new CopyOnWriteArrayList<>();

    public KafkaEventBus(
            KafkaTemplate<String, DomainEvent> kafka,
            DedupStore dedupStore,
            DegradedModeMonitor monitor,
            EventLedger ledger,
            MeterRegistry meterRegistry,
            @Value("${interface-agent.events.topic:interface-agent.events}") String topic,
            @Value("${interface-agent.events.publish-timeout:5s}") Duration publishTimeout,
            @Value("${interface-agent.events.dedup-ttl:24h}") Duration dedupTtl) {
        this.kafka          = kafka;
        this.dedupStore     = dedupStore;
        this.monitor        = monitor;
        this.ledger         = ledger;
        this.meterRegistry  = meterRegistry;
        this.topic          = topic;
        this.publishTimeout = publishTimeout;
        this.dedupTtl       = dedupTtl;
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    @Override
    public void publish(DomainEvent event) {
        try {
            kafka.send(topic, event.partitionKey(), event)
                    .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw brokerUnavailable(event, "interrupted while waiting for acknowledgement", e);
        } catch (ExecutionException e) {
            throw brokerUnavailable(event, String.valueOf(e.getCause()), e.getCause());
        } catch (TimeoutException e) {
            throw brokerUnavailable(event, "no acknowledgement within " + publishTimeout, e);
        } catch (KafkaException | org.apache.kafka.common.KafkaException e) {
            throw brokerUnavailable(event, e.getMessage(), e);
        }
        monitor.recover(EventBusException.Kind.BROKER_UNAVAILABLE);
        countPublished(event, "ok");
        log.debug("Published {} ({})", event.eventId(), event.type());

        try {
            dedupStore.markIfAbsent(PUBLISHED_PREFIX + event.eventId(), dedupTtl);
        } catch (EventBusException e) {
            dedupUnavailable("published marker write for " + event.eventId(), e);
        }
        ledger.recordPublished(event);
    }

    private EventBusException brokerUnavailable(DomainEvent event, String detail, Throwable cause) {
        countPublished(event, "failed");
        monitor.degrade(EventBusException.Kind.BROKER_UNAVAILABLE, detail);
        log.warn("BrokerUnavailable: event {} ({}) not acknowledged: {}", event.eventId(), event.type(), detail);
        return new EventBusException(EventBusException.Kind.BROKER_UNAVAILABLE,
                "Event " + event.eventId() + " not acknowledged by broker: " + detail, cause);
    }

    @Override
    public boolean wasPublished(String eventId) {
        try {
            return dedupStore.contains(PUBLISHED_PREFIX + eventId);
        } catch (EventBusException e) {
            dedupUnavailable("published marker read for " + eventId, e);
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Consume
    // ------------------------------------------------------------------

    @Override
    public void subscribe(EventConsumer consumer) {
        for (EventConsumer existing : consumers) {
            if (existing.name().equals(consumer.name())) {
                throw new IllegalArgumentException("Consumer '" + consumer.name() + "' is already subscribed");
            }
        }
        consumers.add(consumer);
        log.info("Event consumer '{}' subscribed", consumer.name());
    }

    @KafkaListener(
            id = "interface-agent-events",
            topics = "${interface-agent.events.topic:interface-agent.events}",
            groupId = "${interface-agent.events.group-id:interface-agent}",
            containerFactory = "kafkaListenerContainerFactory")
    public void onRecord(ConsumerRecord<String, DomainEvent> record) {
        log.debug("Received {} from partition {} offset {}",
                record.value().eventId(), record.partition(), record.offset());
        deliver(record.value());
    }

    /**
     * Hand one delivered event to every accepting consumer.
     *
     * @throws RuntimeException the first handler failure, after all consumers were tried
     */
    public void deliver(DomainEvent event) {
        RuntimeException firstFailure = null;
        if (event.executionId() != null) MDC.put("executionId", event.executionId().toString());
        ledger.markProcessing(event);
        try {
            for (EventConsumer consumer : consumers) {
                if (!consumer.accepts(event.type())) continue;
                try {
                    deliverTo(consumer, event);
                } catch (RuntimeException e) {
                    if (firstFailure == null) firstFailure = e;
                }
            }
        } finally {
            MDC.remove("executionId");
        }
        if (firstFailure != null) {
            ledger.markFailed(event, String.valueOf(firstFailure.getMessage()));
            throw firstFailure;
        }
        ledger.markCompleted(event);
    }

    private void deliverTo(EventConsumer consumer, DomainEvent event) {
        String key = PROCESSED_PREFIX + consumer.name() + ":" + event.eventId();

        boolean tracked;
        try {
            if (!dedupStore.markIfAbsent(key, dedupTtl)) {
                countDelivered(consumer, "duplicate");
                log.debug("Duplicate {} suppressed for consumer '{}'", event.eventId(), consumer.name());
                return;
            }
            tracked = true;
            monitor.recover(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE);
        } catch (EventBusException e) {
            dedupUnavailable("dedup check of " + event.eventId() + " for '" + consumer.name() + "'", e);
            tracked = false;
        }

        try {
            consumer.handle(event);
            countDelivered(consumer, "handled");
        } catch (RuntimeException e) {
            countDelivered(consumer, "failed");
            log.warn("Consumer '{}' failed on {} ({}): {}",
                    consumer.name(), event.eventId(), event.type(), e.getMessage());
            if (tracked) {
                try {
                    dedupStore.remove(key);
                } catch (EventBusException removeFailure) {
                    // The key now expires with its TTL; redeliveries before then are suppressed.
                    dedupUnavailable("dedup key release of " + key, removeFailure);
                }
            }
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void dedupUnavailable(String operation, EventBusException e) {
        log.warn("DedupStoreUnavailable: {} failed, continuing without deduplication: {}",
                operation, e.getMessage());
        monitor.degrade(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE, e.getMessage());
    }

    private void countPublished(DomainEvent event, String status) {
        meterRegistry.counter("interfaceagent.events.published", "type", event.type(), "status", status).increment();
    }

    private void countDelivered(EventConsumer consumer, String outcome) {
        meterRegistry.counter("interfaceagent.events.delivered", "consumer", consumer.name(), "outcome", outcome).increment();
    }
}
