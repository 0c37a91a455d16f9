package com.interfaceagent.orchestrator.event;

import com.interfaceagent.orchestrator.model.EventRecord;
import com.interfaceagent.orchestrator.model.EventStatus;
import com.interfaceagent.orchestrator.repository.EventRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link EventLedger} on the {@code event_log} table.
 *
 * Rows are keyed by event id, so a redelivered event moves the row it already
 * has. An event received without a row (published before the ledger existed,
 * or whose publish-side write was lost) gets one on first delivery. Each write
 * commits in its own transaction.
 */
@Component
public class JpaEventLedger implements EventLedger {

    private static final Logger log = LoggerFactory.getLogger(JpaEventLedger.class);

    private final EventRecordRepository repo;
    private final TransactionTemplate   ownTransaction;

    public JpaEventLedger(EventRecordRepository repo, PlatformTransactionManager transactionManager) {
        this.repo           = repo;
        this.ownTransaction = new TransactionTemplate(transactionManager);
        this.ownTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void recordPublished(DomainEvent event) {
        // A re-publish under the same id keeps the existing row and its history.
        update(event, "published", record -> {});
    }

    @Override
    public void markProcessing(DomainEvent event) {
        update(event, "processing", EventRecord::markProcessing);
    }

    @Override
    public void markCompleted(DomainEvent event) {
        update(event, "completed", EventRecord::markCompleted);
    }

    @Override
    public void markFailed(DomainEvent event, String error) {
        update(event, "failed", record -> record.markFailed(error));
    }

    private void update(DomainEvent event, String transition, Consumer<EventRecord> change) {
        if (event.eventId().length() > EventRecord.EVENT_ID_LENGTH) {
            log.warn("Event {} not logged: id longer than {} characters", event.eventId(), EventRecord.EVENT_ID_LENGTH);
            return;
        }
        try {
            ownTransaction.executeWithoutResult(tx -> {
                EventRecord record = repo.findByEventId(event.eventId()).orElseGet(() -> new EventRecord(
                        event.eventId(), event.type(), event.source(), event.executionId(), event.payload()));
                change.accept(record);
                repo.saveAndFlush(record);
            });
        } catch (RuntimeException e) {
            log.warn("Event log transition '{}' lost for {} ({}): {}",
                    transition, event.eventId(), event.type(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** The 100 most recent events in {@code status}. */
    public List<EventRecord> byStatus(EventStatus status) {
        return repo.findTop100ByStatusOrderByCreatedAtDesc(status);
    }

    public List<EventRecord> forExecution(UUID executionId) {
        return repo.findByExecutionIdOrderByCreatedAtAsc(executionId);
    }
}
