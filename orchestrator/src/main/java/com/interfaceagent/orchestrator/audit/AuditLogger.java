package com.interfaceagent.orchestrator.audit;

import com.interfaceagent.orchestrator.model.AuditRecord;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.repository.AuditRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail.
 *
 * {@link #record} never throws: a lost audit row is logged at WARN and the
 * audited operation carries on. Each row is committed in its own transaction,
 * so a FAILURE row survives the rollback of the operation it describes and a
 * rejected insert never surfaces at the caller's commit. With
 * {@code interface-agent.audit.enabled=false} nothing is written.
 */
@Service
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AuditRecordRepository repo;
    private final TransactionTemplate   ownTransaction;
    private final boolean               enabled;

    public AuditLogger(AuditRecordRepository repo,
                       PlatformTransactionManager transactionManager,
                       @Value("${interface-agent.audit.enabled:true}") boolean enabled) {
        this.repo           = repo;
        this.ownTransaction = new TransactionTemplate(transactionManager);
        this.ownTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.enabled        = enabled;
    }

    public void record(String actor, String action, String resourceType, Object resourceId,
                       AuditStatus status, Map<String, Object> details) {
        record(actor, action, resourceType, resourceId, status, details, null);
    }

    public void record(String actor, String action, String resourceType, Object resourceId,
                       AuditStatus status, Map<String, Object> details, String origin) {
        if (!enabled) return;
        try {
            AuditRecord entry = new AuditRecord(
                    actor == null ? SYSTEM_ACTOR : actor,
                    action,
                    resourceType,
                    resourceId == null ? null : resourceId.toString(),
                    status,
                    details,
                    origin);
            ownTransaction.executeWithoutResult(tx -> repo.saveAndFlush(entry));
        } catch (RuntimeException e) {
            log.warn("Audit record lost (actor={}, action={}, {}={}): {}",
                    actor, action, resourceType, resourceId, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public List<AuditRecord> forResource(String resourceType, String resourceId) {
        return repo.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(resourceType, resourceId);
    }

    public List<AuditRecord> byAction(String action) {
        return repo.findByActionOrderByCreatedAtDesc(action);
    }

    public List<AuditRecord> byActor(String actor) {
        return repo.findByActorOrderByCreatedAtDesc(actor);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
