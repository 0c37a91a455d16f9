package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.AuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Insert + query operations for the audit trail. Nothing in the service
 * calls delete or update on this repository.
 */
public interface AuditRecordRepository extends JpaRepository<AuditRecord, UUID> {

    List<AuditRecord> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);

    List<AuditRecord> findByActionOrderByCreatedAtDesc(String action);

    List<AuditRecord> findByActorOrderByCreatedAtDesc(String actor);
}
