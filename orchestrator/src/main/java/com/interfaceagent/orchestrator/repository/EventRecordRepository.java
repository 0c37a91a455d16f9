package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.EventRecord;
import com.interfaceagent.orchestrator.model.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EventRecordRepository extends JpaRepository<EventRecord, UUID> {

    Optional<EventRecord> findByEventId(String eventId);

    List<EventRecord> findTop100ByStatusOrderByCreatedAtDesc(EventStatus status);

    List<EventRecord> findByExecutionIdOrderByCreatedAtAsc(UUID executionId);
}
