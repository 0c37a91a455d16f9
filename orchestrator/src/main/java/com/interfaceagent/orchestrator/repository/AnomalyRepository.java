package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.AnomalyRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface AnomalyRepository extends JpaRepository<AnomalyRecord, UUID> {

    Optional<AnomalyRecord> findBySourceEventId(String sourceEventId);
}
