package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.StepResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StepResultRepository extends JpaRepository<StepResult, UUID> {

    /** Step results of one execution, in execution order. */
    List<StepResult> findByExecutionIdOrderByStepOrderAsc(UUID executionId);
}
