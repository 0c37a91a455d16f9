package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.ExecutionStatus;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + monitoring queries for the pipeline_executions table.
 */
public interface ExecutionRepository extends JpaRepository<PipelineExecution, UUID> {

    /** Most recent first. */
    List<PipelineExecution> findByPipelineIdOrderByStartedAtDesc(UUID pipelineId);

    /** RUNNING executions whose heartbeat is older than {@code cutoff} (see ExecutionReaper). */
    List<PipelineExecution> findByStatusAndHeartbeatAtBefore(ExecutionStatus status, Instant cutoff);
}
