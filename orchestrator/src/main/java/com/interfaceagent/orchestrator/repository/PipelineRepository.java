package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.PipelineDefinition;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD operations for pipelines and their steps.
 */
public interface PipelineRepository extends JpaRepository<PipelineDefinition, UUID> {

    boolean existsByName(String name);

    /**
     * Load a pipeline with its steps in one query, so the result can be
     * snapshotted outside a transaction.
     */
    @EntityGraph(attributePaths = "steps")
    @Query("SELECT p FROM PipelineDefinition p WHERE p.id = :id")
    Optional<PipelineDefinition> findWithStepsById(@Param("id") UUID id);

    /** Referential check before an agent definition may be deleted. */
    @Query("SELECT COUNT(s) > 0 FROM PipelineStep s WHERE s.agentId = :agentId")
    boolean isAgentReferenced(@Param("agentId") UUID agentId);
}
