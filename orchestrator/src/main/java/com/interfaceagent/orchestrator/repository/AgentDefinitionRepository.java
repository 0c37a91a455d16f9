package com.interfaceagent.orchestrator.repository;

import com.interfaceagent.orchestrator.model.AgentDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * CRUD operations for the agents table.
 */
public interface AgentDefinitionRepository extends JpaRepository<AgentDefinition, UUID> {

    boolean existsByName(String name);
}
