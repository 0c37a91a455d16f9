package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.api.dto.AgentRequest;
import com.interfaceagent.orchestrator.api.dto.AgentResponse;
import com.interfaceagent.orchestrator.api.dto.AgentTypeResponse;
import com.interfaceagent.orchestrator.model.AgentDefinition;
import com.interfaceagent.orchestrator.service.AgentChanges;
import com.interfaceagent.orchestrator.service.AgentDraft;
import com.interfaceagent.orchestrator.service.AgentService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for agent definitions.
 *
 * GET    /agents                  list definitions by name
 * POST   /agents                  create (starts INACTIVE)
 * GET    /agents/types            registered implementation types
 * GET    /agents/{id}             one definition
 * PUT    /agents/{id}             partial update
 * DELETE /agents/{id}             delete (409 while a pipeline step uses it)
 * POST   /agents/{id}/activate    make it usable by executions
 * POST   /agents/{id}/deactivate
 */
@RestController
@RequestMapping("/agents")
public class AgentController {

    private final AgentService agentService;

    public AgentController(AgentService agentService) {
        this.agentService = agentService;
    }

    @GetMapping
    public List<AgentResponse> list() {
        return agentService.list().stream().map(AgentResponse::from).toList();
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/agents \
     *     -H "Content-Type: application/json" -H "X-Actor: alice" \
     *     -d '{"name":"order-validator","agentType":"validator",
     *          "config":{"rules":[{"field":"id","type":"required"}]}}'
     */
    @PostMapping
    public ResponseEntity<AgentResponse> create(@RequestBody AgentRequest req, HttpServletRequest http) {
        AgentDefinition agent = agentService.create(new AgentDraft(
                req.name(), req.description(), req.agentType(), req.category(), req.version(),
                req.config(), req.pluginModule(), req.pluginSymbol()), Callers.from(http));
        return ResponseEntity.status(HttpStatus.CREATED).body(AgentResponse.from(agent));
    }

    @GetMapping("/types")
    public List<AgentTypeResponse> types() {
        return agentService.registeredTypes().stream().map(AgentTypeResponse::from).toList();
    }

    @GetMapping("/{id}")
    public AgentResponse get(@PathVariable UUID id) {
        return AgentResponse.from(agentService.get(id));
    }

    @PutMapping("/{id}")
    public AgentResponse update(@PathVariable UUID id, @RequestBody AgentRequest req, HttpServletRequest http) {
        AgentChanges changes = new AgentChanges(req.name(), req.description(), req.version(), req.config());
        return AgentResponse.from(agentService.update(id, changes, Callers.from(http)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id, HttpServletRequest http) {
        agentService.delete(id, Callers.from(http));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/activate")
    public AgentResponse activate(@PathVariable UUID id, HttpServletRequest http) {
        return AgentResponse.from(agentService.activate(id, Callers.from(http)));
    }

    @PostMapping("/{id}/deactivate")
    public AgentResponse deactivate(@PathVariable UUID id, HttpServletRequest http) {
        return AgentResponse.from(agentService.deactivate(id, Callers.from(http)));
    }
}
