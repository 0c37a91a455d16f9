package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.api.dto.ExecuteRequest;
import com.interfaceagent.orchestrator.api.dto.ExecutionResponse;
import com.interfaceagent.orchestrator.api.dto.PipelineRequest;
import com.interfaceagent.orchestrator.api.dto.PipelineResponse;
import com.interfaceagent.orchestrator.api.dto.StepRequest;
import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import com.interfaceagent.orchestrator.model.PipelineStep;
import com.interfaceagent.orchestrator.orchestration.PipelineOrchestrator;
import com.interfaceagent.orchestrator.service.PipelineChanges;
import com.interfaceagent.orchestrator.service.PipelineService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for pipelines and their executions.
 *
 * GET    /pipelines                       list (without steps)
 * POST   /pipelines                       create a DRAFT pipeline
 * GET    /pipelines/{id}                  pipeline with its steps in order
 * PUT    /pipelines/{id}                  partial update, including status
 * DELETE /pipelines/{id}
 * POST   /pipelines/{id}/steps            add a step
 * DELETE /pipelines/{id}/steps/{stepId}   remove a step
 * POST   /pipelines/{id}/execute          start an execution (202, runs in the background)
 * GET    /pipelines/{id}/executions       executions, most recent first
 */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final PipelineService      pipelineService;
    private final PipelineOrchestrator orchestrator;

    public PipelineController(PipelineService pipelineService, PipelineOrchestrator orchestrator) {
        this.pipelineService = pipelineService;
        this.orchestrator    = orchestrator;
    }

    @GetMapping
    public List<PipelineResponse> list() {
        return pipelineService.list().stream().map(PipelineResponse::summary).toList();
    }

    @PostMapping
    public ResponseEntity<PipelineResponse> create(@RequestBody PipelineRequest req, HttpServletRequest http) {
        PipelineDefinition pipeline = pipelineService.create(req.name(), req.description(), req.config(),
                Callers.from(http));
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(pipeline));
    }

    @GetMapping("/{id}")
    public PipelineResponse get(@PathVariable UUID id) {
        return PipelineResponse.from(pipelineService.get(id));
    }

    @PutMapping("/{id}")
    public PipelineResponse update(@PathVariable UUID id, @RequestBody PipelineRequest req, HttpServletRequest http) {
        PipelineChanges changes = new PipelineChanges(req.name(), req.description(), req.status(), req.config());
        pipelineService.update(id, changes, Callers.from(http));
        return PipelineResponse.from(pipelineService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id, HttpServletRequest http) {
        pipelineService.delete(id, Callers.from(http));
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    @PostMapping("/{id}/steps")
    public ResponseEntity<PipelineResponse.StepView> addStep(@PathVariable UUID id, @RequestBody StepRequest req,
                                                             HttpServletRequest http) {
        if (req.agentId() == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        PipelineStep step = pipelineService.addStep(id, req.agentId(), req.order(), req.config(), Callers.from(http));
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.StepView.from(step));
    }

    @DeleteMapping("/{id}/steps/{stepId}")
    public ResponseEntity<Void> removeStep(@PathVariable UUID id, @PathVariable UUID stepId, HttpServletRequest http) {
        pipelineService.removeStep(id, stepId, Callers.from(http));
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Executions
    // ------------------------------------------------------------------

    /**
     * Start an execution. Returns as soon as the execution is RUNNING; poll
     * GET /executions/{id} for progress.
     *
     * Example:
     *   curl -X POST http://localhost:8080/pipelines/{id}/execute \
     *     -H "Content-Type: application/json" -d '{"input":{"id":1}}'
     */
    @PostMapping("/{id}/execute")
    public ResponseEntity<ExecutionResponse> execute(@PathVariable UUID id,
                                                     @RequestBody(required = false) ExecuteRequest req,
                                                     HttpServletRequest http) {
        ExecuteRequest body = req == null ? new ExecuteRequest(null) : req;
        PipelineExecution execution = orchestrator.executePipeline(id, body.input(), Callers.from(http).actor());
        return ResponseEntity.accepted().body(ExecutionResponse.from(execution));
    }

    @GetMapping("/{id}/executions")
    public List<ExecutionResponse> executions(@PathVariable UUID id) {
        return orchestrator.listExecutions(id).stream().map(ExecutionResponse::from).toList();
    }
}
