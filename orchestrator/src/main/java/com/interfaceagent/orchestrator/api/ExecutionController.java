package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.api.dto.ExecutionDetailsResponse;
import com.interfaceagent.orchestrator.orchestration.PipelineOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * GET  /executions/{id}          execution plus ordered step results
 * POST /executions/{id}/cancel   202 if cancellation was requested, 409 if the
 *                                execution is not running in this instance
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final PipelineOrchestrator orchestrator;

    public ExecutionController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/{id}")
    public ExecutionDetailsResponse get(@PathVariable UUID id) {
        return ExecutionDetailsResponse.from(orchestrator.getExecution(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID id, HttpServletRequest http) {
        boolean requested = orchestrator.cancel(id, Callers.from(http).actor());
        Map<String, Object> body = Map.of("executionId", id.toString(), "cancelRequested", requested);
        return requested
                ? ResponseEntity.accepted().body(body)
                : ResponseEntity.status(409).body(body);
    }
}
