package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.TestEntities;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import com.interfaceagent.orchestrator.model.StepFailureKind;
import com.interfaceagent.orchestrator.model.StepRecovery;
import com.interfaceagent.orchestrator.model.StepResult;
import com.interfaceagent.orchestrator.orchestration.OrchestrationException;
import com.interfaceagent.orchestrator.orchestration.PipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExecutionController.class)
class ExecutionControllerTest {

    @Autowired MockMvc                mockMvc;
    @MockitoBean PipelineOrchestrator orchestrator;

    @Test
    void get_returnsExecutionWithOrderedSteps() throws Exception {
        PipelineExecution execution = TestEntities.runningExecution(UUID.randomUUID(), Map.of("id", 1));
        StepResult first = StepResult.succeeded(execution.getId(), UUID.randomUUID(), UUID.randomUUID(), 1,
                true, Map.of("valid", true), Duration.ofMillis(12));
        StepResult second = StepResult.failed(execution.getId(), UUID.randomUUID(), UUID.randomUUID(), 2,
                false, StepFailureKind.TIMEOUT, "timed out after 500 ms", StepRecovery.NONE, Duration.ofMillis(500));
        when(orchestrator.getExecution(execution.getId()))
                .thenReturn(new PipelineOrchestrator.ExecutionDetails(execution, List.of(first, second)));

        mockMvc.perform(get("/executions/{id}", execution.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.execution.status").value("RUNNING"))
                .andExpect(jsonPath("$.steps[0].status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.steps[1].failureKind").value("TIMEOUT"))
                .andExpect(jsonPath("$.steps[1].critical").value(false));
    }

    @Test
    void get_unknownExecution_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.getExecution(id)).thenThrow(new OrchestrationException(
                OrchestrationException.Kind.EXECUTION_NOT_FOUND, "Execution " + id + " not found"));

        mockMvc.perform(get("/executions/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("EXECUTION_NOT_FOUND"));
    }

    @Test
    void cancel_running_returns202() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.cancel(eq(id), any())).thenReturn(true);

        mockMvc.perform(post("/executions/{id}/cancel", id).header("X-Actor", "bob"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    @Test
    void cancel_notRunning_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.cancel(eq(id), any())).thenReturn(false);

        mockMvc.perform(post("/executions/{id}/cancel", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.cancelRequested").value(false));
    }
}
