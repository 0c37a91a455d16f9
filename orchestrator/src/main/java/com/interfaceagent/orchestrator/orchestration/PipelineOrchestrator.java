package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import com.interfaceagent.orchestrator.model.PipelineStatus;
import com.interfaceagent.orchestrator.model.StepResult;
import com.interfaceagent.orchestrator.repository.ExecutionRepository;
import com.interfaceagent.orchestrator.repository.PipelineRepository;
import com.interfaceagent.orchestrator.repository.StepResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for running pipelines.
 *
 * {@link #executePipeline} validates and snapshots the pipeline, persists the
 * execution already in RUNNING state and hands it to the execution pool; it
 * returns without waiting for any step. Each execution runs on its own task, so
 * one pipeline can have many executions in flight.
 *
 * Not @Transactional: the execution row must be committed before the worker
 * thread looks it up.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    /** An execution plus its step results in order. */
    public record ExecutionDetails(PipelineExecution execution, List<StepResult> steps) {}

    private final PipelineRepository   pipelines;
    private final ExecutionRepository  executions;
    private final StepResultRepository stepResults;
    private final ExecutionRunner      runner;
    private final AuditLogger          auditLogger;
    private final ExecutorService      executionExecutor;

    // Executions running in this process, with their cancellation flag.
    private final Map<UUID, AtomicBoolean> running = new ConcurrentHashMap<>();

    public PipelineOrchestrator(PipelineRepository pipelines,
                                ExecutionRepository executions,
                                StepResultRepository stepResults,
                                ExecutionRunner runner,
                                AuditLogger auditLogger,
                                @Qualifier("executionExecutor") ExecutorService executionExecutor) {
        this.pipelines         = pipelines;
        this.executions        = executions;
        this.stepResults       = stepResults;
        this.runner            = runner;
        this.auditLogger       = auditLogger;
        this.executionExecutor = executionExecutor;
    }

    // ------------------------------------------------------------------
    // Execute
    // ------------------------------------------------------------------

    /**
     * Accept an execution of {@code pipelineId} against {@code input}.
     *
     * @return the execution, already RUNNING
     * @throws OrchestrationException PIPELINE_NOT_FOUND, PIPELINE_NOT_ACTIVE or STEP_ORDER_CONFLICT
     */
    public PipelineExecution executePipeline(UUID pipelineId, Map<String, Object> input, String actor) {
        PipelineSnapshot snapshot;
        try {
            PipelineDefinition pipeline = pipelines.findWithStepsById(pipelineId).orElseThrow(() ->
                    new OrchestrationException(OrchestrationException.Kind.PIPELINE_NOT_FOUND,
                            "Pipeline " + pipelineId + " not found"));
            if (pipeline.getStatus() != PipelineStatus.ACTIVE) {
                throw new OrchestrationException(OrchestrationException.Kind.PIPELINE_NOT_ACTIVE,
                        "Pipeline '" + pipeline.getName() + "' is " + pipeline.getStatus() + ", not ACTIVE");
            }
            snapshot = PipelineSnapshot.of(pipeline);
        } catch (RuntimeException e) {
            auditLogger.record(actor, "pipeline.execute", "pipeline", pipelineId, AuditStatus.FAILURE,
                    Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }

        PipelineExecution execution = new PipelineExecution(pipelineId, input, actor);
        execution.markRunning();
        execution = executions.save(execution);
        UUID executionId = execution.getId();

        auditLogger.record(actor, "pipeline.execute", "pipeline", pipelineId, AuditStatus.SUCCESS,
                Map.of("executionId", executionId.toString(), "steps", snapshot.steps().size()));
        log.info("Accepted execution {} of pipeline '{}' ({} step(s))",
                executionId, snapshot.name(), snapshot.steps().size());

        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        running.put(executionId, cancelFlag);
        try {
            executionExecutor.execute(() -> {
                try {
                    runner.run(executionId, snapshot, cancelFlag::get);
                } catch (Exception e) {
                    log.error("Unhandled error in execution {}: {}", executionId, e.getMessage(), e);
                    runner.failUnexpectedly(executionId, e);
                } finally {
                    running.remove(executionId);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(executionId);
            log.error("Execution pool rejected execution {}", executionId, e);
            runner.failUnexpectedly(executionId, e);
        }
        return execution;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public ExecutionDetails getExecution(UUID executionId) {
        PipelineExecution execution = executions.findById(executionId).orElseThrow(() ->
                new OrchestrationException(OrchestrationException.Kind.EXECUTION_NOT_FOUND,
                        "Execution " + executionId + " not found"));
        return new ExecutionDetails(execution, stepResults.findByExecutionIdOrderByStepOrderAsc(executionId));
    }

    public List<PipelineExecution> listExecutions(UUID pipelineId) {
        if (!pipelines.existsById(pipelineId)) {
            throw new OrchestrationException(OrchestrationException.Kind.PIPELINE_NOT_FOUND,
                    "Pipeline " + pipelineId + " not found");
        }
        return executions.findByPipelineIdOrderByStartedAtDesc(pipelineId);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. The running step finishes; no further step starts and
     * the execution ends FAILED with cause CANCELLED.
     *
     * @return false if the execution is not running in this process (already
     *         terminal, or owned by another instance)
     * @throws OrchestrationException EXECUTION_NOT_FOUND
     */
    public boolean cancel(UUID executionId, String actor) {
        if (!executions.existsById(executionId)) {
            throw new OrchestrationException(OrchestrationException.Kind.EXECUTION_NOT_FOUND,
                    "Execution " + executionId + " not found");
        }
        AtomicBoolean flag = running.get(executionId);
        boolean requested = flag != null && !flag.getAndSet(true);
        auditLogger.record(actor, "pipeline.execution.cancel", "pipeline_execution", executionId,
                requested ? AuditStatus.SUCCESS : AuditStatus.FAILURE, Map.of("requested", requested));
        if (requested) {
            log.info("Cancellation requested for execution {}", executionId);
        }
        return requested;
    }

    /** True while this process is driving the execution. */
    public boolean isRunningLocally(UUID executionId) {
        return running.containsKey(executionId);
    }
}
