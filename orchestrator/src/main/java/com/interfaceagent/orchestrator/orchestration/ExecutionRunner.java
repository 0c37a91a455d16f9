package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.event.DomainEvent;
import com.interfaceagent.orchestrator.event.EventBus;
import com.interfaceagent.orchestrator.event.EventBusException;
import com.interfaceagent.orchestrator.event.EventTypes;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.model.ExecutionStatus;
import com.interfaceagent.orchestrator.model.FailureCause;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import com.interfaceagent.orchestrator.model.StepFailureKind;
import com.interfaceagent.orchestrator.model.StepRecovery;
import com.interfaceagent.orchestrator.model.StepResult;
import com.interfaceagent.orchestrator.repository.ExecutionRepository;
import com.interfaceagent.orchestrator.repository.StepResultRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Drives one accepted execution from RUNNING to a terminal status.
 *
 * <p>Per step, strictly in snapshot order:
 * <ol>
 *   <li>stop with FAILED / CANCELLED if cancellation was requested;</li>
 *   <li>publish {@code pipeline.step.started};</li>
 *   <li>resolve the agent (failure: AGENT_UNAVAILABLE) and invoke it;</li>
 *   <li>persist the StepResult and publish {@code pipeline.step.succeeded} or {@code .failed};</li>
 *   <li>a failed critical step ends the execution as FAILED; a failed non-critical
 *       step is recorded and the next step receives the latest successful output.</li>
 * </ol>
 * Terminal output is the pipeline's {@link MergeStrategy} applied to the outputs
 * of the steps that succeeded; an empty pipeline returns its input.
 *
 * <p>Event publication is best-effort relative to execution state: a broker
 * failure is logged as EventPublishDegraded, flags the execution and is counted,
 * and the run continues.
 *
 * <p>Every terminal transition (normal end, cancellation, crash, reaping) goes
 * through {@link #finishExecution}, which saves first and only then publishes
 * {@code pipeline.execution.completed}. The execution row is versioned: if
 * another instance finished it meanwhile, the save fails and this runner stops
 * without writing or publishing anything further.
 */
@Component
public class ExecutionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    static final String SOURCE = "orchestrator";

    private final ExecutionRepository  executions;
    private final StepResultRepository stepResults;
    private final AgentResolver        resolver;
    private final StepInvoker          invoker;
    private final EventBus             eventBus;
    private final AuditLogger          auditLogger;
    private final MeterRegistry        meterRegistry;
    private final Duration             defaultStepTimeout;

    public ExecutionRunner(ExecutionRepository executions,
                           StepResultRepository stepResults,
                           AgentResolver resolver,
                           StepInvoker invoker,
                           EventBus eventBus,
                           AuditLogger auditLogger,
                           MeterRegistry meterRegistry,
                           @Value("${interface-agent.execution.default-step-timeout:30s}") Duration defaultStepTimeout) {
        this.executions         = executions;
        this.stepResults        = stepResults;
        this.resolver           = resolver;
        this.invoker            = invoker;
        this.eventBus           = eventBus;
        this.auditLogger        = auditLogger;
        this.meterRegistry      = meterRegistry;
        this.defaultStepTimeout = defaultStepTimeout;
    }

    // ------------------------------------------------------------------
    // Main loop
    // ------------------------------------------------------------------

    public void run(UUID executionId, PipelineSnapshot snapshot, BooleanSupplier cancelRequested) {
        MDC.put("executionId", executionId.toString());
        MDC.put("pipelineId", String.valueOf(snapshot.pipelineId()));
        try {
            PipelineExecution execution = executions.findById(executionId).orElseThrow(() ->
                    new OrchestrationException(OrchestrationException.Kind.EXECUTION_NOT_FOUND,
                            "Execution " + executionId + " disappeared before it started"));
            if (execution.getStatus().isTerminal()) {
                log.warn("Execution is already {} ({}) before it started here; skipping",
                        execution.getStatus(), execution.getFailureCause());
                return;
            }
            log.info("Execution started: pipeline '{}' with {} step(s)", snapshot.name(), snapshot.steps().size());
            runSteps(execution, snapshot, cancelRequested);
        } catch (OptimisticLockingFailureException e) {
            meterRegistry.counter("interfaceagent.execution.taken_over").increment();
            log.warn("Execution was finished by another instance while running here; stopping: {}", e.getMessage());
        } finally {
            MDC.remove("executionId");
            MDC.remove("pipelineId");
        }
    }

    private void runSteps(PipelineExecution execution, PipelineSnapshot snapshot, BooleanSupplier cancelRequested) {
        List<Map<String, Object>> succeededOutputs = new ArrayList<>();
        Map<String, Object> current = execution.getInput();
        boolean nonCriticalFailed = false;
        int completed = 0;

        // Time spent queued for a worker does not count against stale-after.
        execution.heartbeat();
        execution = executions.save(execution);

        for (PipelineSnapshot.StepSnapshot step : snapshot.steps()) {
            if (cancelRequested.getAsBoolean()) {
                finishExecution(execution, snapshot.steps().size(), ExecutionStatus.FAILED,
                        snapshot.mergeStrategy().combine(succeededOutputs), FailureCause.CANCELLED,
                        "Cancelled after " + completed + " of " + snapshot.steps().size() + " step(s)");
                return;
            }

            StepResult result = runStep(execution, snapshot, step, current);
            completed++;
            execution.heartbeat();
            execution = executions.save(execution);

            if (result.isSucceeded()) {
                succeededOutputs.add(result.getOutput());
                current = result.getOutput();
            } else if (result.isCritical()) {
                finishExecution(execution, snapshot.steps().size(), ExecutionStatus.FAILED,
                        snapshot.mergeStrategy().combine(succeededOutputs), FailureCause.STEP_FAILED,
                        "Step " + step.order() + " failed (" + result.getFailureKind() + "): " + result.getError());
                return;
            } else {
                nonCriticalFailed = true;
            }
        }

        Map<String, Object> output = snapshot.steps().isEmpty()
                ? execution.getInput()
                : snapshot.mergeStrategy().combine(succeededOutputs);
        finishExecution(execution, snapshot.steps().size(),
                nonCriticalFailed ? ExecutionStatus.PARTIALLY_FAILED : ExecutionStatus.SUCCEEDED,
                output, null, null);
    }

    private StepResult runStep(PipelineExecution execution, PipelineSnapshot snapshot,
                               PipelineSnapshot.StepSnapshot step, Map<String, Object> input) {
        MDC.put("stepId", String.valueOf(step.stepId()));
        try {
            StepPolicy policy = StepPolicy.from(step.config(), defaultStepTimeout);
            publish(execution, EventTypes.STEP_STARTED, step, stepPayload(snapshot, step, policy));

            StepResult result;
            try {
                result = invokeStep(execution, step, policy, input);
                stepResults.save(result);
            } catch (RuntimeException e) {
                // Close the started step on the bus before the crash reaches failUnexpectedly.
                Map<String, Object> payload = stepPayload(snapshot, step, policy);
                payload.put("failureKind", FailureCause.INTERNAL_ERROR.name());
                payload.put("error", String.valueOf(e.getMessage()));
                publish(execution, EventTypes.STEP_FAILED, step, payload);
                throw e;
            }

            Map<String, Object> payload = stepPayload(snapshot, step, policy);
            payload.put("durationMs", result.getDurationMs());
            if (result.isSucceeded()) {
                payload.put("output", result.getOutput());
                log.info("Step {} succeeded in {} ms", step.order(), result.getDurationMs());
                publish(execution, EventTypes.STEP_SUCCEEDED, step, payload);
            } else {
                payload.put("failureKind", result.getFailureKind().name());
                payload.put("error", result.getError());
                payload.put("recovery", result.getRecovery().name());
                log.info("Step {} failed ({}, critical={}, recovery={}): {}", step.order(),
                        result.getFailureKind(), result.isCritical(), result.getRecovery(), result.getError());
                publish(execution, EventTypes.STEP_FAILED, step, payload);
            }
            return result;
        } finally {
            MDC.remove("stepId");
            MDC.remove("agentType");
        }
    }

    private StepResult invokeStep(PipelineExecution execution, PipelineSnapshot.StepSnapshot step,
                                  StepPolicy policy, Map<String, Object> input) {
        long startNanos = System.nanoTime();
        AgentResolver.ResolvedAgent resolved;
        try {
            resolved = resolver.resolve(step);
        } catch (OrchestrationException e) {
            meterRegistry.counter("interfaceagent.step.calls", "agent_type", "unresolved",
                    "status", "agent_unavailable").increment();
            return StepResult.failed(execution.getId(), step.stepId(), step.agentId(), step.order(),
                    policy.critical(), StepFailureKind.AGENT_UNAVAILABLE, e.getMessage(), StepRecovery.NONE,
                    Duration.ofNanos(System.nanoTime() - startNanos));
        }

        String agentType = resolved.definition().getAgentType();
        MDC.put("agentType", agentType);

        Timer.Sample sample = Timer.start(meterRegistry);
        StepOutcome outcome = invoker.invoke(resolved.agent(), input, policy.timeout());
        sample.stop(meterRegistry.timer("interfaceagent.step.duration", "agent_type", agentType));
        meterRegistry.counter("interfaceagent.step.calls", "agent_type", agentType,
                "status", outcome.isSucceeded() ? "succeeded"
                        : outcome.failureKind().name().toLowerCase(Locale.ROOT)).increment();

        if (outcome.isSucceeded()) {
            return StepResult.succeeded(execution.getId(), step.stepId(), step.agentId(), step.order(),
                    policy.critical(), outcome.output(), outcome.duration());
        }
        return StepResult.failed(execution.getId(), step.stepId(), step.agentId(), step.order(),
                policy.critical(), outcome.failureKind(), outcome.error(), outcome.recovery(), outcome.duration());
    }

    // ------------------------------------------------------------------
    // Terminal transition
    // ------------------------------------------------------------------

    /**
     * RUNNING to {@code status}: save, publish {@code pipeline.execution.completed}
     * under its deterministic id, audit and count.
     *
     * @param stepCount steps in the snapshot, or null when the snapshot is not at hand
     * @throws OptimisticLockingFailureException the row was finished elsewhere; nothing was published
     */
    void finishExecution(PipelineExecution execution, Integer stepCount, ExecutionStatus status,
                         Map<String, Object> output, FailureCause cause, String error) {
        execution.finish(status, output, cause, error);
        execution = executions.save(execution);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipelineId", String.valueOf(execution.getPipelineId()));
        payload.put("status", status.name());
        if (stepCount != null) {
            payload.put("stepCount", stepCount);
        }
        payload.put("durationMs", Duration.between(execution.getStartedAt(), execution.getFinishedAt()).toMillis());
        if (cause != null) {
            payload.put("failureCause", cause.name());
            payload.put("error", error);
        }

        boolean degradedBefore = execution.isEventsDegraded();
        publish(execution, DomainEvent.of(EventTypes.completionEventId(execution.getId()),
                EventTypes.EXECUTION_COMPLETED, payload, execution.getId(), SOURCE));
        if (execution.isEventsDegraded() != degradedBefore) {
            try {
                executions.save(execution);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Could not flag execution {} as events-degraded: {}", execution.getId(), e.getMessage());
            }
        }

        auditLogger.record(AuditLogger.SYSTEM_ACTOR, "pipeline.execution.completed", "pipeline_execution",
                execution.getId(),
                status == ExecutionStatus.SUCCEEDED ? AuditStatus.SUCCESS : AuditStatus.FAILURE,
                payload);
        meterRegistry.counter("interfaceagent.execution.completed", "status", status.name().toLowerCase(Locale.ROOT))
                .increment();

        if (status == ExecutionStatus.FAILED) {
            log.warn("Execution {} finished {} ({}): {}", execution.getId(), status, cause, error);
        } else {
            log.info("Execution {} finished {}", execution.getId(), status);
        }
    }

    /**
     * Fail an execution whose task crashed outside the step loop (repository
     * failure, rejected task). Errors here are logged; there is no caller left to report to.
     */
    public void failUnexpectedly(UUID executionId, Throwable failure) {
        try {
            executions.findById(executionId).ifPresent(execution -> {
                if (execution.getStatus().isTerminal()) return;
                finishExecution(execution, null, ExecutionStatus.FAILED, Map.of(), FailureCause.INTERNAL_ERROR,
                        "Unhandled exception: " + failure.getMessage());
            });
        } catch (OptimisticLockingFailureException e) {
            log.warn("Execution {} was finished elsewhere while being failed: {}", executionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark execution {} as failed: {}", executionId, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    private Map<String, Object> stepPayload(PipelineSnapshot snapshot, PipelineSnapshot.StepSnapshot step,
                                            StepPolicy policy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipelineId", String.valueOf(snapshot.pipelineId()));
        payload.put("stepId", String.valueOf(step.stepId()));
        payload.put("agentId", String.valueOf(step.agentId()));
        payload.put("order", step.order());
        payload.put("critical", policy.critical());
        return payload;
    }

    private void publish(PipelineExecution execution, String type, PipelineSnapshot.StepSnapshot step,
                         Map<String, Object> payload) {
        publish(execution, DomainEvent.of(EventTypes.stepEventId(execution.getId(), step.order(), type),
                type, payload, execution.getId(), SOURCE));
    }

    private void publish(PipelineExecution execution, DomainEvent event) {
        try {
            eventBus.publish(event);
        } catch (EventBusException e) {
            execution.markEventsDegraded();
            log.warn("EventPublishDegraded: {} ({}) was not published: {}", event.eventId(), event.type(), e.getMessage());
        } catch (RuntimeException e) {
            execution.markEventsDegraded();
            log.warn("EventPublishDegraded: {} ({}) failed unexpectedly: {}", event.eventId(), event.type(), e.toString());
        }
    }
}
