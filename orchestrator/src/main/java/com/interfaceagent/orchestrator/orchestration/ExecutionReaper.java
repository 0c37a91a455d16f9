package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.model.ExecutionStatus;
import com.interfaceagent.orchestrator.model.FailureCause;
import com.interfaceagent.orchestrator.model.PipelineExecution;
import com.interfaceagent.orchestrator.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fails executions left RUNNING by a process that died.
 *
 * An execution whose heartbeat is older than {@code stale-after} and that no
 * task in this process is driving can never finish on its own, so it is marked
 * FAILED with cause INTERRUPTED through {@link ExecutionRunner#finishExecution},
 * which also publishes {@code pipeline.execution.completed}. The heartbeat moves
 * on every step transition, and step timeouts are kept below stale-after when a
 * step is added. An execution that another instance touched after it was read
 * here fails the versioned save and is left to that instance.
 */
@Component
@EnableScheduling
public class ExecutionReaper {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReaper.class);

    private final ExecutionRepository  executions;
    private final PipelineOrchestrator orchestrator;
    private final ExecutionRunner      runner;
    private final Duration             staleAfter;

    public ExecutionReaper(ExecutionRepository executions,
                           PipelineOrchestrator orchestrator,
                           ExecutionRunner runner,
                           @Value("${interface-agent.execution.stale-after:10m}") Duration staleAfter) {
        this.executions   = executions;
        this.orchestrator = orchestrator;
        this.runner       = runner;
        this.staleAfter   = staleAfter;
    }

    @Scheduled(fixedDelayString = "${interface-agent.execution.reaper-interval:60000}")
    public int reapStaleExecutions() {
        Instant cutoff = Instant.now().minus(staleAfter);
        List<PipelineExecution> stale = executions.findByStatusAndHeartbeatAtBefore(ExecutionStatus.RUNNING, cutoff);

        int reaped = 0;
        for (PipelineExecution execution : stale) {
            if (orchestrator.isRunningLocally(execution.getId())) continue;
            try {
                runner.finishExecution(execution, null, ExecutionStatus.FAILED, Map.of(), FailureCause.INTERRUPTED,
                        "No heartbeat since " + execution.getHeartbeatAt());
                reaped++;
            } catch (OptimisticLockingFailureException e) {
                log.info("Execution {} moved on while being reaped; leaving it: {}", execution.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Could not reap execution {}: {}", execution.getId(), e.getMessage(), e);
            }
        }
        if (reaped > 0) {
            log.warn("Marked {} stale execution(s) as FAILED/INTERRUPTED", reaped);
        }
        return reaped;
    }
}
