package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.agent.Agent;
import com.interfaceagent.orchestrator.agent.AgentException;
import com.interfaceagent.orchestrator.model.StepFailureKind;
import com.interfaceagent.orchestrator.model.StepRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the validate, execute and on-error lifecycle of one agent for one step.
 *
 * The agent runs on the step pool so the calling execution thread can give up
 * on it at the step deadline. A timed-out call is interrupted and abandoned;
 * the execution moves on and never waits for it.
 *
 * Outcomes:
 * <ul>
 *   <li>validateInput returns false: VALIDATION_FAILED, onError not called</li>
 *   <li>execute throws: PROCESSING_FAILED, onError called</li>
 *   <li>deadline passes: TIMEOUT, onError called with a TIMEOUT AgentException</li>
 * </ul>
 * onError is bounded by the same deadline. If it returns the step is tagged
 * RECOVERED, if it throws or hangs UNRECOVERED. The step stays failed either way.
 */
@Component
public class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final ExecutorService stepExecutor;

    public StepInvoker(@Qualifier("stepExecutor") ExecutorService stepExecutor) {
        this.stepExecutor = stepExecutor;
    }

    public StepOutcome invoke(Agent agent, Map<String, Object> input, Duration timeout) {
        long startNanos = System.nanoTime();
        Map<String, Object> view = Collections.unmodifiableMap(new LinkedHashMap<>(input));

        Future<Map<String, Object>> future = stepExecutor.submit(withMdc(() -> {
            if (!agent.validateInput(view)) {
                throw new AgentException(AgentException.Kind.VALIDATION_FAILED, "Input rejected by " + describe(agent));
            }
            Map<String, Object> out = agent.execute(view);
            return out == null ? new LinkedHashMap<>() : new LinkedHashMap<>(out);
        }));

        try {
            Map<String, Object> output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return StepOutcome.succeeded(output, since(startNanos));

        } catch (TimeoutException e) {
            future.cancel(true);
            AgentException error = new AgentException(AgentException.Kind.TIMEOUT,
                    describe(agent) + " did not finish within " + timeout.toMillis() + " ms");
            log.warn("Step timed out: {}", error.getMessage());
            return failWithHook(agent, view, error, StepFailureKind.TIMEOUT, timeout, startNanos);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentException ae && ae.getKind() == AgentException.Kind.VALIDATION_FAILED) {
                return StepOutcome.failed(StepFailureKind.VALIDATION_FAILED, ae.getMessage(),
                        StepRecovery.NONE, since(startNanos));
            }
            AgentException error = cause instanceof AgentException ae
                    ? ae
                    : new AgentException(AgentException.Kind.PROCESSING_FAILED,
                            describe(agent) + " failed: " + cause, cause);
            StepFailureKind kind = error.getKind() == AgentException.Kind.TIMEOUT
                    ? StepFailureKind.TIMEOUT : StepFailureKind.PROCESSING_FAILED;
            log.info("Step failed: {}", error.getMessage());
            return failWithHook(agent, view, error, kind, timeout, startNanos);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StepOutcome.failed(StepFailureKind.PROCESSING_FAILED,
                    "Interrupted while waiting for " + describe(agent), StepRecovery.NONE, since(startNanos));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StepOutcome failWithHook(Agent agent, Map<String, Object> view, AgentException error,
                                     StepFailureKind kind, Duration timeout, long startNanos) {
        StepRecovery recovery = runOnError(agent, view, error, timeout);
        return StepOutcome.failed(kind, error.getMessage(), recovery, since(startNanos));
    }

    private StepRecovery runOnError(Agent agent, Map<String, Object> view, AgentException error, Duration timeout) {
        Future<?> hook = stepExecutor.submit(withMdc(() -> {
            agent.onError(error, view);
            return null;
        }));
        try {
            hook.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return StepRecovery.RECOVERED;
        } catch (ExecutionException e) {
            log.warn("onError hook of {} threw: {}", describe(agent), String.valueOf(e.getCause()));
            return StepRecovery.UNRECOVERED;
        } catch (TimeoutException e) {
            hook.cancel(true);
            log.warn("onError hook of {} did not return within {} ms", describe(agent), timeout.toMillis());
            return StepRecovery.UNRECOVERED;
        } catch (InterruptedException e) {
            hook.cancel(true);
            Thread.currentThread().interrupt();
            return StepRecovery.UNRECOVERED;
        }
    }

    // Carry the execution's MDC keys onto the step pool thread.
    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) MDC.setContextMap(context);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Agent agent) {
        return agent.getClass().getSimpleName();
    }
}
