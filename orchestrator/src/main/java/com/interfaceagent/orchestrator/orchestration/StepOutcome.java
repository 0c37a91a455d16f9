package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.model.StepFailureKind;
import com.interfaceagent.orchestrator.model.StepRecovery;

import java.time.Duration;
import java.util.Map;

/**
 * Result of invoking one agent for one step. Failures are values, not exceptions.
 *
 * @param output      step output; null when failed
 * @param failureKind null when succeeded
 * @param recovery    outcome of the onError hook; NONE when it was not called
 */
public record StepOutcome(
        Map<String, Object> output,
        StepFailureKind     failureKind,
        String              error,
        StepRecovery        recovery,
        Duration            duration) {

    public static StepOutcome succeeded(Map<String, Object> output, Duration duration) {
        return new StepOutcome(output, null, null, StepRecovery.NONE, duration);
    }

    public static StepOutcome failed(StepFailureKind kind, String error, StepRecovery recovery, Duration duration) {
        return new StepOutcome(null, kind, error, recovery, duration);
    }

    public boolean isSucceeded() {
        return failureKind == null;
    }
}
