package com.interfaceagent.orchestrator.agent;

import java.util.Map;

/**
 * The capability every agent implements, whether built in or loaded as a plugin.
 *
 * <p>Lifecycle per step, driven by the orchestrator:
 * <ol>
 *   <li>{@link #validateInput}: pure precondition check. Returning {@code false}
 *       ends the step as VALIDATION_FAILED; {@link #execute} is not called.</li>
 *   <li>{@link #execute}: the transform. Any exception ends the step as
 *       PROCESSING_FAILED (or TIMEOUT when the step deadline passes first).</li>
 *   <li>{@link #onError}: best-effort hook after a failed {@code execute}.
 *       Exceptions thrown from it are logged and dropped.</li>
 * </ol>
 *
 * <p>The {@code data} map handed to every method is read-only. Instances are
 * stateless between calls and, unless their registration is marked reentrant,
 * never shared between executions.
 *
 * <p>{@code execute} may be retried after a failure elsewhere, so implementations
 * should keep their side effects idempotent.
 */
public interface Agent {

    default boolean validateInput(Map<String, Object> data) {
        return true;
    }

    /**
     * @return the step output; {@code null} is treated as an empty map
     * @throws AgentException on a controlled processing failure
     */
    Map<String, Object> execute(Map<String, Object> data);

    default void onError(AgentException error, Map<String, Object> data) {
        // no recovery by default
    }
}
