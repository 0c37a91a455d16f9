package com.interfaceagent.orchestrator.orchestration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrator-side settings of one step, read from the reserved step config keys.
 *
 * @param critical a failure ends the execution as FAILED (default); otherwise it is recorded and skipped
 * @param timeout  upper bound for validate + execute of the step
 */
public record StepPolicy(boolean critical, Duration timeout) {

    public static final String CRITICAL   = "critical";
    public static final String TIMEOUT_MS = "timeout_ms";

    static final Set<String> RESERVED_KEYS = Set.of(CRITICAL, TIMEOUT_MS);

    /**
     * @throws IllegalArgumentException {@code critical} is not a boolean, or {@code timeout_ms}
     *         is not a positive number of milliseconds
     */
    public static StepPolicy from(Map<String, Object> stepConfig, Duration defaultTimeout) {
        boolean critical = true;
        Object c = stepConfig.get(CRITICAL);
        if (c instanceof Boolean b) {
            critical = b;
        } else if (c != null) {
            String text = c.toString().trim();
            if ("true".equalsIgnoreCase(text)) {
                critical = true;
            } else if ("false".equalsIgnoreCase(text)) {
                critical = false;
            } else {
                throw new IllegalArgumentException("critical must be true or false, got '" + c + "'");
            }
        }

        Duration timeout = defaultTimeout;
        Object t = stepConfig.get(TIMEOUT_MS);
        if (t != null) {
            long ms;
            try {
                ms = t instanceof Number n ? n.longValue() : Long.parseLong(t.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("timeout_ms must be a positive number of milliseconds, got '" + t + "'", e);
            }
            if (ms <= 0) {
                throw new IllegalArgumentException("timeout_ms must be a positive number of milliseconds, got '" + t + "'");
            }
            timeout = Duration.ofMillis(ms);
        }
        return new StepPolicy(critical, timeout);
    }

    /** Agent config for a step: the agent's own config overlaid by the non-reserved step keys. */
    public static Map<String, Object> agentConfig(Map<String, Object> agentConfig, Map<String, Object> stepConfig) {
        Map<String, Object> merged = new LinkedHashMap<>(agentConfig);
        stepConfig.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) merged.put(key, value);
        });
        return merged;
    }
}
