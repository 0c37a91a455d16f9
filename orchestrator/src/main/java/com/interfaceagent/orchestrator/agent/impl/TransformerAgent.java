package com.interfaceagent.orchestrator.agent.impl;

import com.interfaceagent.orchestrator.agent.Agent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renames fields according to {@code mappings} (source name to target name).
 * Fields without a mapping are dropped unless {@code copy_unmapped} is true.
 */
public class TransformerAgent implements Agent {

    public static final String TYPE = "transformer";

    private final Map<String, String> mappings = new LinkedHashMap<>();
    private final boolean copyUnmapped;

    public TransformerAgent(Map<String, Object> config) {
        if (config.get("mappings") instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> mappings.put(String.valueOf(k), String.valueOf(v)));
        }
        this.copyUnmapped = Boolean.TRUE.equals(config.get("copy_unmapped"));
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>();
        mappings.forEach((source, target) -> {
            if (data.containsKey(source)) {
                out.put(target, data.get(source));
            }
        });
        if (copyUnmapped) {
            data.forEach((key, value) -> {
                if (!mappings.containsKey(key) && !out.containsKey(key)) {
                    out.put(key, value);
                }
            });
        }
        return out;
    }
}
