package com.interfaceagent.orchestrator.orchestration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How the terminal output is built from the outputs of the steps that succeeded.
 * Selected by the pipeline config key {@code merge_strategy}.
 */
public enum MergeStrategy {

    /** Shallow merge in step order; a later step wins on a shared field. */
    MERGE {
        @Override
        public Map<String, Object> combine(List<Map<String, Object>> outputs) {
            Map<String, Object> merged = new LinkedHashMap<>();
            outputs.forEach(merged::putAll);
            return merged;
        }
    },

    /** Output of the last step that succeeded. */
    LAST {
        @Override
        public Map<String, Object> combine(List<Map<String, Object>> outputs) {
            return outputs.isEmpty() ? new LinkedHashMap<>() : new LinkedHashMap<>(outputs.get(outputs.size() - 1));
        }
    };

    public static final String CONFIG_KEY = "merge_strategy";

    public abstract Map<String, Object> combine(List<Map<String, Object>> outputs);

    public static MergeStrategy fromConfig(Map<String, Object> pipelineConfig) {
        Object raw = pipelineConfig.get(CONFIG_KEY);
        if (raw == null) return MERGE;
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown merge_strategy '" + raw + "'; expected merge or last", e);
        }
    }
}
