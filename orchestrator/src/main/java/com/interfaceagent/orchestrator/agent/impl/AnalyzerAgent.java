package com.interfaceagent.orchestrator.agent.impl;

import com.interfaceagent.orchestrator.agent.Agent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes the payload: size, field count, missing values and numeric fields.
 * Output is {@code {analysis, data}}; the payload itself passes through unchanged.
 */
public class AnalyzerAgent implements Agent {

    public static final String TYPE = "analyzer";

    private final Clock clock;

    public AnalyzerAgent(Map<String, Object> config) {
        this(Clock.systemUTC());
    }

    AnalyzerAgent(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> data) {
        List<Map<String, Object>> insights = new ArrayList<>();

        List<String> missing = data.entrySet().stream()
                .filter(e -> e.getValue() == null || "".equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        if (!missing.isEmpty()) {
            insights.add(Map.of("type", "missing_data", "fields", missing));
        }

        List<String> numeric = data.entrySet().stream()
                .filter(e -> e.getValue() instanceof Number)
                .map(Map.Entry::getKey)
                .toList();
        if (!numeric.isEmpty()) {
            insights.add(Map.of("type", "numeric_summary", "fields", numeric, "count", numeric.size()));
        }

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("timestamp", clock.instant().toString());
        analysis.put("data_size", String.valueOf(data).length());
        analysis.put("fields_count", data.size());
        analysis.put("insights", insights);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("analysis", analysis);
        result.put("data", data);
        return result;
    }
}
