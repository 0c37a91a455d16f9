package com.interfaceagent.orchestrator.agent.impl;

import com.interfaceagent.orchestrator.agent.Agent;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies the payload and adds an {@code _enrichment} block plus any fields
 * configured as {@code {"rules": [{"add_field": "region", "value": "eu"}]}}.
 */
public class EnricherAgent implements Agent {

    public static final String TYPE    = "enricher";
    public static final String VERSION = "1.0.0";

    private final List<?> rules;
    private final Clock   clock;

    public EnricherAgent(Map<String, Object> config) {
        this(config, Clock.systemUTC());
    }

    EnricherAgent(Map<String, Object> config, Clock clock) {
        this.rules = config.get("rules") instanceof List<?> list ? list : List.of();
        this.clock = clock;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> data) {
        Map<String, Object> enriched = new LinkedHashMap<>(data);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timestamp", clock.instant().toString());
        meta.put("agent", TYPE);
        meta.put("version", VERSION);
        enriched.put("_enrichment", meta);

        for (Object entry : rules) {
            if (!(entry instanceof Map<?, ?> rule)) continue;
            Object field = rule.get("add_field");
            Object value = rule.get("value");
            if (field != null && value != null) {
                enriched.put(String.valueOf(field), value);
            }
        }
        return enriched;
    }
}
