package com.interfaceagent.orchestrator.agent.impl;

import com.interfaceagent.orchestrator.agent.Agent;
import com.interfaceagent.orchestrator.agent.AgentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the payload against a configured rule list.
 *
 * <pre>
 * {"rules": [
 *     {"field": "id",   "type": "required"},
 *     {"field": "name", "type": "type",  "expected": "string"},
 *     {"field": "age",  "type": "range", "min": 0, "max": 150}
 *  ],
 *  "strict": false}
 * </pre>
 *
 * Output is {@code {valid, errors, data}}. With {@code strict: true} a
 * non-empty error list fails the step instead.
 */
public class ValidatorAgent implements Agent {

    public static final String TYPE = "validator";

    private final List<?> rules;
    private final boolean strict;

    public ValidatorAgent(Map<String, Object> config) {
        this.rules  = config.get("rules") instanceof List<?> list ? list : List.of();
        this.strict = Boolean.TRUE.equals(config.get("strict"));
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> data) {
        List<String> errors = new ArrayList<>();

        for (Object entry : rules) {
            if (!(entry instanceof Map<?, ?> rule)) continue;
            Object field = rule.get("field");
            String type  = String.valueOf(rule.get("type"));

            if (!data.containsKey(String.valueOf(field))) {
                errors.add("Missing required field: " + field);
                continue;
            }
            Object value = data.get(String.valueOf(field));

            switch (type) {
                case "required" -> {
                    if (isEmpty(value)) errors.add("Field " + field + " is required");
                }
                case "type" -> {
                    Object expected = rule.get("expected");
                    if ("string".equals(expected) && !(value instanceof String)) {
                        errors.add("Field " + field + " must be a string");
                    } else if ("number".equals(expected) && !(value instanceof Number)) {
                        errors.add("Field " + field + " must be a number");
                    }
                }
                case "range" -> {
                    if (value instanceof Number n) {
                        double v = n.doubleValue();
                        if (rule.get("min") instanceof Number min && v < min.doubleValue()) {
                            errors.add("Field " + field + " must be >= " + min);
                        }
                        if (rule.get("max") instanceof Number max && v > max.doubleValue()) {
                            errors.add("Field " + field + " must be <= " + max);
                        }
                    }
                }
                default -> { }   // unknown rule types are ignored
            }
        }

        if (strict && !errors.isEmpty()) {
            throw AgentException.processingFailed("Validation failed: " + String.join("; ", errors));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("valid", errors.isEmpty());
        result.put("errors", errors);
        result.put("data", data);
        return result;
    }

    private static boolean isEmpty(Object value) {
        if (value == null)                      return true;
        if (value instanceof String s)          return s.isEmpty();
        if (value instanceof Collection<?> c)   return c.isEmpty();
        if (value instanceof Map<?, ?> m)       return m.isEmpty();
        if (value instanceof Boolean b)         return !b;
        if (value instanceof Number n)          return n.doubleValue() == 0;
        return false;
    }
}
