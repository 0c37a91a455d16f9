package com.interfaceagent.orchestrator.anomaly;

import com.interfaceagent.orchestrator.model.AnomalySeverity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Z-score model over three features of a payload: serialized size, number of
 * top-level fields, and {@code durationMs} when present.
 *
 * Running mean and variance per feature (Welford). Until {@code minSamples}
 * payloads were observed every score is normal. The score is the largest
 * |z| across features; severity grows with score / threshold:
 * {@literal >=} 2.0 CRITICAL, {@literal >=} 5/3 HIGH, {@literal >=} 4/3 MEDIUM, otherwise LOW.
 */
@Component
public class StatisticalAnomalyScorer implements AnomalyScorer {

    static final String SIZE     = "payload_size";
    static final String FIELDS   = "field_count";
    static final String DURATION = "duration_ms";

    private final double threshold;
    private final long   minSamples;

    private final Map<String, RunningStats> stats = new LinkedHashMap<>();

    public StatisticalAnomalyScorer(@Value("${interface-agent.anomaly.threshold:3.0}") double threshold,
                                    @Value("${interface-agent.anomaly.min-samples:100}") long minSamples) {
        this.threshold  = threshold;
        this.minSamples = minSamples;
    }

    @Override
    public synchronized AnomalyScore score(Map<String, Object> data) {
        double max = 0;
        for (Map.Entry<String, Double> feature : features(data).entrySet()) {
            RunningStats s = stats.get(feature.getKey());
            if (s == null || s.count < minSamples) continue;
            double sd = s.stdDev();
            if (sd == 0) continue;
            max = Math.max(max, Math.abs(feature.getValue() - s.mean) / sd);
        }
        if (max <= threshold) {
            return AnomalyScore.normal(max);
        }
        return new AnomalyScore(true, severity(max / threshold), max);
    }

    @Override
    public synchronized void observe(Map<String, Object> data) {
        features(data).forEach((name, value) -> stats.computeIfAbsent(name, k -> new RunningStats()).add(value));
    }

    synchronized long observations(String feature) {
        RunningStats s = stats.get(feature);
        return s == null ? 0 : s.count;
    }

    static AnomalySeverity severity(double ratio) {
        if (ratio >= 2.0)       return AnomalySeverity.CRITICAL;
        if (ratio >= 5.0 / 3.0) return AnomalySeverity.HIGH;
        if (ratio >= 4.0 / 3.0) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    static Map<String, Double> features(Map<String, Object> data) {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put(SIZE, (double) String.valueOf(data).length());
        f.put(FIELDS, (double) data.size());
        if (data.get("durationMs") instanceof Number n) {
            f.put(DURATION, n.doubleValue());
        }
        return f;
    }

    private static final class RunningStats {
        long   count;
        double mean;
        double m2;

        void add(double x) {
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
        }

        double stdDev() {
            return count < 2 ? 0 : Math.sqrt(m2 / (count - 1));
        }
    }
}
