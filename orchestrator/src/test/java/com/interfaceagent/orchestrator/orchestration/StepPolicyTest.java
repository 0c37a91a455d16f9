package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.TestEntities;
import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the per-step policy, merge strategies and pipeline snapshots.
 */
class StepPolicyTest {

    static final Duration DEFAULT = Duration.ofSeconds(30);

    // ------------------------------------------------------------------
    // StepPolicy
    // ------------------------------------------------------------------

    @Test
    void from_emptyConfig_criticalWithDefaultTimeout() {
        StepPolicy policy = StepPolicy.from(Map.of(), DEFAULT);

        assertThat(policy.critical()).isTrue();
        assertThat(policy.timeout()).isEqualTo(DEFAULT);
    }

    @Test
    void from_readsReservedKeys() {
        StepPolicy policy = StepPolicy.from(Map.of("critical", false, "timeout_ms", 250), DEFAULT);

        assertThat(policy.critical()).isFalse();
        assertThat(policy.timeout()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void from_acceptsStringValues() {
        StepPolicy policy = StepPolicy.from(Map.of("critical", "false", "timeout_ms", "1500"), DEFAULT);

        assertThat(policy.critical()).isFalse();
        assertThat(policy.timeout()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void from_malformedTimeout_rejected() {
        assertThatThrownBy(() -> StepPolicy.from(Map.of("timeout_ms", "soon"), DEFAULT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout_ms");
    }

    @Test
    void from_nonBooleanCritical_rejected() {
        assertThatThrownBy(() -> StepPolicy.from(Map.of("critical", "no"), DEFAULT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("critical");
        assertThatThrownBy(() -> StepPolicy.from(Map.of("critical", 0), DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void from_nonPositiveTimeout_rejected() {
        assertThatThrownBy(() -> StepPolicy.from(Map.of("timeout_ms", 0), DEFAULT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout_ms");
    }

    @Test
    void agentConfig_overlaysStepKeysExceptReservedOnes() {
        Map<String, Object> merged = StepPolicy.agentConfig(
                Map.of("strict", false, "rules", List.of()),
                Map.of("strict", true, "critical", false, "timeout_ms", 10));

        assertThat(merged).containsOnly(Map.entry("strict", true), Map.entry("rules", List.of()));
    }

    // ------------------------------------------------------------------
    // MergeStrategy
    // ------------------------------------------------------------------

    @Test
    void merge_laterStepWinsPerField() {
        Map<String, Object> out = MergeStrategy.MERGE.combine(List.of(
                Map.of("a", 1, "b", 1),
                Map.of("b", 2, "c", 2)));

        assertThat(out).containsOnly(Map.entry("a", 1), Map.entry("b", 2), Map.entry("c", 2));
    }

    @Test
    void last_returnsLastOutputOrEmpty() {
        assertThat(MergeStrategy.LAST.combine(List.of(Map.of("a", 1), Map.of("b", 2))))
                .containsOnly(Map.entry("b", 2));
        assertThat(MergeStrategy.LAST.combine(List.of())).isEmpty();
    }

    @Test
    void fromConfig_defaultsToMergeAndRejectsUnknown() {
        assertThat(MergeStrategy.fromConfig(Map.of())).isEqualTo(MergeStrategy.MERGE);
        assertThat(MergeStrategy.fromConfig(Map.of("merge_strategy", "Last"))).isEqualTo(MergeStrategy.LAST);
        assertThatThrownBy(() -> MergeStrategy.fromConfig(Map.of("merge_strategy", "deep")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // PipelineSnapshot
    // ------------------------------------------------------------------

    @Test
    void snapshot_sortsStepsAndIsDetachedFromLaterEdits() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.ACTIVE);
        pipeline.setConfig(Map.of("merge_strategy", "last"));
        TestEntities.step(pipeline, UUID.randomUUID(), 20, Map.of());
        TestEntities.step(pipeline, UUID.randomUUID(), 10, Map.of("critical", false));

        PipelineSnapshot snapshot = PipelineSnapshot.of(pipeline);
        TestEntities.step(pipeline, UUID.randomUUID(), 30, Map.of());

        assertThat(snapshot.steps()).extracting(PipelineSnapshot.StepSnapshot::order).containsExactly(10, 20);
        assertThat(snapshot.mergeStrategy()).isEqualTo(MergeStrategy.LAST);
        assertThat(snapshot.steps().get(0).config()).containsEntry("critical", false);
    }
}
