package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.TestEntities;
import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.audit.Caller;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineStatus;
import com.interfaceagent.orchestrator.model.PipelineStep;
import com.interfaceagent.orchestrator.orchestration.OrchestrationException;
import com.interfaceagent.orchestrator.repository.AgentDefinitionRepository;
import com.interfaceagent.orchestrator.repository.AuditRecordRepository;
import com.interfaceagent.orchestrator.repository.PipelineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    @Mock PipelineRepository        pipelines;
    @Mock AgentDefinitionRepository agents;
    @Mock AuditLogger               auditLogger;

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final Duration STALE_AFTER     = Duration.ofMinutes(10);

    PipelineService service;

    private final Caller alice = new Caller("alice", null);

    @BeforeEach
    void setUp() {
        service = new PipelineService(pipelines, agents, auditLogger, DEFAULT_TIMEOUT, STALE_AFTER);
    }

    @Test
    void create_newName_savedAsDraft() {
        when(pipelines.existsByName("orders")).thenReturn(false);
        when(pipelines.save(any(PipelineDefinition.class))).thenAnswer(inv ->
                TestEntities.withId(inv.<PipelineDefinition>getArgument(0), UUID.randomUUID()));

        PipelineDefinition created = service.create("orders", "order intake", Map.of("merge_strategy", "last"), alice);

        assertThat(created.getStatus()).isEqualTo(PipelineStatus.DRAFT);
        assertThat(created.getConfig()).containsEntry("merge_strategy", "last");
        verify(auditLogger).record(eq("alice"), eq("pipeline.create"), eq("pipeline"), eq(created.getId()),
                eq(AuditStatus.SUCCESS), anyMap(), isNull());
    }

    @Test
    void create_unknownMergeStrategy_rejectedBeforeSave() {
        when(pipelines.existsByName("orders")).thenReturn(false);

        assertThatThrownBy(() -> service.create("orders", null, Map.of("merge_strategy", "zip"), alice))
                .isInstanceOf(IllegalArgumentException.class);
        verify(pipelines, never()).save(any());
    }

    @Test
    void create_blankName_rejected() {
        assertThatThrownBy(() -> service.create(" ", null, null, alice))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void update_statusChange_applied() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        when(pipelines.findById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(pipelines.save(pipeline)).thenReturn(pipeline);

        service.update(pipeline.getId(), new PipelineChanges(null, null, PipelineStatus.ACTIVE, null), alice);

        assertThat(pipeline.getStatus()).isEqualTo(PipelineStatus.ACTIVE);
        assertThat(pipeline.getName()).isEqualTo("orders");
    }

    @Test
    void addStep_freeOrder_appendsStep() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        PipelineStep step = service.addStep(pipeline.getId(), agentId, 10, Map.of("critical", false), alice);

        assertThat(pipeline.getSteps()).containsExactly(step);
        assertThat(step.getStepOrder()).isEqualTo(10);
        assertThat(step.getAgentId()).isEqualTo(agentId);
        verify(pipelines).saveAndFlush(pipeline);
    }

    @Test
    void addStep_orderTaken_conflict() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        TestEntities.step(pipeline, agentId, 10, Map.of());
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        assertThatThrownBy(() -> service.addStep(pipeline.getId(), agentId, 10, null, alice))
                .isInstanceOf(OrchestrationException.class)
                .hasMessageContaining("STEP_ORDER_CONFLICT");
        assertThat(pipeline.getSteps()).hasSize(1);
        verify(auditLogger).record(eq("alice"), eq("pipeline.step.add"), eq("pipeline"), eq(pipeline.getId()),
                eq(AuditStatus.FAILURE), anyMap(), isNull());
    }

    @Test
    void addStep_unknownAgent_notFound() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(false);

        assertThatThrownBy(() -> service.addStep(pipeline.getId(), agentId, 1, null, alice))
                .hasMessageContaining("AGENT_NOT_FOUND");
    }

    @Test
    void addStep_malformedTimeout_rejected() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        assertThatThrownBy(() -> service.addStep(pipeline.getId(), agentId, 1, Map.of("timeout_ms", "soon"), alice))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(pipeline.getSteps()).isEmpty();
    }

    @Test
    void addStep_nonBooleanCritical_rejected() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        assertThatThrownBy(() -> service.addStep(pipeline.getId(), agentId, 1, Map.of("critical", "no"), alice))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("critical");
        assertThat(pipeline.getSteps()).isEmpty();
        verify(pipelines, never()).saveAndFlush(any());
    }

    @Test
    void addStep_timeoutReachingStaleWindow_rejected() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        assertThatThrownBy(() -> service.addStep(pipeline.getId(), agentId, 1,
                Map.of("timeout_ms", STALE_AFTER.toMillis()), alice))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stale-after");
        assertThat(pipeline.getSteps()).isEmpty();
    }

    @Test
    void addStep_auditWriteFails_stepIsStillAdded() {
        AuditRecordRepository auditRepo = mock(AuditRecordRepository.class);
        PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
        when(auditRepo.saveAndFlush(any())).thenThrow(
                new DataIntegrityViolationException("value too long for type character varying(100)"));
        PipelineService withRealAudit = new PipelineService(pipelines, agents,
                new AuditLogger(auditRepo, transactionManager, true), DEFAULT_TIMEOUT, STALE_AFTER);

        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        UUID agentId = UUID.randomUUID();
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(agents.existsById(agentId)).thenReturn(true);

        PipelineStep step = withRealAudit.addStep(pipeline.getId(), agentId, 1, Map.of(),
                new Caller("x".repeat(400), null));

        assertThat(pipeline.getSteps()).containsExactly(step);
        verify(pipelines).saveAndFlush(pipeline);
        verify(transactionManager).rollback(any());
    }

    @Test
    void removeStep_unknownStep_notFound() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));

        assertThatThrownBy(() -> service.removeStep(pipeline.getId(), UUID.randomUUID(), alice))
                .hasMessageContaining("STEP_NOT_FOUND");
    }

    @Test
    void removeStep_existingStep_removed() {
        PipelineDefinition pipeline = TestEntities.pipeline("orders", PipelineStatus.DRAFT);
        PipelineStep step = TestEntities.step(pipeline, UUID.randomUUID(), 1, Map.of());
        when(pipelines.findWithStepsById(pipeline.getId())).thenReturn(Optional.of(pipeline));

        service.removeStep(pipeline.getId(), step.getId(), alice);

        assertThat(pipeline.getSteps()).isEmpty();
    }

    @Test
    void delete_unknownPipeline_notFound() {
        UUID id = UUID.randomUUID();
        when(pipelines.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(id, alice))
                .isInstanceOf(OrchestrationException.class)
                .hasMessageContaining("PIPELINE_NOT_FOUND");
    }
}
