package com.interfaceagent.orchestrator.audit;

import com.interfaceagent.orchestrator.model.AuditRecord;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.repository.AuditRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditLoggerTest {

    @Mock AuditRecordRepository      repo;
    @Mock PlatformTransactionManager transactionManager;

    @Test
    void record_writesOneRowWithAllFields() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);
        UUID id = UUID.randomUUID();

        logger.record("alice", "pipeline.create", "pipeline", id, AuditStatus.SUCCESS,
                Map.of("name", "orders"), "10.0.0.1 curl/8.0");

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repo).saveAndFlush(captor.capture());
        AuditRecord row = captor.getValue();
        assertThat(row.getActor()).isEqualTo("alice");
        assertThat(row.getAction()).isEqualTo("pipeline.create");
        assertThat(row.getResourceType()).isEqualTo("pipeline");
        assertThat(row.getResourceId()).isEqualTo(id.toString());
        assertThat(row.getStatus()).isEqualTo(AuditStatus.SUCCESS);
        assertThat(row.getDetails()).containsEntry("name", "orders");
        assertThat(row.getOrigin()).isEqualTo("10.0.0.1 curl/8.0");
    }

    @Test
    void record_commitsInItsOwnTransaction() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);

        logger.record("alice", "pipeline.step.add", "pipeline", UUID.randomUUID(), AuditStatus.FAILURE,
                Map.of("error", "order taken"));

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        verify(transactionManager).commit(any());
    }

    @Test
    void record_withoutActor_attributesToSystem() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);

        logger.record(null, "pipeline.execution.completed", "pipeline_execution", null, AuditStatus.FAILURE, Map.of());

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repo).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getActor()).isEqualTo(AuditLogger.SYSTEM_ACTOR);
        assertThat(captor.getValue().getResourceId()).isNull();
    }

    @Test
    void record_oversizedActorAndOrigin_areCutToColumnWidth() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);

        logger.record("a".repeat(300), "agent.create", "agent", null, AuditStatus.SUCCESS, Map.of(),
                "10.0.0.1 " + "x".repeat(2_000));

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repo).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getActor()).hasSize(AuditRecord.ACTOR_LENGTH);
        assertThat(captor.getValue().getOrigin()).hasSize(AuditRecord.ORIGIN_LENGTH).startsWith("10.0.0.1 ");
    }

    @Test
    void record_repositoryFails_doesNotPropagate() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);
        when(repo.saveAndFlush(any())).thenThrow(new IllegalStateException("disk full"));

        assertThatCode(() -> logger.record("alice", "agent.delete", "agent", UUID.randomUUID(),
                AuditStatus.SUCCESS, Map.of())).doesNotThrowAnyException();
        verify(transactionManager).rollback(any());
    }

    @Test
    void record_commitFails_doesNotPropagate() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, true);
        doThrow(new TransactionSystemException("value too long for type character varying(100)"))
                .when(transactionManager).commit(any());

        assertThatCode(() -> logger.record("alice", "agent.delete", "agent", UUID.randomUUID(),
                AuditStatus.SUCCESS, Map.of())).doesNotThrowAnyException();
    }

    @Test
    void record_disabled_writesNothing() {
        AuditLogger logger = new AuditLogger(repo, transactionManager, false);

        logger.record("alice", "agent.delete", "agent", UUID.randomUUID(), AuditStatus.SUCCESS, Map.of());

        assertThat(logger.isEnabled()).isFalse();
        verifyNoInteractions(repo, transactionManager);
    }
}
