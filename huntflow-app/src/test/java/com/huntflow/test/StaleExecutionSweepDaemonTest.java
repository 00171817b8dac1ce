package com.huntflow.test;

import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.test.support.InMemoryWorkflowExecutionRepository;
import com.huntflow.trigger.job.StaleExecutionSweepDaemon;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class StaleExecutionSweepDaemonTest {

    private final WorkflowPersistencePolicyDomainService persistencePolicy = new WorkflowPersistencePolicyDomainService();

    @Test
    public void shouldFailRunningExecutionWithoutRecentHeartbeat() {
        InMemoryWorkflowExecutionRepository repository = new InMemoryWorkflowExecutionRepository();
        WorkflowExecutionEntity stale = running(repository, 1L);
        repository.modifyStored(stale.getId(), stored -> {
            stored.setCurrentStep(WorkflowStepEnum.EXTRACT);
            stored.setHeartbeatAt(LocalDateTime.now().minusHours(2));
        });
        WorkflowExecutionEntity fresh = running(repository, 2L);

        new StaleExecutionSweepDaemon(repository, persistencePolicy, 60, 10).sweepStaleExecutions();

        WorkflowExecutionEntity swept = repository.findById(stale.getId());
        assertEquals(ExecutionStatusEnum.FAILED, swept.getStatus());
        assertEquals(TerminationReasonEnum.STALE_TIMEOUT, swept.getTerminationReason());
        assertEquals(WorkflowStepEnum.EXTRACT, swept.getFailedStep());
        assertEquals(ExecutionStatusEnum.RUNNING, repository.findById(fresh.getId()).getStatus());
    }

    @Test
    public void shouldSkipExecutionThatAdvancedConcurrently() {
        IWorkflowExecutionRepository repository = mock(IWorkflowExecutionRepository.class);
        WorkflowExecutionEntity execution = WorkflowExecutionEntity.create(1L, "v1", Map.of());
        execution.setId(5L);
        execution.claim("worker-a");
        execution.setHeartbeatAt(LocalDateTime.now().minusHours(1));
        when(repository.findStaleRunning(any(LocalDateTime.class), anyInt())).thenReturn(List.of(execution));
        when(repository.update(any(WorkflowExecutionEntity.class)))
                .thenThrow(new RuntimeException(Constants.OPTIMISTIC_LOCK_FAILED + ": executionId=5"));

        assertDoesNotThrow(() ->
                new StaleExecutionSweepDaemon(repository, persistencePolicy, 60, 10).sweepStaleExecutions());

        verify(repository).update(execution);
    }

    private WorkflowExecutionEntity running(InMemoryWorkflowExecutionRepository repository, Long documentId) {
        WorkflowExecutionEntity execution = repository.save(WorkflowExecutionEntity.create(documentId, "v1", Map.of()));
        execution.claim("worker-a");
        return repository.update(execution);
    }
}
