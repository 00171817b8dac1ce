package com.huntflow.test.domain;

import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkflowExecutionEntityTest {

    @Test
    public void shouldIncrementTokenOnEveryClaim() {
        WorkflowExecutionEntity execution = WorkflowExecutionEntity.create(1L, "v1", Map.of());

        execution.claim("worker-a");
        assertEquals(ExecutionStatusEnum.RUNNING, execution.getStatus());
        assertEquals(1, execution.getDispatchToken());
        assertTrue(execution.isOwnedBy("worker-a", 1, WorkflowStepEnum.FILTER));

        execution.releaseClaim();
        execution.claim("worker-b");

        assertEquals(2, execution.getDispatchToken());
        assertFalse(execution.isOwnedBy("worker-a", 1, null));
        assertTrue(execution.isOwnedBy("worker-b", 2, null));
    }

    @Test
    public void shouldOnlyMoveForward() {
        WorkflowExecutionEntity execution = running();
        execution.advanceTo(WorkflowStepEnum.RANK);

        assertThrows(IllegalStateException.class, () -> execution.advanceTo(WorkflowStepEnum.FILTER));
        assertThrows(IllegalStateException.class, () -> execution.advanceTo(WorkflowStepEnum.RANK));
        assertEquals(WorkflowStepEnum.RANK, execution.getCurrentStep());
    }

    @Test
    public void shouldRetryFromFailedStepKeepingEarlierResults() {
        WorkflowExecutionEntity execution = running();
        execution.recordStepResult(WorkflowStepEnum.FILTER, Map.of("keptChunks", 2));
        execution.advanceTo(WorkflowStepEnum.RANK);
        execution.recordStepResult(WorkflowStepEnum.RANK, Map.of("partial", true));
        execution.fail(WorkflowStepEnum.RANK, "timeout", "model timed out");

        execution.retryFromFailed();

        assertEquals(ExecutionStatusEnum.PENDING, execution.getStatus());
        assertEquals(WorkflowStepEnum.RANK, execution.getCurrentStep());
        assertTrue(execution.hasStepResult(WorkflowStepEnum.FILTER));
        assertFalse(execution.hasStepResult(WorkflowStepEnum.RANK));
        assertNull(execution.getErrorType());
        assertEquals(1, execution.getRetryCount());
    }

    @Test
    public void shouldCancelPendingImmediatelyAndRunningLater() {
        WorkflowExecutionEntity pending = WorkflowExecutionEntity.create(1L, "v1", Map.of());
        pending.requestCancel();
        assertEquals(ExecutionStatusEnum.CANCELLED, pending.getStatus());
        assertEquals(TerminationReasonEnum.CANCELLED, pending.getTerminationReason());

        WorkflowExecutionEntity running = running();
        running.requestCancel();
        assertEquals(ExecutionStatusEnum.RUNNING, running.getStatus());
        assertTrue(running.isCancelRequested());
    }

    @Test
    public void shouldRejectTransitionsFromTerminalStates() {
        WorkflowExecutionEntity execution = running();
        execution.complete(TerminationReasonEnum.QUEUED);

        assertTrue(execution.isTerminal());
        assertThrows(IllegalStateException.class, execution::requestCancel);
        assertThrows(IllegalStateException.class, execution::retryFromFailed);
        assertThrows(IllegalStateException.class, () -> execution.markStale("late"));
    }

    @Test
    public void shouldMarkStaleAtCurrentStep() {
        WorkflowExecutionEntity execution = running();
        execution.advanceTo(WorkflowStepEnum.EXTRACT);

        execution.markStale("no heartbeat");

        assertEquals(ExecutionStatusEnum.FAILED, execution.getStatus());
        assertEquals(TerminationReasonEnum.STALE_TIMEOUT, execution.getTerminationReason());
        assertEquals(WorkflowStepEnum.EXTRACT, execution.getFailedStep());
        assertEquals("stale_timeout", execution.getErrorType());
    }

    private WorkflowExecutionEntity running() {
        WorkflowExecutionEntity execution = WorkflowExecutionEntity.create(1L, "v1", Map.of());
        execution.claim("worker-a");
        return execution;
    }
}
