package com.huntflow.test.domain;

import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.domain.workflow.model.valobj.StepTransition;
import com.huntflow.domain.workflow.service.WorkflowTransitionDomainService;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkflowTransitionDomainServiceTest {

    private final WorkflowTransitionDomainService service = new WorkflowTransitionDomainService();

    @Test
    public void shouldAdvanceThroughStepsInOrder() {
        WorkflowStepEnum step = WorkflowStepEnum.first();
        int visited = 1;
        while (true) {
            StepTransition transition = service.next(step, StepOutcome.proceed(null));
            if (!transition.isAdvance()) {
                assertEquals(ExecutionStatusEnum.COMPLETED, transition.getTargetStatus());
                break;
            }
            assertTrue(transition.getNextStep().isAfter(step));
            step = transition.getNextStep();
            visited++;
        }
        assertEquals(WorkflowStepEnum.PROMOTE, step);
        assertEquals(WorkflowStepEnum.values().length, visited);
    }

    @Test
    public void shouldCompleteWithReasonOnTerminate() {
        StepTransition transition = service.next(WorkflowStepEnum.RANK,
                StepOutcome.terminate(TerminationReasonEnum.LOW_RELEVANCE, null));

        assertEquals(ExecutionStatusEnum.COMPLETED, transition.getTargetStatus());
        assertEquals(TerminationReasonEnum.LOW_RELEVANCE, transition.getTerminationReason());
        assertNull(transition.getNextStep());
    }

    @Test
    public void shouldFailOnFailure() {
        StepTransition transition = service.next(WorkflowStepEnum.EXTRACT,
                StepOutcome.fail("timeout", "model timed out", null));

        assertEquals(ExecutionStatusEnum.FAILED, transition.getTargetStatus());
        assertFalse(transition.isAdvance());
    }

    @Test
    public void shouldRejectMissingInput() {
        assertThrows(IllegalArgumentException.class, () -> service.next(null, StepOutcome.proceed(null)));
    }
}
