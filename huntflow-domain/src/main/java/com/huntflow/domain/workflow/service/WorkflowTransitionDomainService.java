package com.huntflow.domain.workflow.service;

import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.domain.workflow.model.valobj.StepTransition;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.springframework.stereotype.Service;

/**
 * 执行状态迁移领域服务：纯函数，根据当前步骤与步骤结果决定下一状态。
 */
@Service
public class WorkflowTransitionDomainService {

    public StepTransition next(WorkflowStepEnum step, StepOutcome outcome) {
        if (step == null || outcome == null) {
            throw new IllegalArgumentException("Step and outcome are required");
        }
        return switch (outcome.getKind()) {
            case CONTINUE -> step.next() == null
                    ? new StepTransition(ExecutionStatusEnum.COMPLETED, null, null)
                    : new StepTransition(ExecutionStatusEnum.RUNNING, step.next(), null);
            case TERMINATE -> new StepTransition(ExecutionStatusEnum.COMPLETED, null, outcome.getTerminationReason());
            case FAIL -> new StepTransition(ExecutionStatusEnum.FAILED, null, null);
        };
    }
}
