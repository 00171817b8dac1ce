package com.huntflow.domain.workflow.model.valobj;

import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 状态迁移结果：目标状态、下一步骤与终止原因。
 */
@Getter
@AllArgsConstructor
public final class StepTransition {

    private final ExecutionStatusEnum targetStatus;
    private final WorkflowStepEnum nextStep;
    private final TerminationReasonEnum terminationReason;

    public boolean isAdvance() {
        return targetStatus == ExecutionStatusEnum.RUNNING && nextStep != null;
    }
}
