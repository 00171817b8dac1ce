package com.huntflow.domain.workflow.model.valobj;

import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 代理调用上下文，用于审计归属；ownershipGuard 在步骤内落库前复核派发所有权。
 */
@Getter
@AllArgsConstructor
public final class AgentInvocationContext {

    private final Long executionId;
    private final WorkflowStepEnum step;
    private final WorkflowConfig config;
    private final OwnershipGuard ownershipGuard;

    public AgentInvocationContext(Long executionId, WorkflowStepEnum step, WorkflowConfig config) {
        this(executionId, step, config, OwnershipGuard.NONE);
    }

    public void ensureOwned() {
        ownershipGuard.ensureOwned();
    }
}
