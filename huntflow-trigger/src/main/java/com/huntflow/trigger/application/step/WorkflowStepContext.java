package com.huntflow.trigger.application.step;

import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.model.valobj.DocumentSnapshot;
import com.huntflow.domain.workflow.model.valobj.OwnershipGuard;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.Getter;

import java.util.Map;

/**
 * 步骤执行上下文：当前执行快照、执行时的配置与文档。
 */
@Getter
public class WorkflowStepContext {

    private final WorkflowExecutionEntity execution;
    private final WorkflowConfig config;
    private final DocumentSnapshot document;
    private final OwnershipGuard ownershipGuard;

    public WorkflowStepContext(WorkflowExecutionEntity execution, WorkflowConfig config, DocumentSnapshot document,
                               OwnershipGuard ownershipGuard) {
        this.execution = execution;
        this.config = config;
        this.document = document;
        this.ownershipGuard = ownershipGuard;
    }

    public Long getExecutionId() {
        return execution.getId();
    }

    public WorkflowStepEnum getStep() {
        return execution.getCurrentStep();
    }

    public AgentInvocationContext invocationContext() {
        return new AgentInvocationContext(execution.getId(), execution.getCurrentStep(), config, ownershipGuard);
    }

    /**
     * 前序步骤结果；缺失说明执行记录被破坏，直接抛出
     */
    public Map<String, Object> requireStepResult(WorkflowStepEnum step) {
        Map<String, Object> result = execution.getStepResult(step);
        if (result == null) {
            throw new IllegalStateException("Missing result of step " + step.getCode()
                    + " for execution " + execution.getId());
        }
        return result;
    }

    public String requireString(WorkflowStepEnum step, String key) {
        Object value = requireStepResult(step).get(key);
        return value == null ? null : String.valueOf(value);
    }

    public Long requireLong(WorkflowStepEnum step, String key) {
        Object value = requireStepResult(step).get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        return null;
    }
}
