package com.huntflow.domain.workflow.adapter.repository;

import com.huntflow.domain.workflow.model.entity.ExecutionAttemptEntity;
import com.huntflow.types.enums.WorkflowStepEnum;

import java.util.List;

/**
 * 调用尝试审计仓储接口，实现需线程安全（子代理并发写入）。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public interface IExecutionAttemptRepository {

    ExecutionAttemptEntity save(ExecutionAttemptEntity entity);

    List<ExecutionAttemptEntity> findByExecutionId(Long executionId);

    List<ExecutionAttemptEntity> findByExecutionIdAndStep(Long executionId, WorkflowStepEnum step);
}
