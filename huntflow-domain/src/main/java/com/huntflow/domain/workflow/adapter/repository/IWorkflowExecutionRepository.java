package com.huntflow.domain.workflow.adapter.repository;

import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.types.enums.ExecutionStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流执行仓储接口。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public interface IWorkflowExecutionRepository {

    /**
     * 保存新执行
     */
    WorkflowExecutionEntity save(WorkflowExecutionEntity entity);

    /**
     * 乐观锁更新；版本不匹配时抛出 "Optimistic lock failed" 异常
     */
    WorkflowExecutionEntity update(WorkflowExecutionEntity entity);

    WorkflowExecutionEntity findById(Long id);

    List<WorkflowExecutionEntity> findByStatus(ExecutionStatusEnum status, int limit);

    List<WorkflowExecutionEntity> findByDocumentId(Long documentId);

    /**
     * 查询同一 (文档, 配置版本) 下仍处于 pending/running 的执行
     */
    List<WorkflowExecutionEntity> findActiveByDocumentAndConfig(Long documentId, String configVersion);

    /**
     * 查询心跳早于截止时间的 running 执行
     */
    List<WorkflowExecutionEntity> findStaleRunning(LocalDateTime heartbeatBefore, int limit);
}
