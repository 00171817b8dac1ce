package com.huntflow.infrastructure.repository.workflow;

import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.infrastructure.dao.WorkflowExecutionDao;
import com.huntflow.infrastructure.dao.po.WorkflowExecutionPO;
import com.huntflow.infrastructure.util.JsonCodec;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流执行仓储实现类。
 * <p>
 * 负责执行记录的持久化，包括：
 * <ul>
 *   <li>带乐观锁的条件更新（领取、步骤结果、终态、清扫共用）</li>
 *   <li>活跃执行与过期执行查询</li>
 *   <li>JSONB 字段（stepResults、configSnapshot）的序列化/反序列化</li>
 * </ul>
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class WorkflowExecutionRepositoryImpl implements IWorkflowExecutionRepository {

    private final WorkflowExecutionDao workflowExecutionDao;
    private final JsonCodec jsonCodec;

    public WorkflowExecutionRepositoryImpl(WorkflowExecutionDao workflowExecutionDao, JsonCodec jsonCodec) {
        this.workflowExecutionDao = workflowExecutionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WorkflowExecutionEntity save(WorkflowExecutionEntity entity) {
        entity.validate();
        WorkflowExecutionPO po = toPO(entity);
        workflowExecutionDao.insert(po);
        entity.setId(po.getId());
        return toEntity(po);
    }

    @Override
    public WorkflowExecutionEntity update(WorkflowExecutionEntity entity) {
        entity.validate();
        entity.incrementVersion();
        WorkflowExecutionPO po = toPO(entity);
        int affected = workflowExecutionDao.updateWithVersion(po);
        if (affected == 0) {
            throw new RuntimeException(Constants.OPTIMISTIC_LOCK_FAILED + " for WorkflowExecution: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public WorkflowExecutionEntity findById(Long id) {
        WorkflowExecutionPO po = workflowExecutionDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<WorkflowExecutionEntity> findByStatus(ExecutionStatusEnum status, int limit) {
        return workflowExecutionDao.selectByStatus(status.getCode(), limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecutionEntity> findByDocumentId(Long documentId) {
        return workflowExecutionDao.selectByDocumentId(documentId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecutionEntity> findActiveByDocumentAndConfig(Long documentId, String configVersion) {
        return workflowExecutionDao.selectActiveByDocumentAndConfig(documentId, configVersion).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecutionEntity> findStaleRunning(LocalDateTime heartbeatBefore, int limit) {
        return workflowExecutionDao.selectStaleRunning(heartbeatBefore, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private WorkflowExecutionEntity toEntity(WorkflowExecutionPO po) {
        if (po == null) {
            return null;
        }
        WorkflowExecutionEntity entity = new WorkflowExecutionEntity();
        entity.setId(po.getId());
        entity.setDocumentId(po.getDocumentId());
        entity.setConfigVersion(po.getConfigVersion());
        entity.setStatus(ExecutionStatusEnum.fromCode(po.getStatus()));
        entity.setCurrentStep(WorkflowStepEnum.fromCode(po.getCurrentStep()));
        entity.setTerminationReason(TerminationReasonEnum.fromCode(po.getTerminationReason()));
        entity.setFailedStep(WorkflowStepEnum.fromCode(po.getFailedStep()));
        entity.setErrorType(po.getErrorType());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setFilterDegraded(po.getFilterDegraded());
        entity.setCancelRequested(po.getCancelRequested());
        entity.setDispatchOwner(po.getDispatchOwner());
        entity.setDispatchToken(po.getDispatchToken());
        entity.setRetryCount(po.getRetryCount());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setHeartbeatAt(po.getHeartbeatAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setCompletedAt(po.getCompletedAt());

        // JSONB 字段转换
        entity.setConfigSnapshot(jsonCodec.readMap(po.getConfigSnapshot()));
        entity.setStepResults(po.getStepResults() != null
                ? jsonCodec.readMap(po.getStepResults()) : new LinkedHashMap<>());
        return entity;
    }

    private WorkflowExecutionPO toPO(WorkflowExecutionEntity entity) {
        return WorkflowExecutionPO.builder()
                .id(entity.getId())
                .documentId(entity.getDocumentId())
                .configVersion(entity.getConfigVersion())
                .configSnapshot(jsonCodec.writeValue(entity.getConfigSnapshot()))
                .status(entity.getStatus().getCode())
                .currentStep(entity.getCurrentStep().getCode())
                .stepResults(jsonCodec.writeValue(entity.getStepResults()))
                .terminationReason(entity.getTerminationReason() == null ? null : entity.getTerminationReason().getCode())
                .failedStep(entity.getFailedStep() == null ? null : entity.getFailedStep().getCode())
                .errorType(entity.getErrorType())
                .errorMessage(entity.getErrorMessage())
                .filterDegraded(entity.getFilterDegraded())
                .cancelRequested(entity.getCancelRequested())
                .dispatchOwner(entity.getDispatchOwner())
                .dispatchToken(entity.getDispatchToken())
                .retryCount(entity.getRetryCount())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .heartbeatAt(entity.getHeartbeatAt())
                .updatedAt(entity.getUpdatedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
