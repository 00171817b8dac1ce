package com.huntflow.infrastructure.repository.workflow;

import com.huntflow.domain.workflow.adapter.repository.IExecutionAttemptRepository;
import com.huntflow.domain.workflow.model.entity.ExecutionAttemptEntity;
import com.huntflow.infrastructure.dao.ExecutionAttemptDao;
import com.huntflow.infrastructure.dao.po.ExecutionAttemptPO;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 调用尝试审计仓储实现，只追加不更新。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Repository
public class ExecutionAttemptRepositoryImpl implements IExecutionAttemptRepository {

    private final ExecutionAttemptDao executionAttemptDao;

    public ExecutionAttemptRepositoryImpl(ExecutionAttemptDao executionAttemptDao) {
        this.executionAttemptDao = executionAttemptDao;
    }

    @Override
    public ExecutionAttemptEntity save(ExecutionAttemptEntity entity) {
        entity.validate();
        ExecutionAttemptPO po = toPO(entity);
        executionAttemptDao.insert(po);
        return toEntity(po);
    }

    @Override
    public List<ExecutionAttemptEntity> findByExecutionId(Long executionId) {
        return executionAttemptDao.selectByExecutionId(executionId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<ExecutionAttemptEntity> findByExecutionIdAndStep(Long executionId, WorkflowStepEnum step) {
        return executionAttemptDao.selectByExecutionIdAndStep(executionId, step.getCode()).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ExecutionAttemptEntity toEntity(ExecutionAttemptPO po) {
        ExecutionAttemptEntity entity = new ExecutionAttemptEntity();
        entity.setId(po.getId());
        entity.setExecutionId(po.getExecutionId());
        entity.setStep(WorkflowStepEnum.fromCode(po.getStep()));
        entity.setAgentName(po.getAgentName());
        entity.setAttemptNumber(po.getAttemptNumber());
        entity.setPromptSnapshot(po.getPromptSnapshot());
        entity.setResponseRaw(po.getResponseRaw());
        entity.setIsValid(po.getIsValid());
        entity.setValidationFeedback(po.getValidationFeedback());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setErrorType(po.getErrorType());
        entity.setExecutionTimeMs(po.getExecutionTimeMs());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private ExecutionAttemptPO toPO(ExecutionAttemptEntity entity) {
        return ExecutionAttemptPO.builder()
                .id(entity.getId())
                .executionId(entity.getExecutionId())
                .step(entity.getStep() == null ? null : entity.getStep().getCode())
                .agentName(entity.getAgentName())
                .attemptNumber(entity.getAttemptNumber())
                .promptSnapshot(entity.getPromptSnapshot())
                .responseRaw(entity.getResponseRaw())
                .isValid(entity.getIsValid())
                .validationFeedback(entity.getValidationFeedback())
                .errorMessage(entity.getErrorMessage())
                .errorType(entity.getErrorType())
                .executionTimeMs(entity.getExecutionTimeMs())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
