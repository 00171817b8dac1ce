package com.huntflow.test.support;

import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ExecutionStatusEnum;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 内存执行仓储。
 * <p>
 * 读写都做拷贝，行为与数据库一致：调用方修改读到的实体不会影响存储，update 按 version 条件写入，
 * 同一 (文档, 配置版本) 只允许一条 pending/running 记录。
 * </p>
 */
public class InMemoryWorkflowExecutionRepository implements IWorkflowExecutionRepository {

    private final Map<Long, WorkflowExecutionEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private int updateCount;

    @Override
    public synchronized WorkflowExecutionEntity save(WorkflowExecutionEntity entity) {
        entity.validate();
        boolean activeExists = store.values().stream()
                .anyMatch(item -> isActive(item)
                        && Objects.equals(item.getDocumentId(), entity.getDocumentId())
                        && Objects.equals(item.getConfigVersion(), entity.getConfigVersion()));
        if (isActive(entity) && activeExists) {
            throw new DuplicateKeyException("uk_workflow_execution_active");
        }
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized WorkflowExecutionEntity update(WorkflowExecutionEntity entity) {
        entity.validate();
        WorkflowExecutionEntity stored = store.get(entity.getId());
        entity.incrementVersion();
        if (stored == null || stored.getVersion() + 1 != entity.getVersion()) {
            throw new RuntimeException(Constants.OPTIMISTIC_LOCK_FAILED + ": executionId=" + entity.getId());
        }
        store.put(entity.getId(), copy(entity));
        updateCount++;
        return entity;
    }

    @Override
    public synchronized WorkflowExecutionEntity findById(Long id) {
        WorkflowExecutionEntity stored = store.get(id);
        return stored == null ? null : copy(stored);
    }

    @Override
    public synchronized List<WorkflowExecutionEntity> findByStatus(ExecutionStatusEnum status, int limit) {
        return store.values().stream()
                .filter(item -> item.getStatus() == status)
                .sorted(Comparator.comparing(WorkflowExecutionEntity::getId))
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowExecutionEntity> findByDocumentId(Long documentId) {
        return store.values().stream()
                .filter(item -> Objects.equals(item.getDocumentId(), documentId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowExecutionEntity> findActiveByDocumentAndConfig(Long documentId, String configVersion) {
        return store.values().stream()
                .filter(this::isActive)
                .filter(item -> Objects.equals(item.getDocumentId(), documentId))
                .filter(item -> Objects.equals(item.getConfigVersion(), configVersion))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowExecutionEntity> findStaleRunning(LocalDateTime heartbeatBefore, int limit) {
        return store.values().stream()
                .filter(item -> item.getStatus() == ExecutionStatusEnum.RUNNING)
                .filter(item -> item.getHeartbeatAt() != null && item.getHeartbeatAt().isBefore(heartbeatBefore))
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    /**
     * 模拟其它写入方直接修改存储记录（版本号随之递增）
     */
    public synchronized void modifyStored(Long id, Consumer<WorkflowExecutionEntity> mutation) {
        WorkflowExecutionEntity stored = store.get(id);
        mutation.accept(stored);
        stored.incrementVersion();
    }

    public synchronized int getUpdateCount() {
        return updateCount;
    }

    private boolean isActive(WorkflowExecutionEntity entity) {
        return entity.getStatus() == ExecutionStatusEnum.PENDING || entity.getStatus() == ExecutionStatusEnum.RUNNING;
    }

    private WorkflowExecutionEntity copy(WorkflowExecutionEntity source) {
        WorkflowExecutionEntity target = new WorkflowExecutionEntity();
        target.setId(source.getId());
        target.setDocumentId(source.getDocumentId());
        target.setConfigVersion(source.getConfigVersion());
        target.setConfigSnapshot(source.getConfigSnapshot() == null ? null : new LinkedHashMap<>(source.getConfigSnapshot()));
        target.setStatus(source.getStatus());
        target.setCurrentStep(source.getCurrentStep());
        target.setStepResults(source.getStepResults() == null ? null : new LinkedHashMap<>(source.getStepResults()));
        target.setTerminationReason(source.getTerminationReason());
        target.setFailedStep(source.getFailedStep());
        target.setErrorType(source.getErrorType());
        target.setErrorMessage(source.getErrorMessage());
        target.setFilterDegraded(source.getFilterDegraded());
        target.setCancelRequested(source.getCancelRequested());
        target.setDispatchOwner(source.getDispatchOwner());
        target.setDispatchToken(source.getDispatchToken());
        target.setRetryCount(source.getRetryCount());
        target.setVersion(source.getVersion());
        target.setCreatedAt(source.getCreatedAt());
        target.setStartedAt(source.getStartedAt());
        target.setHeartbeatAt(source.getHeartbeatAt());
        target.setUpdatedAt(source.getUpdatedAt());
        target.setCompletedAt(source.getCompletedAt());
        return target;
    }
}
