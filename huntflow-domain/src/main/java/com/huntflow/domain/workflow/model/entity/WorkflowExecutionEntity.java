package com.huntflow.domain.workflow.model.entity;

import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 工作流执行领域实体：单次运行唯一的共享可变记录。
 * <p>
 * 状态机：pending → running(step) → completed | failed | cancelled。
 * 每个步骤写入一次结果，写入方必须持有当前派发令牌，持久化时通过 version 做乐观锁。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
public class WorkflowExecutionEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 文档 ID
     */
    private Long documentId;

    /**
     * 配置版本
     */
    private String configVersion;

    /**
     * 触发时的配置快照
     */
    private Map<String, Object> configSnapshot;

    /**
     * 状态
     */
    private ExecutionStatusEnum status;

    /**
     * 当前步骤（终态时为最后到达的步骤）
     */
    private WorkflowStepEnum currentStep;

    /**
     * 各步骤结果，key 为步骤 code
     */
    private Map<String, Object> stepResults;

    /**
     * 终止原因
     */
    private TerminationReasonEnum terminationReason;

    /**
     * 失败步骤
     */
    private WorkflowStepEnum failedStep;

    /**
     * 错误类型
     */
    private String errorType;

    /**
     * 错误信息
     */
    private String errorMessage;

    /**
     * 内容过滤是否降级（分类器不可用时全部保留）
     */
    private Boolean filterDegraded;

    /**
     * 是否已请求取消
     */
    private Boolean cancelRequested;

    /**
     * 派发持有者
     */
    private String dispatchOwner;

    /**
     * 派发令牌（每次领取递增）
     */
    private Integer dispatchToken;

    /**
     * 外部重试次数
     */
    private Integer retryCount;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    /**
     * 最近一次步骤推进时间，过期清扫依据
     */
    private LocalDateTime heartbeatAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    /**
     * 新建待调度执行
     */
    public static WorkflowExecutionEntity create(Long documentId, String configVersion, Map<String, Object> configSnapshot) {
        WorkflowExecutionEntity entity = new WorkflowExecutionEntity();
        LocalDateTime now = LocalDateTime.now();
        entity.setDocumentId(documentId);
        entity.setConfigVersion(configVersion);
        entity.setConfigSnapshot(configSnapshot);
        entity.setStatus(ExecutionStatusEnum.PENDING);
        entity.setCurrentStep(WorkflowStepEnum.first());
        entity.setStepResults(new LinkedHashMap<>());
        entity.setFilterDegraded(false);
        entity.setCancelRequested(false);
        entity.setDispatchToken(0);
        entity.setRetryCount(0);
        entity.setVersion(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证执行是否有效
     */
    public void validate() {
        if (documentId == null) {
            throw new IllegalStateException("Document ID cannot be null");
        }
        if (configVersion == null || configVersion.trim().isEmpty()) {
            throw new IllegalStateException("Config version cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (currentStep == null) {
            throw new IllegalStateException("Current step cannot be null");
        }
    }

    /**
     * 执行器领取：pending → running，令牌递增
     */
    public void claim(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalStateException("Dispatch owner cannot be empty");
        }
        if (this.status != ExecutionStatusEnum.PENDING) {
            throw new IllegalStateException("Execution must be in PENDING status to be claimed");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = ExecutionStatusEnum.RUNNING;
        this.dispatchOwner = owner;
        this.dispatchToken = (this.dispatchToken == null ? 0 : this.dispatchToken) + 1;
        if (this.startedAt == null) {
            this.startedAt = now;
        }
        this.heartbeatAt = now;
        this.updatedAt = now;
    }

    /**
     * 派发失败时归还领取
     */
    public void releaseClaim() {
        if (this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Only RUNNING execution can release claim");
        }
        this.status = ExecutionStatusEnum.PENDING;
        this.dispatchOwner = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 是否仍由指定持有者与令牌持有，且停留在预期步骤
     */
    public boolean isOwnedBy(String owner, Integer token, WorkflowStepEnum expectedStep) {
        return this.status == ExecutionStatusEnum.RUNNING
                && Objects.equals(this.dispatchOwner, owner)
                && Objects.equals(this.dispatchToken, token)
                && (expectedStep == null || this.currentStep == expectedStep);
    }

    /**
     * 记录步骤结果
     */
    public void recordStepResult(WorkflowStepEnum step, Map<String, Object> result) {
        if (step == null) {
            return;
        }
        if (this.stepResults == null) {
            this.stepResults = new LinkedHashMap<>();
        }
        this.stepResults.put(step.getCode(), result == null ? new LinkedHashMap<>() : result);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getStepResult(WorkflowStepEnum step) {
        if (step == null || this.stepResults == null) {
            return null;
        }
        Object value = this.stepResults.get(step.getCode());
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    public boolean hasStepResult(WorkflowStepEnum step) {
        return getStepResult(step) != null;
    }

    /**
     * 推进到下一步骤；只允许严格向前
     */
    public void advanceTo(WorkflowStepEnum nextStep) {
        if (this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Execution must be in RUNNING status to advance");
        }
        if (nextStep == null || !nextStep.isAfter(this.currentStep)) {
            throw new IllegalStateException("Step transition must move forward: " + this.currentStep + " -> " + nextStep);
        }
        this.currentStep = nextStep;
        touch();
    }

    /**
     * 完成执行
     */
    public void complete(TerminationReasonEnum reason) {
        if (this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Execution must be in RUNNING status to complete");
        }
        this.status = ExecutionStatusEnum.COMPLETED;
        this.terminationReason = reason;
        this.completedAt = LocalDateTime.now();
        touch();
    }

    /**
     * 步骤失败
     */
    public void fail(WorkflowStepEnum step, String errorType, String errorMessage) {
        if (this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Execution must be in RUNNING status to fail");
        }
        this.status = ExecutionStatusEnum.FAILED;
        this.failedStep = step;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.completedAt = LocalDateTime.now();
        touch();
    }

    /**
     * 过期清扫：running 记录标记失败
     */
    public void markStale(String message) {
        if (this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Only RUNNING execution can be marked stale");
        }
        this.status = ExecutionStatusEnum.FAILED;
        this.terminationReason = TerminationReasonEnum.STALE_TIMEOUT;
        this.failedStep = this.currentStep;
        this.errorType = TerminationReasonEnum.STALE_TIMEOUT.getCode();
        this.errorMessage = message;
        this.completedAt = LocalDateTime.now();
        touch();
    }

    /**
     * 请求取消：pending 立即取消，running 由执行器在步骤边界处理
     */
    public void requestCancel() {
        if (this.status == null || this.status.isTerminal()) {
            throw new IllegalStateException("Execution already finished: " + this.status);
        }
        this.cancelRequested = true;
        if (this.status == ExecutionStatusEnum.PENDING) {
            cancel();
            return;
        }
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 执行取消
     */
    public void cancel() {
        if (this.status != ExecutionStatusEnum.PENDING && this.status != ExecutionStatusEnum.RUNNING) {
            throw new IllegalStateException("Execution cannot be cancelled from status: " + this.status);
        }
        this.status = ExecutionStatusEnum.CANCELLED;
        this.terminationReason = TerminationReasonEnum.CANCELLED;
        this.completedAt = LocalDateTime.now();
        touch();
    }

    public boolean isCancelRequested() {
        return Boolean.TRUE.equals(this.cancelRequested);
    }

    /**
     * 外部重试：failed → pending，停留在失败步骤并保留之前的步骤结果
     */
    public void retryFromFailed() {
        if (this.status != ExecutionStatusEnum.FAILED) {
            throw new IllegalStateException("Only FAILED execution can be retried");
        }
        if (this.failedStep != null) {
            this.currentStep = this.failedStep;
        }
        if (this.stepResults != null && this.currentStep != null) {
            this.stepResults.remove(this.currentStep.getCode());
        }
        this.status = ExecutionStatusEnum.PENDING;
        this.terminationReason = null;
        this.failedStep = null;
        this.errorType = null;
        this.errorMessage = null;
        this.cancelRequested = false;
        this.dispatchOwner = null;
        this.completedAt = null;
        this.retryCount = (this.retryCount == null ? 0 : this.retryCount) + 1;
        this.updatedAt = LocalDateTime.now();
    }

    public void markFilterDegraded() {
        this.filterDegraded = true;
    }

    /**
     * 递增版本号
     */
    public void incrementVersion() {
        this.version = (this.version == null ? 0 : this.version) + 1;
    }

    public boolean isTerminal() {
        return this.status != null && this.status.isTerminal();
    }

    private void touch() {
        LocalDateTime now = LocalDateTime.now();
        this.heartbeatAt = now;
        this.updatedAt = now;
    }
}
