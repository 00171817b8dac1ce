package com.huntflow.domain.workflow.model.entity;

import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 外部调用尝试审计实体：保存每次模型调用的 prompt、原始响应和校验结果。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
public class ExecutionAttemptEntity {

    private Long id;

    private Long executionId;

    private WorkflowStepEnum step;

    /**
     * 代理名称，如 RankAgent、CmdlineExtract、CmdlineQA
     */
    private String agentName;

    /**
     * 该代理在本步骤内的尝试序号，从 1 开始
     */
    private Integer attemptNumber;

    private String promptSnapshot;

    private String responseRaw;

    private Boolean isValid;

    private String validationFeedback;

    private String errorMessage;

    private String errorType;

    private Long executionTimeMs;

    private LocalDateTime createdAt;

    /**
     * 验证审计记录是否有效
     */
    public void validate() {
        if (executionId == null) {
            throw new IllegalStateException("Execution ID cannot be null");
        }
        if (step == null) {
            throw new IllegalStateException("Step cannot be null");
        }
        if (attemptNumber == null || attemptNumber < 1) {
            throw new IllegalStateException("Attempt number must be greater than 0");
        }
    }

    public void markAsValid(String feedback) {
        this.isValid = true;
        this.validationFeedback = feedback;
    }

    public void markAsInvalid(String feedback) {
        this.isValid = false;
        this.validationFeedback = feedback;
    }

    public void recordError(String errorType, String errorMessage) {
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.isValid = false;
    }

    public boolean hasError() {
        return this.errorMessage != null && !this.errorMessage.trim().isEmpty();
    }
}
