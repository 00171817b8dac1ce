package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 调用尝试审计 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionAttemptPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 执行 ID (关联 workflow_execution.id)
     */
    private Long executionId;

    private String step;

    private String agentName;

    /**
     * 尝试次数
     */
    private Integer attemptNumber;

    /**
     * Prompt 快照
     */
    private String promptSnapshot;

    /**
     * 模型原始响应
     */
    private String responseRaw;

    /**
     * 是否验证通过
     */
    private Boolean isValid;

    /**
     * 验证反馈
     */
    private String validationFeedback;

    private String errorMessage;

    private String errorType;

    /**
     * 执行耗时 (毫秒)
     */
    private Long executionTimeMs;

    private LocalDateTime createdAt;
}
