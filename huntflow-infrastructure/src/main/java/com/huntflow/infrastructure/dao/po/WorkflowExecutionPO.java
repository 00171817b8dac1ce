package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作流执行 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowExecutionPO {

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
     * 配置快照 (JSONB)
     */
    private String configSnapshot;

    /**
     * 状态 code
     */
    private String status;

    /**
     * 当前步骤 code
     */
    private String currentStep;

    /**
     * 各步骤结果 (JSONB)
     */
    private String stepResults;

    private String terminationReason;

    private String failedStep;

    private String errorType;

    private String errorMessage;

    private Boolean filterDegraded;

    private Boolean cancelRequested;

    /**
     * 派发持有者
     */
    private String dispatchOwner;

    /**
     * 派发令牌
     */
    private Integer dispatchToken;

    private Integer retryCount;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime heartbeatAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;
}
