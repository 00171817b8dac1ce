package com.huntflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 工作流执行记录 DTO。
 */
@Data
public class WorkflowExecutionDTO {

    private Long executionId;
    private Long documentId;
    private String configVersion;
    private String status;
    private String currentStep;
    private String terminationReason;
    private String failedStep;
    private String errorType;
    private String errorMessage;
    private Boolean filterDegraded;
    private Boolean cancelRequested;
    private Integer retryCount;
    private Map<String, Object> stepResults;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime heartbeatAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
}
