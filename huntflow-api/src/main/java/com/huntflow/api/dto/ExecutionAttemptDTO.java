package com.huntflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 外部调用尝试审计记录 DTO。
 */
@Data
public class ExecutionAttemptDTO {

    private Long attemptId;
    private Long executionId;
    private String step;
    private String agentName;
    private Integer attemptNumber;
    private String promptSnapshot;
    private String responseRaw;
    private Boolean valid;
    private String validationFeedback;
    private String errorMessage;
    private String errorType;
    private Long executionTimeMs;
    private LocalDateTime createdAt;
}
