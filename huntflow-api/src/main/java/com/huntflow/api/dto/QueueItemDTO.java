package com.huntflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 审核队列条目 DTO。
 */
@Data
public class QueueItemDTO {

    private Long queueItemId;
    private Long ruleDraftId;
    private Long executionId;
    private Long documentId;
    private String ruleYaml;
    private Map<String, Object> similarityContext;
    private Double maxSimilarity;
    private String reviewStatus;
    private String reviewerComment;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime reviewedAt;
}
