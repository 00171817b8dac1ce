package com.huntflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 规则草稿 DTO，包含相似度匹配记录。
 */
@Data
public class RuleDraftDTO {

    private Long draftId;
    private Long executionId;
    private String title;
    private String description;
    private Map<String, Object> logSource;
    private Map<String, Object> detection;
    private List<String> tags;
    private String severity;
    private String rawYaml;
    private String validationStatus;
    private List<String> validationErrors;
    private Integer attemptCount;
    private SimilarityMatchDTO similarityMatch;
    private LocalDateTime createdAt;
}
