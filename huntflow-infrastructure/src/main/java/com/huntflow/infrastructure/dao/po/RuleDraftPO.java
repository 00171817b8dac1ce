package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 规则草稿 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDraftPO {

    /**
     * 主键 ID
     */
    private Long id;

    private Long executionId;

    private String title;

    private String description;

    /**
     * 日志源 (JSONB)
     */
    private String logSource;

    /**
     * 检测谓词 (JSONB)
     */
    private String detection;

    /**
     * 标签 (JSONB)
     */
    private String tags;

    private String severity;

    private String rawYaml;

    private String validationStatus;

    /**
     * 校验错误 (JSONB)
     */
    private String validationErrors;

    private Integer attemptCount;

    private LocalDateTime createdAt;
}
