package com.huntflow.domain.rule.model.entity;

import com.huntflow.types.enums.ValidationStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 规则草稿领域实体：结构化检测规则，校验失败的草稿同样持久化但永不入队。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
public class RuleDraftEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 执行 ID
     */
    private Long executionId;

    private String title;

    private String description;

    /**
     * 日志源 (product/category/service)
     */
    private Map<String, Object> logSource;

    /**
     * 检测谓词树
     */
    private Map<String, Object> detection;

    private List<String> tags;

    /**
     * 严重级别 (level)
     */
    private String severity;

    /**
     * 原始 YAML
     */
    private String rawYaml;

    private ValidationStatusEnum validationStatus;

    private List<String> validationErrors;

    /**
     * 生成尝试次数
     */
    private Integer attemptCount;

    private LocalDateTime createdAt;

    public void validate() {
        if (executionId == null) {
            throw new IllegalStateException("Execution ID cannot be null");
        }
        if (validationStatus == null) {
            throw new IllegalStateException("Validation status cannot be null");
        }
        if (attemptCount == null || attemptCount < 1) {
            throw new IllegalStateException("Attempt count must be at least 1");
        }
    }

    public void markValid() {
        this.validationStatus = ValidationStatusEnum.VALID;
        this.validationErrors = new ArrayList<>();
    }

    public void markInvalid(List<String> errors) {
        this.validationStatus = ValidationStatusEnum.INVALID;
        this.validationErrors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
    }

    public boolean isValid() {
        return this.validationStatus == ValidationStatusEnum.VALID;
    }
}
