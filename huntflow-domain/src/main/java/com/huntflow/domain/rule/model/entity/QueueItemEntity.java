package com.huntflow.domain.rule.model.entity;

import com.huntflow.types.enums.ReviewStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 人工审核队列条目。
 * <p>
 * 审核状态：pending → approved | rejected | edited，edited 可继续审核；持久化时通过 version 做乐观锁。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
public class QueueItemEntity {

    /**
     * 主键 ID
     */
    private Long id;

    private Long ruleDraftId;

    private Long executionId;

    private Long documentId;

    /**
     * 待审核规则 YAML，编辑后替换
     */
    private String ruleYaml;

    /**
     * 相似度上下文 (最接近规则、分段得分)
     */
    private Map<String, Object> similarityContext;

    private Double maxSimilarity;

    private ReviewStatusEnum reviewStatus;

    private String reviewerComment;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime reviewedAt;

    public static QueueItemEntity create(RuleDraftEntity draft, Long documentId, Map<String, Object> similarityContext,
                                         Double maxSimilarity) {
        if (draft == null || !draft.isValid()) {
            throw new IllegalStateException("Only a valid rule draft can be queued");
        }
        QueueItemEntity item = new QueueItemEntity();
        LocalDateTime now = LocalDateTime.now();
        item.setRuleDraftId(draft.getId());
        item.setExecutionId(draft.getExecutionId());
        item.setDocumentId(documentId);
        item.setRuleYaml(draft.getRawYaml());
        item.setSimilarityContext(similarityContext);
        item.setMaxSimilarity(maxSimilarity);
        item.setReviewStatus(ReviewStatusEnum.PENDING);
        item.setVersion(0);
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }

    public void validate() {
        if (ruleDraftId == null) {
            throw new IllegalStateException("Rule draft ID cannot be null");
        }
        if (ruleYaml == null || ruleYaml.isBlank()) {
            throw new IllegalStateException("Rule YAML cannot be empty");
        }
        if (reviewStatus == null) {
            throw new IllegalStateException("Review status cannot be null");
        }
    }

    public void approve(String comment) {
        requireOpen("approve");
        this.reviewStatus = ReviewStatusEnum.APPROVED;
        this.reviewerComment = comment;
        markReviewed();
    }

    public void reject(String comment) {
        requireOpen("reject");
        this.reviewStatus = ReviewStatusEnum.REJECTED;
        this.reviewerComment = comment;
        markReviewed();
    }

    /**
     * 编辑规则内容，保持可审核
     */
    public void edit(String ruleYaml, String comment) {
        requireOpen("edit");
        if (ruleYaml == null || ruleYaml.isBlank()) {
            throw new IllegalStateException("Edited rule YAML cannot be empty");
        }
        this.ruleYaml = ruleYaml;
        this.reviewStatus = ReviewStatusEnum.EDITED;
        this.reviewerComment = comment;
        markReviewed();
    }

    public void incrementVersion() {
        this.version = (this.version == null ? 0 : this.version) + 1;
    }

    private void requireOpen(String action) {
        if (this.reviewStatus == null || !this.reviewStatus.isOpen()) {
            throw new IllegalStateException("Queue item cannot " + action + " from status: " + this.reviewStatus);
        }
    }

    private void markReviewed() {
        LocalDateTime now = LocalDateTime.now();
        this.reviewedAt = now;
        this.updatedAt = now;
    }
}
