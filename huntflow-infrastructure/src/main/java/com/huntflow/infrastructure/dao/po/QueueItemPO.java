package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审核队列条目 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueItemPO {

    /**
     * 主键 ID
     */
    private Long id;

    private Long ruleDraftId;

    private Long executionId;

    private Long documentId;

    private String ruleYaml;

    /**
     * 相似度上下文 (JSONB)
     */
    private String similarityContext;

    private Double maxSimilarity;

    private String reviewStatus;

    private String reviewerComment;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime reviewedAt;
}
