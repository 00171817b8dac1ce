package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 相似度匹配 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityMatchPO {

    /**
     * 主键 ID
     */
    private Long id;

    private Long ruleDraftId;

    private Long executionId;

    private String matchedRuleId;

    /**
     * 分段得分 (JSONB)
     */
    private String sectionScores;

    private Double aggregateScore;

    private String classification;

    private LocalDateTime createdAt;
}
