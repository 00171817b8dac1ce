package com.huntflow.domain.rule.model.entity;

import com.huntflow.types.enums.SimilarityClassEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 相似度匹配记录：草稿与语料中最接近规则的比较结果，无论分类如何都会持久化。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
public class SimilarityMatchEntity {

    private Long id;

    private Long ruleDraftId;

    private Long executionId;

    /**
     * 最接近的语料规则 ID，语料为空时为 null
     */
    private String matchedRuleId;

    /**
     * 分段得分，key 为段落 code
     */
    private Map<String, Double> sectionScores;

    private Double aggregateScore;

    private SimilarityClassEnum classification;

    private LocalDateTime createdAt;

    public boolean isNovel() {
        return this.classification == SimilarityClassEnum.NOVEL;
    }
}
