package com.huntflow.domain.rule.model.valobj;

import com.huntflow.types.enums.RuleSectionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Map;

/**
 * 向量索引返回的候选规则，aggregateScore 由领域层按权重计算。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityCandidate {

    /**
     * 聚合分降序，其次 updatedAt 降序，最后 ruleId 升序
     */
    public static final Comparator<SimilarityCandidate> RANKING = Comparator
            .comparingDouble(SimilarityCandidate::getAggregateScore).reversed()
            .thenComparing(SimilarityCandidate::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(SimilarityCandidate::getRuleId, Comparator.nullsLast(Comparator.naturalOrder()));

    private String ruleId;
    private String title;
    private Map<RuleSectionEnum, Double> sectionScores;
    private LocalDateTime updatedAt;
    private double aggregateScore;
}
