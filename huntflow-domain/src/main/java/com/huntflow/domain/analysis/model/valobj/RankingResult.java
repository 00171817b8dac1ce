package com.huntflow.domain.analysis.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 相关性评分结果，score 取值 [0, 100]。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankingResult {

    private double score;
    private String reasoning;
    private double threshold;
    private int attempts;

    public boolean isBelowThreshold() {
        return score < threshold;
    }
}
