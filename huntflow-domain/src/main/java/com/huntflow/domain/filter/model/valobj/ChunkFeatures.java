package com.huntflow.domain.filter.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * 分块特征向量：词频 + 精度模式命中数。
 */
@Getter
@AllArgsConstructor
public final class ChunkFeatures {

    /**
     * 小写词 → 出现次数
     */
    private final Map<String, Integer> tokenCounts;

    private final int tokenTotal;

    private final int huntableHits;

    private final int notHuntableHits;

    /**
     * 归一化词频
     */
    public double termFrequency(String token) {
        if (tokenTotal <= 0 || tokenCounts == null) {
            return 0.0;
        }
        Integer count = tokenCounts.get(token);
        return count == null ? 0.0 : (double) count / tokenTotal;
    }

    /**
     * 关键词得分：可狩猎命中占全部命中的比例，无命中为 0
     */
    public double keywordScore() {
        int total = huntableHits + notHuntableHits;
        if (total <= 0) {
            return 0.0;
        }
        return (double) huntableHits / total;
    }
}
