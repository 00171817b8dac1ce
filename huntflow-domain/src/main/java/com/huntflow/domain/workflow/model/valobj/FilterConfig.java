package com.huntflow.domain.workflow.model.valobj;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 内容过滤配置。
 * <p>
 * 相关度 = classifierWeight * 分类器概率 + keywordWeight * 关键词得分，两者权重均可配置。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilterConfig {

    @Builder.Default
    int chunkSize = 1000;

    @Builder.Default
    int overlap = 200;

    @Builder.Default
    double minConfidence = 0.5;

    @Builder.Default
    double classifierWeight = 1.0;

    @Builder.Default
    double keywordWeight = 0.0;

    /**
     * 命中即强制保留的字面模式（正则，大小写不敏感）
     */
    @Singular
    List<String> protectedPatterns;

    /**
     * 可狩猎精度模式
     */
    @Singular
    List<String> huntablePatterns;

    /**
     * 不可狩猎精度模式
     */
    @Singular
    List<String> notHuntablePatterns;

    /**
     * 窗口步长
     */
    public int stride() {
        return chunkSize - effectiveOverlap();
    }

    public int effectiveOverlap() {
        return Math.max(0, Math.min(overlap, chunkSize - 1));
    }

    public void validate() {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("Min confidence must be within [0, 1]");
        }
        if (classifierWeight < 0 || keywordWeight < 0 || classifierWeight + keywordWeight <= 0) {
            throw new IllegalArgumentException("Relevance blend weights must be non-negative and not both zero");
        }
    }
}
