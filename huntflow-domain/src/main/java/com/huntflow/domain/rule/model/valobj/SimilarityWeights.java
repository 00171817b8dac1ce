package com.huntflow.domain.rule.model.valobj;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.huntflow.types.enums.RuleSectionEnum;
import lombok.Value;

import java.util.Map;

/**
 * 相似度分段权重，四段之和必须为 1.0 ± 1e-6。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
public class SimilarityWeights {

    public static final double SUM_TOLERANCE = 1e-6;

    double title;
    double description;
    double tags;
    double signature;

    @JsonCreator
    public SimilarityWeights(@JsonProperty("title") double title,
                             @JsonProperty("description") double description,
                             @JsonProperty("tags") double tags,
                             @JsonProperty("signature") double signature) {
        this.title = title;
        this.description = description;
        this.tags = tags;
        this.signature = signature;
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.042, 0.042, 0.042, 0.874);
    }

    public double weightOf(RuleSectionEnum section) {
        return switch (section) {
            case TITLE -> title;
            case DESCRIPTION -> description;
            case TAGS -> tags;
            case SIGNATURE -> signature;
        };
    }

    public SimilarityWeights validate() {
        if (title < 0 || description < 0 || tags < 0 || signature < 0) {
            throw new IllegalArgumentException("Similarity weights cannot be negative");
        }
        double sum = title + description + tags + signature;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Similarity weights must sum to 1.0, actual=" + sum);
        }
        return this;
    }

    /**
     * 加权聚合；每段分数截断到 [0, 1]，缺失视为 0
     */
    public double aggregate(Map<RuleSectionEnum, Double> sectionScores) {
        double total = 0.0;
        for (RuleSectionEnum section : RuleSectionEnum.values()) {
            Double score = sectionScores == null ? null : sectionScores.get(section);
            total += weightOf(section) * clamp(score);
        }
        return Math.min(1.0, Math.max(0.0, total));
    }

    private double clamp(Double score) {
        if (score == null || score.isNaN()) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, score));
    }
}
