package com.huntflow.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 相似度匹配 DTO。
 */
@Data
public class SimilarityMatchDTO {

    private String matchedRuleId;
    private Map<String, Double> sectionScores;
    private Double aggregateScore;
    private String classification;
}
