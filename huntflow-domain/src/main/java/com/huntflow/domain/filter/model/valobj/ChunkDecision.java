package com.huntflow.domain.filter.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个分块的过滤决策，偏移区间左闭右开。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDecision {

    public static final String REASON_PROTECTED = "protected_literal";
    public static final String REASON_CLASSIFIER_UNAVAILABLE = "classifier_unavailable";
    public static final String REASON_RELEVANT = "relevant";
    public static final String REASON_BELOW_MIN_CONFIDENCE = "below_min_confidence";

    private int startOffset;
    private int endOffset;
    private boolean relevant;
    private Double confidence;
    private boolean protectedChunk;
    private String classifierVersion;
    private String reason;
}
