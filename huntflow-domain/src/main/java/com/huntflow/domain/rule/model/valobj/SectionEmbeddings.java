package com.huntflow.domain.rule.model.valobj;

import com.huntflow.types.enums.RuleSectionEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 分段嵌入向量；缺失段落与任何向量的余弦相似度为 0。
 */
public final class SectionEmbeddings {

    private final Map<RuleSectionEnum, float[]> vectors;

    public SectionEmbeddings(Map<RuleSectionEnum, float[]> vectors) {
        EnumMap<RuleSectionEnum, float[]> copy = new EnumMap<>(RuleSectionEnum.class);
        if (vectors != null) {
            vectors.forEach((section, vector) -> {
                if (section != null && vector != null && vector.length > 0) {
                    copy.put(section, vector.clone());
                }
            });
        }
        this.vectors = Collections.unmodifiableMap(copy);
    }

    public float[] get(RuleSectionEnum section) {
        float[] vector = vectors.get(section);
        return vector == null ? null : vector.clone();
    }

    public boolean has(RuleSectionEnum section) {
        return vectors.containsKey(section);
    }

    public Map<RuleSectionEnum, float[]> asMap() {
        Map<RuleSectionEnum, float[]> copy = new EnumMap<>(RuleSectionEnum.class);
        vectors.forEach((section, vector) -> copy.put(section, vector.clone()));
        return copy;
    }

    /**
     * 各段余弦相似度
     */
    public Map<RuleSectionEnum, Double> sectionScores(SectionEmbeddings other) {
        Map<RuleSectionEnum, Double> scores = new EnumMap<>(RuleSectionEnum.class);
        for (RuleSectionEnum section : RuleSectionEnum.values()) {
            scores.put(section, cosine(vectors.get(section), other == null ? null : other.vectors.get(section)));
        }
        return scores;
    }

    public static double cosine(float[] left, float[] right) {
        if (left == null || right == null || left.length == 0 || left.length != right.length) {
            return 0.0;
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftNorm += (double) left[i] * left[i];
            rightNorm += (double) right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
