package com.huntflow.infrastructure.classifier;

import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifact;
import com.huntflow.domain.filter.model.valobj.ChunkFeatures;

import java.util.Map;

/**
 * 版本化线性分类器：z = bias + Σ w_t·ln(1+count_t) + w_h·huntableHits + w_n·notHuntableHits，输出 sigmoid(z)。
 * 构造后不可变。
 */
public final class LinearClassifierArtifact implements IClassifierArtifact {

    private final String version;
    private final double bias;
    private final Map<String, Double> weights;
    private final double huntableHitWeight;
    private final double notHuntableHitWeight;

    public LinearClassifierArtifact(String version, double bias, Map<String, Double> weights,
                                    double huntableHitWeight, double notHuntableHitWeight) {
        this.version = version;
        this.bias = bias;
        this.weights = Map.copyOf(weights);
        this.huntableHitWeight = huntableHitWeight;
        this.notHuntableHitWeight = notHuntableHitWeight;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public double predict(ChunkFeatures features) {
        double z = bias;
        Map<String, Integer> counts = features.getTokenCounts();
        if (counts != null) {
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                Double weight = weights.get(entry.getKey());
                if (weight != null) {
                    z += weight * Math.log1p(entry.getValue());
                }
            }
        }
        z += huntableHitWeight * features.getHuntableHits();
        z += notHuntableHitWeight * features.getNotHuntableHits();
        return 1.0 / (1.0 + Math.exp(-z));
    }

    public int vocabularySize() {
        return weights.size();
    }
}
