package com.huntflow.test.support;

import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifact;
import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifactProvider;
import com.huntflow.domain.filter.model.valobj.ChunkFeatures;

import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * 固定分类器：以给定函数给分块打分，也可模拟产物缺失。
 */
public class FixedClassifierProvider implements IClassifierArtifactProvider {

    private final IClassifierArtifact artifact;
    private Runnable onCurrent = () -> {
    };

    private FixedClassifierProvider(IClassifierArtifact artifact) {
        this.artifact = artifact;
    }

    public static FixedClassifierProvider scoring(String version, ToDoubleFunction<ChunkFeatures> scorer) {
        return new FixedClassifierProvider(new IClassifierArtifact() {
            @Override
            public String version() {
                return version;
            }

            @Override
            public double predict(ChunkFeatures features) {
                return scorer.applyAsDouble(features);
            }
        });
    }

    /**
     * 所有分块给同一分数
     */
    public static FixedClassifierProvider constant(double probability) {
        return scoring("test-constant", features -> probability);
    }

    public static FixedClassifierProvider missing() {
        return new FixedClassifierProvider(null);
    }

    /**
     * 每次加载分类器时先执行 hook，用于在过滤步骤中途模拟并发写入
     */
    public FixedClassifierProvider onCurrent(Runnable hook) {
        this.onCurrent = hook;
        return this;
    }

    @Override
    public Optional<IClassifierArtifact> current() {
        onCurrent.run();
        return Optional.ofNullable(artifact);
    }
}
