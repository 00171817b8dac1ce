package com.huntflow.domain.filter.adapter.gateway;

import com.huntflow.domain.filter.model.valobj.ChunkFeatures;

/**
 * 已训练的二分类器产物：特征向量 → 相关概率。实现必须不可变且线程安全。
 */
public interface IClassifierArtifact {

    String version();

    double predict(ChunkFeatures features);
}
