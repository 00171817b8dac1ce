package com.huntflow.domain.rule.adapter.gateway;

import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import com.huntflow.domain.rule.model.valobj.SimilarityCandidate;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 已有检测规则的分段向量索引。
 */
public interface IVectorIndex {

    /**
     * 写入或覆盖一条规则
     */
    void upsert(String ruleId, String title, SectionEmbeddings embeddings, LocalDateTime updatedAt);

    /**
     * 按 weights 加权聚合分取前 topK 个候选，各段得分与 aggregateScore 已填充
     */
    List<SimilarityCandidate> query(SectionEmbeddings embeddings, SimilarityWeights weights, int topK);
}
