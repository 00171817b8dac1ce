package com.huntflow.test.support;

import com.huntflow.domain.rule.adapter.gateway.IVectorIndex;
import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import com.huntflow.domain.rule.model.valobj.SimilarityCandidate;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.types.enums.RuleSectionEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存向量索引：对全部已写入规则逐段计算余弦相似度，按加权聚合分取 topK。
 * <p>
 * 设置固定候选后 query 直接返回这些候选，用于构造指定相似度的场景。
 * </p>
 */
public class InMemoryVectorIndex implements IVectorIndex {

    private final Map<String, Entry> rules = new LinkedHashMap<>();
    private List<SimilarityCandidate> fixedCandidates;
    private Runnable onQuery = () -> {
    };

    @Override
    public synchronized void upsert(String ruleId, String title, SectionEmbeddings embeddings, LocalDateTime updatedAt) {
        rules.put(ruleId, new Entry(title, embeddings, updatedAt));
    }

    @Override
    public synchronized List<SimilarityCandidate> query(SectionEmbeddings embeddings, SimilarityWeights weights, int topK) {
        onQuery.run();
        if (fixedCandidates != null) {
            List<SimilarityCandidate> copies = new ArrayList<>();
            for (SimilarityCandidate candidate : fixedCandidates) {
                copies.add(new SimilarityCandidate(candidate.getRuleId(), candidate.getTitle(),
                        candidate.getSectionScores(), candidate.getUpdatedAt(), 0.0));
            }
            return copies;
        }
        List<SimilarityCandidate> candidates = new ArrayList<>();
        rules.forEach((ruleId, entry) -> {
            Map<RuleSectionEnum, Double> scores = embeddings.sectionScores(entry.embeddings);
            candidates.add(new SimilarityCandidate(ruleId, entry.title, scores, entry.updatedAt, weights.aggregate(scores)));
        });
        candidates.sort(SimilarityCandidate.RANKING);
        return new ArrayList<>(candidates.subList(0, Math.min(Math.max(topK, 0), candidates.size())));
    }

    public synchronized void useFixedCandidates(List<SimilarityCandidate> candidates) {
        this.fixedCandidates = candidates;
    }

    /**
     * 每次 query 前执行，用于在步骤进行中改动执行记录
     */
    public synchronized void onQuery(Runnable hook) {
        this.onQuery = hook;
    }

    public synchronized boolean contains(String ruleId) {
        return rules.containsKey(ruleId);
    }

    public synchronized int size() {
        return rules.size();
    }

    private record Entry(String title, SectionEmbeddings embeddings, LocalDateTime updatedAt) {
    }
}
