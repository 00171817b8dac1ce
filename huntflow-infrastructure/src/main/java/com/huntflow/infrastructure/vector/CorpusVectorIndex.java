package com.huntflow.infrastructure.vector;

import com.google.common.cache.Cache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.huntflow.domain.rule.adapter.gateway.IVectorIndex;
import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import com.huntflow.domain.rule.model.valobj.SimilarityCandidate;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.infrastructure.dao.DetectionRuleCorpusDao;
import com.huntflow.infrastructure.dao.po.DetectionRuleCorpusPO;
import com.huntflow.infrastructure.util.JsonCodec;
import com.huntflow.types.enums.RuleSectionEnum;
import com.huntflow.types.exception.AppException;
import com.huntflow.types.exception.FatalConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * 基于 detection_rule_corpus 表的分段向量索引。
 * <p>
 * 语料整体解码后放入 Guava 缓存，按 TTL 刷新；upsert 后立即失效。
 * 查询按分段权重计算聚合分后取 topK，与领域层排序一致，签名段高度相似的规则不会被提前截掉。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Component
public class CorpusVectorIndex implements IVectorIndex {

    static final String CORPUS_KEY = "corpus";

    private final DetectionRuleCorpusDao detectionRuleCorpusDao;
    private final JsonCodec jsonCodec;
    private final Cache<String, List<CorpusRule>> corpusCache;

    public CorpusVectorIndex(DetectionRuleCorpusDao detectionRuleCorpusDao,
                             JsonCodec jsonCodec,
                             @Qualifier("corpusCache") Cache<String, List<CorpusRule>> corpusCache) {
        this.detectionRuleCorpusDao = detectionRuleCorpusDao;
        this.jsonCodec = jsonCodec;
        this.corpusCache = corpusCache;
    }

    @Override
    public void upsert(String ruleId, String title, SectionEmbeddings embeddings, LocalDateTime updatedAt) {
        Map<String, float[]> encoded = new LinkedHashMap<>();
        embeddings.asMap().forEach((section, vector) -> encoded.put(section.getCode(), vector));
        DetectionRuleCorpusPO po = DetectionRuleCorpusPO.builder()
                .ruleId(ruleId)
                .title(title)
                .sectionEmbeddings(jsonCodec.writeValue(encoded))
                .updatedAt(updatedAt)
                .build();
        detectionRuleCorpusDao.upsert(po);
        corpusCache.invalidateAll();
        log.info("Corpus rule indexed. ruleId={}, sections={}", ruleId, encoded.keySet());
    }

    @Override
    public List<SimilarityCandidate> query(SectionEmbeddings embeddings, SimilarityWeights weights, int topK) {
        List<CorpusRule> corpus = loadCorpus();
        if (corpus.isEmpty() || topK <= 0) {
            return Collections.emptyList();
        }
        List<SimilarityCandidate> candidates = new ArrayList<>(corpus.size());
        for (CorpusRule rule : corpus) {
            Map<RuleSectionEnum, Double> scores = embeddings.sectionScores(rule.getEmbeddings());
            candidates.add(new SimilarityCandidate(rule.getRuleId(), rule.getTitle(), scores,
                    rule.getUpdatedAt(), weights.aggregate(scores)));
        }
        candidates.sort(SimilarityCandidate.RANKING);
        return new ArrayList<>(candidates.subList(0, Math.min(topK, candidates.size())));
    }

    List<CorpusRule> loadCorpus() {
        try {
            return corpusCache.get(CORPUS_KEY, this::readCorpus);
        } catch (UncheckedExecutionException ex) {
            if (ex.getCause() instanceof AppException appException) {
                throw appException;
            }
            throw ex;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Failed to load detection rule corpus", ex.getCause());
        }
    }

    private List<CorpusRule> readCorpus() {
        List<DetectionRuleCorpusPO> rows = detectionRuleCorpusDao.selectAll();
        List<CorpusRule> corpus = new ArrayList<>(rows.size());
        for (DetectionRuleCorpusPO row : rows) {
            corpus.add(decode(row));
        }
        log.info("Detection rule corpus loaded. size={}", corpus.size());
        return Collections.unmodifiableList(corpus);
    }

    private CorpusRule decode(DetectionRuleCorpusPO row) {
        Map<String, float[]> raw;
        try {
            raw = jsonCodec.readSectionVectors(row.getSectionEmbeddings());
        } catch (AppException ex) {
            throw new FatalConfigurationException("Malformed section embeddings for corpus rule: " + row.getRuleId(), ex);
        }
        if (raw == null || raw.isEmpty()) {
            throw new FatalConfigurationException("Missing section embeddings for corpus rule: " + row.getRuleId());
        }
        Map<RuleSectionEnum, float[]> vectors = new EnumMap<>(RuleSectionEnum.class);
        int dimension = -1;
        for (Map.Entry<String, float[]> entry : raw.entrySet()) {
            RuleSectionEnum section;
            try {
                section = RuleSectionEnum.fromCode(entry.getKey());
            } catch (IllegalArgumentException ex) {
                throw new FatalConfigurationException("Unknown embedding section '" + entry.getKey()
                        + "' for corpus rule: " + row.getRuleId(), ex);
            }
            float[] vector = entry.getValue();
            if (vector == null || vector.length == 0) {
                continue;
            }
            if (dimension >= 0 && vector.length != dimension) {
                throw new FatalConfigurationException("Embedding dimension mismatch for corpus rule: " + row.getRuleId());
            }
            dimension = vector.length;
            vectors.put(section, vector);
        }
        return new CorpusRule(row.getRuleId(), row.getTitle(), new SectionEmbeddings(vectors), row.getUpdatedAt());
    }
}
