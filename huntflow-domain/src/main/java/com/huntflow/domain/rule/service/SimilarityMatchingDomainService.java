package com.huntflow.domain.rule.service;

import com.huntflow.domain.agent.adapter.gateway.IEmbeddingGateway;
import com.huntflow.domain.agent.service.ExternalCallDomainService;
import com.huntflow.domain.rule.adapter.gateway.IVectorIndex;
import com.huntflow.domain.rule.adapter.repository.ISimilarityMatchRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.model.valobj.RuleSections;
import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import com.huntflow.domain.rule.model.valobj.SimilarityCandidate;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.domain.workflow.model.valobj.OwnershipGuard;
import com.huntflow.domain.workflow.model.valobj.RetryPolicy;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.types.enums.RuleSectionEnum;
import com.huntflow.types.enums.SimilarityClassEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 相似度匹配领域服务：分段嵌入、按权重聚合、确定性排序与分类。
 */
@Slf4j
@Service
public class SimilarityMatchingDomainService {

    /**
     * 聚合分降序，其次更新时间降序，最后 ruleId 字典序
     */
    private final IEmbeddingGateway embeddingGateway;
    private final IVectorIndex vectorIndex;
    private final ISimilarityMatchRepository similarityMatchRepository;
    private final ExternalCallDomainService externalCallDomainService;
    private final RuleSectionDomainService ruleSectionDomainService;

    public SimilarityMatchingDomainService(IEmbeddingGateway embeddingGateway,
                                           IVectorIndex vectorIndex,
                                           ISimilarityMatchRepository similarityMatchRepository,
                                           ExternalCallDomainService externalCallDomainService,
                                           RuleSectionDomainService ruleSectionDomainService) {
        this.embeddingGateway = embeddingGateway;
        this.vectorIndex = vectorIndex;
        this.similarityMatchRepository = similarityMatchRepository;
        this.externalCallDomainService = externalCallDomainService;
        this.ruleSectionDomainService = ruleSectionDomainService;
    }

    public SimilarityMatchEntity match(RuleDraftEntity draft, WorkflowConfig config) {
        return match(draft, config, OwnershipGuard.NONE);
    }

    /**
     * 比较草稿与语料并持久化匹配记录；同一草稿已有记录时直接返回，写入前经 ownershipGuard 复核
     */
    public SimilarityMatchEntity match(RuleDraftEntity draft, WorkflowConfig config, OwnershipGuard ownershipGuard) {
        SimilarityMatchEntity existing = similarityMatchRepository.findByRuleDraftId(draft.getId());
        if (existing != null) {
            return existing;
        }
        SectionEmbeddings embeddings = embed(ruleSectionDomainService.sections(draft), config.getRetryPolicy());
        List<SimilarityCandidate> candidates = externalCallDomainService.execute("vector_index.query",
                () -> vectorIndex.query(embeddings, config.getSimilarityWeights(), config.getSimilarityTopK()), config.getRetryPolicy());
        List<SimilarityCandidate> ranked = rank(candidates, config.getSimilarityWeights());

        SimilarityMatchEntity match = new SimilarityMatchEntity();
        match.setRuleDraftId(draft.getId());
        match.setExecutionId(draft.getExecutionId());
        match.setCreatedAt(LocalDateTime.now());
        if (ranked.isEmpty()) {
            match.setSectionScores(zeroScores());
            match.setAggregateScore(0.0);
        } else {
            SimilarityCandidate top = ranked.get(0);
            match.setMatchedRuleId(top.getRuleId());
            match.setSectionScores(toCodeMap(top.getSectionScores()));
            match.setAggregateScore(top.getAggregateScore());
        }
        match.setClassification(classify(match.getAggregateScore(), config));
        log.info("Similarity matched. executionId={}, draftId={}, matchedRuleId={}, aggregate={}, classification={}",
                draft.getExecutionId(), draft.getId(), match.getMatchedRuleId(), match.getAggregateScore(),
                match.getClassification().getCode());
        ownershipGuard.ensureOwned();
        return similarityMatchRepository.save(match);
    }

    /**
     * 四段分别嵌入；空文本段不嵌入
     */
    public SectionEmbeddings embed(RuleSections sections, RetryPolicy retryPolicy) {
        Map<RuleSectionEnum, float[]> vectors = new EnumMap<>(RuleSectionEnum.class);
        for (Map.Entry<RuleSectionEnum, String> entry : sections.asMap().entrySet()) {
            if (StringUtils.isBlank(entry.getValue())) {
                continue;
            }
            String text = entry.getValue();
            float[] vector = externalCallDomainService.execute("embedding." + entry.getKey().getCode(),
                    () -> embeddingGateway.embed(text), retryPolicy);
            vectors.put(entry.getKey(), vector);
        }
        return new SectionEmbeddings(vectors);
    }

    public List<SimilarityCandidate> rank(List<SimilarityCandidate> candidates, SimilarityWeights weights) {
        List<SimilarityCandidate> ranked = new ArrayList<>();
        if (candidates == null) {
            return ranked;
        }
        for (SimilarityCandidate candidate : candidates) {
            candidate.setAggregateScore(weights.aggregate(candidate.getSectionScores()));
            ranked.add(candidate);
        }
        ranked.sort(SimilarityCandidate.RANKING);
        return ranked;
    }

    public SimilarityClassEnum classify(double aggregate, WorkflowConfig config) {
        if (aggregate >= config.getDuplicateThreshold()) {
            return SimilarityClassEnum.DUPLICATE;
        }
        if (aggregate >= config.getSimilarityThreshold()) {
            return SimilarityClassEnum.VARIANT;
        }
        return SimilarityClassEnum.NOVEL;
    }

    private Map<String, Double> toCodeMap(Map<RuleSectionEnum, Double> scores) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (RuleSectionEnum section : RuleSectionEnum.values()) {
            Double score = scores == null ? null : scores.get(section);
            result.put(section.getCode(), score == null ? 0.0 : score);
        }
        return result;
    }

    private Map<String, Double> zeroScores() {
        return toCodeMap(null);
    }
}
