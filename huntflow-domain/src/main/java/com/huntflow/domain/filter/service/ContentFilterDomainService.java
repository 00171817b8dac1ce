package com.huntflow.domain.filter.service;

import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifact;
import com.huntflow.domain.filter.model.valobj.ChunkDecision;
import com.huntflow.domain.filter.model.valobj.ChunkFeatures;
import com.huntflow.domain.filter.model.valobj.FilterResult;
import com.huntflow.domain.workflow.model.valobj.FilterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * 内容过滤领域服务。
 * <p>
 * 固定窗口重叠滑动分块：命中保护字面模式的分块强制保留；其余分块计算特征并按
 * classifierWeight * 分类器概率 + keywordWeight * 关键词得分 得到相关度，
 * 相关度不低于 minConfidence 时保留。分类器不可用时全部保留并标记降级。
 * 给定文本、配置和分类器版本，结果确定。
 * </p>
 */
@Slf4j
@Service
public class ContentFilterDomainService {

    private final ChunkFeatureDomainService chunkFeatureDomainService;

    public ContentFilterDomainService(ChunkFeatureDomainService chunkFeatureDomainService) {
        this.chunkFeatureDomainService = chunkFeatureDomainService;
    }

    /**
     * @param artifact 分类器，null 表示不可用
     */
    public FilterResult filter(String text, FilterConfig config, IClassifierArtifact artifact) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Document text is empty");
        }
        boolean degraded = artifact == null;
        String version = degraded ? null : artifact.version();
        List<ChunkDecision> decisions = new ArrayList<>();
        StringJoiner kept = new StringJoiner(" ");
        int keptCount = 0;

        for (int[] window : windows(text.length(), config)) {
            String chunk = text.substring(window[0], window[1]);
            if (chunk.isBlank()) {
                continue;
            }
            ChunkDecision decision = decide(chunk, window, config, artifact, version);
            decisions.add(decision);
            if (decision.isRelevant()) {
                kept.add(chunk);
                keptCount++;
            }
        }
        if (degraded) {
            log.warn("Content filter degraded, classifier unavailable. chunks={}", decisions.size());
        }
        return new FilterResult(kept.toString(), decisions, degraded, version, decisions.size(), keptCount);
    }

    private ChunkDecision decide(String chunk, int[] window, FilterConfig config,
                                 IClassifierArtifact artifact, String version) {
        ChunkDecision decision = new ChunkDecision();
        decision.setStartOffset(window[0]);
        decision.setEndOffset(window[1]);
        decision.setClassifierVersion(version);
        if (chunkFeatureDomainService.matchesAny(chunk, config.getProtectedPatterns())) {
            decision.setRelevant(true);
            decision.setProtectedChunk(true);
            decision.setConfidence(1.0);
            decision.setReason(ChunkDecision.REASON_PROTECTED);
            return decision;
        }
        if (artifact == null) {
            decision.setRelevant(true);
            decision.setReason(ChunkDecision.REASON_CLASSIFIER_UNAVAILABLE);
            return decision;
        }
        ChunkFeatures features = chunkFeatureDomainService.extract(chunk,
                config.getHuntablePatterns(), config.getNotHuntablePatterns());
        double relevance = relevance(features, artifact, config);
        boolean relevant = relevance >= config.getMinConfidence();
        decision.setRelevant(relevant);
        decision.setConfidence(relevance);
        decision.setReason(relevant ? ChunkDecision.REASON_RELEVANT : ChunkDecision.REASON_BELOW_MIN_CONFIDENCE);
        return decision;
    }

    private double relevance(ChunkFeatures features, IClassifierArtifact artifact, FilterConfig config) {
        double weightSum = config.getClassifierWeight() + config.getKeywordWeight();
        double probability = config.getClassifierWeight() > 0 ? artifact.predict(features) : 0.0;
        double blended = config.getClassifierWeight() * probability + config.getKeywordWeight() * features.keywordScore();
        return Math.max(0.0, Math.min(1.0, blended / weightSum));
    }

    /**
     * 窗口区间列表，步长 chunkSize - overlap，最后一个窗口截止到文本末尾
     */
    List<int[]> windows(int length, FilterConfig config) {
        List<int[]> windows = new ArrayList<>();
        int chunkSize = config.getChunkSize();
        int stride = config.stride();
        for (int start = 0; start < length; start += stride) {
            int end = Math.min(start + chunkSize, length);
            windows.add(new int[]{start, end});
            if (end == length) {
                break;
            }
        }
        return windows;
    }
}
