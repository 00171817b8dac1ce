package com.huntflow.domain.rule.service;

import com.huntflow.domain.rule.adapter.repository.IQueueItemRepository;
import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.model.valobj.PromotionResult;
import com.huntflow.domain.workflow.model.valobj.OwnershipGuard;
import com.huntflow.types.enums.TerminationReasonEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入队领域服务：仅校验通过且分类为 novel 的草稿进入审核队列。
 */
@Slf4j
@Service
public class QueuePromotionDomainService {

    private final IQueueItemRepository queueItemRepository;

    public QueuePromotionDomainService(IQueueItemRepository queueItemRepository) {
        this.queueItemRepository = queueItemRepository;
    }

    public PromotionResult promote(RuleDraftEntity draft, SimilarityMatchEntity match, Long documentId) {
        return promote(draft, match, documentId, OwnershipGuard.NONE);
    }

    /**
     * 新颖且有效的草稿入队；同一草稿已入队时返回原记录，写入前经 ownershipGuard 复核
     */
    public PromotionResult promote(RuleDraftEntity draft, SimilarityMatchEntity match, Long documentId,
                                   OwnershipGuard ownershipGuard) {
        if (draft == null || !draft.isValid()) {
            return new PromotionResult(TerminationReasonEnum.GENERATION_INVALID, null);
        }
        if (match == null || !match.isNovel()) {
            return new PromotionResult(TerminationReasonEnum.DUPLICATE_SUPPRESSED, null);
        }
        QueueItemEntity existing = queueItemRepository.findByRuleDraftId(draft.getId());
        if (existing != null) {
            return new PromotionResult(TerminationReasonEnum.QUEUED, existing);
        }
        QueueItemEntity item = QueueItemEntity.create(draft, documentId, similarityContext(match),
                match.getAggregateScore());
        item.validate();
        ownershipGuard.ensureOwned();
        QueueItemEntity saved = queueItemRepository.save(item);
        log.info("Rule draft queued for review. executionId={}, draftId={}, queueItemId={}",
                draft.getExecutionId(), draft.getId(), saved.getId());
        return new PromotionResult(TerminationReasonEnum.QUEUED, saved);
    }

    private Map<String, Object> similarityContext(SimilarityMatchEntity match) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("matchedRuleId", match.getMatchedRuleId());
        context.put("aggregateScore", match.getAggregateScore());
        context.put("classification", match.getClassification().getCode());
        context.put("sectionScores", match.getSectionScores());
        return context;
    }
}
