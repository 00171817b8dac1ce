package com.huntflow.test.domain;

import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.model.valobj.PromotionResult;
import com.huntflow.domain.rule.service.QueuePromotionDomainService;
import com.huntflow.test.support.InMemoryQueueItemRepository;
import com.huntflow.types.enums.ReviewStatusEnum;
import com.huntflow.types.enums.SimilarityClassEnum;
import com.huntflow.types.enums.TerminationReasonEnum;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueuePromotionDomainServiceTest {

    private final InMemoryQueueItemRepository queueRepository = new InMemoryQueueItemRepository();
    private final QueuePromotionDomainService service = new QueuePromotionDomainService(queueRepository);

    @Test
    public void shouldQueueValidNovelDraft() {
        PromotionResult result = service.promote(validDraft(), match(SimilarityClassEnum.NOVEL, 0.3), 5L);

        assertEquals(TerminationReasonEnum.QUEUED, result.reason());
        assertEquals(ReviewStatusEnum.PENDING, result.queueItem().getReviewStatus());
        assertEquals(5L, result.queueItem().getDocumentId());
        assertEquals("title: x", result.queueItem().getRuleYaml());
        assertEquals("novel", result.queueItem().getSimilarityContext().get("classification"));
        assertEquals(1, queueRepository.findAll().size());
    }

    @Test
    public void shouldSuppressVariantAndDuplicate() {
        assertEquals(TerminationReasonEnum.DUPLICATE_SUPPRESSED,
                service.promote(validDraft(), match(SimilarityClassEnum.VARIANT, 0.7), 5L).reason());
        assertEquals(TerminationReasonEnum.DUPLICATE_SUPPRESSED,
                service.promote(validDraft(), match(SimilarityClassEnum.DUPLICATE, 0.99), 5L).reason());
        assertTrue(queueRepository.findAll().isEmpty());
    }

    @Test
    public void shouldNeverQueueInvalidDraft() {
        RuleDraftEntity draft = validDraft();
        draft.markInvalid(List.of("missing logsource"));

        PromotionResult result = service.promote(draft, match(SimilarityClassEnum.NOVEL, 0.0), 5L);

        assertEquals(TerminationReasonEnum.GENERATION_INVALID, result.reason());
        assertNull(result.queueItem());
        assertTrue(queueRepository.findAll().isEmpty());
    }

    @Test
    public void shouldPromoteIdempotentlyPerDraft() {
        RuleDraftEntity draft = validDraft();
        PromotionResult first = service.promote(draft, match(SimilarityClassEnum.NOVEL, 0.1), 5L);
        PromotionResult second = service.promote(draft, match(SimilarityClassEnum.NOVEL, 0.1), 5L);

        assertEquals(first.queueItem().getId(), second.queueItem().getId());
        assertEquals(1, queueRepository.findAll().size());
    }

    private RuleDraftEntity validDraft() {
        RuleDraftEntity draft = new RuleDraftEntity();
        draft.setId(11L);
        draft.setExecutionId(3L);
        draft.setTitle("x");
        draft.setRawYaml("title: x");
        draft.setAttemptCount(1);
        draft.markValid();
        return draft;
    }

    private SimilarityMatchEntity match(SimilarityClassEnum classification, double aggregate) {
        SimilarityMatchEntity match = new SimilarityMatchEntity();
        match.setRuleDraftId(11L);
        match.setAggregateScore(aggregate);
        match.setClassification(classification);
        match.setSectionScores(Map.of("signature", aggregate));
        return match;
    }
}
