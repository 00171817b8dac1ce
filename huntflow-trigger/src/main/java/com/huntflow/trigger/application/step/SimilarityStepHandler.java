package com.huntflow.trigger.application.step;

import com.huntflow.domain.rule.adapter.repository.IRuleDraftRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.service.SimilarityMatchingDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 相似度匹配步骤：仅对校验通过的草稿比较，invalid 草稿跳过。
 */
@Component
public class SimilarityStepHandler implements WorkflowStepHandler {

    private final IRuleDraftRepository ruleDraftRepository;
    private final SimilarityMatchingDomainService similarityMatchingDomainService;

    public SimilarityStepHandler(IRuleDraftRepository ruleDraftRepository,
                                 SimilarityMatchingDomainService similarityMatchingDomainService) {
        this.ruleDraftRepository = ruleDraftRepository;
        this.similarityMatchingDomainService = similarityMatchingDomainService;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.SIMILARITY;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        RuleDraftEntity draft = requireDraft(context, ruleDraftRepository);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(GenerateStepHandler.KEY_DRAFT_ID, draft.getId());
        if (!draft.isValid()) {
            result.put("skipped", true);
            return StepOutcome.proceed(result);
        }
        SimilarityMatchEntity match = similarityMatchingDomainService.match(draft, context.getConfig(),
                context.getOwnershipGuard());
        result.put("matchId", match.getId());
        result.put("matchedRuleId", match.getMatchedRuleId());
        result.put("aggregateScore", match.getAggregateScore());
        result.put("classification", match.getClassification().getCode());
        result.put("sectionScores", match.getSectionScores());
        return StepOutcome.proceed(result);
    }

    static RuleDraftEntity requireDraft(WorkflowStepContext context, IRuleDraftRepository ruleDraftRepository) {
        Long draftId = context.requireLong(WorkflowStepEnum.GENERATE, GenerateStepHandler.KEY_DRAFT_ID);
        RuleDraftEntity draft = draftId == null ? null : ruleDraftRepository.findById(draftId);
        if (draft == null) {
            throw new IllegalStateException("Rule draft not found for execution " + context.getExecutionId()
                    + ": " + draftId);
        }
        return draft;
    }
}
