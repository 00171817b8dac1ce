package com.huntflow.trigger.application.step;

import com.huntflow.domain.rule.adapter.repository.IRuleDraftRepository;
import com.huntflow.domain.rule.adapter.repository.ISimilarityMatchRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.rule.model.valobj.PromotionResult;
import com.huntflow.domain.rule.service.QueuePromotionDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入队步骤：总以终止原因结束执行 (queued / duplicate_suppressed / generation_invalid)。
 */
@Component
public class PromoteStepHandler implements WorkflowStepHandler {

    private final IRuleDraftRepository ruleDraftRepository;
    private final ISimilarityMatchRepository similarityMatchRepository;
    private final QueuePromotionDomainService queuePromotionDomainService;

    public PromoteStepHandler(IRuleDraftRepository ruleDraftRepository,
                              ISimilarityMatchRepository similarityMatchRepository,
                              QueuePromotionDomainService queuePromotionDomainService) {
        this.ruleDraftRepository = ruleDraftRepository;
        this.similarityMatchRepository = similarityMatchRepository;
        this.queuePromotionDomainService = queuePromotionDomainService;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.PROMOTE;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        RuleDraftEntity draft = SimilarityStepHandler.requireDraft(context, ruleDraftRepository);
        SimilarityMatchEntity match = draft.isValid() ? similarityMatchRepository.findByRuleDraftId(draft.getId()) : null;
        PromotionResult promotion = queuePromotionDomainService.promote(draft, match,
                context.getExecution().getDocumentId(), context.getOwnershipGuard());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(GenerateStepHandler.KEY_DRAFT_ID, draft.getId());
        result.put("reason", promotion.reason().getCode());
        result.put("queueItemId", promotion.queueItem() == null ? null : promotion.queueItem().getId());
        return StepOutcome.terminate(promotion.reason(), result);
    }
}
