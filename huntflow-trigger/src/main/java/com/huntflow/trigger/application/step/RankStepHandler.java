package com.huntflow.trigger.application.step;

import com.huntflow.domain.analysis.model.valobj.RankingResult;
import com.huntflow.domain.analysis.service.RankingDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 相关性评分步骤：低于阈值终止为 low_relevance；过滤后无保留内容时不调用模型，直接按 0 分终止。
 */
@Slf4j
@Component
public class RankStepHandler implements WorkflowStepHandler {

    private final RankingDomainService rankingDomainService;

    public RankStepHandler(RankingDomainService rankingDomainService) {
        this.rankingDomainService = rankingDomainService;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.RANK;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        String filteredText = context.requireString(WorkflowStepEnum.FILTER, FilterStepHandler.KEY_FILTERED_TEXT);
        double threshold = context.getConfig().getRankingThreshold();
        if (StringUtils.isBlank(filteredText)) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("score", 0.0);
            result.put("threshold", threshold);
            result.put("attempts", 0);
            result.put("reasoning", "no chunk survived the content filter");
            log.info("Ranking skipped, nothing kept by filter. executionId={}", context.getExecutionId());
            return StepOutcome.terminate(TerminationReasonEnum.LOW_RELEVANCE, result);
        }

        RankingResult ranking = rankingDomainService.rank(context.invocationContext(), filteredText);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("score", ranking.getScore());
        result.put("threshold", ranking.getThreshold());
        result.put("attempts", ranking.getAttempts());
        result.put("reasoning", ranking.getReasoning());
        log.info("Ranking finished. executionId={}, score={}, threshold={}",
                context.getExecutionId(), ranking.getScore(), ranking.getThreshold());
        if (ranking.isBelowThreshold()) {
            return StepOutcome.terminate(TerminationReasonEnum.LOW_RELEVANCE, result);
        }
        return StepOutcome.proceed(result);
    }
}
