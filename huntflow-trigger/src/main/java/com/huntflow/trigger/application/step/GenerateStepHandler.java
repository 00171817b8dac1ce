package com.huntflow.trigger.application.step;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.extraction.model.valobj.ExtractionResult;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.service.RuleGenerationDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.WorkflowStepEnum;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规则生成步骤：草稿无论校验结果都已持久化，是否入队由 promote 决定。
 */
@Component
public class GenerateStepHandler implements WorkflowStepHandler {

    public static final String KEY_DRAFT_ID = "draftId";

    private final RuleGenerationDomainService ruleGenerationDomainService;
    private final ObjectMapper objectMapper;

    public GenerateStepHandler(RuleGenerationDomainService ruleGenerationDomainService, ObjectMapper objectMapper) {
        this.ruleGenerationDomainService = ruleGenerationDomainService;
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.GENERATE;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        ExtractionResult extraction = ExtractStepHandler.restore(context, objectMapper);
        String platform = context.requireString(WorkflowStepEnum.PLATFORM_DETECT, PlatformDetectStepHandler.KEY_PLATFORM);
        String title = context.getDocument() == null ? null : context.getDocument().getTitle();
        RuleDraftEntity draft = ruleGenerationDomainService.generate(context.invocationContext(), extraction,
                platform, title);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(KEY_DRAFT_ID, draft.getId());
        result.put("valid", draft.isValid());
        result.put("attemptCount", draft.getAttemptCount());
        result.put("title", draft.getTitle());
        result.put("severity", draft.getSeverity());
        result.put("validationErrors", draft.getValidationErrors());
        return StepOutcome.proceed(result);
    }
}
