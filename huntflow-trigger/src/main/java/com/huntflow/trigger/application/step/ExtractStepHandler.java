package com.huntflow.trigger.application.step;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.extraction.model.valobj.ExtractionResult;
import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.service.ExtractionSupervisorDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 抽取步骤：全部子代理失败时终止为 extraction_failed，部分失败只降级对应类型。
 */
@Slf4j
@Component
public class ExtractStepHandler implements WorkflowStepHandler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ExtractionSupervisorDomainService extractionSupervisorDomainService;
    private final ObjectMapper objectMapper;
    private final Counter qaExhaustedCounter;

    public ExtractStepHandler(ExtractionSupervisorDomainService extractionSupervisorDomainService,
                              ObjectMapper objectMapper) {
        this.extractionSupervisorDomainService = extractionSupervisorDomainService;
        this.objectMapper = objectMapper;
        this.qaExhaustedCounter = Counter.builder("huntflow.extraction.qa.exhausted.total").register(Metrics.globalRegistry);
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.EXTRACT;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        String filteredText = context.requireString(WorkflowStepEnum.FILTER, FilterStepHandler.KEY_FILTERED_TEXT);
        String platform = context.requireString(WorkflowStepEnum.PLATFORM_DETECT, PlatformDetectStepHandler.KEY_PLATFORM);
        ExtractionResult extraction = extractionSupervisorDomainService.extract(context.invocationContext(),
                filteredText, platform);
        for (SubAgentOutcome outcome : extraction.getOutcomes()) {
            if (outcome.isQaExhausted()) {
                qaExhaustedCounter.increment();
            }
        }
        Map<String, Object> result = objectMapper.convertValue(extraction, MAP_TYPE);
        if (extraction.isAllFailed()) {
            log.warn("Extraction failed for every sub-agent. executionId={}, warnings={}",
                    context.getExecutionId(), extraction.getWarnings());
            return StepOutcome.terminate(TerminationReasonEnum.EXTRACTION_FAILED, result);
        }
        return StepOutcome.proceed(result);
    }

    /**
     * 从缓存的步骤结果还原抽取结果，重试续跑时使用
     */
    static ExtractionResult restore(WorkflowStepContext context, ObjectMapper objectMapper) {
        return objectMapper.convertValue(context.requireStepResult(WorkflowStepEnum.EXTRACT), ExtractionResult.class);
    }
}
