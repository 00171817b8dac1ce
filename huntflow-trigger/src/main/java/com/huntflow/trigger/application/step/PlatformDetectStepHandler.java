package com.huntflow.trigger.application.step;

import com.huntflow.domain.analysis.model.valobj.PlatformDetectionResult;
import com.huntflow.domain.analysis.service.PlatformDetectionDomainService;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.TerminationReasonEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 平台检测步骤：检测平台不在目标集合时终止为 platform_excluded。
 */
@Slf4j
@Component
public class PlatformDetectStepHandler implements WorkflowStepHandler {

    public static final String KEY_PLATFORM = "platform";

    private final PlatformDetectionDomainService platformDetectionDomainService;

    public PlatformDetectStepHandler(PlatformDetectionDomainService platformDetectionDomainService) {
        this.platformDetectionDomainService = platformDetectionDomainService;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.PLATFORM_DETECT;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        String filteredText = context.requireString(WorkflowStepEnum.FILTER, FilterStepHandler.KEY_FILTERED_TEXT);
        List<String> hints = context.getDocument() == null ? null : context.getDocument().getPlatformHints();
        PlatformDetectionResult detection = platformDetectionDomainService.detect(context.invocationContext(),
                filteredText, hints);
        boolean excluded = platformDetectionDomainService.isExcluded(detection.getPlatform(), context.getConfig());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(KEY_PLATFORM, detection.getPlatform().getCode());
        result.put("method", detection.getMethod());
        result.put("scores", detection.getScores());
        result.put("excluded", excluded);
        if (detection.getFallbackResponse() != null) {
            result.put("fallbackResponse", detection.getFallbackResponse());
        }
        log.info("Platform detected. executionId={}, platform={}, method={}, excluded={}",
                context.getExecutionId(), detection.getPlatform().getCode(), detection.getMethod(), excluded);
        if (excluded) {
            return StepOutcome.terminate(TerminationReasonEnum.PLATFORM_EXCLUDED, result);
        }
        return StepOutcome.proceed(result);
    }
}
