package com.huntflow.trigger.application.step;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifactProvider;
import com.huntflow.domain.filter.model.valobj.FilterResult;
import com.huntflow.domain.filter.service.ContentFilterDomainService;
import com.huntflow.domain.workflow.model.valobj.DocumentSnapshot;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.WorkflowStepEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内容过滤步骤：分类器损坏时 FatalConfigurationException 向上抛出，分类器缺失时降级放行。
 */
@Slf4j
@Component
public class FilterStepHandler implements WorkflowStepHandler {

    public static final String KEY_FILTERED_TEXT = "filteredText";
    public static final String ERROR_INVALID_INPUT = "invalid_input";

    private static final TypeReference<List<Map<String, Object>>> DECISION_LIST_TYPE =
            new TypeReference<List<Map<String, Object>>>() {};

    private final ContentFilterDomainService contentFilterDomainService;
    private final IClassifierArtifactProvider classifierArtifactProvider;
    private final ObjectMapper objectMapper;

    public FilterStepHandler(ContentFilterDomainService contentFilterDomainService,
                             IClassifierArtifactProvider classifierArtifactProvider,
                             ObjectMapper objectMapper) {
        this.contentFilterDomainService = contentFilterDomainService;
        this.classifierArtifactProvider = classifierArtifactProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkflowStepEnum step() {
        return WorkflowStepEnum.FILTER;
    }

    @Override
    public StepOutcome handle(WorkflowStepContext context) {
        DocumentSnapshot document = context.getDocument();
        if (document == null) {
            return StepOutcome.fail(ERROR_INVALID_INPUT,
                    "Document not found: " + context.getExecution().getDocumentId(), null);
        }
        if (StringUtils.isBlank(document.getRawText())) {
            return StepOutcome.fail(ERROR_INVALID_INPUT, "Document text is empty: " + document.getId(), null);
        }
        FilterResult filterResult = contentFilterDomainService.filter(document.getRawText(),
                context.getConfig().getFilter(), classifierArtifactProvider.current().orElse(null));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(KEY_FILTERED_TEXT, filterResult.getFilteredText());
        result.put("degraded", filterResult.isDegraded());
        result.put("classifierVersion", filterResult.getClassifierVersion());
        result.put("totalChunks", filterResult.getTotalChunks());
        result.put("keptChunks", filterResult.getKeptChunks());
        result.put("removedChunks", filterResult.getRemovedChunks());
        result.put("decisions", objectMapper.convertValue(filterResult.getDecisions(), DECISION_LIST_TYPE));
        log.info("Content filtered. executionId={}, totalChunks={}, keptChunks={}, degraded={}",
                context.getExecutionId(), filterResult.getTotalChunks(), filterResult.getKeptChunks(),
                filterResult.isDegraded());
        return filterResult.isDegraded() ? StepOutcome.proceedDegraded(result) : StepOutcome.proceed(result);
    }
}
