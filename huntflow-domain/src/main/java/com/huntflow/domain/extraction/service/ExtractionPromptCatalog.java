package com.huntflow.domain.extraction.service;

import com.huntflow.domain.extraction.model.valobj.Observable;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.types.enums.ObservableTypeEnum;
import com.huntflow.types.exception.FatalConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 抽取与 QA 提示词目录，按 promptTemplateId 取内置模板。
 */
@Component
public class ExtractionPromptCatalog {

    private static final int MAX_SOURCE_CHARS = 12000;

    private static final Map<String, String> TASKS = Map.of(
            "cmdline", "Extract every literal command line executed by the adversary (full process command with "
                    + "arguments, e.g. powershell.exe -enc ..., cmd.exe /c ...). Do not invent or normalize commands.",
            "hunt_queries", "Extract every hunting query or query fragment quoted in the content (KQL, SPL, EQL, "
                    + "Sigma detection fields, SQL against EDR telemetry).",
            "event_id", "Extract every Windows or Sysmon event ID mentioned as evidence of the behavior "
                    + "(e.g. 4688, 4624, Sysmon 1), with the channel when stated.",
            "proc_tree", "Extract every parent/child process relationship observed in the behavior, formatted as "
                    + "parent.exe -> child.exe.",
            "registry", "Extract every registry key or value the adversary creates, modifies, queries or deletes, "
                    + "with the operation.");

    /**
     * 未配置 promptTemplateId 时按可观测项类型选用的模板
     */
    private static final Map<ObservableTypeEnum, String> DEFAULT_TEMPLATES = new EnumMap<>(Map.of(
            ObservableTypeEnum.COMMAND_LINE, "cmdline",
            ObservableTypeEnum.QUERY_FRAGMENT, "hunt_queries",
            ObservableTypeEnum.EVENT_ID, "event_id",
            ObservableTypeEnum.PROCESS_LINEAGE, "proc_tree",
            ObservableTypeEnum.REGISTRY_OPERATION, "registry"));

    private static final String EXTRACTION_TEMPLATE = """
            You are a detection engineer extracting %s observables from threat intelligence.
            Task: %s
            Target platform: %s
            Respond with JSON only: {"observables": [{"value": "...", "source_reference": "<exact quote from the content>"}]}.
            Return an empty list when nothing qualifies.
            %s
            Content:
            %s
            """;

    private static final String QA_TEMPLATE = """
            You are a QA reviewer for %s extraction.
            Task: %s
            Check that every item is literally supported by the content, nothing qualifying was missed, and no item is invented.
            Respond with JSON only: {"verdict": "pass|needs_revision|critical_failure", "summary": "...", "issues": ["..."]}.

            Extracted:
            %s

            Content:
            %s
            """;

    public String extractionPrompt(SubAgentSpec spec, String text, String platform, String feedback) {
        String feedbackBlock = StringUtils.isBlank(feedback)
                ? ""
                : "Previous attempt was rejected. Address this feedback:\n" + feedback + "\n";
        return String.format(EXTRACTION_TEMPLATE, spec.getObservableType().getCode(), task(spec),
                StringUtils.defaultIfBlank(platform, "unknown"), feedbackBlock, truncate(text));
    }

    public String qaPrompt(SubAgentSpec spec, String text, List<Observable> candidates) {
        StringBuilder extracted = new StringBuilder();
        for (Observable observable : candidates) {
            extracted.append("- ").append(observable.getValue());
            if (StringUtils.isNotBlank(observable.getSourceReference())) {
                extracted.append(" (source: ").append(observable.getSourceReference()).append(')');
            }
            extracted.append('\n');
        }
        if (extracted.length() == 0) {
            extracted.append("(none)\n");
        }
        return String.format(QA_TEMPLATE, spec.getObservableType().getCode(), task(spec), extracted, truncate(text));
    }

    private String task(SubAgentSpec spec) {
        String templateId = StringUtils.defaultIfBlank(spec.getPromptTemplateId(),
                DEFAULT_TEMPLATES.get(spec.getObservableType()));
        String task = TASKS.get(templateId);
        if (task == null) {
            throw new FatalConfigurationException("Unknown prompt template: " + templateId + ", agent=" + spec.getName());
        }
        return task;
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_SOURCE_CHARS ? text : text.substring(0, MAX_SOURCE_CHARS);
    }
}
