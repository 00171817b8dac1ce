package com.huntflow.domain.rule.service;

import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.agent.service.AgentInvocationDomainService;
import com.huntflow.domain.extraction.model.valobj.ExtractionResult;
import com.huntflow.domain.extraction.model.valobj.Observable;
import com.huntflow.domain.rule.adapter.repository.IRuleDraftRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.valobj.ParsedRule;
import com.huntflow.domain.rule.model.valobj.RuleValidationResult;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 规则生成领域服务：按校验错误反馈重新生成，次数用尽时保存为 invalid 草稿。
 */
@Slf4j
@Service
public class RuleGenerationDomainService {

    public static final String AGENT_NAME = "SigmaAgent";

    private static final String PROMPT_TEMPLATE = """
            You are a detection engineer. Write one Sigma detection rule in YAML for the behavior below.
            Required: title, description, logsource (product/category/service), detection with named selections \
            and a condition that only references those selections, tags, level (informational|low|medium|high|critical).
            Do not use aggregation (| count, near) or timeframe.
            Output the YAML only.

            Target platform: %s
            Document title: %s

            Observables:
            %s
            %s""";

    private final AgentInvocationDomainService agentInvocationDomainService;
    private final ExecutionAuditDomainService executionAuditDomainService;
    private final RuleDraftParser ruleDraftParser;
    private final RuleValidationDomainService ruleValidationDomainService;
    private final IRuleDraftRepository ruleDraftRepository;

    public RuleGenerationDomainService(AgentInvocationDomainService agentInvocationDomainService,
                                       ExecutionAuditDomainService executionAuditDomainService,
                                       RuleDraftParser ruleDraftParser,
                                       RuleValidationDomainService ruleValidationDomainService,
                                       IRuleDraftRepository ruleDraftRepository) {
        this.agentInvocationDomainService = agentInvocationDomainService;
        this.executionAuditDomainService = executionAuditDomainService;
        this.ruleDraftParser = ruleDraftParser;
        this.ruleValidationDomainService = ruleValidationDomainService;
        this.ruleDraftRepository = ruleDraftRepository;
    }

    public RuleDraftEntity generate(AgentInvocationContext context, ExtractionResult extraction,
                                    String platform, String documentTitle) {
        int maxAttempts = Math.max(context.getConfig().getGenerationMaxAttempts(), 1);
        String observables = renderObservables(extraction);
        String feedback = null;
        String lastText = null;
        ParsedRule lastParsed = null;
        List<String> lastErrors = new ArrayList<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String prompt = String.format(PROMPT_TEMPLATE, StringUtils.defaultIfBlank(platform, "unknown"),
                    StringUtils.defaultString(documentTitle), observables, feedbackBlock(feedback));
            AgentReply reply = agentInvocationDomainService.invoke(context, AGENT_NAME, attempt, prompt);
            lastText = reply.getText();

            ParseOutcome<ParsedRule> parsed = ruleDraftParser.parse(reply.getText());
            RuleValidationResult validation;
            if (parsed.isSuccess()) {
                lastParsed = parsed.getValue();
                validation = ruleValidationDomainService.validate(lastParsed.document());
            } else {
                lastParsed = null;
                validation = RuleValidationResult.failed(List.of(parsed.getError()));
            }
            executionAuditDomainService.recordReply(context, reply, validation.valid(),
                    validation.valid() ? "valid" : validation.joinedErrors());

            if (validation.valid()) {
                log.info("Rule draft validated. executionId={}, attempt={}", context.getExecutionId(), attempt);
                context.ensureOwned();
                return ruleDraftRepository.save(buildDraft(context.getExecutionId(), lastParsed, attempt, validation));
            }
            lastErrors = validation.errors();
            feedback = validation.joinedErrors();
            log.info("Rule draft invalid. executionId={}, attempt={}, maxAttempts={}, errors={}",
                    context.getExecutionId(), attempt, maxAttempts, feedback);
        }

        RuleDraftEntity draft = lastParsed != null
                ? buildDraft(context.getExecutionId(), lastParsed, maxAttempts, RuleValidationResult.failed(lastErrors))
                : invalidDraft(context.getExecutionId(), lastText, maxAttempts, lastErrors);
        log.warn("Rule generation exhausted. executionId={}, attempts={}, errors={}",
                context.getExecutionId(), maxAttempts, lastErrors);
        context.ensureOwned();
        return ruleDraftRepository.save(draft);
    }

    /**
     * 由已解析的规则构建草稿，审核编辑复用
     */
    public RuleDraftEntity buildDraft(Long executionId, ParsedRule parsed, int attemptCount,
                                      RuleValidationResult validation) {
        Map<String, Object> document = parsed.document();
        RuleDraftEntity draft = new RuleDraftEntity();
        draft.setExecutionId(executionId);
        draft.setTitle(asString(document.get("title")));
        draft.setDescription(asString(document.get("description")));
        draft.setLogSource(asMap(document.get("logsource")));
        draft.setDetection(asMap(document.get("detection")));
        draft.setTags(asStringList(document.get("tags")));
        draft.setSeverity(asString(document.get("level")));
        draft.setRawYaml(parsed.yaml());
        draft.setAttemptCount(attemptCount);
        draft.setCreatedAt(LocalDateTime.now());
        if (validation.valid()) {
            draft.markValid();
        } else {
            draft.markInvalid(validation.errors());
        }
        return draft;
    }

    private RuleDraftEntity invalidDraft(Long executionId, String rawText, int attemptCount, List<String> errors) {
        RuleDraftEntity draft = new RuleDraftEntity();
        draft.setExecutionId(executionId);
        draft.setRawYaml(rawText);
        draft.setAttemptCount(attemptCount);
        draft.setTags(new ArrayList<>());
        draft.setCreatedAt(LocalDateTime.now());
        draft.markInvalid(errors);
        return draft;
    }

    private String renderObservables(ExtractionResult extraction) {
        StringBuilder builder = new StringBuilder();
        if (extraction != null) {
            extraction.getObservables().forEach((type, items) -> {
                if (items.isEmpty()) {
                    return;
                }
                builder.append(type).append(":\n");
                for (Observable observable : items) {
                    builder.append("- ").append(observable.getValue()).append('\n');
                }
            });
        }
        return builder.length() == 0 ? "(none)\n" : builder.toString();
    }

    private String feedbackBlock(String feedback) {
        if (StringUtils.isBlank(feedback)) {
            return "";
        }
        return "\nThe previous rule failed validation. Fix these errors:\n" + feedback + "\n";
    }

    private String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }
}
