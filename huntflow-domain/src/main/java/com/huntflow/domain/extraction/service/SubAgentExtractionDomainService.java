package com.huntflow.domain.extraction.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.agent.service.AgentInvocationDomainService;
import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.extraction.model.entity.SubAgentRunEntity;
import com.huntflow.domain.extraction.model.valobj.Observable;
import com.huntflow.domain.extraction.model.valobj.QaVerdict;
import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import com.huntflow.types.enums.ObservableTypeEnum;
import com.huntflow.types.exception.ModelGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * 单个抽取子代理：生成 → 解析 → QA 复核，带反馈的有界重试。
 */
@Slf4j
@Service
public class SubAgentExtractionDomainService {

    static final String INVALID_JSON_FEEDBACK = "output was not valid JSON";
    static final String QA_UNPARSEABLE_FEEDBACK = "QA response could not be parsed";
    static final String QA_UNAVAILABLE_WARNING = "qa_unavailable";
    static final String ABORTED_ERROR = "aborted";

    private final AgentInvocationDomainService agentInvocationDomainService;
    private final TolerantParseDomainService tolerantParseDomainService;
    private final ExecutionAuditDomainService executionAuditDomainService;
    private final ExtractionPromptCatalog extractionPromptCatalog;

    public SubAgentExtractionDomainService(AgentInvocationDomainService agentInvocationDomainService,
                                           TolerantParseDomainService tolerantParseDomainService,
                                           ExecutionAuditDomainService executionAuditDomainService,
                                           ExtractionPromptCatalog extractionPromptCatalog) {
        this.agentInvocationDomainService = agentInvocationDomainService;
        this.tolerantParseDomainService = tolerantParseDomainService;
        this.executionAuditDomainService = executionAuditDomainService;
        this.extractionPromptCatalog = extractionPromptCatalog;
    }

    public SubAgentOutcome run(AgentInvocationContext context, SubAgentSpec spec, String text, String platform) {
        return run(context, spec, text, platform, () -> false);
    }

    /**
     * aborted 在每次生成前检查，为 true 时不再调用模型，直接以 aborted 失败结束
     */
    public SubAgentOutcome run(AgentInvocationContext context, SubAgentSpec spec, String text, String platform,
                               BooleanSupplier aborted) {
        SubAgentRunEntity run = SubAgentRunEntity.create(spec, context.getConfig().getQaMaxAttempts());
        while (run.hasAttemptsLeft()) {
            if (aborted.getAsBoolean()) {
                run.fail(ABORTED_ERROR, "extraction aborted by a failed sibling sub-agent");
                log.info("Sub-agent stopped before generation. executionId={}, agent={}, attempts={}",
                        context.getExecutionId(), spec.getName(), run.getAttempts());
                return run.toOutcome();
            }
            int attempt = run.beginGeneration();
            String prompt = extractionPromptCatalog.extractionPrompt(spec, text, platform, run.getFeedback());
            AgentReply reply;
            try {
                reply = agentInvocationDomainService.invoke(context, spec.getName(), attempt, prompt);
            } catch (ModelGatewayException ex) {
                run.fail(ex.getErrorType().getCode(), ex.getMessage());
                log.warn("Sub-agent gateway failure. executionId={}, agent={}, attempt={}, errorType={}",
                        context.getExecutionId(), spec.getName(), attempt, ex.getErrorType().getCode());
                return run.toOutcome();
            }

            ParseOutcome<List<Observable>> parsed = parseObservables(reply.getText(), spec.getObservableType());
            if (!parsed.isSuccess()) {
                executionAuditDomainService.recordReply(context, reply, false, INVALID_JSON_FEEDBACK);
                run.requestRetry(INVALID_JSON_FEEDBACK);
                log.info("Sub-agent output unparseable. executionId={}, agent={}, attempt={}, error={}",
                        context.getExecutionId(), spec.getName(), attempt, parsed.getError());
                continue;
            }
            List<Observable> candidates = parsed.getValue();
            executionAuditDomainService.recordReply(context, reply, true, "observables=" + candidates.size());
            run.recordCandidates(candidates);

            if (!spec.isQaEnabled()) {
                run.accept(candidates);
                return run.toOutcome();
            }

            run.beginReview();
            String qaAgentName = spec.resolveQaAgentName();
            String qaPrompt = extractionPromptCatalog.qaPrompt(spec, text, candidates);
            AgentReply qaReply;
            try {
                qaReply = agentInvocationDomainService.invoke(context, qaAgentName, attempt, qaPrompt);
            } catch (ModelGatewayException ex) {
                run.addWarning(QA_UNAVAILABLE_WARNING + ": " + ex.getErrorType().getCode());
                run.accept(candidates);
                log.warn("QA unavailable, accepting candidates. executionId={}, agent={}, attempt={}",
                        context.getExecutionId(), qaAgentName, attempt);
                return run.toOutcome();
            }
            QaVerdict verdict = parseVerdict(qaReply.getText());
            executionAuditDomainService.recordReply(context, qaReply, verdict.pass(),
                    verdict.verdict() + ": " + StringUtils.defaultString(verdict.feedback()));
            if (verdict.pass()) {
                run.accept(candidates);
                return run.toOutcome();
            }
            run.requestRetry(verdict.feedback());
            log.info("QA rejected candidates. executionId={}, agent={}, attempt={}, verdict={}",
                    context.getExecutionId(), spec.getName(), attempt, verdict.verdict());
        }
        run.exhaust();
        if (run.isQaExhausted()) {
            log.info("Sub-agent attempts exhausted, using best candidates. executionId={}, agent={}, bestAttempt={}",
                    context.getExecutionId(), spec.getName(), run.getBestAttempt());
        } else {
            log.warn("Sub-agent failed without parseable output. executionId={}, agent={}, attempts={}",
                    context.getExecutionId(), spec.getName(), run.getAttempts());
        }
        return run.toOutcome();
    }

    /**
     * 解析抽取输出：{"observables": [...]}、任意首个数组字段或顶层数组；元素可为对象或字符串
     */
    ParseOutcome<List<Observable>> parseObservables(String text, ObservableTypeEnum type) {
        ParseOutcome<JsonNode> parsed = tolerantParseDomainService.parseJson(text);
        if (!parsed.isSuccess()) {
            return ParseOutcome.error(parsed.getError());
        }
        JsonNode items = locateItems(parsed.getValue());
        if (items == null) {
            return ParseOutcome.error("no observable list in response");
        }
        Set<String> seen = new LinkedHashSet<>();
        List<Observable> observables = new ArrayList<>();
        for (JsonNode item : items) {
            String value;
            String sourceReference = null;
            if (item.isTextual() || item.isNumber()) {
                value = item.asText();
            } else if (item.isObject()) {
                value = firstText(item, "value", "command", "query", "event_id", "key", "item");
                sourceReference = firstText(item, "source_reference", "sourceReference", "source", "context");
            } else {
                continue;
            }
            if (StringUtils.isBlank(value) || !seen.add(value.trim())) {
                continue;
            }
            observables.add(Observable.builder()
                    .type(type)
                    .value(value.trim())
                    .sourceReference(sourceReference)
                    .build());
        }
        return ParseOutcome.success(observables);
    }

    /**
     * 解析 QA 结论；无法解析视为驳回
     */
    QaVerdict parseVerdict(String text) {
        ParseOutcome<JsonNode> parsed = tolerantParseDomainService.parseJsonObject(text);
        if (!parsed.isSuccess()) {
            return QaVerdict.rejected(QaVerdict.NEEDS_REVISION, QA_UNPARSEABLE_FEEDBACK);
        }
        JsonNode node = parsed.getValue();
        String verdict = firstText(node, "verdict", "status");
        if (verdict == null && node.has("pass")) {
            verdict = node.get("pass").asBoolean() ? QaVerdict.PASS : QaVerdict.NEEDS_REVISION;
        }
        String normalized = verdict == null ? "" : verdict.trim().toLowerCase(Locale.ROOT);
        StringBuilder feedback = new StringBuilder(StringUtils.defaultString(firstText(node, "summary", "feedback")));
        JsonNode issues = node.get("issues");
        if (issues != null && issues.isArray()) {
            for (JsonNode issue : issues) {
                String description = issue.isObject() ? firstText(issue, "description", "message") : issue.asText();
                if (StringUtils.isNotBlank(description)) {
                    feedback.append(feedback.length() == 0 ? "" : "\n").append("- ").append(description);
                }
            }
        }
        if (QaVerdict.PASS.equals(normalized)) {
            return QaVerdict.accepted(feedback.toString());
        }
        if (feedback.length() == 0) {
            feedback.append("QA rejected without feedback");
        }
        return QaVerdict.rejected(normalized.isEmpty() ? QaVerdict.NEEDS_REVISION : normalized, feedback.toString());
    }

    private JsonNode locateItems(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        if (!root.isObject()) {
            return null;
        }
        JsonNode observables = root.get("observables");
        if (observables != null && observables.isArray()) {
            return observables;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                return field.getValue();
            }
        }
        return null;
    }

    private String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                return value.asText();
            }
        }
        return null;
    }
}
