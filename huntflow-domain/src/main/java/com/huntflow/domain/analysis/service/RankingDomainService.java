package com.huntflow.domain.analysis.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.agent.service.AgentInvocationDomainService;
import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.analysis.model.valobj.RankingResult;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.exception.ModelGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 相关性评分领域服务：单次模型调用给出 0-100 分与理由，无法解析时有限次重问。
 */
@Slf4j
@Service
public class RankingDomainService {

    public static final String AGENT_NAME = "RankAgent";

    private static final String PROMPT_TEMPLATE = """
            You are a threat-intelligence analyst. Score how useful the following content is for \
            writing behavioural detection rules (commands, process trees, registry, event IDs, queries).
            Respond with JSON only: {"score": <number 0-100>, "reasoning": "<one paragraph>"}.

            Content:
            %s
            """;

    private final AgentInvocationDomainService agentInvocationDomainService;
    private final TolerantParseDomainService tolerantParseDomainService;
    private final ExecutionAuditDomainService executionAuditDomainService;

    public RankingDomainService(AgentInvocationDomainService agentInvocationDomainService,
                                TolerantParseDomainService tolerantParseDomainService,
                                ExecutionAuditDomainService executionAuditDomainService) {
        this.agentInvocationDomainService = agentInvocationDomainService;
        this.tolerantParseDomainService = tolerantParseDomainService;
        this.executionAuditDomainService = executionAuditDomainService;
    }

    public RankingResult rank(AgentInvocationContext context, String filteredText) {
        String prompt = String.format(PROMPT_TEMPLATE, filteredText);
        int maxAttempts = Math.max(context.getConfig().getRankingMaxAttempts(), 1);
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AgentReply reply = agentInvocationDomainService.invoke(context, AGENT_NAME, attempt, prompt);
            ParseOutcome<RankingResult> parsed = parseScore(reply.getText());
            if (parsed.isSuccess()) {
                RankingResult result = parsed.getValue();
                result.setThreshold(context.getConfig().getRankingThreshold());
                result.setAttempts(attempt);
                executionAuditDomainService.recordReply(context, reply, true, "score=" + result.getScore());
                return result;
            }
            lastError = parsed.getError();
            executionAuditDomainService.recordReply(context, reply, false, lastError);
            log.warn("Ranking response unparseable. executionId={}, attempt={}, error={}",
                    context.getExecutionId(), attempt, lastError);
        }
        throw new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE,
                "Ranking response could not be parsed: " + lastError);
    }

    ParseOutcome<RankingResult> parseScore(String text) {
        ParseOutcome<JsonNode> parsed = tolerantParseDomainService.parseJsonObject(text);
        if (!parsed.isSuccess()) {
            return ParseOutcome.error(parsed.getError());
        }
        JsonNode scoreNode = parsed.getValue().get("score");
        if (scoreNode == null || scoreNode.isNull()) {
            return ParseOutcome.error("missing score");
        }
        double score;
        if (scoreNode.isNumber()) {
            score = scoreNode.asDouble();
        } else {
            try {
                score = Double.parseDouble(scoreNode.asText().trim());
            } catch (NumberFormatException ex) {
                return ParseOutcome.error("score is not numeric: " + scoreNode.asText());
            }
        }
        if (Double.isNaN(score) || score < 0 || score > 100) {
            return ParseOutcome.error("score out of range [0, 100]: " + score);
        }
        JsonNode reasoning = parsed.getValue().get("reasoning");
        RankingResult result = new RankingResult();
        result.setScore(score);
        result.setReasoning(reasoning == null || reasoning.isNull() ? "" : reasoning.asText());
        return ParseOutcome.success(result);
    }
}
