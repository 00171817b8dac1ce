package com.huntflow.domain.workflow.service;

import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.workflow.adapter.repository.IExecutionAttemptRepository;
import com.huntflow.domain.workflow.model.entity.ExecutionAttemptEntity;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 执行审计领域服务：每次外部模型调用写入一条尝试记录。
 */
@Service
public class ExecutionAuditDomainService {

    private final IExecutionAttemptRepository executionAttemptRepository;

    public ExecutionAuditDomainService(IExecutionAttemptRepository executionAttemptRepository) {
        this.executionAttemptRepository = executionAttemptRepository;
    }

    public ExecutionAttemptEntity recordReply(AgentInvocationContext context, AgentReply reply,
                                              boolean valid, String feedback) {
        ExecutionAttemptEntity attempt = newAttempt(context, reply.getAgentName(), reply.getAttemptNumber(), reply.getPrompt());
        attempt.setResponseRaw(reply.getText());
        attempt.setExecutionTimeMs(reply.getElapsedMs());
        if (valid) {
            attempt.markAsValid(feedback);
        } else {
            attempt.markAsInvalid(feedback);
        }
        return executionAttemptRepository.save(attempt);
    }

    public ExecutionAttemptEntity recordFailure(AgentInvocationContext context, String agentName, int attemptNumber,
                                                String prompt, String errorType, String errorMessage, long elapsedMs) {
        ExecutionAttemptEntity attempt = newAttempt(context, agentName, attemptNumber, prompt);
        attempt.recordError(errorType, errorMessage);
        attempt.setExecutionTimeMs(elapsedMs);
        return executionAttemptRepository.save(attempt);
    }

    private ExecutionAttemptEntity newAttempt(AgentInvocationContext context, String agentName,
                                              int attemptNumber, String prompt) {
        ExecutionAttemptEntity attempt = new ExecutionAttemptEntity();
        attempt.setExecutionId(context.getExecutionId());
        attempt.setStep(context.getStep());
        attempt.setAgentName(agentName);
        attempt.setAttemptNumber(attemptNumber);
        attempt.setPromptSnapshot(prompt);
        attempt.setCreatedAt(LocalDateTime.now());
        return attempt;
    }
}
