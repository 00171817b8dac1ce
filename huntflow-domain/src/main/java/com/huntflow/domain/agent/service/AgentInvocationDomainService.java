package com.huntflow.domain.agent.service;

import com.huntflow.domain.agent.adapter.gateway.IModelGateway;
import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import com.huntflow.types.exception.ModelGatewayException;
import org.springframework.stereotype.Service;

/**
 * 代理调用领域服务：经传输层重试调用模型网关，失败时写入审计记录后抛出。
 * 成功回复的审计由调用方在校验后写入。
 */
@Service
public class AgentInvocationDomainService {

    private final IModelGateway modelGateway;
    private final ExternalCallDomainService externalCallDomainService;
    private final ExecutionAuditDomainService executionAuditDomainService;

    public AgentInvocationDomainService(IModelGateway modelGateway,
                                        ExternalCallDomainService externalCallDomainService,
                                        ExecutionAuditDomainService executionAuditDomainService) {
        this.modelGateway = modelGateway;
        this.externalCallDomainService = externalCallDomainService;
        this.executionAuditDomainService = executionAuditDomainService;
    }

    public AgentReply invoke(AgentInvocationContext context, String agentName, int attemptNumber, String prompt) {
        long startTime = System.currentTimeMillis();
        try {
            String text = externalCallDomainService.execute(agentName,
                    () -> modelGateway.complete(agentName, prompt, context.getConfig().optionsFor(agentName)),
                    context.getConfig().getRetryPolicy());
            return new AgentReply(agentName, attemptNumber, prompt, text, System.currentTimeMillis() - startTime);
        } catch (ModelGatewayException ex) {
            executionAuditDomainService.recordFailure(context, agentName, attemptNumber, prompt,
                    ex.getErrorType().getCode(), ex.getMessage(), System.currentTimeMillis() - startTime);
            throw ex;
        }
    }
}
