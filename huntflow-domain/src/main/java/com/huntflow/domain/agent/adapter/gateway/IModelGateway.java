package com.huntflow.domain.agent.adapter.gateway;

import com.huntflow.domain.workflow.model.valobj.ModelCallOptions;

/**
 * 模型网关：文本补全。
 * <p>
 * 失败时抛出 {@link com.huntflow.types.exception.ModelGatewayException}，
 * 错误类型为 UNAVAILABLE、RATE_LIMITED、TIMEOUT 或 INVALID_RESPONSE。
 * </p>
 */
public interface IModelGateway {

    String complete(String agentName, String prompt, ModelCallOptions options);
}
