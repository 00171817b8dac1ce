package com.huntflow.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次代理调用的原始回复。
 */
@Getter
@AllArgsConstructor
public final class AgentReply {

    private final String agentName;
    private final int attemptNumber;
    private final String prompt;
    private final String text;
    private final long elapsedMs;
}
