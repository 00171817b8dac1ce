package com.huntflow.domain.agent.adapter.gateway;

/**
 * 文本嵌入网关。
 */
public interface IEmbeddingGateway {

    float[] embed(String text);
}
