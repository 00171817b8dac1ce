package com.huntflow.infrastructure.ai;

import com.huntflow.domain.agent.adapter.gateway.IEmbeddingGateway;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.exception.ModelGatewayException;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring AI EmbeddingModel 的嵌入网关。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Component
public class SpringAiEmbeddingGateway implements IEmbeddingGateway {

    private final ObjectProvider<EmbeddingModel> embeddingModelProvider;

    public SpringAiEmbeddingGateway(ObjectProvider<EmbeddingModel> embeddingModelProvider) {
        this.embeddingModelProvider = embeddingModelProvider;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingModel embeddingModel = embeddingModelProvider.getIfAvailable();
        if (embeddingModel == null) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE, "EmbeddingModel bean not available");
        }
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (NonTransientAiException ex) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE,
                    "Embedding request rejected: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE,
                    "Embedding call failed: " + ex.getMessage(), ex);
        }
        if (vector == null || vector.length == 0) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE, "Embedding model returned empty vector");
        }
        return vector;
    }
}
