package com.huntflow.infrastructure.ai;

import com.huntflow.domain.agent.adapter.gateway.IModelGateway;
import com.huntflow.domain.workflow.model.valobj.ModelCallOptions;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.exception.ModelGatewayException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * 基于 Spring AI ChatClient 的模型网关。
 * <p>
 * 每次调用按代理参数构建 ChatOptions，底层异常统一映射为 {@link GatewayErrorTypeEnum}，
 * 重试由领域层的外部调用服务负责。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Component
public class SpringAiModelGateway implements IModelGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;

    public SpringAiModelGateway(ObjectProvider<ChatModel> chatModelProvider) {
        this.chatModelProvider = chatModelProvider;
    }

    @Override
    public String complete(String agentName, String prompt, ModelCallOptions options) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE, "ChatModel bean not available");
        }
        ChatClient.Builder builder = ChatClient.builder(chatModel);
        ChatOptions chatOptions = buildChatOptions(options);
        if (chatOptions != null) {
            builder.defaultOptions(chatOptions);
        }
        String content;
        try {
            content = builder.build().prompt(prompt).call().content();
        } catch (RuntimeException ex) {
            throw translate(agentName, ex);
        }
        if (StringUtils.isBlank(content)) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE,
                    "Model returned empty content, agent=" + agentName);
        }
        return content;
    }

    private ChatOptions buildChatOptions(ModelCallOptions options) {
        if (options == null) {
            return null;
        }
        if (options.getModel() == null && options.getTemperature() == null && options.getTopP() == null) {
            return null;
        }
        ChatOptions.Builder builder = ChatOptions.builder();
        if (StringUtils.isNotBlank(options.getModel())) {
            builder.model(options.getModel());
        }
        if (options.getTemperature() != null) {
            builder.temperature(options.getTemperature());
        }
        if (options.getTopP() != null) {
            builder.topP(options.getTopP());
        }
        return builder.build();
    }

    ModelGatewayException translate(String agentName, RuntimeException ex) {
        if (ex instanceof ModelGatewayException gatewayException) {
            return gatewayException;
        }
        String message = "Model call failed, agent=" + agentName + ", error=" + ex.getMessage();
        GatewayErrorTypeEnum errorType = classify(ex);
        Counter.builder("huntflow.model.call.failure.total")
                .tag("errorType", errorType.getCode())
                .register(Metrics.globalRegistry)
                .increment();
        log.debug("Model call exception translated. agent={}, errorType={}, exception={}",
                agentName, errorType.getCode(), ex.getClass().getSimpleName());
        return new ModelGatewayException(errorType, message, ex);
    }

    private GatewayErrorTypeEnum classify(Throwable ex) {
        if (ex instanceof HttpClientErrorException.TooManyRequests || mentionsRateLimit(ex)) {
            return GatewayErrorTypeEnum.RATE_LIMITED;
        }
        if (hasTimeoutCause(ex)) {
            return GatewayErrorTypeEnum.TIMEOUT;
        }
        if (ex instanceof TransientAiException || ex instanceof HttpServerErrorException
                || ex instanceof ResourceAccessException) {
            return GatewayErrorTypeEnum.UNAVAILABLE;
        }
        if (ex instanceof NonTransientAiException || ex instanceof HttpClientErrorException) {
            return GatewayErrorTypeEnum.INVALID_RESPONSE;
        }
        return GatewayErrorTypeEnum.UNAVAILABLE;
    }

    private boolean mentionsRateLimit(Throwable ex) {
        String message = ex.getMessage();
        return message != null && (message.contains("429") || message.toLowerCase().contains("rate limit"));
    }

    private boolean hasTimeoutCause(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
