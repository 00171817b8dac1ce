package com.huntflow.config;

import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.domain.workflow.model.valobj.FilterConfig;
import com.huntflow.domain.workflow.model.valobj.ModelCallOptions;
import com.huntflow.domain.workflow.model.valobj.RetryPolicy;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.types.enums.PlatformEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * 当前生效的工作流配置。
 * <p>
 * 启动时校验不变量（阈值范围、权重和为 1、次数上限），不合法直接阻止启动。
 * 新触发的执行使用此配置并保存快照，已有执行始终按自身快照运行。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({WorkflowConfigProperties.class, AgentModelProperties.class})
public class WorkflowConfigConfig {

    @Bean
    public WorkflowConfig workflowConfig(WorkflowConfigProperties properties, AgentModelProperties agentModelProperties) {
        WorkflowConfig config = build(properties, agentModelProperties).validate();
        log.info("Workflow config loaded. version={}, rankingThreshold={}, targetPlatforms={}, agentOverrides={}",
                config.getVersion(), config.getRankingThreshold(), config.getTargetPlatforms(),
                config.getAgentOptions().keySet());
        return config;
    }

    WorkflowConfig build(WorkflowConfigProperties properties, AgentModelProperties agentModelProperties) {
        WorkflowConfigProperties.Filter filter = properties.getFilter();
        WorkflowConfigProperties.Weights weights = properties.getSimilarityWeights();
        WorkflowConfigProperties.Retry retry = properties.getRetry();
        WorkflowConfig.WorkflowConfigBuilder builder = WorkflowConfig.builder()
                .version(properties.getVersion())
                .rankingThreshold(properties.getRankingThreshold())
                .rankingMaxAttempts(properties.getRankingMaxAttempts())
                .platformFallbackEnabled(Boolean.TRUE.equals(properties.getPlatformFallbackEnabled()))
                .platformMultipleRatio(properties.getPlatformMultipleRatio())
                .disabledAgents(properties.getDisabledAgents())
                .qaMaxAttempts(properties.getQaMaxAttempts())
                .generationMaxAttempts(properties.getGenerationMaxAttempts())
                .similarityThreshold(properties.getSimilarityThreshold())
                .duplicateThreshold(properties.getDuplicateThreshold())
                .similarityTopK(properties.getSimilarityTopK())
                .filter(FilterConfig.builder()
                        .chunkSize(filter.getChunkSize())
                        .overlap(filter.getOverlap())
                        .minConfidence(filter.getMinConfidence())
                        .classifierWeight(filter.getClassifierWeight())
                        .keywordWeight(filter.getKeywordWeight())
                        .protectedPatterns(filter.getProtectedPatterns())
                        .huntablePatterns(filter.getHuntablePatterns())
                        .notHuntablePatterns(filter.getNotHuntablePatterns())
                        .build())
                .similarityWeights(new SimilarityWeights(weights.getTitle(), weights.getDescription(),
                        weights.getTags(), weights.getSignature()))
                .retryPolicy(RetryPolicy.builder()
                        .maxAttempts(retry.getMaxAttempts())
                        .initialBackoffMs(retry.getInitialBackoffMs())
                        .multiplier(retry.getMultiplier())
                        .maxBackoffMs(retry.getMaxBackoffMs())
                        .callTimeoutMs(retry.getCallTimeoutMs())
                        .build())
                .defaultModelOptions(ModelCallOptions.builder()
                        .model(StringUtils.trimToNull(properties.getDefaultModel()))
                        .temperature(properties.getDefaultTemperature())
                        .build());
        for (String platform : properties.getTargetPlatforms()) {
            if (StringUtils.isNotBlank(platform)) {
                builder.targetPlatform(PlatformEnum.fromCode(platform.trim()));
            }
        }
        for (Map.Entry<String, AgentModelProperties.AgentOverride> entry : agentModelProperties.getAgents().entrySet()) {
            AgentModelProperties.AgentOverride override = entry.getValue();
            if (override == null) {
                continue;
            }
            builder.agentOption(entry.getKey(), ModelCallOptions.builder()
                    .model(StringUtils.trimToNull(override.getModel()))
                    .temperature(override.getTemperature())
                    .topP(override.getTopP())
                    .build());
        }
        return builder.build();
    }

}
