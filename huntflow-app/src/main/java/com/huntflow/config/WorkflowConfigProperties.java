package com.huntflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流配置属性，前缀 huntflow.workflow，由 {@link WorkflowConfigConfig} 物化为不可变的 WorkflowConfig。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "huntflow.workflow")
public class WorkflowConfigProperties {

    /** 配置版本，写入每条执行记录 */
    private String version = "v1";

    private Double rankingThreshold = 60.0;

    private Integer rankingMaxAttempts = 2;

    /** 目标平台编码，空表示不过滤 */
    private List<String> targetPlatforms = new ArrayList<>();

    private Boolean platformFallbackEnabled = true;

    private Double platformMultipleRatio = 0.5;

    /** 禁用的子代理名称 */
    private List<String> disabledAgents = new ArrayList<>();

    private Integer qaMaxAttempts = 3;

    private Integer generationMaxAttempts = 3;

    private Double similarityThreshold = 0.5;

    private Double duplicateThreshold = 0.95;

    private Integer similarityTopK = 10;

    private Filter filter = new Filter();

    private Weights similarityWeights = new Weights();

    private Retry retry = new Retry();

    /** 默认模型名，空表示使用 spring.ai.openai 配置 */
    private String defaultModel;

    private Double defaultTemperature;

    @Data
    public static class Filter {

        private Integer chunkSize = 1000;

        private Integer overlap = 200;

        private Double minConfidence = 0.5;

        private Double classifierWeight = 1.0;

        private Double keywordWeight = 0.0;

        private List<String> protectedPatterns = new ArrayList<>();

        private List<String> huntablePatterns = new ArrayList<>();

        private List<String> notHuntablePatterns = new ArrayList<>();
    }

    /** 四段之和必须为 1.0 */
    @Data
    public static class Weights {

        private Double title = 0.042;

        private Double description = 0.042;

        private Double tags = 0.042;

        private Double signature = 0.874;
    }

    @Data
    public static class Retry {

        private Integer maxAttempts = 3;

        private Long initialBackoffMs = 500L;

        private Double multiplier = 2.0;

        private Long maxBackoffMs = 8000L;

        private Long callTimeoutMs = 120_000L;
    }

}
