package com.huntflow.domain.workflow.model.valobj;

import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.domain.rule.model.valobj.SimilarityWeights;
import com.huntflow.types.enums.PlatformEnum;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 工作流配置值对象：不可变、带版本，随执行快照保存，传入每个阶段调用。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowConfig {

    /**
     * 配置版本，写入每条执行记录
     */
    String version;

    /**
     * 相关性阈值 (0-100)，低于则 low_relevance
     */
    @Builder.Default
    double rankingThreshold = 60.0;

    /**
     * 排序响应无法解析时的最大尝试次数
     */
    @Builder.Default
    int rankingMaxAttempts = 2;

    /**
     * 目标平台集合，空表示不过滤
     */
    @Singular
    List<PlatformEnum> targetPlatforms;

    /**
     * 关键词无证据时是否启用模型兜底
     */
    @Builder.Default
    boolean platformFallbackEnabled = true;

    /**
     * 次高平台得分达到最高分该比例时判定为 multiple
     */
    @Builder.Default
    double platformMultipleRatio = 0.5;

    @Builder.Default
    FilterConfig filter = FilterConfig.builder().build();

    /**
     * 抽取子代理名册，顺序即合并顺序
     */
    @Singular("rosterEntry")
    List<SubAgentSpec> roster;

    /**
     * 禁用的子代理名称
     */
    @Singular
    List<String> disabledAgents;

    /**
     * 子代理生成次数上限（含首次）
     */
    @Builder.Default
    int qaMaxAttempts = 3;

    /**
     * 规则生成次数上限（含首次）
     */
    @Builder.Default
    int generationMaxAttempts = 3;

    @Builder.Default
    SimilarityWeights similarityWeights = SimilarityWeights.defaults();

    /**
     * 聚合相似度低于该值判定为 novel
     */
    @Builder.Default
    double similarityThreshold = 0.5;

    /**
     * 聚合相似度不低于该值判定为 duplicate
     */
    @Builder.Default
    double duplicateThreshold = 0.95;

    @Builder.Default
    int similarityTopK = 10;

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.builder().build();

    @Builder.Default
    ModelCallOptions defaultModelOptions = ModelCallOptions.builder().build();

    /**
     * 按代理名称覆盖模型参数
     */
    @Singular
    Map<String, ModelCallOptions> agentOptions;

    /**
     * 取代理模型参数，未配置时使用默认
     */
    public ModelCallOptions optionsFor(String agentName) {
        ModelCallOptions options = agentOptions == null ? null : agentOptions.get(agentName);
        return options == null ? defaultModelOptions : options;
    }

    public boolean isAgentDisabled(String agentName) {
        return disabledAgents != null && agentName != null && disabledAgents.contains(agentName);
    }

    /**
     * 校验配置不变量，构造后由配置层调用
     */
    public WorkflowConfig validate() {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Workflow config version cannot be empty");
        }
        if (rankingThreshold < 0 || rankingThreshold > 100) {
            throw new IllegalArgumentException("Ranking threshold must be within [0, 100]");
        }
        if (qaMaxAttempts < 1 || generationMaxAttempts < 1) {
            throw new IllegalArgumentException("Attempt limits must be at least 1");
        }
        if (similarityThreshold > duplicateThreshold) {
            throw new IllegalArgumentException("Similarity threshold cannot exceed duplicate threshold");
        }
        filter.validate();
        similarityWeights.validate();
        return this;
    }
}
