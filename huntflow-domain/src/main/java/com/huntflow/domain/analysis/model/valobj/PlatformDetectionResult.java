package com.huntflow.domain.analysis.model.valobj;

import com.huntflow.types.enums.PlatformEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 平台检测结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlatformDetectionResult {

    public static final String METHOD_KEYWORD = "keyword";
    public static final String METHOD_MODEL_FALLBACK = "model_fallback";
    public static final String METHOD_NONE = "none";

    private PlatformEnum platform;

    /**
     * 判定方式：keyword / model_fallback / none
     */
    private String method;

    /**
     * 各平台关键词得分
     */
    private Map<String, Integer> scores;

    private String fallbackResponse;
}
