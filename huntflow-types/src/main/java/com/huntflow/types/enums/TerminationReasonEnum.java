package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 终止原因枚举：预期内的停止点，不属于错误。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum TerminationReasonEnum {

    /**
     * 相关性评分低于阈值
     */
    LOW_RELEVANCE("low_relevance"),

    /**
     * 检测到的平台不在目标平台集合内
     */
    PLATFORM_EXCLUDED("platform_excluded"),

    /**
     * 全部抽取子代理失败
     */
    EXTRACTION_FAILED("extraction_failed"),

    /**
     * 规则草稿全部校验失败，无可入队草稿
     */
    GENERATION_INVALID("generation_invalid"),

    /**
     * 与已有规则重复或近似，未入队
     */
    DUPLICATE_SUPPRESSED("duplicate_suppressed"),

    /**
     * 新规则已入审核队列
     */
    QUEUED("queued"),

    /**
     * 子代理 QA 重试耗尽，接受最佳输出（记录在子代理结果上）
     */
    QA_EXHAUSTED("qa_exhausted"),

    /**
     * 运行超时被清扫
     */
    STALE_TIMEOUT("stale_timeout"),

    /**
     * 协作式取消
     */
    CANCELLED("cancelled");

    private final String code;

    TerminationReasonEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TerminationReasonEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TerminationReasonEnum reason : TerminationReasonEnum.values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown termination reason code: " + code);
    }
}
