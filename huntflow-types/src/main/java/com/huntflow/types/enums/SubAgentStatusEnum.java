package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 抽取子代理本地状态枚举
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum SubAgentStatusEnum {

    PENDING("pending"),
    GENERATING("generating"),
    REVIEWING("reviewing"),
    RETRY("retry"),
    DONE("done"),
    FAILED("failed"),

    /**
     * 被配置禁用，未执行
     */
    SKIPPED("skipped");

    private final String code;

    SubAgentStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    public static SubAgentStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SubAgentStatusEnum status : SubAgentStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sub-agent status code: " + code);
    }
}
