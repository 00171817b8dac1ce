package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外部网关调用失败类型
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum GatewayErrorTypeEnum {

    UNAVAILABLE("unavailable", true),
    RATE_LIMITED("rate_limited", true),
    TIMEOUT("timeout", true),
    INVALID_RESPONSE("invalid_response", false);

    private final String code;
    private final boolean transientFailure;

    GatewayErrorTypeEnum(String code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否允许传输层退避重试
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
