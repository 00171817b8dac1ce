package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 规则草稿校验状态
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum ValidationStatusEnum {

    VALID("valid"),
    INVALID("invalid");

    private final String code;

    ValidationStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ValidationStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ValidationStatusEnum status : ValidationStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown validation status code: " + code);
    }
}
