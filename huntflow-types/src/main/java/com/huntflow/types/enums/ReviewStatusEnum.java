package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审核队列条目状态枚举
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum ReviewStatusEnum {

    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EDITED("edited");

    private final String code;

    ReviewStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isOpen() {
        return this == PENDING || this == EDITED;
    }

    public static ReviewStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ReviewStatusEnum status : ReviewStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown review status code: " + code);
    }
}
