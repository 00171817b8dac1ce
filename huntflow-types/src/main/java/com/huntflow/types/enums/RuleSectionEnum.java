package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 规则相似度比较的分段
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum RuleSectionEnum {

    TITLE("title"),
    DESCRIPTION("description"),
    TAGS("tags"),
    SIGNATURE("signature");

    private final String code;

    RuleSectionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static RuleSectionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RuleSectionEnum section : RuleSectionEnum.values()) {
            if (section.code.equals(code)) {
                return section;
            }
        }
        throw new IllegalArgumentException("Unknown rule section code: " + code);
    }
}
