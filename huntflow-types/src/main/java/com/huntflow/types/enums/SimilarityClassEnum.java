package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 相似度判定结果
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum SimilarityClassEnum {

    DUPLICATE("duplicate"),
    VARIANT("variant"),
    NOVEL("novel");

    private final String code;

    SimilarityClassEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SimilarityClassEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SimilarityClassEnum value : SimilarityClassEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown similarity class code: " + code);
    }
}
