package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 目标平台枚举
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum PlatformEnum {

    WINDOWS("windows"),
    LINUX("linux"),
    MACOS("macos"),
    MULTIPLE("multiple"),
    UNKNOWN("unknown");

    private final String code;

    PlatformEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isConcrete() {
        return this == WINDOWS || this == LINUX || this == MACOS;
    }

    public static PlatformEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (PlatformEnum platform : PlatformEnum.values()) {
            if (platform.code.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform code: " + code);
    }
}
